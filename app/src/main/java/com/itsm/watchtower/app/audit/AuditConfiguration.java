package com.itsm.watchtower.app.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import com.itsm.watchtower.spi.repositories.ResourceStateRepository;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationPropertiesScan
public class AuditConfiguration {

    @Bean
    public DerbyDao derbyDao(DerbyAuditProperties derbyAuditProperties, ObjectMapper objectMapper) {
        return new DerbyDao(derbyAuditProperties.getUrl(), objectMapper);
    }

    @Bean
    public AuditRecordRepository auditRecordRepository(DerbyDao derbyDao) {
        return new DerbyAuditRecordRepository(derbyDao);
    }

    @Bean
    public ResourceStateRepository resourceStateRepository(DerbyDao derbyDao) {
        return new DerbyResourceStateRepository(derbyDao);
    }
}
