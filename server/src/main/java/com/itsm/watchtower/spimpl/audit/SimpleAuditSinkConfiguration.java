package com.itsm.watchtower.spimpl.audit;

import com.itsm.watchtower.spi.AuditSink;
import com.itsm.watchtower.spi.repositories.AuditRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnMissingBean(AuditSink.class)
public class SimpleAuditSinkConfiguration {

    @Bean
    public AuditSink auditSink(AuditRecordRepository auditRecordRepository, MeterRegistry meterRegistry) {
        return new RepositoryAuditSink(auditRecordRepository, meterRegistry, Clock.systemUTC());
    }
}
