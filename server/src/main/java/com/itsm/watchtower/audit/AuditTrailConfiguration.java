package com.itsm.watchtower.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itsm.watchtower.audit.utils.RequestUtils;
import com.itsm.watchtower.configuration.properties.AuditProperties;
import com.itsm.watchtower.spi.AuditSink;
import com.itsm.watchtower.spi.repositories.ResourceStateRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "audit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AuditTrailConfiguration {

    @Bean
    public AuditTaskExecutor auditTaskExecutor(AuditProperties auditProperties, MeterRegistry meterRegistry) {
        AuditProperties.Executor executor = auditProperties.getExecutor();
        return new AuditTaskExecutor(executor.getThreads(), executor.getQueueSize(), executor.getShutdownTimeout(), meterRegistry);
    }

    @Bean
    public PriorStateFetcher priorStateFetcher(ResourceStateRepository resourceStateRepository, ObjectMapper objectMapper,
                                               MeterRegistry meterRegistry, AuditProperties auditProperties) {
        return new PriorStateFetcher(resourceStateRepository, objectMapper, meterRegistry,
                auditProperties.getPriorStateTimeout(), auditProperties.getExecutor().getPriorStateThreads());
    }

    @Bean
    public FilterRegistrationBean<AuditTrailFilter> auditTrailFilter(PriorStateFetcher priorStateFetcher, AuditTaskExecutor auditTaskExecutor,
                                                                     AuditSink auditSink, ObjectMapper objectMapper,
                                                                     MeterRegistry meterRegistry, AuditProperties auditProperties) {
        AuditTrailFilter filter = new AuditTrailFilter(priorStateFetcher, auditTaskExecutor, auditSink,
                new RequestUtils(auditProperties.isTrustForwardedHeaders()), objectMapper, meterRegistry, auditProperties.getMaxBodyBytes());
        FilterRegistrationBean<AuditTrailFilter> registration = new FilterRegistrationBean<>(filter);
        // after spring security so that the authenticated user is known
        registration.setOrder(SecurityProperties.DEFAULT_FILTER_ORDER + 1);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
