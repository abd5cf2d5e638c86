package com.itsm.watchtower.app.audit;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@ConfigurationProperties(prefix = "audit.derby")
@Validated
public class DerbyAuditProperties {
    /**
     * jdbc url of the derby database holding the audit trail and the ITSM tables
     */
    @NotEmpty
    private String url;
}
