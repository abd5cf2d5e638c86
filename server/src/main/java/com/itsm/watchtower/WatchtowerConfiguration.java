package com.itsm.watchtower;

import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.ComponentScan;

/**
 * Entry point of the audit trail server module. Applications import this and provide the storage repositories.
 */
@ComponentScan
@ConfigurationPropertiesScan
public class WatchtowerConfiguration {
}
