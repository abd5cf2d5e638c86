package com.itsm.watchtower.configuration.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "audit")
@Validated
public class AuditProperties {

    /**
     * turns the audit trail filter on or off as a whole
     */
    private boolean enabled = true;

    /**
     * how long a request waits for the stored state of the resource before it is audited without one
     */
    @NotNull
    private Duration priorStateTimeout = Duration.ofSeconds(2);

    /**
     * use the first X-Forwarded-For address as client address. only enable behind a trusted proxy
     */
    private boolean trustForwardedHeaders;

    /**
     * JSON bodies larger than this are passed through without being captured
     */
    @Min(1)
    private int maxBodyBytes = 1024 * 1024;

    @Valid
    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Executor {
        /**
         * number of threads writing audit records
         */
        @Min(1)
        private int threads = 2;

        /**
         * records waiting beyond this are dropped
         */
        @Min(1)
        private int queueSize = 10000;

        @Min(1)
        private int priorStateThreads = 4;

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }
}
