package com.vidnyan.tfguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the audit and remediation engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "tfguard")
public class TfGuardProperties {

    private Audit audit = new Audit();
    private Remediation remediation = new Remediation();
    private Policies policies = new Policies();

    @Data
    public static class Audit {
        /**
         * Region used for cost estimates of static templates.
         */
        private String defaultRegion = "us-east-1";

        /**
         * Threads used to evaluate policies in parallel.
         */
        private int policyThreads = 4;

        /**
         * Template file audited on startup by the CLI runner. Empty disables it.
         */
        private String path = "";

        /**
         * Optional second file compared against {@link #path}.
         */
        private String comparePath = "";

        private String provider = "aws";
    }

    @Data
    public static class Remediation {
        /**
         * How long to wait for an AI fix suggestion before falling back to a placeholder.
         */
        private Duration aiTimeout = Duration.ofSeconds(20);

        private int aiThreads = 2;
    }

    @Data
    public static class Policies {
        /**
         * Policy codes switched off at startup.
         */
        private List<String> disabled = new ArrayList<>();
    }
}
