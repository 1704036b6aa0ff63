package com.tracura.plm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PLM application configuration properties.
 */
@ConfigurationProperties(prefix = "plm")
public record PlmProperties(
    ReconciliationProperties reconciliation,
    DelegationProperties delegation,
    NotificationProperties notification
) {
    public PlmProperties {
        reconciliation = reconciliation != null ? reconciliation : new ReconciliationProperties(0, 0);
        delegation = delegation != null ? delegation : new DelegationProperties(0);
        notification = notification != null ? notification : new NotificationProperties(null);
    }

    public static PlmProperties defaults() {
        return new PlmProperties(null, null, null);
    }

    public record ReconciliationProperties(
        int parallelism,
        int phaseLoadTimeoutSeconds
    ) {
        public ReconciliationProperties {
            if (parallelism <= 0) parallelism = 4;
            if (phaseLoadTimeoutSeconds <= 0) phaseLoadTimeoutSeconds = 30;
        }
    }

    public record DelegationProperties(int maxWindowDays) {
        public DelegationProperties {
            if (maxWindowDays <= 0) maxWindowDays = 30;
        }
    }

    public record NotificationProperties(String topic) {
        public NotificationProperties {
            if (topic == null || topic.isBlank()) {
                topic = "project-updated";
            }
        }
    }
}
