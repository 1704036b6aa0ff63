package com.tracura.plm.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Project lifecycle status as stored on the project document.
 */
public enum ProjectStatus {
    IN_REVIEW,
    LOCKED,
    ACTIVE,
    SUSPENDED,
    STANDBY,
    MAINTENANCE,
    COMPLETED,
    DECLINED,
    ARCHIVE;

    /**
     * Decode a stored status value. Unknown, blank or missing values map to LOCKED
     * so that legacy documents never break a reconciliation pass.
     */
    public static ProjectStatus fromStored(String stored) {
        if (stored == null || stored.isBlank()) {
            return LOCKED;
        }
        var normalized = stored.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.name().equals(normalized))
            .findFirst()
            .orElse(LOCKED);
    }

    /**
     * Statuses the automatic phase-activity pass is allowed to move a project out of.
     */
    public boolean isPhaseDriven() {
        return this == ACTIVE || this == STANDBY;
    }
}
