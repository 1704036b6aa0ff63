package com.tracura.plm.domain;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Delegation status of a temporary approver.
 */
public enum TempApproverStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    ACTIVE,
    EXPIRED;

    /**
     * Status as observed at {@code now}, derived from the stored status and the authority window.
     * REJECTED and EXPIRED are terminal.
     */
    public static TempApproverStatus currentStatus(
        TempApproverStatus stored, LocalDateTime start, LocalDateTime end, LocalDateTime now
    ) {
        return switch (stored) {
            case REJECTED -> REJECTED;
            case EXPIRED -> EXPIRED;
            case PENDING -> now.isAfter(end) ? EXPIRED : PENDING;
            case ACCEPTED -> {
                if (now.isAfter(end)) {
                    yield EXPIRED;
                }
                yield now.isBefore(start) ? ACCEPTED : ACTIVE;
            }
            case ACTIVE -> now.isAfter(end) ? EXPIRED : ACTIVE;
        };
    }

    /**
     * Whether a delegate in this (current) status may approve expenses.
     */
    public boolean grantsAuthority() {
        return this == ACCEPTED || this == ACTIVE;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == EXPIRED;
    }

    public static Optional<TempApproverStatus> fromStored(String stored) {
        if (stored == null) {
            return Optional.empty();
        }
        var normalized = stored.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.name().equals(normalized))
            .findFirst();
    }
}
