package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Time-bounded stage of a project.
 * A missing start or end date leaves the timeline unbounded on that side.
 */
public record Phase(
    String id,
    String projectId,
    String phaseName,
    int phaseNumber,
    Optional<LocalDate> startDate,
    Optional<LocalDate> endDate,
    boolean enabled,
    Map<String, BigDecimal> legacyBudgets
) {
    public Phase {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (phaseNumber < 1) {
            throw new IllegalArgumentException("phaseNumber must be 1-based: " + phaseNumber);
        }
        phaseName = phaseName != null ? phaseName : "Phase " + phaseNumber;
        startDate = startDate != null ? startDate : Optional.empty();
        endDate = endDate != null ? endDate : Optional.empty();
        legacyBudgets = legacyBudgets != null ? Map.copyOf(legacyBudgets) : Map.of();
    }

    public static Phase of(String id, String projectId, int phaseNumber, LocalDate start, LocalDate end) {
        return new Phase(id, projectId, null, phaseNumber,
            Optional.ofNullable(start), Optional.ofNullable(end), true, Map.of());
    }

    /**
     * Inclusive containment of {@code day} in [startDate, endDate].
     */
    public boolean isInTimeline(LocalDate day) {
        var afterStart = startDate.map(s -> !day.isBefore(s)).orElse(true);
        var beforeEnd = endDate.map(e -> !day.isAfter(e)).orElse(true);
        return afterStart && beforeEnd;
    }

    /**
     * Enabled and in timeline on {@code day}.
     */
    public boolean isActiveOn(LocalDate day) {
        return enabled && isInTimeline(day);
    }

    public BigDecimal legacyTotalBudget() {
        return legacyBudgets.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Phase withPhaseNumber(int newNumber) {
        return new Phase(id, projectId, phaseName, newNumber, startDate, endDate, enabled, legacyBudgets);
    }

    public Phase withEnabled(boolean newEnabled) {
        return new Phase(id, projectId, phaseName, phaseNumber, startDate, endDate, newEnabled, legacyBudgets);
    }

    public Phase withLegacyBudgets(Map<String, BigDecimal> budgets) {
        return new Phase(id, projectId, phaseName, phaseNumber, startDate, endDate, enabled, budgets);
    }
}
