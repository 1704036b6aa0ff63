package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Aggregated figures of one phase.
 * When {@code degraded} is set the departments failed to load and the figures come from the
 * phase's legacy budget map; department rows are then informational only.
 */
public record PhaseBudget(
    String phaseId,
    String phaseName,
    int phaseNumber,
    BigDecimal totalBudget,
    BigDecimal approvedAmount,
    BigDecimal remaining,
    boolean enabled,
    boolean inTimeline,
    boolean degraded,
    List<DepartmentBudget> departments
) {
    public PhaseBudget {
        departments = departments != null ? List.copyOf(departments) : List.of();
    }

    /**
     * Enabled and in timeline; only active phases accept expenses and keep a project ACTIVE.
     */
    public boolean active() {
        return enabled && inTimeline;
    }

    public Optional<DepartmentBudget> department(String nameOrKey) {
        if (nameOrKey == null) {
            return Optional.empty();
        }
        var key = DepartmentKey.normalize(phaseId, nameOrKey);
        return departments.stream()
            .filter(d -> d.key().equals(key) || d.name().equalsIgnoreCase(nameOrKey.trim()))
            .findFirst();
    }
}
