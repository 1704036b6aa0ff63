package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Budget figures of a whole project.
 * {@code approvedAmount} counts every approved expense, including those whose phase no longer
 * exists; {@code unattributedAmount} is that orphaned share.
 */
public record ProjectBudget(
    String projectId,
    BigDecimal totalBudget,
    BigDecimal approvedAmount,
    BigDecimal remaining,
    BigDecimal unattributedAmount,
    boolean degraded,
    List<PhaseBudget> phases
) {
    public ProjectBudget {
        phases = phases != null ? List.copyOf(phases) : List.of();
    }

    public Optional<PhaseBudget> phase(String phaseId) {
        return phases.stream().filter(p -> p.phaseId().equals(phaseId)).findFirst();
    }

    public boolean hasActivePhase() {
        return phases.stream().anyMatch(PhaseBudget::active);
    }
}
