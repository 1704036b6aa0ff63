package com.tracura.plm.domain;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of evaluating a candidate expense against its phase and department budgets.
 */
public record EscalationDecision(
    boolean requiresAdmin,
    List<EscalationReason> reasons
) {
    public EscalationDecision {
        reasons = List.copyOf(Objects.requireNonNullElse(reasons, Collections.emptyList()));
    }

    public static EscalationDecision none() {
        return new EscalationDecision(false, List.of());
    }

    public static EscalationDecision escalate(List<EscalationReason> reasons) {
        return new EscalationDecision(!reasons.isEmpty(), reasons);
    }

    public String message() {
        return reasons.stream().map(EscalationReason::message).collect(Collectors.joining(". "));
    }
}
