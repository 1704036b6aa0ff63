package com.tracura.plm.service;

import com.tracura.plm.domain.DepartmentBudget;
import com.tracura.plm.domain.EscalationDecision;
import com.tracura.plm.domain.EscalationReason;
import com.tracura.plm.domain.PhaseBudget;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Decides whether a candidate expense needs administrator approval.
 * Figures are the ones computed before the candidate is added.
 */
@Component
public class EscalationEvaluator {

    /**
     * @param department the target department, empty when the phase has no such department
     */
    public EscalationDecision evaluate(BigDecimal amount, PhaseBudget phase, Optional<DepartmentBudget> department) {
        if (amount == null || amount.signum() <= 0) {
            return EscalationDecision.none();
        }
        var reasons = new ArrayList<EscalationReason>();

        if (phase.totalBudget().signum() == 0) {
            reasons.add(EscalationReason.PHASE_BUDGET_ZERO);
        } else if (amount.compareTo(phase.remaining()) > 0) {
            reasons.add(EscalationReason.PHASE_BUDGET_EXCEEDED);
        }

        // Unknown department counts as a zero budget bucket
        var allocated = department.map(DepartmentBudget::allocatedBudget).orElse(BigDecimal.ZERO);
        var remaining = department.map(DepartmentBudget::remaining).orElse(BigDecimal.ZERO);
        if (allocated.signum() == 0) {
            reasons.add(EscalationReason.DEPARTMENT_BUDGET_ZERO);
        } else if (amount.compareTo(remaining) > 0) {
            reasons.add(EscalationReason.DEPARTMENT_BUDGET_EXCEEDED);
        }

        return EscalationDecision.escalate(reasons);
    }
}
