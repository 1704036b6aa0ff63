package com.tracura.plm.domain;

/**
 * A stored expense together with the escalation decision made when it was submitted.
 */
public record SubmittedExpense(
    Expense expense,
    EscalationDecision decision
) {
}
