package com.tracura.plm.domain;

/**
 * Why an expense needs administrator approval.
 */
public enum EscalationReason {
    PHASE_BUDGET_ZERO("Phase total budget is 0, so expense will be approved by admin"),
    PHASE_BUDGET_EXCEEDED("Entered amount is greater than remaining amount in phase, so expense will be approved by admin"),
    DEPARTMENT_BUDGET_ZERO("Department total budget is 0, so expense will be approved by admin"),
    DEPARTMENT_BUDGET_EXCEEDED("Entered amount is greater than remaining amount in department, so expense will be approved by admin");

    private final String message;

    EscalationReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
