package com.tracura.plm.domain;

/**
 * Expense approval status.
 */
public enum ExpenseStatus {
    PENDING,
    APPROVED,
    REJECTED;

    /**
     * An expense leaves PENDING exactly once.
     */
    public boolean canTransitionTo(ExpenseStatus target) {
        return this == PENDING && (target == APPROVED || target == REJECTED);
    }
}
