package com.tracura.plm.domain;

import java.math.BigDecimal;

/**
 * Aggregated figures of one department. {@code remaining} may be negative (overspend).
 */
public record DepartmentBudget(
    String name,
    String key,
    BigDecimal allocatedBudget,
    BigDecimal approvedAmount,
    BigDecimal remaining
) {
    public static DepartmentBudget of(String name, String key, BigDecimal allocated, BigDecimal approved) {
        return new DepartmentBudget(name, key, allocated, approved, allocated.subtract(approved));
    }

    public boolean isOverspent() {
        return remaining.signum() < 0;
    }
}
