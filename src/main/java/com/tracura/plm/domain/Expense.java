package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Expense submitted against a phase department.
 * {@code department} holds the phase-scoped key for phase expenses; {@code admin} is the
 * escalation flag fixed at submission time.
 */
public record Expense(
    Optional<String> id,
    String projectId,
    Optional<String> phaseId,
    String department,
    LocalDate date,
    BigDecimal amount,
    ExpenseStatus status,
    boolean admin,
    String submittedBy,
    Optional<String> approvedBy,
    Optional<String> rejectedBy,
    Optional<String> remark,
    Optional<LocalDateTime> createdAt,
    Optional<LocalDateTime> updatedAt
) {
    public Expense {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (department == null || department.isBlank()) {
            throw new IllegalArgumentException("department is required");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
        if (submittedBy == null || submittedBy.isBlank()) {
            throw new IllegalArgumentException("submittedBy is required");
        }
        id = id != null ? id : Optional.empty();
        phaseId = phaseId != null ? phaseId : Optional.empty();
        status = status != null ? status : ExpenseStatus.PENDING;
        approvedBy = approvedBy != null ? approvedBy : Optional.empty();
        rejectedBy = rejectedBy != null ? rejectedBy : Optional.empty();
        remark = remark != null ? remark : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    /**
     * New pending expense for a phase department.
     */
    public static Expense pending(
        String projectId, String phaseId, String departmentName, LocalDate date,
        BigDecimal amount, String submittedBy, boolean admin, LocalDateTime at
    ) {
        return new Expense(
            Optional.empty(),
            projectId,
            Optional.of(phaseId),
            DepartmentKey.normalize(phaseId, departmentName),
            date,
            amount,
            ExpenseStatus.PENDING,
            admin,
            submittedBy,
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.ofNullable(at),
            Optional.ofNullable(at)
        );
    }

    /**
     * Approved expense, used mostly by aggregation callers and tests.
     */
    public static Expense approved(String id, String projectId, String phaseId, String department, BigDecimal amount) {
        return new Expense(
            Optional.ofNullable(id), projectId, Optional.ofNullable(phaseId), department, null, amount,
            ExpenseStatus.APPROVED, false, "system", Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty()
        );
    }

    public Expense withId(String newId) {
        return new Expense(
            Optional.ofNullable(newId), projectId, phaseId, department, date, amount, status, admin,
            submittedBy, approvedBy, rejectedBy, remark, createdAt, updatedAt
        );
    }

    /**
     * Copy carrying the outcome of an approval action.
     */
    public Expense decided(ExpenseStatus outcome, String actor, String newRemark, LocalDateTime at) {
        if (!status.canTransitionTo(outcome)) {
            throw new IllegalStateException("Expense cannot move from " + status + " to " + outcome);
        }
        return new Expense(
            id, projectId, phaseId, department, date, amount, outcome, admin, submittedBy,
            outcome == ExpenseStatus.APPROVED ? Optional.ofNullable(actor) : approvedBy,
            outcome == ExpenseStatus.REJECTED ? Optional.ofNullable(actor) : rejectedBy,
            Optional.ofNullable(newRemark), createdAt, Optional.ofNullable(at)
        );
    }

    /**
     * Department key scoped to the expense's phase, or the raw department for phase-less expenses.
     */
    public String departmentKey() {
        return phaseId.map(p -> DepartmentKey.normalize(p, department)).orElse(department);
    }

    public boolean isApproved() {
        return status == ExpenseStatus.APPROVED;
    }
}
