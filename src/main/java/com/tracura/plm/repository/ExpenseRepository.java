package com.tracura.plm.repository;

import com.tracura.plm.domain.Expense;
import com.tracura.plm.domain.ExpenseStatus;

import java.util.List;
import java.util.Optional;

/**
 * Expense documents of a project.
 */
public interface ExpenseRepository {

    /**
     * Approved expenses only; these are the ones that count against budgets.
     */
    List<Expense> findApproved(String projectId);

    Optional<Expense> findById(String projectId, String expenseId);

    Expense insert(Expense expense);

    /**
     * Persist an approval outcome if the stored status still equals {@code expected}.
     */
    boolean updateDecision(Expense decided, ExpenseStatus expected);
}
