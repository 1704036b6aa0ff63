package com.tracura.plm.repository;

import com.tracura.plm.domain.TempApprover;
import com.tracura.plm.domain.TempApproverStatus;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Delegation documents of a project.
 */
public interface TempApproverRepository {

    /**
     * Most recent delegation of {@code approverId} on the project.
     */
    Optional<TempApprover> find(String projectId, String approverId);

    TempApprover insert(TempApprover tempApprover);

    /**
     * Conditional status write on the most recent delegation.
     */
    boolean updateStatus(
        String projectId, String approverId, TempApproverStatus expected,
        TempApproverStatus newStatus, String reason, LocalDateTime at
    );

    void addApprovedExpense(String tempApproverId, String expenseId);
}
