package com.tracura.plm.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Time-windowed delegation of approval authority over a project.
 */
public record TempApprover(
    Optional<String> id,
    String projectId,
    String approverId,
    LocalDateTime startDate,
    LocalDateTime endDate,
    TempApproverStatus status,
    List<String> approvedExpenses,
    Optional<String> rejectionReason,
    Optional<LocalDateTime> updatedAt
) {
    public TempApprover {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (approverId == null || approverId.isBlank()) {
            throw new IllegalArgumentException("approverId is required");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("authority window is required");
        }
        id = id != null ? id : Optional.empty();
        status = status != null ? status : TempApproverStatus.PENDING;
        approvedExpenses = approvedExpenses != null ? List.copyOf(approvedExpenses) : List.of();
        rejectionReason = rejectionReason != null ? rejectionReason : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    public static TempApprover pending(
        String projectId, String approverId, LocalDateTime start, LocalDateTime end, LocalDateTime at
    ) {
        return new TempApprover(
            Optional.empty(), projectId, approverId, start, end, TempApproverStatus.PENDING,
            List.of(), Optional.empty(), Optional.ofNullable(at)
        );
    }

    /**
     * Status derived from the stored status and the window at {@code now}.
     */
    public TempApproverStatus currentStatus(LocalDateTime now) {
        return TempApproverStatus.currentStatus(status, startDate, endDate, now);
    }

    public boolean needsStatusUpdate(LocalDateTime now) {
        return currentStatus(now) != status;
    }

    public boolean hasExpired(LocalDateTime now) {
        return now.isAfter(endDate);
    }

    public TempApprover withStatus(TempApproverStatus newStatus, LocalDateTime at) {
        return new TempApprover(
            id, projectId, approverId, startDate, endDate, newStatus, approvedExpenses,
            rejectionReason, Optional.ofNullable(at)
        );
    }

    public TempApprover rejected(String reason, LocalDateTime at) {
        return new TempApprover(
            id, projectId, approverId, startDate, endDate, TempApproverStatus.REJECTED, approvedExpenses,
            Optional.ofNullable(reason), Optional.ofNullable(at)
        );
    }

    public TempApprover withId(String newId) {
        return new TempApprover(
            Optional.ofNullable(newId), projectId, approverId, startDate, endDate, status,
            approvedExpenses, rejectionReason, updatedAt
        );
    }
}
