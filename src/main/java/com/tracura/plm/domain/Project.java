package com.tracura.plm.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Project document. Status is kept as the stored text, null and legacy values included, and
 * decoded through {@link ProjectStatus#fromStored(String)}; total budget is derived from phases,
 * never stored.
 */
public record Project(
    String id,
    String name,
    String status,
    Optional<LocalDate> plannedDate,
    Optional<LocalDate> handoverDate,
    Optional<LocalDate> initialHandoverDate,
    Optional<LocalDate> maintenanceDate,
    boolean suspended,
    Optional<LocalDate> suspendedDate,
    Optional<String> suspensionReason,
    Set<String> teamMembers,
    List<String> managerIds,
    Optional<String> tempApproverId,
    Optional<LocalDateTime> createdAt,
    Optional<LocalDateTime> updatedAt
) {
    public Project {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        name = name != null ? name : "";
        plannedDate = plannedDate != null ? plannedDate : Optional.empty();
        handoverDate = handoverDate != null ? handoverDate : Optional.empty();
        initialHandoverDate = initialHandoverDate != null ? initialHandoverDate : Optional.empty();
        maintenanceDate = maintenanceDate != null ? maintenanceDate : Optional.empty();
        suspendedDate = suspendedDate != null ? suspendedDate : Optional.empty();
        suspensionReason = suspensionReason != null ? suspensionReason : Optional.empty();
        teamMembers = teamMembers != null ? Set.copyOf(teamMembers) : Set.of();
        managerIds = managerIds != null ? List.copyOf(managerIds) : List.of();
        tempApproverId = tempApproverId != null ? tempApproverId : Optional.empty();
        createdAt = createdAt != null ? createdAt : Optional.empty();
        updatedAt = updatedAt != null ? updatedAt : Optional.empty();
    }

    /**
     * New project awaiting review.
     */
    public static Project inReview(String id, String name, LocalDate plannedDate, String managerId) {
        return new Project(
            id,
            name,
            ProjectStatus.IN_REVIEW.name(),
            Optional.ofNullable(plannedDate),
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            false,
            Optional.empty(),
            Optional.empty(),
            Set.of(),
            managerId != null ? List.of(managerId) : List.of(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty()
        );
    }

    public ProjectStatus statusType() {
        return ProjectStatus.fromStored(status);
    }

    /**
     * The single active manager; managers are stored as a list for compatibility.
     */
    public Optional<String> primaryManagerId() {
        return managerIds.stream().findFirst();
    }

    public Project withStatus(ProjectStatus newStatus, LocalDateTime at) {
        return new Project(
            id, name, newStatus.name(), plannedDate, handoverDate, initialHandoverDate, maintenanceDate,
            suspended, suspendedDate, suspensionReason, teamMembers, managerIds, tempApproverId,
            createdAt, Optional.ofNullable(at)
        );
    }

    public Project withDates(LocalDate planned, LocalDate handover, LocalDate maintenance) {
        return new Project(
            id, name, status, Optional.ofNullable(planned), Optional.ofNullable(handover),
            initialHandoverDate.isPresent() ? initialHandoverDate : Optional.ofNullable(handover),
            Optional.ofNullable(maintenance), suspended, suspendedDate, suspensionReason,
            teamMembers, managerIds, tempApproverId, createdAt, updatedAt
        );
    }

    public Project suspendedUntil(LocalDate until, String reason) {
        return new Project(
            id, name, ProjectStatus.SUSPENDED.name(), plannedDate, handoverDate, initialHandoverDate,
            maintenanceDate, true, Optional.ofNullable(until), Optional.ofNullable(reason),
            teamMembers, managerIds, tempApproverId, createdAt, updatedAt
        );
    }

    /**
     * Copy with suspension cleared and the given status.
     */
    public Project unsuspended(ProjectStatus newStatus, LocalDateTime at) {
        return new Project(
            id, name, newStatus.name(), plannedDate, handoverDate, initialHandoverDate, maintenanceDate,
            false, Optional.empty(), Optional.empty(), teamMembers, managerIds, tempApproverId,
            createdAt, Optional.ofNullable(at)
        );
    }

    public Project withTempApprover(String approverId) {
        return new Project(
            id, name, status, plannedDate, handoverDate, initialHandoverDate, maintenanceDate,
            suspended, suspendedDate, suspensionReason, teamMembers, managerIds,
            Optional.ofNullable(approverId), createdAt, updatedAt
        );
    }

    public Project withTeam(Set<String> members, List<String> managers) {
        return new Project(
            id, name, status, plannedDate, handoverDate, initialHandoverDate, maintenanceDate,
            suspended, suspendedDate, suspensionReason, members, managers, tempApproverId,
            createdAt, updatedAt
        );
    }

    public boolean isTempApprover(String userId) {
        return userId != null && tempApproverId.map(userId::equals).orElse(false);
    }
}
