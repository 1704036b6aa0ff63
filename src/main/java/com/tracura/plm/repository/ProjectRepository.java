package com.tracura.plm.repository;

import com.tracura.plm.domain.Project;
import com.tracura.plm.domain.ProjectStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Project document store.
 * Status writes are conditional on the status text as it was read ({@code null} for a missing
 * status); a {@code false} return means the stored document moved on since it was read
 * (state conflict) and nothing was written.
 */
public interface ProjectRepository {

    // ========================================================================
    // QUERY OPERATIONS
    // ========================================================================

    Optional<Project> findById(String projectId);

    List<Project> findAll();

    // ========================================================================
    // WRITE OPERATIONS
    // ========================================================================

    Project insert(Project project);

    /**
     * Set status and updated timestamp if the stored status text still equals {@code expectedStatus}.
     */
    boolean updateStatus(String projectId, String expectedStatus, ProjectStatus newStatus, LocalDateTime at);

    /**
     * Clear the suspension fields and set status, if the project is still suspended with
     * status text {@code expectedStatus}.
     */
    boolean unsuspend(String projectId, String expectedStatus, ProjectStatus newStatus, LocalDateTime at);

    /**
     * Set the temporary approver if no delegation is currently assigned.
     */
    boolean assignTempApprover(String projectId, String approverId, LocalDateTime at);

    /**
     * Clear the temporary approver if it is still {@code approverId}.
     */
    boolean clearTempApprover(String projectId, String approverId);
}
