package com.tracura.plm.domain;

/**
 * A project status change decided by a reconciliation pass.
 * {@code expectedStatus} is the status text exactly as read from the store (possibly a legacy
 * value or null); the corrective write only applies while the stored text is still the same.
 * {@code unsuspend} marks transitions that also clear the suspension fields.
 */
public record StatusTransition(
    String projectId,
    ProjectStatus from,
    String expectedStatus,
    ProjectStatus to,
    String reason,
    boolean unsuspend
) {
    public static StatusTransition of(Project project, ProjectStatus to, String reason) {
        return new StatusTransition(project.id(), project.statusType(), project.status(), to, reason, false);
    }

    public static StatusTransition unsuspend(Project project, ProjectStatus to, String reason) {
        return new StatusTransition(project.id(), project.statusType(), project.status(), to, reason, true);
    }
}
