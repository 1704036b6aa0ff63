package com.tracura.plm.domain;

/**
 * Payload of a {@code project-updated} change notification.
 */
public record ProjectChangeEvent(
    String projectId,
    String reason
) {
    public ProjectChangeEvent {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        reason = reason != null ? reason : "";
    }
}
