package com.tracura.plm.handler;

import com.tracura.plm.config.PlmProperties;
import com.tracura.plm.domain.ProjectChangeEvent;
import io.vavr.control.Try;
import org.apache.camel.ProducerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Emits {@code project-updated} change notifications onto the Camel notification queue.
 * Delivery is asynchronous; a failed hand-off is logged and does not fail the caller.
 */
@Component
public class ProjectChangePublisher {

    private static final Logger log = LoggerFactory.getLogger(ProjectChangePublisher.class);

    private final ProducerTemplate producerTemplate;
    private final String endpointUri;

    public ProjectChangePublisher(ProducerTemplate producerTemplate, PlmProperties properties) {
        this.producerTemplate = producerTemplate;
        this.endpointUri = "seda:" + properties.notification().topic();
    }

    public void projectUpdated(String projectId, String reason) {
        var event = new ProjectChangeEvent(projectId, reason);
        Try.run(() -> producerTemplate.sendBody(endpointUri, event))
            .onSuccess(ignored -> log.debug("Queued change notification for project {}: {}", projectId, reason))
            .onFailure(e -> log.warn("Change notification for project {} not delivered: {}", projectId, e.getMessage()));
    }
}
