package com.tracura.plm.camel;

import com.tracura.plm.config.PlmProperties;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.stereotype.Component;

/**
 * Change-notification routes: every {@code project-updated} event is wrapped in the message
 * envelope and handed to the reconciliation handler.
 */
@Component
public class ProjectEventRoute extends RouteBuilder {

    private final String topic;

    public ProjectEventRoute(PlmProperties properties) {
        this.topic = properties.notification().topic();
    }

    @Override
    public void configure() throws Exception {

        // ====================================================================
        // EVENT EMISSION
        // ====================================================================
        from("seda:" + topic)
            .routeId("project-updated-event")
            .setHeader("messageType", constant("PROJECT_UPDATED"))
            .bean("eventPublisher", "publish")
            .to("direct:project-changed");

        // ====================================================================
        // RECONCILIATION TRIGGER
        // ====================================================================
        from("direct:project-changed")
            .routeId("project-changed")
            .log("Project change notification ${header.messageId} for project ${header.projectId}")
            .transform(simple("${body[payload]}"))
            .doTry()
                .bean("projectEventHandler", "onProjectUpdated")
            .doCatch(Exception.class)
                .log("Project reconciliation after change failed: ${exception.message}")
            .end();
    }
}
