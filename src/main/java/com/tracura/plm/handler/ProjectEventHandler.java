package com.tracura.plm.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracura.plm.service.ProjectReconciliationService;
import org.apache.camel.Exchange;
import org.apache.camel.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Re-runs reconciliation for a project whenever a change notification for it arrives.
 * The pass is idempotent, so a notification caused by its own corrective write ends in a no-op.
 */
@Component("projectEventHandler")
public class ProjectEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ProjectEventHandler.class);

    private final ProjectReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;

    public ProjectEventHandler(ProjectReconciliationService reconciliationService, ObjectMapper objectMapper) {
        this.reconciliationService = reconciliationService;
        this.objectMapper = objectMapper;
    }

    @Handler
    public void onProjectUpdated(Exchange exchange) {
        var payload = exchange.getIn().getBody(String.class);

        try {
            var data = objectMapper.readValue(payload, Map.class);
            if (!(data.get("projectId") instanceof String projectId) || projectId.isBlank()) {
                log.error("Invalid or missing projectId in project updated event");
                return;
            }

            var result = reconciliationService.reconcileProject(projectId);
            if (result.isNoOp()) {
                log.debug("Project {} already consistent ({})", projectId, data.get("reason"));
            } else {
                log.info("[PROJECT_UPDATED] Project {} reconciled: {} transition(s), {} expired delegation(s)",
                    projectId, result.transitions().size(), result.expiredDelegations().size());
            }
        } catch (JsonProcessingException e) {
            log.error("Unreadable project updated payload: {}", e.getMessage());
            exchange.setException(e);
        }
    }
}
