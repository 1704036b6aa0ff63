package com.tracura.plm.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracura.plm.domain.ProjectChangeEvent;
import org.apache.camel.Exchange;
import org.apache.camel.Handler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Wraps a {@link ProjectChangeEvent} in the notification envelope consumed by
 * {@code direct:project-changed}. The project id is lifted into a header and an envelope field
 * so routes and logs can address it without parsing the payload.
 */
@Component("eventPublisher")
public class EventPublisher {

    public static final String PROJECT_ID_HEADER = "projectId";
    public static final String MESSAGE_ID_HEADER = "messageId";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventPublisher(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Handler
    public void publish(Exchange exchange) {
        var in = exchange.getIn();
        var messageType = in.getHeader("messageType", "PROJECT_UPDATED", String.class);
        var body = in.getBody();

        try {
            var event = body instanceof ProjectChangeEvent changeEvent ? changeEvent : toEvent(body);
            var messageId = UUID.randomUUID().toString();

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("messageId", messageId);
            envelope.put("messageType", messageType);
            envelope.put("projectId", event.projectId());
            envelope.put("reason", event.reason());
            envelope.put("emittedAt", clock.millis());
            envelope.put("payload", objectMapper.writeValueAsString(event));

            in.setHeader(MESSAGE_ID_HEADER, messageId);
            in.setHeader(PROJECT_ID_HEADER, event.projectId());
            in.setBody(envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            exchange.setException(e);
        }
    }

    // Events arriving as JSON text, e.g. from an external producer on the same queue
    private ProjectChangeEvent toEvent(Object body) throws JsonProcessingException {
        if (body instanceof String json) {
            return objectMapper.readValue(json, ProjectChangeEvent.class);
        }
        throw new IllegalArgumentException("Unsupported project event body: "
            + (body == null ? "null" : body.getClass().getSimpleName()));
    }
}
