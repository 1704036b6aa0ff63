package com.tracura.plm.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracura.plm.domain.ProjectChangeEvent;
import org.apache.camel.impl.DefaultCamelContext;
import org.apache.camel.support.DefaultExchange;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventPublisherTests {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventPublisher publisher = new EventPublisher(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void publish_wrapsProjectEventInEnvelope() throws Exception {
        var exchange = new DefaultExchange(new DefaultCamelContext());
        exchange.getIn().setHeader("messageType", "PROJECT_UPDATED");
        exchange.getIn().setBody(new ProjectChangeEvent("P-1", "Phase deleted"));

        publisher.publish(exchange);

        var envelope = exchange.getIn().getBody(Map.class);
        assertEquals("PROJECT_UPDATED", envelope.get("messageType"));
        assertEquals("P-1", envelope.get("projectId"));
        assertEquals("Phase deleted", envelope.get("reason"));
        assertEquals(NOW.toEpochMilli(), envelope.get("emittedAt"));
        assertEquals(exchange.getIn().getHeader(EventPublisher.MESSAGE_ID_HEADER), envelope.get("messageId"));
        assertEquals("P-1", exchange.getIn().getHeader(EventPublisher.PROJECT_ID_HEADER));
        var payload = objectMapper.readValue((String) envelope.get("payload"), Map.class);
        assertEquals("P-1", payload.get("projectId"));
    }

    @Test
    void publish_jsonBodyWithoutMessageType_isProjectUpdated() {
        var exchange = new DefaultExchange(new DefaultCamelContext());
        exchange.getIn().setBody("{\"projectId\":\"P-1\",\"reason\":\"Expense submitted\"}");

        publisher.publish(exchange);

        var envelope = exchange.getIn().getBody(Map.class);
        assertEquals("PROJECT_UPDATED", envelope.get("messageType"));
        assertEquals("P-1", envelope.get("projectId"));
        assertEquals("Expense submitted", envelope.get("reason"));
    }

    @Test
    void publish_unsupportedBody_failsExchange() {
        var exchange = new DefaultExchange(new DefaultCamelContext());
        exchange.getIn().setBody(42);

        publisher.publish(exchange);

        assertInstanceOf(IllegalArgumentException.class, exchange.getException());
    }
}
