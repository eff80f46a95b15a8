package org.prefixwatch.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record Ticket(long id, long diffId, String target, String externalTicketId, TicketStatus status,
                     JsonNode requestPayload, JsonNode responsePayload, Instant createdAt) {
}
