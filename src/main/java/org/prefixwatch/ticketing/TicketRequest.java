package org.prefixwatch.ticketing;

import com.fasterxml.jackson.databind.JsonNode;
import org.prefixwatch.diff.DiffResult;

import java.util.List;

public record TicketRequest(String target, DiffResult changeSet, List<String> sources, String idempotencyKey,
                            JsonNode payload) {

    public TicketRequest {
        sources = List.copyOf(sources);
    }
}
