package org.prefixwatch.ticketing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.prefixwatch.diff.DiffResult;

import java.time.Instant;
import java.util.List;

public final class TicketPayloads {
    public static final String TICKET_TYPE = "irr_prefix_change";

    private TicketPayloads() {
    }

    public static ObjectNode build(ObjectMapper mapper, String target, DiffResult diff, List<String> sources,
                                   Instant timestamp) {
        final var payload = mapper.createObjectNode();
        payload.put("type", TICKET_TYPE);
        payload.put("target", target);
        payload.put("timestamp", timestamp.toString());
        final var changes = payload.putObject("changes");
        diff.addedV4().forEach(changes.putArray("added_ipv4")::add);
        diff.removedV4().forEach(changes.putArray("removed_ipv4")::add);
        diff.addedV6().forEach(changes.putArray("added_ipv6")::add);
        diff.removedV6().forEach(changes.putArray("removed_ipv6")::add);
        payload.put("summary", diff.summary());
        sources.forEach(payload.putArray("irr_sources")::add);
        payload.put("diff_hash", diff.diffHash());
        return payload;
    }
}
