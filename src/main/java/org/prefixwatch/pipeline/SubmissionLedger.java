package org.prefixwatch.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.LogContext;
import org.prefixwatch.diff.DiffEngine;
import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.SnapshotStore;
import org.prefixwatch.store.Ticket;
import org.prefixwatch.store.TicketStatus;
import org.prefixwatch.ticketing.SubmissionResult;
import org.prefixwatch.ticketing.TicketPayloads;
import org.prefixwatch.ticketing.TicketRequest;
import org.prefixwatch.ticketing.TicketingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Turns a change-set into at most one successful ticket. The pending row, with the exact payload,
 * is committed before the network call so a crash leaves a retryable record rather than nothing.
 */
public final class SubmissionLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubmissionLedger.class);

    private final SnapshotStore store;
    private final TicketingClient ticketingClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SubmissionLedger(SnapshotStore store, TicketingClient ticketingClient, ObjectMapper mapper, Clock clock) {
        this.store = store;
        this.ticketingClient = ticketingClient;
        this.mapper = mapper;
        this.clock = clock;
    }

    public SubmissionOutcome submit(ChangeSet changeSet, List<String> sources, boolean dryRun, LogContext context) {
        final var diff = DiffEngine.fromChangeSet(changeSet);
        final var diffContext = context.with("diff_id", changeSet.id()).with("diff_hash", changeSet.diffHash());
        if (!changeSet.hasChanges()) {
            diffContext.atInfo(LOGGER).log("No changes for {}, nothing to submit", changeSet.target());
            return SubmissionOutcome.noChanges(diff.summary());
        }

        final var existing = alreadySubmitted(changeSet);
        if (existing.isPresent()) {
            final var ticket = existing.get();
            diffContext.atInfo(LOGGER).addKeyValue("external_ticket_id", ticket.externalTicketId())
                    .log("Change already submitted as {}", ticket.externalTicketId());
            return new SubmissionOutcome(RunOutcome.ALREADY_SUBMITTED, existing,
                    "Ticket already exists: " + ticket.externalTicketId());
        }

        final var payload = TicketPayloads.build(mapper, changeSet.target(), diff, sources, clock.instant());
        if (dryRun) {
            final var ticketId = store.saveTicket(changeSet.id(), changeSet.target(), TicketStatus.DRY_RUN, payload);
            diffContext.atInfo(LOGGER).addKeyValue("payload", payload)
                    .log("[DRY-RUN] Would create ticket for {}", changeSet.target());
            return new SubmissionOutcome(RunOutcome.DRY_RUN, store.getTicketById(ticketId),
                    "Dry run, ticket not submitted");
        }
        if (ticketingClient == null) {
            throw new IllegalStateException("Ticketing is not configured (ticketing.base_url)");
        }

        // a pending row means an earlier attempt never finished; resend its exact body on the same row
        final var stranded = store.getTicketForDiff(changeSet.id())
                .filter(ticket -> ticket.status() == TicketStatus.PENDING);
        final var ticketId = stranded.isPresent()
                ? stranded.get().id()
                : store.saveTicket(changeSet.id(), changeSet.target(), TicketStatus.PENDING, payload);
        final JsonNode body = stranded.isPresent() ? stranded.get().requestPayload() : payload;
        if (stranded.isPresent()) {
            diffContext.atWarn(LOGGER).addKeyValue("ticket_row", ticketId)
                    .log("Resubmitting pending ticket for {}", changeSet.target());
        }
        final var result = ticketingClient.submit(new TicketRequest(changeSet.target(), diff, sources,
                changeSet.diffHash(), body));
        store.updateTicketStatus(ticketId, result.status(), responsePayload(result), result.externalTicketId());
        final var ticket = store.getTicketById(ticketId);

        final var ticketContext = diffContext.with("ticket_row", ticketId);
        return switch (result.status()) {
            case CREATED -> {
                ticketContext.atInfo(LOGGER).log("Ticket {} created for {}", result.externalTicketId(),
                        changeSet.target());
                yield new SubmissionOutcome(RunOutcome.TICKET_CREATED, ticket,
                        "Ticket created: " + result.externalTicketId());
            }
            case DUPLICATE -> {
                ticketContext.atInfo(LOGGER).log("Remote system reports duplicate ticket {}",
                        result.externalTicketId());
                yield new SubmissionOutcome(RunOutcome.TICKET_DUPLICATE, ticket,
                        "Ticket already exists: " + result.externalTicketId());
            }
            default -> {
                ticketContext.atError(LOGGER).log("Ticket submission failed: {}", result.errorMessage());
                yield new SubmissionOutcome(RunOutcome.SUBMISSION_FAILED, ticket,
                        "Ticket submission failed: " + result.errorMessage());
            }
        };
    }

    private Optional<Ticket> alreadySubmitted(ChangeSet changeSet) {
        return store.getTicketForDiff(changeSet.id())
                .filter(ticket -> ticket.status().isSuccessful())
                .or(() -> store.findSuccessfulTicket(changeSet.diffHash()));
    }

    private JsonNode responsePayload(SubmissionResult result) {
        if (result.responsePayload() != null) return result.responsePayload();
        if (result.errorMessage() == null) return null;
        return mapper.createObjectNode().put("error", result.errorMessage());
    }
}
