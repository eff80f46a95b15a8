package org.prefixwatch.pipeline;

import org.prefixwatch.store.Ticket;

import java.util.Optional;

public record SubmissionOutcome(RunOutcome outcome, Optional<Ticket> ticket, String message) {

    public static SubmissionOutcome noChanges(String message) {
        return new SubmissionOutcome(RunOutcome.NO_CHANGES, Optional.empty(), message);
    }

    public Optional<String> externalTicketId() {
        return ticket.map(Ticket::externalTicketId);
    }
}
