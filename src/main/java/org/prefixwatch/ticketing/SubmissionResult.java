package org.prefixwatch.ticketing;

import com.fasterxml.jackson.databind.JsonNode;
import org.prefixwatch.store.TicketStatus;

public record SubmissionResult(TicketStatus status, String externalTicketId, String errorMessage,
                               JsonNode responsePayload) {

    public static SubmissionResult created(String ticketId, JsonNode response) {
        return new SubmissionResult(TicketStatus.CREATED, ticketId, null, response);
    }

    public static SubmissionResult duplicate(String existingTicketId, JsonNode response) {
        return new SubmissionResult(TicketStatus.DUPLICATE, existingTicketId, null, response);
    }

    public static SubmissionResult failed(String errorMessage, JsonNode response) {
        return new SubmissionResult(TicketStatus.FAILED, null, errorMessage, response);
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }
}
