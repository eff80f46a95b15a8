package org.prefixwatch.ticketing;

public interface TicketingClient extends AutoCloseable {

    SubmissionResult submit(TicketRequest request);

    @Override
    default void close() {
    }
}
