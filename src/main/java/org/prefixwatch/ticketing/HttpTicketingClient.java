package org.prefixwatch.ticketing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.LogContext;
import org.prefixwatch.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * REST client for the change-management API: {@code POST {base}/tickets} with the diff hash as
 * {@code X-Idempotency-Key}. 201 is a new ticket, 409 the ticket already filed for that key.
 * Server errors and I/O failures are retried; other client errors fail at once.
 */
public final class HttpTicketingClient implements TicketingClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTicketingClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI ticketsUri;
    private final String apiToken;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public HttpTicketingClient(HttpClient httpClient, ObjectMapper mapper, URI baseUrl, String apiToken,
                               Duration timeout, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.ticketsUri = URI.create(baseUrl.toString().replaceAll("/+$", "") + "/tickets");
        this.apiToken = apiToken == null ? "" : apiToken;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    public static RetryPolicy defaultRetryPolicy(int maxRetries) {
        return RetryPolicy.exponential(maxRetries, HttpTicketingClient::isRetryable);
    }

    @Override
    public SubmissionResult submit(TicketRequest request) {
        final var context = LogContext.of("target", request.target()).with("diff_hash", request.idempotencyKey());
        try {
            return retryPolicy.execute("ticket-submit", context, () -> post(request, context));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SubmissionResult.failed("Interrupted while submitting ticket", null);
        } catch (ServerErrorException ex) {
            context.atError(LOGGER).log("Failed to create ticket after {} attempts: {}",
                    retryPolicy.maxAttempts(), ex.getMessage());
            return SubmissionResult.failed(ex.getMessage(), ex.response());
        } catch (Exception ex) {
            context.atError(LOGGER).log("Failed to create ticket after {} attempts: {}",
                    retryPolicy.maxAttempts(), ex.toString());
            return SubmissionResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage(), null);
        }
    }

    private SubmissionResult post(TicketRequest request, LogContext context) throws IOException, InterruptedException {
        context.atDebug(LOGGER).log("Submitting ticket to {}", ticketsUri);
        final var httpRequest = HttpRequest.newBuilder(ticketsUri)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(request.payload())))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("User-Agent", "prefixwatch/1.0")
                .header("Authorization", "Bearer " + apiToken)
                .header("X-Idempotency-Key", request.idempotencyKey())
                .timeout(timeout)
                .build();
        final var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        final var status = response.statusCode();
        final var body = readJson(response.body());

        if (status == 409 && body != null) {
            final var existing = textOrNull(body, "existing_ticket_id");
            context.atInfo(LOGGER).addKeyValue("existing_ticket_id", existing)
                    .log("Ticket already exists: {}", existing);
            return SubmissionResult.duplicate(existing, body);
        }
        if (status == 201 && body != null) {
            final var ticketId = textOrNull(body, "ticket_id");
            context.atInfo(LOGGER).addKeyValue("ticket_id", ticketId).log("Ticket created: {}", ticketId);
            return SubmissionResult.created(ticketId, body);
        }

        final var message = "API returned status " + status + ": " + abbreviate(response.body());
        context.atError(LOGGER).addKeyValue("status_code", status).log(message);
        final var responsePayload = body != null ? body : rawResponse(status, response.body());
        if (status >= 500 && status < 600) throw new ServerErrorException(message, responsePayload);
        return SubmissionResult.failed(message, responsePayload);
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            final var node = mapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (IOException ex) {
            return null;
        }
    }

    private JsonNode rawResponse(int status, String body) {
        final var node = mapper.createObjectNode();
        node.put("status_code", status);
        node.put("body", abbreviate(body));
        return node;
    }

    private static String textOrNull(JsonNode node, String field) {
        final var value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        final var text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200);
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof IOException;
    }

    static final class ServerErrorException extends IOException {
        private final transient JsonNode response;

        ServerErrorException(String message, JsonNode response) {
            super(message);
            this.response = response;
        }

        JsonNode response() {
            return response;
        }
    }
}
