package org.prefixwatch.ticketing;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.prefixwatch.ObjectMapperFactory;
import org.prefixwatch.RetryPolicy;
import org.prefixwatch.diff.DiffEngine;
import org.prefixwatch.diff.DiffResult;
import org.prefixwatch.store.ContentHashes;
import org.prefixwatch.store.Snapshot;
import org.prefixwatch.store.TargetType;
import org.prefixwatch.store.TicketStatus;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpTicketingClientTest {
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), 1.0, Duration.ofMillis(1),
            HttpTicketingClient::isRetryable);

    private final DiffResult diff = DiffEngine.compute(new Snapshot(2, "AS15169", TargetType.ASN,
            Instant.ofEpochSecond(200), List.of("RADB"), List.of("8.8.8.0/24", "8.8.4.0/24"), List.of(),
            ContentHashes.snapshotHash(List.of("8.8.8.0/24", "8.8.4.0/24"), List.of())), null);

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createdTicketCarriesAuthAndIdempotencyHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"ticket_id\": \"CHG-1001\"}"));

        final var result = client().submit(request());

        assertThat(result.status()).isEqualTo(TicketStatus.CREATED);
        assertThat(result.externalTicketId()).isEqualTo("CHG-1001");
        assertThat(result.isSuccessful()).isTrue();

        final var recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/api/tickets");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer secret-token");
        assertThat(recorded.getHeader("X-Idempotency-Key")).isEqualTo(diff.diffHash());
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        final var body = ObjectMapperFactory.create().readTree(recorded.getBody().readUtf8());
        assertThat(body.path("type").asText()).isEqualTo(TicketPayloads.TICKET_TYPE);
        assertThat(body.path("diff_hash").asText()).isEqualTo(diff.diffHash());
    }

    @Test
    void repeatedKeyReturnsExistingTicket() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"ticket_id\": \"CHG-1\"}"));
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"existing_ticket_id\": \"CHG-1\"}"));
        final var client = client();

        final var first = client.submit(request());
        final var second = client.submit(request());

        assertThat(first.status()).isEqualTo(TicketStatus.CREATED);
        assertThat(second.status()).isEqualTo(TicketStatus.DUPLICATE);
        assertThat(second.externalTicketId()).isEqualTo("CHG-1");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getHeader("X-Idempotency-Key"))
                .isEqualTo(server.takeRequest(1, TimeUnit.SECONDS).getHeader("X-Idempotency-Key"));
    }

    @Test
    void serverErrorsAreRetried() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\": \"db locked\"}"));
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"ticket_id\": \"CHG-7\"}"));

        final var result = client().submit(request());

        assertThat(result.status()).isEqualTo(TicketStatus.CREATED);
        assertThat(result.externalTicketId()).isEqualTo("CHG-7");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void persistentServerErrorFailsWithLastResponse() {
        for (var i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"error\": \"maintenance\"}"));
        }

        final var result = client().submit(request());

        assertThat(result.status()).isEqualTo(TicketStatus.FAILED);
        assertThat(result.errorMessage()).startsWith("API returned status 503");
        assertThat(result.responsePayload().path("error").asText()).isEqualTo("maintenance");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void clientErrorsFailWithoutRetry() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad request"));

        final var result = client().submit(request());

        assertThat(result.status()).isEqualTo(TicketStatus.FAILED);
        assertThat(result.errorMessage()).isEqualTo("API returned status 400: bad request");
        assertThat(result.responsePayload().path("status_code").asInt()).isEqualTo(400);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void createdWithoutJsonBodyIsAFailure() {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("<html>ok</html>"));

        final var result = client().submit(request());

        assertThat(result.status()).isEqualTo(TicketStatus.FAILED);
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void payloadListsEveryChangeBucket() {
        final var payload = TicketPayloads.build(ObjectMapperFactory.create(), "AS15169", diff, List.of("RADB", "RIPE"),
                Instant.parse("2026-01-02T03:04:05Z"));

        assertThat(payload.path("target").asText()).isEqualTo("AS15169");
        assertThat(payload.path("timestamp").asText()).isEqualTo("2026-01-02T03:04:05Z");
        assertThat(payload.path("changes").path("added_ipv4")).hasSize(2);
        assertThat(payload.path("changes").path("removed_ipv4").isArray()).isTrue();
        assertThat(payload.path("changes").path("removed_ipv6")).isEmpty();
        assertThat(payload.path("summary").asText()).isEqualTo("Detected 2 added IPv4 prefixes for AS15169");
        assertThat(payload.path("irr_sources").get(1).asText()).isEqualTo("RIPE");
    }

    private TicketRequest request() {
        final var payload = TicketPayloads.build(ObjectMapperFactory.create(), "AS15169", diff, List.of("RADB"),
                Instant.ofEpochSecond(200));
        return new TicketRequest("AS15169", diff, List.of("RADB"), diff.diffHash(), payload);
    }

    private HttpTicketingClient client() {
        return new HttpTicketingClient(HttpClient.newHttpClient(), ObjectMapperFactory.create(),
                server.url("/api/").uri(), "secret-token", Duration.ofSeconds(5), FAST_RETRY);
    }
}
