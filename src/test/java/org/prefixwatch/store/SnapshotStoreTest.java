package org.prefixwatch.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prefixwatch.MutableClock;
import org.prefixwatch.ObjectMapperFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotStoreTest {
    private final MutableClock clock = MutableClock.atEpochSecond(100);
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        store = SnapshotStore.inMemory(ObjectMapperFactory.create(), clock);
        store.migrate();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void snapshotBeforeCutoffPicksNewestStrictlyOlderObservation() {
        clock.set(100);
        save("AS15169", List.of("8.8.8.0/24"));
        clock.set(200);
        final var second = save("AS15169", List.of("8.8.8.0/24", "8.8.4.0/24"));
        clock.set(300);
        save("AS15169", List.of("8.8.4.0/24"));

        final var baseline = store.getSnapshotBefore("AS15169", Instant.ofEpochSecond(250)).orElseThrow();

        assertThat(baseline.id()).isEqualTo(second);
        assertThat(baseline.observedAt()).isEqualTo(Instant.ofEpochSecond(200));
        assertThat(store.getSnapshotBefore("AS15169", Instant.ofEpochSecond(200)).orElseThrow().observedAt())
                .isEqualTo(Instant.ofEpochSecond(100));
        assertThat(store.getSnapshotBefore("AS15169", Instant.ofEpochSecond(100))).isEmpty();
        assertThat(store.getSnapshotBefore("AS64500", Instant.ofEpochSecond(1_000))).isEmpty();
    }

    @Test
    void equalTimestampsResolveByInsertionOrder() {
        final var first = save("AS1", List.of("192.0.2.0/24"));
        final var second = save("AS1", List.of("198.51.100.0/24"));

        assertThat(store.getLatestSnapshot("AS1").orElseThrow().id()).isEqualTo(second);
        assertThat(store.getSnapshotHistory("AS1", 10)).extracting(Snapshot::id).containsExactly(second, first);
        assertThat(store.getSnapshotHistory("AS1", 1)).hasSize(1);
    }

    @Test
    void storesSortedPrefixesAndOrderIndependentHash() {
        final var a = save("AS1", List.of("10.0.0.0/8", "1.0.0.0/8", "10.0.0.0/8"));
        final var b = save("AS1", List.of("1.0.0.0/8", "10.0.0.0/8"));

        final var first = store.getSnapshotById(a).orElseThrow();
        final var second = store.getSnapshotById(b).orElseThrow();

        assertThat(first.ipv4Prefixes()).containsExactly("1.0.0.0/8", "10.0.0.0/8");
        assertThat(first.contentHash()).isEqualTo(second.contentHash()).hasSize(64);
        assertThat(first.targetType()).isEqualTo(TargetType.ASN);
        assertThat(first.sources()).containsExactly("RADB", "RIPE");
    }

    @Test
    void failedTransactionLeavesNoPartialRows() {
        assertThatThrownBy(() -> store.inTransaction(tx -> {
            final var id = tx.saveSnapshot("AS1", TargetType.ASN, List.of("RADB"), List.of("192.0.2.0/24"), List.of());
            tx.saveDiff(id, null, "AS1", List.of("192.0.2.0/24"), List.of(), List.of(), List.of(), "hash");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(store.getLatestSnapshot("AS1")).isEmpty();
        assertThat(store.getLatestDiff("AS1")).isEmpty();

        final var committed = store.inTransaction(tx -> save("AS1", List.of("192.0.2.0/24")));
        assertThat(store.getSnapshotById(committed)).isPresent();
    }

    @Test
    void foreignKeysRejectDanglingReferences() {
        assertThatThrownBy(() -> store.saveDiff(42, null, "AS1", List.of(), List.of(), List.of(), List.of(), "h"))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> store.saveTicket(42, "AS1", TicketStatus.PENDING,
                ObjectMapperFactory.create().createObjectNode()))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void ticketUpdateKeepsKnownExternalId() {
        final var mapper = ObjectMapperFactory.create();
        final var snapshotId = save("AS1", List.of("192.0.2.0/24"));
        final var diffId = store.saveDiff(snapshotId, null, "AS1", List.of("192.0.2.0/24"), List.of(), List.of(),
                List.of(), "hash-1");
        final var ticketId = store.saveTicket(diffId, "AS1", TicketStatus.PENDING,
                mapper.createObjectNode().put("target", "AS1"));

        store.updateTicketStatus(ticketId, TicketStatus.CREATED, mapper.createObjectNode().put("ticket_id", "T-1"),
                "T-1");
        store.updateTicketStatus(ticketId, TicketStatus.DUPLICATE, null, null);

        final var ticket = store.getTicketForDiff(diffId).orElseThrow();
        assertThat(ticket.externalTicketId()).isEqualTo("T-1");
        assertThat(ticket.status()).isEqualTo(TicketStatus.DUPLICATE);
        assertThat(ticket.requestPayload().path("target").asText()).isEqualTo("AS1");
        assertThat(ticket.responsePayload()).isNull();
        assertThatThrownBy(() -> store.updateTicketStatus(999, TicketStatus.FAILED, null, null))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("No ticket with id 999");
    }

    @Test
    void successfulTicketLookupMatchesHashWhateverTheBaseline() {
        final var mapper = ObjectMapperFactory.create();
        final var base = save("AS1", List.of());
        final var next = save("AS1", List.of("192.0.2.0/24"));
        final var diffId = store.saveDiff(next, base, "AS1", List.of("192.0.2.0/24"), List.of(), List.of(),
                List.of(), "hash-a");
        final var ticketId = store.saveTicket(diffId, "AS1", TicketStatus.PENDING, mapper.createObjectNode());

        assertThat(store.findSuccessfulTicket("hash-a")).isEmpty();

        store.updateTicketStatus(ticketId, TicketStatus.CREATED, null, "T-9");
        final var later = save("AS1", List.of("192.0.2.0/24"));
        store.saveDiff(later, next, "AS1", List.of("192.0.2.0/24"), List.of(), List.of(), List.of(), "hash-a");

        assertThat(store.findSuccessfulTicket("hash-a")).map(Ticket::externalTicketId).contains("T-9");
        assertThat(store.findSuccessfulTicket("hash-b")).isEmpty();
    }

    @Test
    void changeSetWithoutBaselineReadsBackWithoutBaseline() {
        final var first = save("AS1", List.of("192.0.2.0/24"));
        final var firstDiff = store.saveDiff(first, null, "AS1", List.of("192.0.2.0/24"), List.of(), List.of(),
                List.of(), "first");
        final var second = save("AS1", List.of("192.0.2.0/24", "198.51.100.0/24"));
        final var secondDiff = store.saveDiff(second, first, "AS1", List.of("198.51.100.0/24"), List.of(),
                List.of(), List.of(), "second");

        assertThat(store.getDiffById(firstDiff).orElseThrow().oldSnapshotId()).isNull();
        assertThat(store.getDiffByHash("first").orElseThrow().oldSnapshotId()).isNull();
        assertThat(store.getDiffById(secondDiff).orElseThrow().oldSnapshotId()).isEqualTo(first);
        assertThat(store.getLatestDiff("AS1").orElseThrow().oldSnapshotId()).isEqualTo(first);
    }

    @Test
    void latestDiffAndLookupByHash() {
        final var snapshotId = save("AS-EXAMPLE", List.of("192.0.2.0/24"));
        final var first = store.saveDiff(snapshotId, null, "AS-EXAMPLE", List.of("192.0.2.0/24"), List.of(),
                List.of(), List.of(), "h1");
        clock.set(500);
        final var second = store.saveDiff(snapshotId, null, "AS-EXAMPLE", List.of(), List.of(), List.of(), List.of(),
                "h2");

        assertThat(store.getLatestDiff("AS-EXAMPLE").orElseThrow().id()).isEqualTo(second);
        assertThat(store.getDiffByHash("h1").orElseThrow().id()).isEqualTo(first);
        final var diff = store.getDiffById(first).orElseThrow();
        assertThat(diff.hasChanges()).isTrue();
        assertThat(diff.oldSnapshotId()).isNull();
        assertThat(store.getDiffById(second).orElseThrow().hasChanges()).isFalse();
        assertThat(store.getSnapshotById(snapshotId).orElseThrow().targetType()).isEqualTo(TargetType.AS_SET);
    }

    @Test
    void fileDatabaseSurvivesReopen(@TempDir Path tempDir) {
        final var file = tempDir.resolve("nested/irr.sqlite");
        try (var fileStore = SnapshotStore.open(file, ObjectMapperFactory.create(), clock)) {
            fileStore.migrate();
            fileStore.saveSnapshot("AS1", TargetType.ASN, List.of("RADB"), List.of("192.0.2.0/24"),
                    List.of("2001:db8::/32"));
        }
        try (var reopened = SnapshotStore.open(file, ObjectMapperFactory.create(), clock)) {
            reopened.migrate();
            final var snapshot = reopened.getLatestSnapshot("AS1").orElseThrow();
            assertThat(snapshot.ipv6Prefixes()).containsExactly("2001:db8::/32");
        }
    }

    private long save(String target, List<String> ipv4) {
        return store.saveSnapshot(target, TargetType.of(target), List.of("RADB", "RIPE"), ipv4, List.of());
    }
}
