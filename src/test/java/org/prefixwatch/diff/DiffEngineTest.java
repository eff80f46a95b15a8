package org.prefixwatch.diff;

import org.junit.jupiter.api.Test;
import org.prefixwatch.ObjectMapperFactory;
import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.ContentHashes;
import org.prefixwatch.store.Snapshot;
import org.prefixwatch.store.TargetType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiffEngineTest {

    @Test
    void addedPrefixIsReported() {
        final var previous = snapshot(1, 100, List.of("8.8.8.0/24"), List.of());
        final var current = snapshot(2, 200, List.of("8.8.8.0/24", "8.8.4.0/24"), List.of());

        final var diff = DiffEngine.compute(current, previous);

        assertThat(diff.addedV4()).containsExactly("8.8.4.0/24");
        assertThat(diff.removedV4()).isEmpty();
        assertThat(diff.hasChanges()).isTrue();
        assertThat(diff.newSnapshotId()).isEqualTo(2);
        assertThat(diff.oldSnapshotId()).isEqualTo(1L);
        assertThat(diff.summary()).isEqualTo("Detected 1 added IPv4 prefixes for AS15169");
    }

    @Test
    void firstSnapshotAddsEverything() {
        final var current = snapshot(7, 100, List.of("1.0.0.0/8"), List.of("2001:db8::/32"));

        final var diff = DiffEngine.compute(current, null);

        assertThat(diff.addedV4()).containsExactly("1.0.0.0/8");
        assertThat(diff.addedV6()).containsExactly("2001:db8::/32");
        assertThat(diff.removedV4()).isEmpty();
        assertThat(diff.removedV6()).isEmpty();
        assertThat(diff.hasChanges()).isTrue();
        assertThat(diff.oldSnapshotId()).isNull();
    }

    @Test
    void firstSnapshotWithoutPrefixesHasNoChanges() {
        final var diff = DiffEngine.compute(snapshot(1, 100, List.of(), List.of()), null);

        assertThat(diff.hasChanges()).isFalse();
        assertThat(diff.summary()).isEqualTo("No changes detected for AS15169");
    }

    @Test
    void identicalSetsHaveNoChangesRegardlessOfTimestamps() {
        final var older = snapshot(1, 100, List.of(), List.of("2001:db8::/32"));
        final var newer = snapshot(2, 90_000, List.of(), List.of("2001:db8::/32"));

        final var diff = DiffEngine.compute(newer, older);

        assertThat(diff.hasChanges()).isFalse();
        assertThat(diff.addedV4()).isEmpty();
        assertThat(diff.removedV4()).isEmpty();
        assertThat(diff.addedV6()).isEmpty();
        assertThat(diff.removedV6()).isEmpty();
    }

    @Test
    void selfDiffIsEmptyWhateverTheSnapshotId() {
        final var snapshot = snapshot(3, 100, List.of("192.0.2.0/24"), List.of("2001:db8::/48"));
        final var sameContentOtherId = snapshot(99, 100, List.of("192.0.2.0/24"), List.of("2001:db8::/48"));

        assertThat(DiffEngine.compute(snapshot, snapshot).hasChanges()).isFalse();
        assertThat(DiffEngine.compute(sameContentOtherId, snapshot).hasChanges()).isFalse();
    }

    @Test
    void addedAndRemovedAreMirrorImages() {
        final var a = snapshot(1, 100, List.of("10.0.0.0/8", "192.0.2.0/24"), List.of("2001:db8::/32"));
        final var b = snapshot(2, 200, List.of("10.0.0.0/8", "198.51.100.0/24"), List.of("2001:db8:1::/48"));

        final var forward = DiffEngine.compute(a, b);
        final var backward = DiffEngine.compute(b, a);

        assertThat(forward.addedV4()).isEqualTo(backward.removedV4());
        assertThat(forward.removedV4()).isEqualTo(backward.addedV4());
        assertThat(forward.addedV6()).isEqualTo(backward.removedV6());
        assertThat(forward.removedV6()).isEqualTo(backward.addedV6());
    }

    @Test
    void hashIgnoresInsertionOrder() {
        final var prefixes = IntStream.range(0, 50).mapToObj(i -> "10." + i + ".0.0/16").toList();
        final var shuffled = new ArrayList<>(prefixes);
        Collections.shuffle(shuffled);

        final var ordered = DiffEngine.compute(snapshot(2, 200, prefixes, List.of()), snapshot(1, 100, List.of(), List.of()));
        final var unordered = DiffEngine.compute(snapshot(4, 400, shuffled, List.of()), snapshot(3, 300, List.of(), List.of()));

        assertThat(unordered.diffHash()).isEqualTo(ordered.diffHash());
        assertThat(unordered.addedV4()).isEqualTo(ordered.addedV4()).isSorted();
    }

    @Test
    void hashDependsOnTargetAndContent() {
        final var base = DiffEngine.compute(snapshot(1, 100, List.of("192.0.2.0/24"), List.of()), null);
        final var otherTarget = DiffEngine.compute(new Snapshot(2, "AS64500", TargetType.ASN,
                Instant.ofEpochSecond(100), List.of(), List.of("192.0.2.0/24"), List.of(), "x"), null);

        assertThat(base.diffHash()).isNotEqualTo(otherTarget.diffHash());
        assertThat(base.diffHash()).isEqualTo(ContentHashes.diffHash("AS15169", List.of("192.0.2.0/24"), List.of(),
                List.of(), List.of()));
    }

    @Test
    void rejectsMissingCurrentSnapshot() {
        assertThatThrownBy(() -> DiffEngine.compute(null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roundTripsThroughStoredChangeSet() {
        final var changeSet = new ChangeSet(5, "AS15169", 2, 1L, List.of("8.8.4.0/24"), List.of(), List.of(),
                List.of("2001:db8::/32"), true, "abc", Instant.ofEpochSecond(200));

        final var diff = DiffEngine.fromChangeSet(changeSet);

        assertThat(diff.summary()).isEqualTo("Detected 1 added IPv4, 1 removed IPv6 prefixes for AS15169");
        assertThat(diff.diffHash()).isEqualTo("abc");
    }

    @Test
    void humanReportTruncatesLongLists() {
        final var prefixes = IntStream.range(0, 12).mapToObj(i -> "10." + i + ".0.0/16").toList();
        final var diff = DiffEngine.compute(snapshot(1, 100, prefixes, List.of()), null);

        final var report = DiffFormatter.human(diff);

        assertThat(report).startsWith("Changes for AS15169:")
                .contains("Added IPv4 (12):")
                .contains("... and 2 more");
        assertThat(report.lines().filter(line -> line.trim().startsWith("+"))).hasSize(10);
        assertThat(DiffFormatter.human(DiffEngine.compute(snapshot(1, 100, List.of(), List.of()), null)))
                .contains("No changes detected");
    }

    @Test
    void jsonReportUsesSnakeCaseKeys() {
        final var diff = DiffEngine.compute(snapshot(1, 100, List.of("192.0.2.0/24"), List.of()), null);

        final var json = DiffFormatter.json(diff, ObjectMapperFactory.create());

        assertThat(json.path("has_changes").asBoolean()).isTrue();
        assertThat(json.path("added_v4").get(0).asText()).isEqualTo("192.0.2.0/24");
        assertThat(json.path("old_snapshot_id").isNull()).isTrue();
        assertThat(json.path("diff_hash").asText()).isEqualTo(diff.diffHash());
    }

    private static Snapshot snapshot(long id, long observedAt, List<String> v4, List<String> v6) {
        return new Snapshot(id, "AS15169", TargetType.ASN, Instant.ofEpochSecond(observedAt), List.of("RADB"),
                v4, v6, ContentHashes.snapshotHash(v4, v6));
    }
}
