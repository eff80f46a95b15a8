package org.prefixwatch.diff;

import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.ContentHashes;
import org.prefixwatch.store.Snapshot;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class DiffEngine {

    private DiffEngine() {
    }

    public static DiffResult compute(Snapshot current, Snapshot baseline) {
        if (current == null) throw new IllegalArgumentException("current snapshot is required");
        final var currentV4 = asSet(current.ipv4Prefixes());
        final var currentV6 = asSet(current.ipv6Prefixes());

        final List<String> addedV4;
        final List<String> removedV4;
        final List<String> addedV6;
        final List<String> removedV6;
        if (baseline == null) {
            addedV4 = ContentHashes.sorted(currentV4);
            addedV6 = ContentHashes.sorted(currentV6);
            removedV4 = List.of();
            removedV6 = List.of();
        } else {
            final var baselineV4 = asSet(baseline.ipv4Prefixes());
            final var baselineV6 = asSet(baseline.ipv6Prefixes());
            addedV4 = minus(currentV4, baselineV4);
            removedV4 = minus(baselineV4, currentV4);
            addedV6 = minus(currentV6, baselineV6);
            removedV6 = minus(baselineV6, currentV6);
        }
        final var hasChanges = !addedV4.isEmpty() || !removedV4.isEmpty() || !addedV6.isEmpty() || !removedV6.isEmpty();
        final var diffHash = ContentHashes.diffHash(current.target(), addedV4, removedV4, addedV6, removedV6);
        return new DiffResult(current.target(), current.id(), baseline == null ? null : baseline.id(),
                addedV4, removedV4, addedV6, removedV6, hasChanges, diffHash);
    }

    public static DiffResult fromChangeSet(ChangeSet changeSet) {
        return new DiffResult(changeSet.target(), changeSet.newSnapshotId(), changeSet.oldSnapshotId(),
                changeSet.addedV4(), changeSet.removedV4(), changeSet.addedV6(), changeSet.removedV6(),
                changeSet.hasChanges(), changeSet.diffHash());
    }

    private static Set<String> asSet(Collection<String> prefixes) {
        return prefixes == null ? Set.of() : new HashSet<>(prefixes);
    }

    private static List<String> minus(Set<String> left, Set<String> right) {
        final var result = new HashSet<>(left);
        result.removeAll(right);
        return ContentHashes.sorted(result);
    }
}
