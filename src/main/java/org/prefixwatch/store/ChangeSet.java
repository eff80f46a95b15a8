package org.prefixwatch.store;

import java.time.Instant;
import java.util.List;

public record ChangeSet(long id, String target, long newSnapshotId, Long oldSnapshotId,
                        List<String> addedV4, List<String> removedV4, List<String> addedV6, List<String> removedV6,
                        boolean hasChanges, String diffHash, Instant createdAt) {

    public ChangeSet {
        addedV4 = List.copyOf(addedV4);
        removedV4 = List.copyOf(removedV4);
        addedV6 = List.copyOf(addedV6);
        removedV6 = List.copyOf(removedV6);
    }
}
