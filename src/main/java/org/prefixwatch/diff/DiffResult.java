package org.prefixwatch.diff;

import java.util.ArrayList;
import java.util.List;

public record DiffResult(String target, long newSnapshotId, Long oldSnapshotId,
                         List<String> addedV4, List<String> removedV4, List<String> addedV6, List<String> removedV6,
                         boolean hasChanges, String diffHash) {

    public DiffResult {
        addedV4 = List.copyOf(addedV4);
        removedV4 = List.copyOf(removedV4);
        addedV6 = List.copyOf(addedV6);
        removedV6 = List.copyOf(removedV6);
    }

    public String summary() {
        final var parts = new ArrayList<String>(4);
        if (!addedV4.isEmpty()) parts.add(addedV4.size() + " added IPv4");
        if (!removedV4.isEmpty()) parts.add(removedV4.size() + " removed IPv4");
        if (!addedV6.isEmpty()) parts.add(addedV6.size() + " added IPv6");
        if (!removedV6.isEmpty()) parts.add(removedV6.size() + " removed IPv6");
        if (parts.isEmpty()) return "No changes detected for " + target;
        return "Detected " + String.join(", ", parts) + " prefixes for " + target;
    }
}
