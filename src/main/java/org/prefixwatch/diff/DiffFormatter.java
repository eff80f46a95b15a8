package org.prefixwatch.diff;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public final class DiffFormatter {
    private static final int PREVIEW_LIMIT = 10;

    private DiffFormatter() {
    }

    public static String human(DiffResult diff) {
        final var out = new StringBuilder("Changes for ").append(diff.target()).append(':');
        if (!diff.hasChanges()) return out.append(System.lineSeparator()).append("  No changes detected").toString();
        section(out, "Added IPv4", '+', diff.addedV4());
        section(out, "Removed IPv4", '-', diff.removedV4());
        section(out, "Added IPv6", '+', diff.addedV6());
        section(out, "Removed IPv6", '-', diff.removedV6());
        return out.toString();
    }

    public static ObjectNode json(DiffResult diff, ObjectMapper mapper) {
        final var node = mapper.createObjectNode();
        node.put("target", diff.target());
        node.put("has_changes", diff.hasChanges());
        node.set("added_v4", mapper.valueToTree(diff.addedV4()));
        node.set("removed_v4", mapper.valueToTree(diff.removedV4()));
        node.set("added_v6", mapper.valueToTree(diff.addedV6()));
        node.set("removed_v6", mapper.valueToTree(diff.removedV6()));
        node.put("diff_hash", diff.diffHash());
        node.put("new_snapshot_id", diff.newSnapshotId());
        if (diff.oldSnapshotId() == null) node.putNull("old_snapshot_id");
        else node.put("old_snapshot_id", diff.oldSnapshotId());
        node.put("summary", diff.summary());
        return node;
    }

    private static void section(StringBuilder out, String label, char marker, List<String> prefixes) {
        if (prefixes.isEmpty()) return;
        final var newline = System.lineSeparator();
        out.append(newline).append("  ").append(label).append(" (").append(prefixes.size()).append("):");
        prefixes.stream().limit(PREVIEW_LIMIT)
                .forEach(prefix -> out.append(newline).append("    ").append(marker).append(' ').append(prefix));
        if (prefixes.size() > PREVIEW_LIMIT) {
            out.append(newline).append("    ... and ").append(prefixes.size() - PREVIEW_LIMIT).append(" more");
        }
    }
}
