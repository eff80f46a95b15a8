package org.prefixwatch.store;

import java.time.Instant;
import java.util.List;

public record Snapshot(long id, String target, TargetType targetType, Instant observedAt, List<String> sources,
                       List<String> ipv4Prefixes, List<String> ipv6Prefixes, String contentHash) {

    public Snapshot {
        sources = List.copyOf(sources);
        ipv4Prefixes = List.copyOf(ipv4Prefixes);
        ipv6Prefixes = List.copyOf(ipv6Prefixes);
    }

    public String shortHash() {
        return contentHash.length() > 12 ? contentHash.substring(0, 12) : contentHash;
    }
}
