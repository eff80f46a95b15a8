package org.prefixwatch.fetch;

import java.util.List;
import java.util.Set;

public record PrefixResult(Set<String> ipv4Prefixes, Set<String> ipv6Prefixes, List<String> sourcesQueried,
                           List<String> errors) {

    public PrefixResult {
        ipv4Prefixes = ipv4Prefixes == null ? Set.of() : Set.copyOf(ipv4Prefixes);
        ipv6Prefixes = ipv6Prefixes == null ? Set.of() : Set.copyOf(ipv6Prefixes);
        sourcesQueried = sourcesQueried == null ? List.of() : List.copyOf(sourcesQueried);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * No prefix of either family and at least one error. An empty result without errors is a real
     * observation (every route withdrawn), not a failure.
     */
    public boolean isTotalFailure() {
        return ipv4Prefixes.isEmpty() && ipv6Prefixes.isEmpty() && !errors.isEmpty();
    }
}
