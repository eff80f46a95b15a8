package org.prefixwatch.fetch;

import org.prefixwatch.LogContext;

public interface PrefixFetcher extends AutoCloseable {

    PrefixResult fetch(String target, LogContext context);

    default PrefixResult fetch(String target) {
        return fetch(target, LogContext.of("target", target));
    }

    String describe();

    @Override
    default void close() {
    }
}
