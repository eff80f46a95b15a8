package org.prefixwatch.fetch;

import java.util.List;

public final class FetchFailureException extends Exception {
    private final String target;
    private final List<String> errors;

    public FetchFailureException(String target, List<String> errors) {
        super("Failed to fetch prefixes for " + target + ": " + errors);
        this.target = target;
        this.errors = List.copyOf(errors);
    }

    public String target() {
        return target;
    }

    public List<String> errors() {
        return errors;
    }
}
