package org.prefixwatch;

import java.util.List;

public final class ConfigValidationException extends RuntimeException {
    private final List<String> problems;

    public ConfigValidationException(List<String> problems) {
        super("Configuration validation failed:" + System.lineSeparator() + "  - "
                + String.join(System.lineSeparator() + "  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
