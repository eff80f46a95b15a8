package org.prefixwatch.pipeline;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Targets {
    private static final Pattern TARGET = Pattern.compile("^AS[-\\w:]+$");

    private Targets() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Target must not be empty");
        final var normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (!TARGET.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid target format: " + raw.trim()
                    + " (expected ASN like AS15169 or AS-SET like AS-GOOGLE)");
        }
        return normalized;
    }
}
