package org.prefixwatch.store;

import java.util.Locale;
import java.util.regex.Pattern;

public enum TargetType {
    ASN("asn"),
    AS_SET("as-set");

    private static final Pattern ASN_PATTERN = Pattern.compile("^AS\\d+$");
    private final String dbValue;

    TargetType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static TargetType of(String normalizedTarget) {
        return ASN_PATTERN.matcher(normalizedTarget).matches() ? ASN : AS_SET;
    }

    public static TargetType fromDb(String value) {
        final var lowered = value.toLowerCase(Locale.ROOT);
        for (final var type : values()) {
            if (type.dbValue.equals(lowered)) return type;
        }
        throw new IllegalArgumentException("Unknown target type: " + value);
    }
}
