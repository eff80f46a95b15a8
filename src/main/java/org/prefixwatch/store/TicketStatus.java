package org.prefixwatch.store;

import java.util.Locale;

public enum TicketStatus {
    PENDING("pending"),
    CREATED("created"),
    DUPLICATE("duplicate"),
    FAILED("failed"),
    DRY_RUN("dry_run");

    private final String dbValue;

    TicketStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isSuccessful() {
        return this == CREATED || this == DUPLICATE;
    }

    public static TicketStatus fromDb(String value) {
        final var lowered = value.toLowerCase(Locale.ROOT);
        for (final var status : values()) {
            if (status.dbValue.equals(lowered)) return status;
        }
        throw new IllegalArgumentException("Unknown ticket status: " + value);
    }
}
