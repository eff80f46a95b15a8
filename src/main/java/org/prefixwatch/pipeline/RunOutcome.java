package org.prefixwatch.pipeline;

import java.util.Locale;

public enum RunOutcome {
    NO_CHANGES(false),
    TICKET_CREATED(false),
    TICKET_DUPLICATE(false),
    ALREADY_SUBMITTED(false),
    DRY_RUN(false),
    SUBMISSION_FAILED(true),
    FETCH_FAILED(true),
    STORAGE_FAILED(true),
    ERROR(true);

    private final boolean failure;

    RunOutcome(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
