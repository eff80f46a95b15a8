package org.prefixwatch.fetch;

import java.io.IOException;

public class SourceQueryException extends IOException {
    private final boolean retryable;

    public SourceQueryException(String message) {
        this(message, true, null);
    }

    public SourceQueryException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof SourceQueryException query) return query.retryable();
        return error instanceof IOException;
    }
}
