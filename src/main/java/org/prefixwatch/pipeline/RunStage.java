package org.prefixwatch.pipeline;

import java.util.Locale;

public enum RunStage {
    FETCH, SNAPSHOT, DIFF, SUBMIT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
