package org.prefixwatch.pipeline;

import java.util.List;

public record BatchReport(List<PipelineResult> results) {

    public BatchReport {
        results = List.copyOf(results);
    }

    public long succeeded() {
        return results.stream().filter(PipelineResult::isSuccess).count();
    }

    public long failed() {
        return results.size() - succeeded();
    }

    public boolean hasFailures() {
        return failed() > 0;
    }
}
