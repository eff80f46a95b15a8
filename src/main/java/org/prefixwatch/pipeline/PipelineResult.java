package org.prefixwatch.pipeline;

import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.Snapshot;
import org.prefixwatch.store.Ticket;

import java.util.List;
import java.util.Optional;

public record PipelineResult(String target, RunStage stage, RunOutcome outcome, Optional<Snapshot> snapshot,
                             Optional<ChangeSet> changeSet, Optional<Ticket> ticket, List<String> errors,
                             String message) {

    public PipelineResult {
        errors = List.copyOf(errors);
    }

    static PipelineResult failed(String target, RunStage stage, RunOutcome outcome, Optional<Snapshot> snapshot,
                                 Optional<ChangeSet> changeSet, List<String> errors, String message) {
        return new PipelineResult(target, stage, outcome, snapshot, changeSet, Optional.empty(), errors, message);
    }

    public boolean isSuccess() {
        return !outcome.isFailure();
    }
}
