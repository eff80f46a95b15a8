package org.prefixwatch.pipeline;

import org.prefixwatch.LogContext;
import org.prefixwatch.diff.DiffEngine;
import org.prefixwatch.diff.DiffResult;
import org.prefixwatch.fetch.FetchFailureException;
import org.prefixwatch.fetch.PrefixFetcher;
import org.prefixwatch.fetch.PrefixResult;
import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.Snapshot;
import org.prefixwatch.store.SnapshotStore;
import org.prefixwatch.store.StorageException;
import org.prefixwatch.store.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * fetch, snapshot, diff and submit for one target, and the batch loop over many. Steps of one target
 * always run in order on the calling thread; only whole targets are spread over the worker pool.
 */
public final class PrefixPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefixPipeline.class);

    private final SnapshotStore store;
    private final PrefixFetcher fetcher;
    private final SubmissionLedger ledger;
    private final Clock clock;

    public PrefixPipeline(SnapshotStore store, PrefixFetcher fetcher, SubmissionLedger ledger, Clock clock) {
        this.store = store;
        this.fetcher = fetcher;
        this.ledger = ledger;
        this.clock = clock;
    }

    public Snapshot fetchAndSnapshot(String target) throws FetchFailureException {
        final var context = runContext(target);
        final var result = fetch(target, context);
        final var snapshotId = store.saveSnapshot(target, TargetType.of(target), result.sourcesQueried(),
                result.ipv4Prefixes(), result.ipv6Prefixes());
        final var snapshot = loadSnapshot(snapshotId);
        context.atInfo(LOGGER).log("Saved snapshot {} for {} (hash {})", snapshotId, target, snapshot.shortHash());
        return snapshot;
    }

    /**
     * Diffs the latest snapshot against the newest one observed more than {@code lookback} before it
     * and persists the change-set. Re-running against the same snapshot returns the stored change-set.
     */
    public Optional<ChangeSet> diffAgainstBaseline(String target, Duration lookback) {
        final var context = runContext(target);
        return store.inTransaction(tx -> {
            final var latest = tx.getLatestSnapshot(target);
            if (latest.isEmpty()) {
                context.atWarn(LOGGER).log("No snapshots recorded for {}", target);
                return Optional.<ChangeSet>empty();
            }
            final var current = latest.get();
            final var baseline = tx.getSnapshotBefore(target, current.observedAt().minus(lookback)).orElse(null);
            final var diff = DiffEngine.compute(current, baseline);
            final var stored = tx.getLatestDiff(target)
                    .filter(previous -> previous.newSnapshotId() == current.id()
                            && previous.diffHash().equals(diff.diffHash()));
            if (stored.isPresent()) return stored;
            return Optional.of(persist(tx, diff));
        });
    }

    public SubmissionOutcome submitIfChanged(String target, boolean dryRun) {
        final var context = runContext(target);
        final var latest = store.getLatestDiff(target);
        if (latest.isEmpty()) return SubmissionOutcome.noChanges("No diff recorded for " + target);
        final var changeSet = latest.get();
        final var sources = store.getSnapshotById(changeSet.newSnapshotId())
                .map(Snapshot::sources)
                .orElse(List.of());
        return ledger.submit(changeSet, sources, dryRun, context);
    }

    public PipelineResult runPipeline(String target, Duration lookback, boolean dryRun) {
        final var context = runContext(target);
        context.atInfo(LOGGER).log("Starting pipeline for {} using {}", target, fetcher.describe());

        final PrefixResult fetched;
        try {
            fetched = fetch(target, context);
        } catch (FetchFailureException ex) {
            return PipelineResult.failed(target, RunStage.FETCH, RunOutcome.FETCH_FAILED, Optional.empty(),
                    Optional.empty(), ex.errors(), ex.getMessage());
        } catch (RuntimeException ex) {
            context.atError(LOGGER).setCause(ex).log("Unexpected failure during fetch stage: {}", ex.toString());
            return PipelineResult.failed(target, RunStage.FETCH, RunOutcome.ERROR, Optional.empty(),
                    Optional.empty(), List.of(ex.toString()), "Unexpected error: " + ex.getMessage());
        }

        var stage = RunStage.SNAPSHOT;
        Snapshot snapshot = null;
        ChangeSet changeSet = null;
        try {
            final var recorded = store.inTransaction(tx -> {
                final var cutoff = clock.instant().minus(lookback);
                final var baseline = tx.getSnapshotBefore(target, cutoff).orElse(null);
                final var snapshotId = tx.saveSnapshot(target, TargetType.of(target), fetched.sourcesQueried(),
                        fetched.ipv4Prefixes(), fetched.ipv6Prefixes());
                final var current = tx.getSnapshotById(snapshotId)
                        .orElseThrow(() -> new StorageException("Snapshot " + snapshotId + " vanished", null));
                return new Recorded(current, persist(tx, DiffEngine.compute(current, baseline)));
            });
            snapshot = recorded.snapshot();
            changeSet = recorded.changeSet();
            stage = RunStage.DIFF;
            context.with("diff_hash", changeSet.diffHash()).atInfo(LOGGER)
                    .log("Snapshot {} recorded: {}", snapshot.id(), DiffEngine.fromChangeSet(changeSet).summary());

            if (!changeSet.hasChanges()) {
                return new PipelineResult(target, stage, RunOutcome.NO_CHANGES, Optional.of(snapshot),
                        Optional.of(changeSet), Optional.empty(), fetched.errors(),
                        DiffEngine.fromChangeSet(changeSet).summary());
            }

            stage = RunStage.SUBMIT;
            final var submission = ledger.submit(changeSet, snapshot.sources(), dryRun, context);
            return new PipelineResult(target, stage, submission.outcome(), Optional.of(snapshot),
                    Optional.of(changeSet), submission.ticket(), fetched.errors(), submission.message());
        } catch (StorageException ex) {
            context.atError(LOGGER).setCause(ex).log("Storage failure during {} stage: {}", stage.label(),
                    ex.getMessage());
            final var errors = new ArrayList<>(fetched.errors());
            errors.add(ex.getMessage());
            return PipelineResult.failed(target, stage, RunOutcome.STORAGE_FAILED, Optional.ofNullable(snapshot),
                    Optional.ofNullable(changeSet), errors, "Storage failure: " + ex.getMessage());
        } catch (RuntimeException ex) {
            context.atError(LOGGER).setCause(ex).log("Unexpected failure during {} stage: {}", stage.label(),
                    ex.toString());
            final var errors = new ArrayList<>(fetched.errors());
            errors.add(ex.toString());
            return PipelineResult.failed(target, stage, RunOutcome.ERROR, Optional.ofNullable(snapshot),
                    Optional.ofNullable(changeSet), errors, "Unexpected error: " + ex.getMessage());
        }
    }

    public BatchReport runAll(List<String> targets, Duration lookback, boolean dryRun, int parallelism) {
        if (parallelism <= 1 || targets.size() <= 1) {
            final var results = new ArrayList<PipelineResult>(targets.size());
            for (final var target : targets) results.add(runGuarded(target, lookback, dryRun));
            return report(results);
        }
        final var executor = Executors.newFixedThreadPool(Math.min(parallelism, targets.size()));
        try {
            final var futures = new ArrayList<Future<PipelineResult>>(targets.size());
            for (final var target : targets) {
                futures.add(executor.submit(() -> runGuarded(target, lookback, dryRun)));
            }
            final var results = new ArrayList<PipelineResult>(targets.size());
            for (var i = 0; i < futures.size(); i++) {
                results.add(await(targets.get(i), futures.get(i)));
            }
            return report(results);
        } finally {
            executor.shutdownNow();
        }
    }

    private PipelineResult runGuarded(String target, Duration lookback, boolean dryRun) {
        try {
            return runPipeline(target, lookback, dryRun);
        } catch (RuntimeException ex) {
            LogContext.of("target", target).atError(LOGGER).setCause(ex)
                    .log("Pipeline for {} failed unexpectedly: {}", target, ex.toString());
            return PipelineResult.failed(target, RunStage.FETCH, RunOutcome.ERROR, Optional.empty(),
                    Optional.empty(), List.of(ex.toString()), "Unexpected error: " + ex.getMessage());
        }
    }

    private static PipelineResult await(String target, Future<PipelineResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return PipelineResult.failed(target, RunStage.FETCH, RunOutcome.ERROR, Optional.empty(),
                    Optional.empty(), List.of("Interrupted"), "Interrupted before completion");
        } catch (ExecutionException ex) {
            final var cause = ex.getCause() == null ? ex : ex.getCause();
            return PipelineResult.failed(target, RunStage.FETCH, RunOutcome.ERROR, Optional.empty(),
                    Optional.empty(), List.of(cause.toString()), "Unexpected error: " + cause.getMessage());
        }
    }

    private static BatchReport report(List<PipelineResult> results) {
        final var report = new BatchReport(results);
        LOGGER.atInfo()
                .addKeyValue("succeeded", report.succeeded())
                .addKeyValue("failed", report.failed())
                .log("Batch complete: {} succeeded, {} failed", report.succeeded(), report.failed());
        return report;
    }

    private PrefixResult fetch(String target, LogContext context) throws FetchFailureException {
        final var result = fetcher.fetch(target, context);
        if (result.isTotalFailure()) {
            context.atError(LOGGER).addKeyValue("errors", result.errors())
                    .log("Fetch failed for {}, no snapshot written", target);
            throw new FetchFailureException(target, result.errors());
        }
        if (!result.errors().isEmpty()) {
            context.atWarn(LOGGER).addKeyValue("errors", result.errors())
                    .log("Partial fetch for {}: {} source error(s)", target, result.errors().size());
        }
        return result;
    }

    private static ChangeSet persist(SnapshotStore tx, DiffResult diff) {
        final var diffId = tx.saveDiff(diff.newSnapshotId(), diff.oldSnapshotId(), diff.target(), diff.addedV4(),
                diff.removedV4(), diff.addedV6(), diff.removedV6(), diff.diffHash());
        return tx.getDiffById(diffId)
                .orElseThrow(() -> new StorageException("Change-set " + diffId + " vanished", null));
    }

    private Snapshot loadSnapshot(long snapshotId) {
        return store.getSnapshotById(snapshotId)
                .orElseThrow(() -> new StorageException("Snapshot " + snapshotId + " vanished", null));
    }

    private static LogContext runContext(String target) {
        return LogContext.of("target", target).with("run_id", UUID.randomUUID().toString().substring(0, 8));
    }

    private record Recorded(Snapshot snapshot, ChangeSet changeSet) {
    }
}
