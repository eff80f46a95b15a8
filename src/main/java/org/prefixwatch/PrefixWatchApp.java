package org.prefixwatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.prefixwatch.diff.DiffEngine;
import org.prefixwatch.diff.DiffFormatter;
import org.prefixwatch.fetch.FetchFailureException;
import org.prefixwatch.fetch.PrefixFetcher;
import org.prefixwatch.fetch.PrefixFetchers;
import org.prefixwatch.pipeline.PipelineResult;
import org.prefixwatch.pipeline.PrefixPipeline;
import org.prefixwatch.pipeline.SubmissionLedger;
import org.prefixwatch.pipeline.Targets;
import org.prefixwatch.store.ChangeSet;
import org.prefixwatch.store.Snapshot;
import org.prefixwatch.store.SnapshotStore;
import org.prefixwatch.store.StorageException;
import org.prefixwatch.store.Ticket;
import org.prefixwatch.ticketing.HttpTicketingClient;
import org.prefixwatch.ticketing.TicketingClient;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;

public final class PrefixWatchApp {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final ConfigLoader configLoader;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper = ObjectMapperFactory.create();

    PrefixWatchApp(ConfigLoader configLoader, Clock clock, PrintStream out, PrintStream err) {
        this.configLoader = configLoader;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        final var app = new PrefixWatchApp(ConfigLoader.fromSystemEnvironment(), Clock.systemUTC(), System.out,
                System.err);
        System.exit(app.run(args));
    }

    int run(String[] args) {
        final CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.print(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if ("help".equals(options.command())) {
            out.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        Config config;
        try {
            config = configLoader.load(options.configFile());
        } catch (NoSuchFileException ex) {
            err.println("Error: Configuration file not found: " + options.configFile());
            return EXIT_FAILURE;
        } catch (ConfigValidationException ex) {
            err.println("Error: Invalid configuration:");
            ex.problems().forEach(problem -> err.println("  - " + problem));
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException ex) {
            err.println("Error: Failed to load config: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        if (options.verbose()) config = config.withLoggingLevel("DEBUG");
        else if (options.quiet()) config = config.withLoggingLevel("ERROR");
        LoggingSetup.apply(config.logging());

        String target = null;
        if (options.target() != null) {
            try {
                target = Targets.normalize(options.target());
            } catch (IllegalArgumentException ex) {
                err.println("Error: " + ex.getMessage());
                return EXIT_USAGE;
            }
        }

        try (var store = SnapshotStore.open(config.database().path(), mapper, clock)) {
            store.migrate();
            return switch (options.command()) {
                case "init-db" -> initDb(options, config);
                case "fetch" -> fetch(options, config, store, target);
                case "diff" -> diff(options, config, store, target);
                case "submit" -> submit(options, config, store, target);
                case "run" -> runOne(options, config, store, target);
                case "run-all" -> runAll(options, config, store);
                case "history" -> history(options, store, target);
                default -> throw new IllegalStateException("Unhandled command " + options.command());
            };
        } catch (StorageException ex) {
            err.println("Error: Storage failure: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int initDb(CliOptions options, Config config) {
        say(options, "Database initialized at %s%n", config.database().path());
        if (options.json()) {
            final var node = mapper.createObjectNode();
            node.put("status", "success");
            node.put("database_path", config.database().path().toString());
            printJson(node);
        }
        return EXIT_OK;
    }

    private int fetch(CliOptions options, Config config, SnapshotStore store, String target) {
        say(options, "Fetching prefixes for %s...%n", target);
        final Snapshot snapshot;
        try (var fetcher = PrefixFetchers.create(config, httpClient(), mapper)) {
            snapshot = pipeline(store, fetcher, null).fetchAndSnapshot(target);
        } catch (FetchFailureException ex) {
            err.println("Error: Failed to fetch prefixes: " + ex.errors());
            if (options.json()) {
                final var node = mapper.createObjectNode();
                node.put("target", target);
                node.put("status", "fetch_failed");
                node.set("errors", mapper.valueToTree(ex.errors()));
                printJson(node);
            }
            return EXIT_FAILURE;
        }
        say(options, "Found %,d IPv4 prefixes, %,d IPv6 prefixes%n",
                snapshot.ipv4Prefixes().size(), snapshot.ipv6Prefixes().size());
        say(options, "Snapshot saved (id: %d, hash: %s...)%n", snapshot.id(), snapshot.shortHash());
        if (options.json()) {
            final var node = mapper.createObjectNode();
            node.put("target", target);
            node.set("snapshot", snapshotJson(snapshot));
            printJson(node);
        }
        return EXIT_OK;
    }

    private int diff(CliOptions options, Config config, SnapshotStore store, String target) {
        final var changeSet = pipeline(store, null, null)
                .diffAgainstBaseline(target, config.diff().lookback());
        if (changeSet.isEmpty()) {
            err.println("Error: No snapshot found for " + target);
            return EXIT_FAILURE;
        }
        final var diff = DiffEngine.fromChangeSet(changeSet.get());
        if (options.json()) {
            final var node = DiffFormatter.json(diff, mapper);
            node.put("diff_id", changeSet.get().id());
            printJson(node);
            return EXIT_OK;
        }
        if (diff.oldSnapshotId() == null) {
            say(options, "No previous snapshot found (first run)%n");
        } else {
            store.getSnapshotById(diff.oldSnapshotId()).ifPresent(previous -> say(options,
                    "Comparing with previous snapshot %d (%s)%n", previous.id(),
                    TIMESTAMP.format(previous.observedAt())));
        }
        say(options, "%s%n", DiffFormatter.human(diff));
        return EXIT_OK;
    }

    private int submit(CliOptions options, Config config, SnapshotStore store, String target) {
        if (store.getLatestDiff(target).isEmpty()) {
            err.println("Error: No diff found for " + target + ". Run 'diff' command first.");
            return EXIT_FAILURE;
        }
        if (!ticketingReady(config, options.dryRun())) return EXIT_FAILURE;
        try (var ticketing = ticketingClient(config, options.dryRun())) {
            final var outcome = pipeline(store, null, ticketing).submitIfChanged(target, options.dryRun());
            say(options, "%s%n", outcome.message());
            if (options.json()) {
                final var node = mapper.createObjectNode();
                node.put("target", target);
                node.put("status", outcome.outcome().label());
                node.put("ticket_id", outcome.externalTicketId().orElse(null));
                node.put("dry_run", options.dryRun());
                node.put("message", outcome.message());
                printJson(node);
            }
            return outcome.outcome().isFailure() ? EXIT_FAILURE : EXIT_OK;
        }
    }

    private int runOne(CliOptions options, Config config, SnapshotStore store, String target) {
        if (!ticketingReady(config, options.dryRun())) return EXIT_FAILURE;
        say(options, "Processing %s...%n", target);
        try (var fetcher = PrefixFetchers.create(config, httpClient(), mapper);
             var ticketing = ticketingClient(config, options.dryRun())) {
            final var result = pipeline(store, fetcher, ticketing)
                    .runPipeline(target, config.diff().lookback(), options.dryRun());
            if (options.json()) {
                final var node = resultJson(result);
                node.put("timestamp", clock.instant().toString());
                node.put("dry_run", options.dryRun());
                printJson(node);
            } else {
                printResult(options, result);
            }
            return result.isSuccess() ? EXIT_OK : EXIT_FAILURE;
        }
    }

    private int runAll(CliOptions options, Config config, SnapshotStore store) {
        if (config.targets().isEmpty()) {
            err.println("Error: No targets configured in config file");
            return EXIT_FAILURE;
        }
        final var targets = new ArrayList<String>(config.targets().size());
        for (final var raw : config.targets()) {
            try {
                targets.add(Targets.normalize(raw));
            } catch (IllegalArgumentException ex) {
                err.println("Error: " + ex.getMessage());
                return EXIT_FAILURE;
            }
        }
        if (!ticketingReady(config, options.dryRun())) return EXIT_FAILURE;
        say(options, "Processing %d targets...%n", targets.size());
        try (var fetcher = PrefixFetchers.create(config, httpClient(), mapper);
             var ticketing = ticketingClient(config, options.dryRun())) {
            final var report = pipeline(store, fetcher, ticketing)
                    .runAll(targets, config.diff().lookback(), options.dryRun(), config.pipeline().parallelism());
            if (options.json()) {
                final var node = mapper.createObjectNode();
                node.put("total", report.results().size());
                node.put("succeeded", report.succeeded());
                node.put("failed", report.failed());
                final var results = node.putArray("results");
                report.results().forEach(result -> results.add(resultJson(result)));
                printJson(node);
            } else {
                report.results().forEach(result -> say(options, "  %-20s %-18s (%s) %s%n", result.target(),
                        result.outcome().label(), result.stage().label(), result.message()));
                say(options, "Completed: %d succeeded, %d failed%n", report.succeeded(), report.failed());
            }
            return report.hasFailures() ? EXIT_FAILURE : EXIT_OK;
        }
    }

    private int history(CliOptions options, SnapshotStore store, String target) {
        final var snapshots = store.getSnapshotHistory(target, options.limit());
        if (options.json()) {
            final var node = mapper.createObjectNode();
            node.put("target", target);
            final var array = node.putArray("snapshots");
            snapshots.forEach(snapshot -> array.add(snapshotJson(snapshot)));
            printJson(node);
            return EXIT_OK;
        }
        if (snapshots.isEmpty()) {
            say(options, "No snapshots found for %s%n", target);
            return EXIT_OK;
        }
        say(options, "Snapshot history for %s:%n%s%n", target, "-".repeat(80));
        for (final var snapshot : snapshots) {
            say(options, "  [%d] %s%n", snapshot.id(), TIMESTAMP.format(snapshot.observedAt()));
            say(options, "       IPv4: %,d | IPv6: %,d%n", snapshot.ipv4Prefixes().size(),
                    snapshot.ipv6Prefixes().size());
            say(options, "       Hash: %s... | Sources: %s%n%n", snapshot.shortHash(),
                    String.join(", ", snapshot.sources()));
        }
        return EXIT_OK;
    }

    private void printResult(CliOptions options, PipelineResult result) {
        result.snapshot().ifPresent(snapshot -> say(options, "Found %,d IPv4, %,d IPv6 prefixes%n",
                snapshot.ipv4Prefixes().size(), snapshot.ipv6Prefixes().size()));
        result.changeSet().ifPresent(changeSet -> {
            if (changeSet.oldSnapshotId() == null) say(options, "No previous snapshot found (first run)%n");
            say(options, "%s%n", DiffFormatter.human(DiffEngine.fromChangeSet(changeSet)));
        });
        final var line = String.format("%s: %s at %s stage: %s", result.target(), result.outcome().label(),
                result.stage().label(), result.message());
        if (result.isSuccess()) say(options, "%s%n", line);
        else err.println("Error: " + line);
    }

    private PrefixPipeline pipeline(SnapshotStore store, PrefixFetcher fetcher, TicketingClient ticketing) {
        return new PrefixPipeline(store, fetcher, new SubmissionLedger(store, ticketing, mapper, clock), clock);
    }

    private boolean ticketingReady(Config config, boolean dryRun) {
        if (dryRun || config.ticketing().baseUrl() != null) return true;
        err.println("Error: ticketing.base_url is not configured (set it or ABC_BASE_URL, or use --dry-run)");
        return false;
    }

    private TicketingClient ticketingClient(Config config, boolean dryRun) {
        final var ticketing = config.ticketing();
        if (dryRun || ticketing.baseUrl() == null) return null;
        return new HttpTicketingClient(httpClient(), mapper, ticketing.baseUrl(), ticketing.apiToken(),
                ticketing.timeout(), HttpTicketingClient.defaultRetryPolicy(ticketing.maxRetries()));
    }

    private HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    private ObjectNode resultJson(PipelineResult result) {
        final var node = mapper.createObjectNode();
        node.put("target", result.target());
        node.put("stage", result.stage().label());
        node.put("status", result.outcome().label());
        node.put("success", result.isSuccess());
        node.put("message", result.message());
        node.set("errors", mapper.valueToTree(result.errors()));
        result.snapshot().ifPresent(snapshot -> node.set("snapshot", snapshotJson(snapshot)));
        result.changeSet().ifPresent(changeSet -> node.set("diff", changeSetJson(changeSet)));
        result.ticket().ifPresent(ticket -> node.set("ticket", ticketJson(ticket)));
        return node;
    }

    private ObjectNode snapshotJson(Snapshot snapshot) {
        final var node = mapper.createObjectNode();
        node.put("id", snapshot.id());
        node.put("timestamp", snapshot.observedAt().toString());
        node.put("ipv4_count", snapshot.ipv4Prefixes().size());
        node.put("ipv6_count", snapshot.ipv6Prefixes().size());
        node.put("hash", snapshot.contentHash());
        node.set("sources", mapper.valueToTree(snapshot.sources()));
        return node;
    }

    private ObjectNode changeSetJson(ChangeSet changeSet) {
        final var node = DiffFormatter.json(DiffEngine.fromChangeSet(changeSet), mapper);
        node.put("diff_id", changeSet.id());
        return node;
    }

    private ObjectNode ticketJson(Ticket ticket) {
        final var node = mapper.createObjectNode();
        node.put("id", ticket.externalTicketId());
        node.put("status", ticket.status().dbValue());
        node.put("ticket_row", ticket.id());
        return node;
    }

    private void printJson(JsonNode node) {
        try {
            out.println(mapper.writeValueAsString(node));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render JSON output", ex);
        }
    }

    private void say(CliOptions options, String format, Object... args) {
        if (options.quiet() || options.json()) return;
        out.printf(format, args);
    }
}
