package org.prefixwatch;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record Config(List<String> irrSources, List<String> targets, URI apiUrl, Fetcher fetcher,
                     Registry radb, Bgpq4 bgpq4, Database database, Ticketing ticketing, Logging logging,
                     Diff diff, Pipeline pipeline) {
    public static final Set<String> KNOWN_IRR_SOURCES = Set.of("RIPE", "RADB", "ARIN", "APNIC", "LACNIC", "AFRINIC",
            "NTTCOM");

    public Config {
        irrSources = List.copyOf(irrSources);
        targets = List.copyOf(targets);
    }

    public static Config defaultConfig() {
        return new Config(List.of("RADB", "RIPE", "NTTCOM"), List.of(), null, null,
                new Registry(URI.create("https://rest.db.ripe.net"), Duration.ofSeconds(60), 3),
                new Bgpq4(List.of("bgpq4"), Duration.ofSeconds(120), "RADB", true),
                new Database(Path.of("./data/irr.sqlite")),
                new Ticketing(null, "", Duration.ofSeconds(30), 3),
                new Logging("INFO", "json", null),
                new Diff(24),
                new Pipeline(1));
    }

    public Fetcher effectiveFetcher() {
        if (fetcher != null) return fetcher;
        return apiUrl != null ? Fetcher.API : Fetcher.IRR;
    }

    public Config withLoggingLevel(String level) {
        return new Config(irrSources, targets, apiUrl, fetcher, radb, bgpq4, database, ticketing,
                new Logging(level, logging.format(), logging.file()), diff, pipeline);
    }

    public enum Fetcher {
        IRR, API, BGPQ4;

        public static Fetcher parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public record Registry(URI baseUrl, Duration timeout, int maxRetries) {
    }

    public record Bgpq4(List<String> command, Duration timeout, String source, boolean aggregate) {
        public Bgpq4 {
            command = List.copyOf(command);
        }
    }

    public record Database(Path path) {
    }

    public record Ticketing(URI baseUrl, String apiToken, Duration timeout, int maxRetries) {
    }

    public record Logging(String level, String format, Path file) {
    }

    public record Diff(long lookbackHours) {
        public Duration lookback() {
            return Duration.ofHours(lookbackHours);
        }
    }

    public record Pipeline(int parallelism) {
    }
}
