package org.prefixwatch;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record CliOptions(String command, Path configFile, boolean verbose, boolean quiet, boolean json,
                         String target, boolean dryRun, int limit) {
    public static final List<String> COMMANDS = List.of("init-db", "fetch", "diff", "submit", "run", "run-all",
            "history");
    private static final Set<String> TARGET_COMMANDS = Set.of("fetch", "diff", "submit", "run", "history");
    private static final Set<String> FLAGS = Set.of("verbose", "quiet", "json", "dry-run", "help");
    private static final Set<String> VALUE_OPTIONS = Set.of("config", "target", "limit");
    private static final int DEFAULT_HISTORY_LIMIT = 10;

    public static final String USAGE = """
            Usage: prefixwatch [--config=PATH] [--verbose] [--quiet] [--json] <command> [options]

            Commands:
              init-db                           Initialize the database
              fetch   --target=AS..             Fetch prefixes and store a snapshot
              diff    --target=AS..             Compute the diff against the lookback baseline
              submit  --target=AS.. [--dry-run] Submit a ticket for the latest diff
              run     --target=AS.. [--dry-run] Fetch, diff and submit if changes were detected
              run-all [--dry-run]               Run for every configured target
              history --target=AS.. [--limit=N] Show snapshot history (default 10)
            """;

    public static CliOptions parse(String[] args) {
        final var values = new HashMap<String, String>();
        final var flags = new HashSet<String>();
        String command = null;
        for (final var arg : args) {
            if (arg.startsWith("--")) {
                final var parts = arg.substring(2).split("=", 2);
                if (parts.length == 2 && VALUE_OPTIONS.contains(parts[0])) {
                    values.put(parts[0], parts[1]);
                } else if (parts.length == 1 && FLAGS.contains(parts[0])) {
                    flags.add(parts[0]);
                } else {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                }
            } else if (command == null) {
                command = arg;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (flags.contains("help")) {
            return new CliOptions("help", Path.of("config.yaml"), false, false, false, null, false,
                    DEFAULT_HISTORY_LIMIT);
        }
        if (command == null) throw new IllegalArgumentException("No command given");
        if (!COMMANDS.contains(command)) throw new IllegalArgumentException("Unknown command: " + command);
        final var target = values.get("target");
        if (TARGET_COMMANDS.contains(command) && (target == null || target.isBlank())) {
            throw new IllegalArgumentException(command + " requires --target=<ASN or AS-SET>");
        }
        return new CliOptions(command,
                Path.of(values.getOrDefault("config", "config.yaml")),
                flags.contains("verbose"),
                flags.contains("quiet"),
                flags.contains("json"),
                target,
                flags.contains("dry-run"),
                parseLimit(values.get("limit")));
    }

    private static int parseLimit(String candidate) {
        if (candidate == null || candidate.isBlank()) return DEFAULT_HISTORY_LIMIT;
        try {
            final var parsed = Integer.parseInt(candidate.trim());
            if (parsed < 1) throw new IllegalArgumentException("--limit must be positive");
            return parsed;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--limit must be a number: " + candidate);
        }
    }
}
