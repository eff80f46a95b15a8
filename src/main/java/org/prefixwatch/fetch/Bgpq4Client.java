package org.prefixwatch.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

public final class Bgpq4Client implements PrefixFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(Bgpq4Client.class);

    private final ObjectMapper mapper;
    private final List<String> command;
    private final Duration timeout;
    private final String source;
    private final boolean aggregate;

    public Bgpq4Client(ObjectMapper mapper, List<String> command, Duration timeout, String source, boolean aggregate) {
        if (command.isEmpty()) throw new IllegalArgumentException("bgpq4 command must not be empty");
        this.mapper = mapper;
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.source = source;
        this.aggregate = aggregate;
    }

    @Override
    public String describe() {
        return "bgpq4 " + String.join(" ", command) + " -S " + source;
    }

    @Override
    public PrefixResult fetch(String target, LogContext context) {
        final var normalized = target.trim().toUpperCase(Locale.ROOT);
        final var errors = new ArrayList<String>();
        Set<String> ipv4 = Set.of();
        Set<String> ipv6 = Set.of();
        try {
            ipv4 = run(normalized, false, context);
        } catch (IOException ex) {
            errors.add("IPv4 query failed: " + ex.getMessage());
        }
        try {
            ipv6 = run(normalized, true, context);
        } catch (IOException ex) {
            errors.add("IPv6 query failed: " + ex.getMessage());
        }
        context.atInfo(LOGGER)
                .addKeyValue("source", source)
                .addKeyValue("ipv4_count", ipv4.size())
                .addKeyValue("ipv6_count", ipv6.size())
                .log("bgpq4 fetched for {}: {} IPv4, {} IPv6 prefixes", normalized, ipv4.size(), ipv6.size());
        errors.forEach(error -> context.atWarn(LOGGER).log(error));
        return new PrefixResult(ipv4, ipv6, List.of(source), errors);
    }

    List<String> commandLine(String target, boolean ipv6) {
        final var cmd = new ArrayList<>(command);
        cmd.add(ipv6 ? "-6" : "-4");
        cmd.add("-j");
        if (aggregate) cmd.add("-A");
        cmd.addAll(List.of("-S", source, "-l", "pl", target));
        return cmd;
    }

    private Set<String> run(String target, boolean ipv6, LogContext context) throws IOException {
        final var cmd = commandLine(target, ipv6);
        context.atDebug(LOGGER).log("Running: {}", String.join(" ", cmd));
        final Process process;
        try {
            process = new ProcessBuilder(cmd).start();
        } catch (IOException ex) {
            throw new IOException("Command not found: " + command.get(0) + ". Ensure bgpq4 is installed", ex);
        }
        final var stdout = drain(process.getInputStream());
        final var stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("bgpq4 timed out after " + timeout.toSeconds() + "s for " + target);
            }
            if (process.exitValue() != 0) {
                throw new IOException("bgpq4 exited with code " + process.exitValue() + ": " + stderr.get().strip());
            }
            return parse(stdout.get());
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running bgpq4", ex);
        } catch (ExecutionException ex) {
            throw new IOException("Unable to read bgpq4 output", ex.getCause());
        }
    }

    Set<String> parse(String output) throws IOException {
        if (output == null || output.isBlank()) return Set.of();
        final var prefixes = new HashSet<String>();
        try {
            for (final var entry : mapper.readTree(output).path("pl")) {
                final var prefix = entry.path("prefix").asText("");
                if (!prefix.isBlank()) prefixes.add(prefix);
            }
        } catch (IOException ex) {
            throw new IOException("Failed to parse bgpq4 JSON output: " + ex.getMessage(), ex);
        }
        return Set.copyOf(prefixes);
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }
}
