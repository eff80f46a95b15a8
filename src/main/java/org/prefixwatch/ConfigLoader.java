package org.prefixwatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code config.yaml}. {@code ${NAME}} placeholders expand from the environment (unset names
 * become empty), then the {@code IRR_*} and {@code ABC_*} variables override file values.
 */
public final class ConfigLoader {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final Set<String> LOG_LEVELS = Set.of("DEBUG", "INFO", "WARN", "WARNING", "ERROR", "CRITICAL");
    private static final Set<String> LOG_FORMATS = Set.of("json", "text");

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public ConfigLoader(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    public static ConfigLoader fromSystemEnvironment() {
        return new ConfigLoader(System.getenv());
    }

    public Config load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) throw new NoSuchFileException(configFile.toString(), null,
                "Configuration file not found");
        final var root = yaml.readTree(configFile.toFile());
        return parse(root == null || root.isMissingNode() || root.isNull()
                ? JsonNodeFactory.instance.objectNode() : expand(root));
    }

    Config parse(JsonNode root) {
        final var defaults = Config.defaultConfig();
        final var problems = new ArrayList<String>();

        final var irrSources = root.has("irr_sources") ? stringList(root.get("irr_sources")) : defaults.irrSources();
        final var targets = root.has("targets") ? stringList(root.get("targets")) : defaults.targets();

        var apiUrl = uri(text(root, "api_url"));
        final var apiOverride = env("IRR_API_URL");
        if (apiOverride != null) apiUrl = uri(apiOverride);

        Config.Fetcher fetcher = null;
        final var fetcherName = text(root, "fetcher");
        if (fetcherName != null) {
            try {
                fetcher = Config.Fetcher.parse(fetcherName);
            } catch (IllegalArgumentException ex) {
                problems.add("fetcher must be one of: irr, api, bgpq4");
            }
        }

        final var radbNode = root.path("radb");
        final var radb = new Config.Registry(
                uriOr(text(radbNode, "base_url"), defaults.radb().baseUrl()),
                Duration.ofSeconds(radbNode.path("timeout_seconds").asLong(defaults.radb().timeout().toSeconds())),
                radbNode.path("max_retries").asInt(defaults.radb().maxRetries()));

        final var bgpq4Node = root.path("bgpq4");
        final var bgpq4 = new Config.Bgpq4(
                bgpq4Node.has("command") ? commandList(bgpq4Node.get("command")) : defaults.bgpq4().command(),
                Duration.ofSeconds(bgpq4Node.path("timeout_seconds").asLong(defaults.bgpq4().timeout().toSeconds())),
                textOr(bgpq4Node, "source", defaults.bgpq4().source()).toUpperCase(Locale.ROOT),
                bgpq4Node.path("aggregate").asBoolean(defaults.bgpq4().aggregate()));

        var databasePath = Path.of(textOr(root.path("database"), "path", defaults.database().path().toString()));
        final var dbOverride = env("IRR_DB_PATH");
        if (dbOverride != null) databasePath = Path.of(dbOverride);

        final var ticketingNode = root.path("ticketing");
        var ticketingUrl = uri(text(ticketingNode, "base_url"));
        var ticketingToken = textOr(ticketingNode, "api_token", defaults.ticketing().apiToken());
        if (env("ABC_BASE_URL") != null) ticketingUrl = uri(env("ABC_BASE_URL"));
        if (env("ABC_TOKEN") != null) ticketingToken = env("ABC_TOKEN");
        final var ticketing = new Config.Ticketing(ticketingUrl, ticketingToken,
                Duration.ofSeconds(ticketingNode.path("timeout_seconds")
                        .asLong(defaults.ticketing().timeout().toSeconds())),
                ticketingNode.path("max_retries").asInt(defaults.ticketing().maxRetries()));

        final var loggingNode = root.path("logging");
        var level = textOr(loggingNode, "level", defaults.logging().level());
        var format = textOr(loggingNode, "format", defaults.logging().format());
        if (env("IRR_LOG_LEVEL") != null) level = env("IRR_LOG_LEVEL");
        if (env("IRR_LOG_FORMAT") != null) format = env("IRR_LOG_FORMAT");
        final var logFile = text(loggingNode, "file");
        final var logging = new Config.Logging(level, format, logFile == null ? null : Path.of(logFile));

        final var diff = new Config.Diff(root.path("diff").path("lookback_hours")
                .asLong(defaults.diff().lookbackHours()));
        final var pipeline = new Config.Pipeline(root.path("pipeline").path("parallelism")
                .asInt(defaults.pipeline().parallelism()));

        final var config = new Config(irrSources, targets, apiUrl, fetcher, radb, bgpq4,
                new Config.Database(databasePath), ticketing, logging, diff, pipeline);
        validate(config, problems);
        return config;
    }

    static void validate(Config config, List<String> problems) {
        if (config.irrSources().isEmpty()) {
            problems.add("At least one IRR source must be configured");
        } else {
            final var unknown = config.irrSources().stream()
                    .map(source -> source.toUpperCase(Locale.ROOT))
                    .filter(source -> !Config.KNOWN_IRR_SOURCES.contains(source))
                    .toList();
            if (!unknown.isEmpty()) {
                problems.add("Unknown IRR sources: " + unknown + ". Valid sources: "
                        + Config.KNOWN_IRR_SOURCES.stream().sorted().toList());
            }
        }
        if (config.radb().timeout().isNegative() || config.radb().timeout().isZero()) {
            problems.add("radb.timeout_seconds must be positive");
        }
        if (config.radb().maxRetries() < 0) problems.add("radb.max_retries must be non-negative");
        if (config.bgpq4().timeout().isNegative() || config.bgpq4().timeout().isZero()) {
            problems.add("bgpq4.timeout_seconds must be positive");
        }
        if (config.bgpq4().command().isEmpty()) problems.add("bgpq4.command must not be empty");
        if (config.ticketing().timeout().isNegative() || config.ticketing().timeout().isZero()) {
            problems.add("ticketing.timeout_seconds must be positive");
        }
        if (config.ticketing().maxRetries() < 0) problems.add("ticketing.max_retries must be non-negative");
        if (config.diff().lookbackHours() <= 0) problems.add("diff.lookback_hours must be positive");
        if (config.pipeline().parallelism() < 1) problems.add("pipeline.parallelism must be at least 1");
        if (!LOG_LEVELS.contains(config.logging().level().toUpperCase(Locale.ROOT))) {
            problems.add("logging.level must be one of: " + LOG_LEVELS.stream().sorted().toList());
        }
        if (!LOG_FORMATS.contains(config.logging().format().toLowerCase(Locale.ROOT))) {
            problems.add("logging.format must be one of: " + LOG_FORMATS.stream().sorted().toList());
        }
        if (config.effectiveFetcher() == Config.Fetcher.API && config.apiUrl() == null) {
            problems.add("fetcher 'api' requires api_url");
        }
        if (!problems.isEmpty()) throw new ConfigValidationException(problems);
    }

    private JsonNode expand(JsonNode node) {
        if (node.isTextual()) return TextNode.valueOf(expand(node.asText()));
        if (node.isObject()) {
            final ObjectNode copy = JsonNodeFactory.instance.objectNode();
            node.fields().forEachRemaining(field -> copy.set(field.getKey(), expand(field.getValue())));
            return copy;
        }
        if (node.isArray()) {
            final ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> copy.add(expand(element)));
            return copy;
        }
        return node;
    }

    String expand(String value) {
        final Matcher matcher = PLACEHOLDER.matcher(value);
        final var result = new StringBuilder();
        while (matcher.find()) {
            final var replacement = environment.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String env(String name) {
        final var value = environment.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    private static String text(JsonNode node, String field) {
        final var value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        final var text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        final var value = text(node, field);
        return value != null ? value : fallback;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        final var values = new ArrayList<String>();
        for (final var element : node) {
            final var value = element.asText("").trim();
            if (!value.isEmpty()) values.add(value);
        }
        return List.copyOf(values);
    }

    private static List<String> commandList(JsonNode node) {
        if (node.isTextual()) return List.of(node.asText().trim().split("\\s+"));
        return stringList(node);
    }

    private static URI uri(String value) {
        if (value == null || value.isBlank()) return null;
        return URI.create(value.trim());
    }

    private static URI uriOr(String value, URI fallback) {
        final var parsed = uri(value);
        return parsed != null ? parsed : fallback;
    }
}
