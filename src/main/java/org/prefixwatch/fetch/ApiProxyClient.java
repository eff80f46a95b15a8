package org.prefixwatch.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.LogContext;
import org.prefixwatch.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ApiProxyClient implements PrefixFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiProxyClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI fetchUri;
    private final List<String> sources;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public ApiProxyClient(HttpClient httpClient, ObjectMapper mapper, URI apiUrl, List<String> sources,
                          Duration timeout, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        final var base = apiUrl.toString().replaceAll("/+$", "");
        this.fetchUri = URI.create(base + "/api/v1/fetch");
        this.sources = List.copyOf(sources);
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String describe() {
        return "API proxy " + fetchUri;
    }

    @Override
    public PrefixResult fetch(String target, LogContext context) {
        try {
            return retryPolicy.execute("api-proxy", context, () -> call(target, context));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new PrefixResult(Set.of(), Set.of(), List.of(), List.of("Interrupted while calling API proxy"));
        } catch (Exception ex) {
            final var message = ex instanceof SourceQueryException
                    ? ex.getMessage()
                    : "API proxy request failed after " + retryPolicy.maxAttempts() + " attempts: " + ex.getMessage();
            context.atWarn(LOGGER).log(message);
            return new PrefixResult(Set.of(), Set.of(), List.of(), List.of(message));
        }
    }

    private PrefixResult call(String target, LogContext context) throws IOException, InterruptedException {
        context.atInfo(LOGGER).addKeyValue("sources", sources).log("Calling API proxy: {}", fetchUri);
        final var body = mapper.writeValueAsString(Map.of("target", target, "irr_sources", sources));
        final var request = HttpRequest.newBuilder(fetchUri)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .header("User-Agent", "prefixwatch/1.0 (proxy)")
                .timeout(timeout)
                .build();
        final var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        final var status = response.statusCode();
        if (status == 422) {
            throw new SourceQueryException("API validation error: " + detail(response.body(), "Validation error"),
                    false, null);
        }
        if (status == 502) {
            final var errors = readTree(response.body()).path("detail").path("errors");
            throw new SourceQueryException("All IRR sources failed via API: " + strings(errors), true, null);
        }
        if (status != 200) {
            throw new SourceQueryException("API returned status " + status + ": " + abbreviate(response.body()),
                    status >= 500 || status == 429, null);
        }

        final var root = readTree(response.body());
        final var result = new PrefixResult(
                new HashSet<>(strings(root.path("ipv4_prefixes"))),
                new HashSet<>(strings(root.path("ipv6_prefixes"))),
                strings(root.path("sources_queried")),
                strings(root.path("errors")));
        context.atInfo(LOGGER)
                .addKeyValue("ipv4_count", result.ipv4Prefixes().size())
                .addKeyValue("ipv6_count", result.ipv6Prefixes().size())
                .log("API proxy returned {} IPv4, {} IPv6 prefixes",
                        result.ipv4Prefixes().size(), result.ipv6Prefixes().size());
        return result;
    }

    private JsonNode readTree(String body) throws SourceQueryException {
        try {
            return mapper.readTree(body == null ? "" : body);
        } catch (IOException ex) {
            throw new SourceQueryException("Invalid JSON response from API proxy: " + ex.getMessage(), false, ex);
        }
    }

    private String detail(String body, String fallback) {
        try {
            final var detail = mapper.readTree(body).path("detail");
            if (detail.isMissingNode() || detail.isNull()) return fallback;
            return detail.isTextual() ? detail.asText() : detail.toString();
        } catch (IOException ex) {
            return fallback;
        }
    }

    private static List<String> strings(JsonNode array) {
        final var values = new ArrayList<String>();
        for (final var element : array) {
            if (element.isTextual() && !element.asText().isBlank()) values.add(element.asText());
        }
        return values;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200);
    }
}
