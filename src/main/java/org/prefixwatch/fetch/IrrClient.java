package org.prefixwatch.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.LogContext;
import org.prefixwatch.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Queries Internet Routing Registries directly: RIPE through its REST search API, every other known
 * source through a WHOIS {@code -i origin} query on port 43. A source without a query strategy is
 * reported as an error for that source.
 */
public final class IrrClient implements PrefixFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(IrrClient.class);
    private static final int WHOIS_PORT = 43;

    public static final Map<String, WhoisServer> WHOIS_SERVERS = Map.of(
            "RADB", new WhoisServer("whois.radb.net", WHOIS_PORT),
            "ARIN", new WhoisServer("rr.arin.net", WHOIS_PORT),
            "APNIC", new WhoisServer("whois.apnic.net", WHOIS_PORT),
            "LACNIC", new WhoisServer("irr.lacnic.net", WHOIS_PORT),
            "AFRINIC", new WhoisServer("whois.afrinic.net", WHOIS_PORT),
            "NTTCOM", new WhoisServer("rr.ntt.net", WHOIS_PORT));

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI restBaseUri;
    private final List<String> sources;
    private final Map<String, WhoisServer> whoisServers;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public IrrClient(HttpClient httpClient, ObjectMapper mapper, URI restBaseUri, List<String> sources,
                     Duration timeout, RetryPolicy retryPolicy) {
        this(httpClient, mapper, restBaseUri, sources, WHOIS_SERVERS, timeout, retryPolicy);
    }

    IrrClient(HttpClient httpClient, ObjectMapper mapper, URI restBaseUri, List<String> sources,
              Map<String, WhoisServer> whoisServers, Duration timeout, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.restBaseUri = normalize(restBaseUri);
        this.sources = List.copyOf(sources);
        this.whoisServers = Map.copyOf(whoisServers);
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    public static RetryPolicy defaultRetryPolicy(int maxRetries) {
        return RetryPolicy.exponential(maxRetries, SourceQueryException::isRetryable);
    }

    @Override
    public String describe() {
        return "IRR " + sources + " (REST " + restBaseUri + ")";
    }

    @Override
    public PrefixResult fetch(String target, LogContext context) {
        final var ipv4 = new HashSet<String>();
        final var ipv6 = new HashSet<String>();
        final var queried = new ArrayList<String>();
        final var errors = new ArrayList<String>();
        for (final var source : sources) {
            final var sourceContext = context.with("source", source);
            try {
                final var routes = retryPolicy.execute("irr-" + source, sourceContext, () -> query(target, source));
                ipv4.addAll(routes.ipv4());
                ipv6.addAll(routes.ipv6());
                queried.add(source);
                sourceContext.atInfo(LOGGER).log("Fetched from {}: {} IPv4, {} IPv6 prefixes",
                        source, routes.ipv4().size(), routes.ipv6().size());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                errors.add("Interrupted while querying " + source);
                break;
            } catch (Exception ex) {
                final var message = "Failed to query " + source + ": " + ex.getMessage();
                errors.add(message);
                sourceContext.atWarn(LOGGER).log(message);
            }
        }
        context.atInfo(LOGGER).log("Total prefixes for {}: {} IPv4, {} IPv6 from {} sources",
                target, ipv4.size(), ipv6.size(), queried.size());
        return new PrefixResult(ipv4, ipv6, queried, errors);
    }

    private Routes query(String target, String source) throws IOException, InterruptedException {
        final var upper = source.toUpperCase(Locale.ROOT);
        if ("RIPE".equals(upper)) return queryRipeRest(target);
        final var server = whoisServers.get(upper);
        if (server == null) {
            throw new SourceQueryException("No query strategy for IRR source " + source, false, null);
        }
        return queryWhois(target, server);
    }

    private Routes queryWhois(String target, WhoisServer server) throws IOException {
        final var timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(server.host(), server.port()), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            final var out = socket.getOutputStream();
            out.write(("-i origin " + target + "\r\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            final var body = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            return parseWhois(body);
        } catch (SocketTimeoutException ex) {
            throw new SourceQueryException("WHOIS query to " + server.host() + " timed out after "
                    + timeout.toSeconds() + "s", true, ex);
        } catch (IOException ex) {
            throw new SourceQueryException("WHOIS connection to " + server.host() + " failed: " + ex.getMessage(),
                    true, ex);
        }
    }

    static Routes parseWhois(String response) {
        final var ipv4 = new HashSet<String>();
        final var ipv6 = new HashSet<String>();
        new BufferedReader(new StringReader(response)).lines().forEach(line -> {
            final var idx = line.indexOf(':');
            if (idx <= 0 || Character.isWhitespace(line.charAt(0))) return;
            final var key = line.substring(0, idx).trim().toLowerCase(Locale.ROOT);
            final var rest = line.substring(idx + 1).trim();
            if (rest.isEmpty()) return;
            final var value = rest.split("\\s+", 2)[0];
            if (!value.contains("/")) return;
            if ("route".equals(key)) ipv4.add(value);
            else if ("route6".equals(key)) ipv6.add(value);
        });
        return new Routes(Set.copyOf(ipv4), Set.copyOf(ipv6));
    }

    private Routes queryRipeRest(String target) throws IOException, InterruptedException {
        return new Routes(queryRipeRestType(target, "route"), queryRipeRestType(target, "route6"));
    }

    private Set<String> queryRipeRestType(String target, String objectType) throws IOException, InterruptedException {
        final var query = "source=ripe"
                + "&query-string=" + URLEncoder.encode(target, StandardCharsets.UTF_8)
                + "&inverse-attribute=origin"
                + "&type-filter=" + objectType;
        final var uri = restBaseUri.resolve("search.json?" + query);
        final var request = HttpRequest.newBuilder(uri)
                .GET()
                .header("Accept", "application/json")
                .header("User-Agent", "prefixwatch/1.0")
                .timeout(timeout)
                .build();
        final var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        final var status = response.statusCode();
        if (status == 404) return Set.of();
        if (status != 200) {
            final var errorText = ripeErrorText(response.body());
            if (errorText != null && errorText.toLowerCase(Locale.ROOT).contains("no entries")) return Set.of();
            final var detail = errorText != null ? "API error: " + errorText
                    : "API returned status " + status + ": " + abbreviate(response.body());
            throw new SourceQueryException(detail, status >= 500 || status == 429, null);
        }
        final JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (IOException ex) {
            throw new SourceQueryException("Invalid JSON response: " + ex.getMessage(), false, ex);
        }
        return parseRipeObjects(root, objectType);
    }

    static Set<String> parseRipeObjects(JsonNode root, String objectType) {
        final var prefixes = new HashSet<String>();
        for (final var object : root.path("objects").path("object")) {
            if (!objectType.equals(object.path("type").asText())) continue;
            for (final var attribute : object.path("attributes").path("attribute")) {
                if (!objectType.equals(attribute.path("name").asText())) continue;
                final var value = attribute.path("value").asText("");
                if (!value.isBlank()) prefixes.add(value.trim());
                break;
            }
        }
        return Set.copyOf(prefixes);
    }

    private String ripeErrorText(String body) {
        try {
            final var messages = mapper.readTree(body).path("errormessages").path("errormessage");
            if (!messages.isArray() || messages.isEmpty()) return null;
            final var text = messages.get(0).path("text").asText(null);
            return text == null || text.isBlank() ? null : text;
        } catch (IOException ex) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200);
    }

    private static URI normalize(URI baseUri) {
        return baseUri.toString().endsWith("/") ? baseUri : URI.create(baseUri + "/");
    }

    record Routes(Set<String> ipv4, Set<String> ipv6) {
    }

    public record WhoisServer(String host, int port) {
    }
}
