package org.prefixwatch.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.prefixwatch.Config;

import java.net.http.HttpClient;

public final class PrefixFetchers {
    private PrefixFetchers() {
    }

    public static PrefixFetcher create(Config config, HttpClient httpClient, ObjectMapper mapper) {
        final var radb = config.radb();
        return switch (config.effectiveFetcher()) {
            case API -> new ApiProxyClient(httpClient, mapper, config.apiUrl(), config.irrSources(), radb.timeout(),
                    IrrClient.defaultRetryPolicy(radb.maxRetries()));
            case BGPQ4 -> new Bgpq4Client(mapper, config.bgpq4().command(), config.bgpq4().timeout(),
                    config.bgpq4().source(), config.bgpq4().aggregate());
            case IRR -> new IrrClient(httpClient, mapper, radb.baseUrl(), config.irrSources(), radb.timeout(),
                    IrrClient.defaultRetryPolicy(radb.maxRetries()));
        };
    }
}
