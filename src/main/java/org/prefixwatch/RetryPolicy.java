package org.prefixwatch;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff,
                          Predicate<Throwable> retryOn) {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (initialBackoff.toMillis() < 1) throw new IllegalArgumentException("initialBackoff must be >= 1ms");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (maxBackoff.compareTo(initialBackoff) < 0) throw new IllegalArgumentException("maxBackoff < initialBackoff");
    }

    public static RetryPolicy exponential(int configuredAttempts, Predicate<Throwable> retryOn) {
        return new RetryPolicy(Math.max(1, configuredAttempts), Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30),
                retryOn);
    }

    public RetryPolicy withBackoff(Duration initial, Duration max) {
        return new RetryPolicy(maxAttempts, initial, multiplier, max, retryOn);
    }

    public <T> T execute(String name, LogContext context, Callable<T> call) throws Exception {
        final var config = RetryConfig.<T>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff.toMillis(), multiplier,
                        maxBackoff.toMillis()))
                .retryOnException(retryOn)
                .build();
        final var retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> context.atWarn(LOGGER)
                .addKeyValue("attempt", event.getNumberOfRetryAttempts())
                .log("{} failed, retrying in {} ms: {}", name, event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())));
        return retry.executeCallable(call);
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
