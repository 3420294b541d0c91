package com.azure.simpleRuntime.http.retry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

public class ExponentialBackoffStrategy {
    private final Random random;

    public ExponentialBackoffStrategy() {
        this(new Random());
    }

    ExponentialBackoffStrategy(Random random) {
        this.random = random;
    }

    public Duration calculateDelay(int attemptNumber, RetryPolicy retryPolicy, Map<String, String> responseHeaders) {
        if (responseHeaders != null) {
            Optional<Duration> serverDelay = RetryAfter.parse(responseHeaders.get(RetryAfter.HEADER));
            if (serverDelay.isPresent()) {
                Duration cap = retryPolicy.getMaxServerDelay();
                return serverDelay.get().compareTo(cap) > 0 ? cap : serverDelay.get();
            }
        }

        long baseDelayMs = retryPolicy.getBaseDelay().toMillis();
        long maxDelayMs = retryPolicy.getMaxDelay().toMillis();
        int shift = Math.min(Math.max(attemptNumber - 1, 0), 30);
        long exponentialDelay = baseDelayMs * (1L << shift);

        // up to 50% jitter on top of the exponential delay
        long jitter = (long) (exponentialDelay * 0.5 * random.nextDouble());

        return Duration.ofMillis(Math.min(exponentialDelay + jitter, maxDelayMs));
    }
}
