package com.azure.simpleRuntime.http.retry;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * How {@link com.azure.simpleRuntime.http.HttpTransport} retries a single request.
 *
 * <p>Retries happen below the pager and the poller. A page or a status poll that took two
 * attempts is still one page or one poll to them, and neither of them retries on its own.
 * Between attempts the transport waits for the server's {@code Retry-After}, capped at
 * {@link #getMaxServerDelay()}, or else backs off exponentially from the base delay up to the
 * max delay.
 */
public final class RetryPolicy {

    /** Failures a request may be retried after. */
    public enum Trigger {
        /** HTTP 429, 502, 503 or 504. */
        TRANSIENT_STATUS,
        TIMEOUT,
        NETWORK_ERROR
    }

    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(429, 502, 503, 504);

    public static final RetryPolicy DEFAULT = builder().build();

    public static final RetryPolicy NO_RETRY = builder().maxAttempts(1).retryOn().build();

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration maxServerDelay;
    private final Set<Trigger> triggers;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.maxServerDelay = builder.maxServerDelay;
        this.triggers = Set.copyOf(builder.triggers);
    }

    public static boolean isTransientStatus(int statusCode) {
        return TRANSIENT_STATUS_CODES.contains(statusCode);
    }

    /**
     * Whether attempt number {@code attempt} (1-based), which just failed with {@code trigger},
     * may be followed by another one.
     */
    public boolean canRetry(int attempt, Trigger trigger) {
        return attempt < maxAttempts && triggers.contains(trigger);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Duration getMaxServerDelay() {
        return maxServerDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(8);
        private Duration maxServerDelay = Duration.ofMinutes(1);
        private Set<Trigger> triggers = EnumSet.allOf(Trigger.class);

        /**
         * Total attempts including the first; 1 disables retries.
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(Duration baseDelay, Duration maxDelay) {
            if (!isPositive(baseDelay) || !isPositive(maxDelay)) {
                throw new IllegalArgumentException("Backoff delays must be positive");
            }
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
            }
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Longest {@code Retry-After} honored between attempts; longer server requests are cut to it.
         */
        public Builder maxServerDelay(Duration maxServerDelay) {
            if (maxServerDelay.isNegative() || maxServerDelay.compareTo(RetryAfter.CEILING) > 0) {
                throw new IllegalArgumentException("maxServerDelay must be between 0 and " + RetryAfter.CEILING);
            }
            this.maxServerDelay = maxServerDelay;
            return this;
        }

        public Builder retryOn(Trigger... triggers) {
            EnumSet<Trigger> selected = EnumSet.noneOf(Trigger.class);
            for (Trigger trigger : triggers) {
                selected.add(trigger);
            }
            this.triggers = selected;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }

        private static boolean isPositive(Duration duration) {
            return !duration.isNegative() && !duration.isZero();
        }
    }
}
