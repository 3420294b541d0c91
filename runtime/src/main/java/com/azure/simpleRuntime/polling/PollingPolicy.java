package com.azure.simpleRuntime.polling;

import java.time.Duration;

public class PollingPolicy {
    private final Duration defaultInterval;
    private final boolean honorRetryAfter;

    public static final PollingPolicy DEFAULT = new Builder().build();

    private PollingPolicy(Builder builder) {
        this.defaultInterval = builder.defaultInterval;
        this.honorRetryAfter = builder.honorRetryAfter;
    }

    /** Wait between status checks when the service suggests none. */
    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    public boolean shouldHonorRetryAfter() {
        return honorRetryAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration defaultInterval = Duration.ofSeconds(30);
        private boolean honorRetryAfter = true;

        public Builder defaultInterval(Duration defaultInterval) {
            if (defaultInterval == null || defaultInterval.isNegative()) {
                throw new IllegalArgumentException("defaultInterval must not be negative");
            }
            this.defaultInterval = defaultInterval;
            return this;
        }

        public Builder honorRetryAfter(boolean honorRetryAfter) {
            this.honorRetryAfter = honorRetryAfter;
            return this;
        }

        public PollingPolicy build() {
            return new PollingPolicy(this);
        }
    }
}
