package com.enterprise.taskrouting.retry;

import java.time.Duration;

/**
 * Exponential backoff policy: the delay after failed attempt {@code n} is
 * {@code baseDelay * multiplier^(n-1)}, capped at {@code maxDelay}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double backoffMultiplier;
    private final Duration maxDelay;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.maxDelay = builder.maxDelay;
    }

    /**
     * Delay before the attempt following failed attempt {@code failedAttempt} (1-based)
     */
    public Duration delayAfter(int failedAttempt) {
        return delayAfter(failedAttempt, baseDelay);
    }

    public Duration delayAfter(int failedAttempt, Duration base) {
        double delayMs = base.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        long maxDelayMs = maxDelay.toMillis();
        return Duration.ofMillis(delayMs >= maxDelayMs ? maxDelayMs : (long) delayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 3 attempts, 2s base delay, doubling: 2s then 4s
     */
    public static RetryPolicy standard() {
        return builder().build();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public RetryPolicy build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be at least 1");
            }
            if (baseDelay.isNegative() || maxDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delays cannot be negative");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
            }
            return new RetryPolicy(this);
        }
    }
}
