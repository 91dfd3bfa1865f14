// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

import java.time.Duration;
import java.util.function.Predicate;
import software.amazon.retrying.logging.LoggerConfig;
import software.amazon.retrying.reject.RejectStrategies;
import software.amazon.retrying.reject.RejectStrategy;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.stop.StopStrategy;
import software.amazon.retrying.time.Clock;
import software.amazon.retrying.time.Sleeper;
import software.amazon.retrying.validation.ParameterValidator;
import software.amazon.retrying.wait.WaitStrategies;
import software.amazon.retrying.wait.WaitStrategy;

/**
 * Configuration of a {@link Retryer}. This class provides a builder pattern for selecting the stop, wait and reject
 * strategies and the optional jitter, exception wrapping and attempt listeners.
 *
 * <p>A configuration is immutable once built and can be shared by any number of retryers.
 *
 * <p>Defaults: no stop bound ({@link StopStrategies#never()}), no wait, retry on every exception, accept every
 * result, no jitter, original exceptions re-thrown unwrapped.
 *
 * <pre>{@code
 * RetryConfig config = RetryConfig.builder()
 *     .withStopStrategy(StopStrategies.afterAttempt(5))
 *     .withWaitStrategy(WaitStrategies.exponential(Duration.ofMillis(100), Duration.ofSeconds(10)))
 *     .withWaitJitterMax(Duration.ofMillis(50))
 *     .withRetryOnExceptionTypes(IOException.class)
 *     .build();
 * }</pre>
 */
public final class RetryConfig {
    static final String DEFAULT_NAME = "retry";

    private final String name;
    private final StopStrategy stopStrategy;
    private final WaitStrategy waitStrategy;
    private final RejectStrategy rejectStrategy;
    private final boolean explicitRejectStrategy;
    private final Predicate<? super Throwable> retryOnException;
    private final Predicate<Object> retryOnResult;
    private final Duration waitJitterMax;
    private final boolean wrapException;
    private final AttemptListener beforeAttempt;
    private final AttemptListener afterAttempt;
    private final Clock clock;
    private final Sleeper sleeper;
    private final LoggerConfig loggerConfig;

    private RetryConfig(Builder builder) {
        this.name = builder.name;
        this.stopStrategy = builder.stopStrategy;
        this.waitStrategy = builder.waitStrategy;
        this.retryOnException = builder.retryOnException;
        this.retryOnResult = builder.retryOnResult;
        this.rejectStrategy = builder.rejectStrategy != null
                ? builder.rejectStrategy
                : RejectStrategies.of(builder.retryOnException, builder.retryOnResult);
        this.waitJitterMax = builder.waitJitterMax;
        this.wrapException = builder.wrapException;
        this.beforeAttempt = builder.beforeAttempt;
        this.afterAttempt = builder.afterAttempt;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.loggerConfig = builder.loggerConfig;
        this.explicitRejectStrategy = builder.rejectStrategy != null;
    }

    /**
     * Creates a RetryConfig with default settings: retry every exception forever, without waiting.
     *
     * @return RetryConfig with default configuration
     */
    public static RetryConfig defaultConfig() {
        return new Builder().build();
    }

    /**
     * Creates a new builder for RetryConfig.
     *
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialised with this configuration.
     *
     * @return Builder instance
     */
    public Builder toBuilder() {
        var builder = new Builder()
                .withName(name)
                .withStopStrategy(stopStrategy)
                .withWaitStrategy(waitStrategy)
                .withWaitJitterMax(waitJitterMax)
                .withWrapException(wrapException)
                .withBeforeAttempt(beforeAttempt)
                .withAfterAttempt(afterAttempt)
                .withClock(clock)
                .withSleeper(sleeper)
                .withLoggerConfig(loggerConfig);
        if (explicitRejectStrategy) {
            builder.withRejectStrategy(rejectStrategy);
        } else {
            builder.withRetryOnException(retryOnException).withRetryOnResult(retryOnResult);
        }
        return builder;
    }

    /** @return name used in log lines and in the MDC */
    public String getName() {
        return name;
    }

    /** @return the stop strategy, never null */
    public StopStrategy getStopStrategy() {
        return stopStrategy;
    }

    /** @return the wait strategy, never null */
    public WaitStrategy getWaitStrategy() {
        return waitStrategy;
    }

    /** @return the effective reject strategy, never null */
    public RejectStrategy getRejectStrategy() {
        return rejectStrategy;
    }

    /** @return upper bound of the random jitter added to each wait, or null if jitter is disabled */
    public Duration getWaitJitterMax() {
        return waitJitterMax;
    }

    /** @return whether exceptions are wrapped in a RetryException when the retryer gives up */
    public boolean isWrapException() {
        return wrapException;
    }

    /** @return listener invoked before each attempt, or null */
    public AttemptListener getBeforeAttempt() {
        return beforeAttempt;
    }

    /** @return listener invoked after each rejected attempt, or null */
    public AttemptListener getAfterAttempt() {
        return afterAttempt;
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public LoggerConfig getLoggerConfig() {
        return loggerConfig;
    }

    @Override
    public String toString() {
        return "RetryConfig{name=" + name + ", stopStrategy=" + stopStrategy + ", waitJitterMax=" + waitJitterMax
                + ", wrapException=" + wrapException + "}";
    }

    /** Builder for RetryConfig */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private StopStrategy stopStrategy = StopStrategies.never();
        private WaitStrategy waitStrategy = WaitStrategies.none();
        private RejectStrategy rejectStrategy;
        private Predicate<? super Throwable> retryOnException;
        private Predicate<Object> retryOnResult;
        private Duration waitJitterMax;
        private boolean wrapException;
        private AttemptListener beforeAttempt;
        private AttemptListener afterAttempt;
        private Clock clock = Clock.systemClock();
        private Sleeper sleeper = Sleeper.threadSleeper();
        private LoggerConfig loggerConfig = LoggerConfig.defaults();

        private Builder() {}

        /**
         * Sets the name used in log lines and in the MDC.
         *
         * @param name the retry name
         * @return this builder for method chaining
         */
        public Builder withName(String name) {
            this.name = ParameterValidator.validateNotNull(name, "name");
            return this;
        }

        /**
         * Sets the stop strategy. To retry without any bound, pass {@link StopStrategies#never()} explicitly; null is
         * not accepted.
         *
         * @param stopStrategy the stop strategy
         * @return this builder for method chaining
         */
        public Builder withStopStrategy(StopStrategy stopStrategy) {
            if (stopStrategy == null) {
                throw new IllegalArgumentException(
                        "stopStrategy cannot be null; use StopStrategies.never() to retry without bound");
            }
            this.stopStrategy = stopStrategy;
            return this;
        }

        /**
         * Sets the wait strategy.
         *
         * @param waitStrategy the wait strategy
         * @return this builder for method chaining
         */
        public Builder withWaitStrategy(WaitStrategy waitStrategy) {
            this.waitStrategy = ParameterValidator.validateNotNull(waitStrategy, "waitStrategy");
            return this;
        }

        /**
         * Sets a complete reject strategy. Cannot be combined with {@link #withRetryOnException},
         * {@link #withRetryOnExceptionTypes} or {@link #withRetryOnResult}.
         *
         * @param rejectStrategy the reject strategy, or null for the predicate-based one
         * @return this builder for method chaining
         */
        public Builder withRejectStrategy(RejectStrategy rejectStrategy) {
            this.rejectStrategy = rejectStrategy;
            return this;
        }

        /**
         * Sets the predicate deciding which exceptions are retried. Null restores the default (retry all).
         *
         * @param retryOnException the exception predicate
         * @return this builder for method chaining
         */
        public Builder withRetryOnException(Predicate<? super Throwable> retryOnException) {
            this.retryOnException = retryOnException;
            return this;
        }

        /**
         * Retries only exceptions that are instances of one of the given types.
         *
         * @param exceptionTypes the retryable exception types
         * @return this builder for method chaining
         */
        @SafeVarargs
        public final Builder withRetryOnExceptionTypes(Class<? extends Throwable>... exceptionTypes) {
            this.retryOnException = RejectStrategies.exceptionTypePredicate(exceptionTypes);
            return this;
        }

        /**
         * Sets the predicate deciding which returned values are retried. Null restores the default (accept all).
         *
         * @param retryOnResult the result predicate
         * @return this builder for method chaining
         */
        public Builder withRetryOnResult(Predicate<Object> retryOnResult) {
            this.retryOnResult = retryOnResult;
            return this;
        }

        /**
         * Adds a uniformly random amount in {@code [0, waitJitterMax)} to every computed wait.
         *
         * @param waitJitterMax the jitter bound, or null to disable jitter
         * @return this builder for method chaining
         */
        public Builder withWaitJitterMax(Duration waitJitterMax) {
            ParameterValidator.validateOptionalDuration(waitJitterMax, "waitJitterMax");
            this.waitJitterMax = waitJitterMax;
            return this;
        }

        /**
         * When true, giving up always throws a {@link software.amazon.retrying.exception.RetryException}; when false,
         * the last exception is re-thrown as is.
         *
         * @param wrapException whether to wrap the last exception
         * @return this builder for method chaining
         */
        public Builder withWrapException(boolean wrapException) {
            this.wrapException = wrapException;
            return this;
        }

        public Builder withBeforeAttempt(AttemptListener beforeAttempt) {
            this.beforeAttempt = beforeAttempt;
            return this;
        }

        public Builder withAfterAttempt(AttemptListener afterAttempt) {
            this.afterAttempt = afterAttempt;
            return this;
        }

        /**
         * Sets the time source used to measure the delay since the first attempt.
         *
         * @param clock the clock
         * @return this builder for method chaining
         */
        public Builder withClock(Clock clock) {
            this.clock = ParameterValidator.validateNotNull(clock, "clock");
            return this;
        }

        /**
         * Sets the primitive used to block between attempts.
         *
         * @param sleeper the sleeper
         * @return this builder for method chaining
         */
        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = ParameterValidator.validateNotNull(sleeper, "sleeper");
            return this;
        }

        public Builder withLoggerConfig(LoggerConfig loggerConfig) {
            this.loggerConfig = ParameterValidator.validateNotNull(loggerConfig, "loggerConfig");
            return this;
        }

        /**
         * Builds the RetryConfig instance.
         *
         * @return a new RetryConfig with the configured options
         * @throws IllegalArgumentException if a reject strategy is combined with reject predicates
         */
        public RetryConfig build() {
            if (rejectStrategy != null && (retryOnException != null || retryOnResult != null)) {
                throw new IllegalArgumentException(
                        "rejectStrategy cannot be combined with retryOnException or retryOnResult");
            }
            return new RetryConfig(this);
        }
    }
}
