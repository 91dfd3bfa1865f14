// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retrying.exception.RetryException;
import software.amazon.retrying.exception.RetryInterruptedException;
import software.amazon.retrying.logging.RetryLogger;
import software.amazon.retrying.validation.ParameterValidator;

/**
 * Retry controller: invokes an operation until its outcome is accepted or the stop strategy gives up, sleeping between
 * attempts as the wait strategy dictates.
 *
 * <p>Each call to {@code execute} runs its own independent sequence of attempts on the calling thread; the retryer
 * itself only holds its immutable {@link RetryConfig}, so one instance can be shared freely.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>accepted result: returned to the caller
 *   <li>accepted exception: re-thrown unchanged, exactly as if the operation had been called directly
 *   <li>give up after an exception: the original exception is re-thrown, or wrapped in a {@link RetryException} when
 *       {@link RetryConfig#isWrapException()} is set
 *   <li>give up after a rejected result: always a {@link RetryException}, since there is no exception to re-throw
 * </ul>
 *
 * <p>Checked exceptions thrown by the operation are re-thrown as is, although the {@code execute} methods do not
 * declare them.
 */
public class Retryer {
    private static final Logger logger = LoggerFactory.getLogger(Retryer.class);

    private final RetryConfig config;
    private final RetryLogger retryLogger;

    Retryer(RetryConfig config, Logger delegate) {
        this.config = ParameterValidator.validateNotNull(config, "config");
        this.retryLogger = new RetryLogger(delegate, config.getName(), config.getLoggerConfig());
    }

    /**
     * Creates a retryer with the default configuration: retry every exception forever, without waiting.
     *
     * @return the retryer
     */
    public static Retryer create() {
        return create(RetryConfig.defaultConfig());
    }

    /**
     * Creates a retryer for the given configuration.
     *
     * @param config the configuration
     * @return the retryer
     */
    public static Retryer create(RetryConfig config) {
        return new Retryer(config, logger);
    }

    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Runs the operation with retries.
     *
     * @param operation the operation to run
     * @return the result of the accepted attempt
     * @throws RetryException when giving up in wrapped mode, or after a rejected result
     * @throws RetryInterruptedException when the operation throws {@link InterruptedException}, or when interrupted
     *     while waiting between attempts
     */
    public <V> V execute(Callable<V> operation) {
        ParameterValidator.validateNotNull(operation, "operation");
        var clock = config.getClock();
        var startMillis = clock.millis();
        var attemptNumber = 1;

        while (true) {
            if (config.getBeforeAttempt() != null) {
                config.getBeforeAttempt().onAttempt(attemptNumber);
            }

            var attempt = invoke(operation, attemptNumber);
            if (attempt.getException() instanceof InterruptedException interrupted) {
                retryLogger.warn("Retry '{}' interrupted during attempt {}", config.getName(), attemptNumber);
                throw new RetryInterruptedException(config.getName(), attempt, interrupted);
            }

            if (!config.getRejectStrategy().shouldReject(attempt)) {
                retryLogger.debug(
                        "Retry '{}' {} at attempt {}", config.getName(), RetryState.ACCEPTED, attemptNumber);
                return attempt.get();
            }

            if (config.getAfterAttempt() != null) {
                config.getAfterAttempt().onAttempt(attemptNumber);
            }

            var delaySinceFirstAttempt = Duration.ofMillis(Math.max(0, clock.millis() - startMillis));
            if (config.getStopStrategy().shouldStop(attemptNumber, delaySinceFirstAttempt)) {
                retryLogger.warn(
                        "Retry '{}' {} after {} attempt(s) in {}: {}",
                        config.getName(),
                        RetryState.GIVING_UP,
                        attemptNumber,
                        delaySinceFirstAttempt,
                        attempt);
                if (!config.isWrapException() && attempt.hasException()) {
                    return attempt.get();
                }
                throw new RetryException(attempt);
            }

            var delay = computeDelay(attemptNumber, delaySinceFirstAttempt);
            retryLogger.debug(
                    "Retry '{}' rejected attempt {} ({}), next attempt in {}",
                    config.getName(),
                    attemptNumber,
                    attempt,
                    delay);
            sleep(delay, attempt);
            attemptNumber++;
        }
    }

    /**
     * Runs a one-argument operation with retries; the argument is passed unchanged to every attempt.
     *
     * @param operation the operation to run
     * @param argument the argument
     * @return the result of the accepted attempt
     */
    public <T, R> R execute(CheckedFunction<T, R> operation, T argument) {
        ParameterValidator.validateNotNull(operation, "operation");
        return execute(() -> operation.apply(argument));
    }

    /**
     * Runs a two-argument operation with retries; the arguments are passed unchanged to every attempt.
     *
     * @param operation the operation to run
     * @param first the first argument
     * @param second the second argument
     * @return the result of the accepted attempt
     */
    public <T, U, R> R execute(CheckedBiFunction<T, U, R> operation, T first, U second) {
        ParameterValidator.validateNotNull(operation, "operation");
        return execute(() -> operation.apply(first, second));
    }

    /**
     * Runs an action with retries.
     *
     * @param action the action to run
     */
    public void run(CheckedRunnable action) {
        ParameterValidator.validateNotNull(action, "action");
        execute(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Binds this retryer to an operation.
     *
     * @param operation the operation to wrap
     * @return a Callable that runs the operation with retries
     */
    public <V> RetryingCallable<V> wrap(Callable<V> operation) {
        return new RetryingCallable<>(this, ParameterValidator.validateNotNull(operation, "operation"));
    }

    /**
     * Binds this retryer to a one-argument operation.
     *
     * @param operation the operation to wrap
     * @return a function with the same signature that runs the operation with retries
     */
    public <T, R> CheckedFunction<T, R> wrap(CheckedFunction<T, R> operation) {
        ParameterValidator.validateNotNull(operation, "operation");
        return new CheckedFunction<>() {
            @Override
            public R apply(T argument) {
                return execute(operation, argument);
            }

            @Override
            public String toString() {
                return operation.toString();
            }
        };
    }

    private <V> Attempt<V> invoke(Callable<V> operation, int attemptNumber) {
        retryLogger.setAttemptContext(attemptNumber);
        if (retryLogger.isDebugEnabled()) {
            retryLogger.debug("Retry '{}' {} attempt {}", config.getName(), RetryState.RUNNING, attemptNumber);
        }
        try {
            return Attempt.success(operation.call(), attemptNumber);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Attempt.failure(e, attemptNumber);
        } catch (Exception e) {
            return Attempt.failure(e, attemptNumber);
        } finally {
            retryLogger.clearAttemptContext();
        }
    }

    private Duration computeDelay(int attemptNumber, Duration delaySinceFirstAttempt) {
        var delay = config.getWaitStrategy().computeDelay(attemptNumber, delaySinceFirstAttempt);
        if (delay == null || delay.isNegative()) {
            delay = Duration.ZERO;
        }
        var jitterMax = config.getWaitJitterMax();
        if (jitterMax != null && !jitterMax.isZero()) {
            var jitterNanos = (long) (ThreadLocalRandom.current().nextDouble() * saturatedNanos(jitterMax));
            delay = delay.plusNanos(jitterNanos);
        }
        return delay;
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void sleep(Duration delay, Attempt<?> lastAttempt) {
        try {
            config.getSleeper().sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            retryLogger.warn(
                    "Retry '{}' interrupted while waiting after attempt {}",
                    config.getName(),
                    lastAttempt.getAttemptNumber());
            throw new RetryInterruptedException(config.getName(), lastAttempt, e);
        }
    }

    @Override
    public String toString() {
        return "Retryer{" + config + "}";
    }
}
