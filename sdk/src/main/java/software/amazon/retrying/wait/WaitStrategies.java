// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.wait;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import software.amazon.retrying.validation.ParameterValidator;

/**
 * Factory class for the built-in wait strategies.
 *
 * <p>All strategies work at millisecond resolution and clamp their result to {@code [0, max]} where a maximum applies.
 */
public final class WaitStrategies {

    /** Upper bound used by the growing strategies when no maximum is given: 1073741823 ms. */
    public static final Duration MAX_WAIT = Duration.ofMillis(1073741823L);

    /** Default bounds of {@link #random()}. */
    public static final Duration DEFAULT_RANDOM_MIN = Duration.ZERO;

    public static final Duration DEFAULT_RANDOM_MAX = Duration.ofMillis(1000);

    /** Default increment of {@link #incrementing()}. */
    public static final Duration DEFAULT_INCREMENT = Duration.ofMillis(100);

    /** Default exponential base: delays grow as 2^n. */
    public static final int DEFAULT_EXPONENTIAL_BASE = 2;

    private static final WaitStrategy NONE = fixedUnchecked(Duration.ZERO);

    private WaitStrategies() {}

    /**
     * Strategy that doesn't wait at all before retrying.
     *
     * @return WaitStrategy always returning zero
     */
    public static WaitStrategy none() {
        return NONE;
    }

    /**
     * Strategy that waits a fixed amount of time between each retry.
     *
     * @param delay the constant delay
     * @return WaitStrategy with fixed delay
     */
    public static WaitStrategy fixed(Duration delay) {
        ParameterValidator.validateDuration(delay, "delay");
        return fixedUnchecked(delay);
    }

    /**
     * Strategy that waits a random amount of time between 0 and 1 second.
     *
     * @return WaitStrategy with random delay
     */
    public static WaitStrategy random() {
        return random(DEFAULT_RANDOM_MIN, DEFAULT_RANDOM_MAX);
    }

    /**
     * Strategy that waits a uniformly random whole number of milliseconds in {@code [min, max]}.
     *
     * @param min minimum delay, inclusive
     * @param max maximum delay, inclusive
     * @return WaitStrategy with random delay
     * @throws IllegalArgumentException if {@code min > max}
     */
    public static WaitStrategy random(Duration min, Duration max) {
        ParameterValidator.validateRange(min, max, "min", "max");
        var minMillis = min.toMillis();
        var maxMillis = max.toMillis();
        return (previousAttemptNumber, delaySinceFirstAttempt) ->
                Duration.ofMillis(ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1));
    }

    /**
     * Strategy that starts at 0 and adds 100 ms per attempt, up to {@link #MAX_WAIT}.
     *
     * @return incrementing WaitStrategy
     */
    public static WaitStrategy incrementing() {
        return incrementing(Duration.ZERO, DEFAULT_INCREMENT, MAX_WAIT);
    }

    /**
     * Strategy that waits an incremental amount of time after each attempt.
     *
     * <p>The delay is {@code start + increment × (previousAttemptNumber − 1)}, clamped to {@code [0, max]}. Start and
     * increment may be negative; the clamping keeps the result usable.
     *
     * @param start delay after the first attempt
     * @param increment amount added per attempt
     * @param max upper limit of the delay
     * @return incrementing WaitStrategy
     */
    public static WaitStrategy incrementing(Duration start, Duration increment, Duration max) {
        ParameterValidator.validateNotNull(start, "start");
        ParameterValidator.validateNotNull(increment, "increment");
        ParameterValidator.validateDuration(max, "max");
        var startMillis = start.toMillis();
        var incrementMillis = increment.toMillis();
        var maxMillis = max.toMillis();
        return (previousAttemptNumber, delaySinceFirstAttempt) -> {
            long result;
            try {
                result = Math.addExact(startMillis, Math.multiplyExact(incrementMillis, previousAttemptNumber - 1L));
            } catch (ArithmeticException overflow) {
                result = incrementMillis > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
            }
            return clamp(result, maxMillis);
        };
    }

    /**
     * Exponential backoff with a multiplier of 1 ms, base 2 and {@link #MAX_WAIT} as upper limit.
     *
     * @return exponential WaitStrategy
     */
    public static WaitStrategy exponential() {
        return exponential(Duration.ofMillis(1), MAX_WAIT);
    }

    /**
     * Exponential backoff with base 2.
     *
     * @param multiplier unit multiplied by {@code 2^previousAttemptNumber}
     * @param max upper limit of the delay
     * @return exponential WaitStrategy
     */
    public static WaitStrategy exponential(Duration multiplier, Duration max) {
        return exponential(multiplier, max, DEFAULT_EXPONENTIAL_BASE);
    }

    /**
     * Strategy that applies exponential backoff.
     *
     * <p>The delay is {@code multiplier × base^previousAttemptNumber}, clamped to {@code [0, max]}. The computation
     * saturates at {@code max} instead of overflowing, however large the attempt number gets.
     *
     * @param multiplier unit multiplied by {@code base^previousAttemptNumber}
     * @param max upper limit of the delay
     * @param base exponential base, at least 1
     * @return exponential WaitStrategy
     */
    public static WaitStrategy exponential(Duration multiplier, Duration max, int base) {
        ParameterValidator.validateNotNull(multiplier, "multiplier");
        ParameterValidator.validateDuration(max, "max");
        ParameterValidator.validatePositiveInteger(base, "base");
        var multiplierMillis = multiplier.toMillis();
        var maxMillis = max.toMillis();
        return (previousAttemptNumber, delaySinceFirstAttempt) -> {
            if (multiplierMillis <= 0) {
                return Duration.ZERO;
            }
            if (base == 1) {
                return clamp(multiplierMillis, maxMillis);
            }
            long result = multiplierMillis;
            for (int i = 0; i < previousAttemptNumber; i++) {
                if (result > maxMillis / base) {
                    // next step would pass max (or overflow)
                    return Duration.ofMillis(maxMillis);
                }
                result *= base;
            }
            return clamp(result, maxMillis);
        };
    }

    private static WaitStrategy fixedUnchecked(Duration delay) {
        return (previousAttemptNumber, delaySinceFirstAttempt) -> delay;
    }

    private static Duration clamp(long millis, long maxMillis) {
        if (millis > maxMillis) {
            return Duration.ofMillis(maxMillis);
        }
        if (millis < 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(millis);
    }
}
