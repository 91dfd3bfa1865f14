// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.stop;

import java.time.Duration;
import java.util.List;
import software.amazon.retrying.validation.ParameterValidator;

/** Factory class for the built-in stop strategies. */
public final class StopStrategies {

    private static final StopStrategy NEVER = new StopStrategy() {
        @Override
        public boolean shouldStop(int previousAttemptNumber, Duration delaySinceFirstAttempt) {
            return false;
        }

        @Override
        public String toString() {
            return "StopStrategy{never}";
        }
    };

    private StopStrategies() {}

    /**
     * Strategy that never stops: the retryer keeps going until an attempt is accepted.
     *
     * <p>This is the default of {@link software.amazon.retrying.RetryConfig}. There is no implicit bound anywhere else,
     * so an operation that never succeeds is retried for as long as the thread lives.
     *
     * @return the unbounded strategy
     */
    public static StopStrategy never() {
        return NEVER;
    }

    /**
     * Strategy that stops when the previous attempt number is at least {@code maxAttemptNumber}.
     *
     * @param maxAttemptNumber maximum number of attempts, including the first one
     * @return StopStrategy bounded by attempt count
     */
    public static StopStrategy afterAttempt(int maxAttemptNumber) {
        ParameterValidator.validatePositiveInteger(maxAttemptNumber, "maxAttemptNumber");
        return (previousAttemptNumber, delaySinceFirstAttempt) -> previousAttemptNumber >= maxAttemptNumber;
    }

    /**
     * Strategy that stops when the time since the first attempt is at least {@code maxDelay}.
     *
     * <p>The bound is checked between attempts only; a running attempt is never cut short.
     *
     * @param maxDelay maximum time to keep retrying
     * @return StopStrategy bounded by elapsed time
     */
    public static StopStrategy afterDelay(Duration maxDelay) {
        ParameterValidator.validateDuration(maxDelay, "maxDelay");
        return (previousAttemptNumber, delaySinceFirstAttempt) -> delaySinceFirstAttempt.compareTo(maxDelay) >= 0;
    }

    /**
     * Strategy that stops as soon as any of the given strategies does.
     *
     * @param strategies the strategies to combine, at least one
     * @return the combined StopStrategy
     */
    public static StopStrategy anyOf(StopStrategy... strategies) {
        ParameterValidator.validateNotNull(strategies, "strategies");
        if (strategies.length == 0) {
            throw new IllegalArgumentException("strategies must not be empty");
        }
        var components = List.of(strategies);
        if (components.size() == 1) {
            return components.get(0);
        }
        return (previousAttemptNumber, delaySinceFirstAttempt) -> {
            for (var strategy : components) {
                if (strategy.shouldStop(previousAttemptNumber, delaySinceFirstAttempt)) {
                    return true;
                }
            }
            return false;
        };
    }
}
