// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.config;

import java.time.Duration;
import software.amazon.retrying.wait.WaitStrategies;
import software.amazon.retrying.wait.WaitStrategy;
import software.amazon.retrying.wait.WaitType;

/**
 * Declarative wait strategy. Only the fields relevant to {@code type} are read; unset fields take the same defaults
 * as the corresponding {@link WaitStrategies} factory.
 *
 * <table>
 *   <caption>Fields per type</caption>
 *   <tr><th>type</th><th>fields</th></tr>
 *   <tr><td>NONE</td><td>none</td></tr>
 *   <tr><td>FIXED</td><td>fixed (required)</td></tr>
 *   <tr><td>RANDOM</td><td>min, max</td></tr>
 *   <tr><td>INCREMENTING</td><td>start, increment, max</td></tr>
 *   <tr><td>EXPONENTIAL</td><td>multiplier, max, base</td></tr>
 * </table>
 */
public record WaitPolicy(
        WaitType type,
        Duration fixed,
        Duration min,
        Duration max,
        Duration start,
        Duration increment,
        Duration multiplier,
        Integer base) {

    public static WaitPolicy ofFixed(Duration fixed) {
        return new WaitPolicy(WaitType.FIXED, fixed, null, null, null, null, null, null);
    }

    public static WaitPolicy ofExponential(Duration multiplier, Duration max) {
        return new WaitPolicy(WaitType.EXPONENTIAL, null, null, max, null, null, multiplier, null);
    }

    public WaitStrategy toWaitStrategy() {
        var waitType = type == null ? WaitType.NONE : type;
        return switch (waitType) {
            case NONE -> WaitStrategies.none();
            case FIXED -> {
                if (fixed == null) {
                    throw new IllegalArgumentException("wait.fixed is required for type FIXED");
                }
                yield WaitStrategies.fixed(fixed);
            }
            case RANDOM -> WaitStrategies.random(
                    orDefault(min, WaitStrategies.DEFAULT_RANDOM_MIN), orDefault(max, WaitStrategies.DEFAULT_RANDOM_MAX));
            case INCREMENTING -> WaitStrategies.incrementing(
                    orDefault(start, Duration.ZERO),
                    orDefault(increment, WaitStrategies.DEFAULT_INCREMENT),
                    orDefault(max, WaitStrategies.MAX_WAIT));
            case EXPONENTIAL -> WaitStrategies.exponential(
                    orDefault(multiplier, Duration.ofMillis(1)),
                    orDefault(max, WaitStrategies.MAX_WAIT),
                    base == null ? WaitStrategies.DEFAULT_EXPONENTIAL_BASE : base);
        };
    }

    private static Duration orDefault(Duration value, Duration defaultValue) {
        return value == null ? defaultValue : value;
    }
}
