// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.config;

import java.time.Duration;
import java.util.ArrayList;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.stop.StopStrategy;

/**
 * Declarative stop condition. Either {@code never} is true, or at least one of {@code afterAttempt} and
 * {@code afterDelay} is set; when both bounds are set the retryer stops at whichever is reached first.
 *
 * @param afterAttempt stop once this many attempts have been made
 * @param afterDelay stop once this much time has passed since the first attempt
 * @param never retry without any bound
 */
public record StopPolicy(Integer afterAttempt, Duration afterDelay, Boolean never) {

    public static StopPolicy ofAttempts(int afterAttempt) {
        return new StopPolicy(afterAttempt, null, null);
    }

    public StopStrategy toStopStrategy() {
        var bounded = afterAttempt != null || afterDelay != null;
        if (Boolean.TRUE.equals(never)) {
            if (bounded) {
                throw new IllegalArgumentException("stop.never cannot be combined with afterAttempt or afterDelay");
            }
            return StopStrategies.never();
        }
        if (!bounded) {
            throw new IllegalArgumentException("stop must set afterAttempt, afterDelay or never");
        }
        var strategies = new ArrayList<StopStrategy>();
        if (afterAttempt != null) {
            strategies.add(StopStrategies.afterAttempt(afterAttempt));
        }
        if (afterDelay != null) {
            strategies.add(StopStrategies.afterDelay(afterDelay));
        }
        return StopStrategies.anyOf(strategies.toArray(new StopStrategy[0]));
    }
}
