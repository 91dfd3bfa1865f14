// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.stop;

import java.time.Duration;

/**
 * Functional interface deciding when a retryer gives up.
 *
 * <p>A StopStrategy is consulted after every rejected attempt. Implementations must be pure functions of their inputs
 * so a single instance can be shared between retryers and threads.
 */
@FunctionalInterface
public interface StopStrategy {

    /**
     * Determines whether to give up after the attempt that just completed.
     *
     * @param previousAttemptNumber number of the attempt that just completed (1-based)
     * @param delaySinceFirstAttempt time elapsed since the retryer started
     * @return true to stop retrying
     */
    boolean shouldStop(int previousAttemptNumber, Duration delaySinceFirstAttempt);
}
