// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.wait;

import java.time.Duration;

/**
 * Functional interface computing how long a retryer sleeps before the next attempt.
 *
 * <p>Implementations must be pure functions of their inputs (random strategies aside) so a single instance can be
 * shared between retryers and threads. A negative result is treated as zero by the retryer.
 */
@FunctionalInterface
public interface WaitStrategy {

    /**
     * Calculates the delay before the next attempt.
     *
     * @param previousAttemptNumber number of the attempt that just completed (1-based)
     * @param delaySinceFirstAttempt time elapsed since the retryer started
     * @return the delay before the next attempt
     */
    Duration computeDelay(int previousAttemptNumber, Duration delaySinceFirstAttempt);
}
