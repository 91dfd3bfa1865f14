// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.time;

import java.time.Duration;

/** Blocking delay primitive used between attempts. */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration how long to block, never negative
     * @throws InterruptedException if the thread is interrupted while blocked
     */
    void sleep(Duration duration) throws InterruptedException;

    /** @return the default sleeper, backed by {@link Thread#sleep(long, int)} */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration.isZero()) {
                return;
            }
            var millis = duration.toMillis();
            var nanos = (int) (duration.minusMillis(millis).toNanos());
            Thread.sleep(millis, nanos);
        };
    }
}
