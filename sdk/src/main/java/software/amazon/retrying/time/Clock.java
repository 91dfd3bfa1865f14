// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.time;

/** Time source used to measure how long a retryer has been running. */
@FunctionalInterface
public interface Clock {

    /**
     * Current reading in milliseconds. Only differences between readings are meaningful; the origin is arbitrary.
     *
     * @return the current time in milliseconds
     */
    long millis();

    /** @return the default clock, backed by {@link System#nanoTime()} */
    static Clock systemClock() {
        return SystemClock.INSTANCE;
    }
}
