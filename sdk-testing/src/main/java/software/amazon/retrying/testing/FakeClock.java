// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.testing;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import software.amazon.retrying.time.Clock;

/** Manually driven {@link Clock}. Time only moves when {@link #advance(Duration)} or {@link #set(long)} is called. */
public class FakeClock implements Clock {
    private final AtomicLong nowMillis;

    public FakeClock() {
        this(0);
    }

    public FakeClock(long startMillis) {
        this.nowMillis = new AtomicLong(startMillis);
    }

    @Override
    public long millis() {
        return nowMillis.get();
    }

    public void advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative, got: " + duration);
        }
        nowMillis.addAndGet(duration.toMillis());
    }

    public void set(long millis) {
        nowMillis.set(millis);
    }

    @Override
    public String toString() {
        return "FakeClock{" + nowMillis.get() + "ms}";
    }
}
