// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.testing.FakeClock;
import software.amazon.retrying.testing.RecordingSleeper;

class FlakyApiExampleTest {

    @Test
    void testSucceedsOnceFailureWindowHasPassed() {
        var clock = new FakeClock();
        var sleeper = new RecordingSleeper(clock);
        var example = new FlakyApiExample(RetryConfig.builder().withClock(clock).withSleeper(sleeper));

        var result = example.call();

        assertTrue(result.startsWith("Flaky API succeeded"));
        // 200 + 400 + 800 ms of backoff plus jitter stays below the 2s window; the fourth wait crosses it
        assertEquals(4, sleeper.getSleepCount());
        assertTrue(sleeper.getTotalDelay().compareTo(FlakyApiExample.FAIL_FOR) >= 0);
        var delays = sleeper.getDelays();
        for (int i = 0; i < delays.size(); i++) {
            var base = Duration.ofMillis(100L << (i + 1));
            assertTrue(delays.get(i).compareTo(base) >= 0);
            assertTrue(delays.get(i).compareTo(base.plusMillis(100)) < 0);
        }
    }
}
