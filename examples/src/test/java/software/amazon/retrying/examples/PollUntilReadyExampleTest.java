// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.examples.PollUntilReadyExample.JobStatus;
import software.amazon.retrying.exception.RetryException;
import software.amazon.retrying.testing.FakeClock;
import software.amazon.retrying.testing.RecordingSleeper;

class PollUntilReadyExampleTest {

    private final RecordingSleeper sleeper = new RecordingSleeper(new FakeClock());

    private PollUntilReadyExample example() {
        return new PollUntilReadyExample(RetryConfig.builder().withSleeper(sleeper));
    }

    @Test
    void testPollsUntilTerminalStatus() {
        var polls = new AtomicInteger();

        var status = example().awaitCompletion(() -> switch (polls.incrementAndGet()) {
            case 1 -> JobStatus.QUEUED;
            case 2, 3 -> JobStatus.RUNNING;
            default -> JobStatus.FAILED;
        });

        assertEquals(JobStatus.FAILED, status);
        assertEquals(4, polls.get());
        assertEquals(
                List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(300)), sleeper.getDelays());
    }

    @Test
    void testGivesUpWithLastStatus() {
        var exception = assertThrows(
                RetryException.class, () -> example().awaitCompletion(() -> JobStatus.RUNNING));

        assertEquals(20, exception.getAttemptNumber());
        assertEquals(JobStatus.RUNNING, exception.getLastAttempt().getResult());
        assertEquals(Duration.ofSeconds(1), sleeper.getDelays().get(18));
    }
}
