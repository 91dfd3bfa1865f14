// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.Retryer;
import software.amazon.retrying.exception.RetryException;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.wait.WaitStrategies;

/**
 * Example of retrying on results rather than exceptions: polls a job status until it is terminal.
 *
 * <p>Giving up while the job is still running surfaces as a {@link RetryException} whose last attempt holds the last
 * observed status.
 */
public class PollUntilReadyExample {

    private static final Logger logger = LoggerFactory.getLogger(PollUntilReadyExample.class);

    public enum JobStatus {
        QUEUED,
        RUNNING,
        SUCCEEDED,
        FAILED;

        boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    private final Retryer retryer;

    public PollUntilReadyExample() {
        this(RetryConfig.builder());
    }

    PollUntilReadyExample(RetryConfig.Builder builder) {
        this.retryer = Retryer.create(builder.withName("job-poller")
                .withStopStrategy(StopStrategies.afterAttempt(20))
                .withWaitStrategy(WaitStrategies.incrementing(
                        Duration.ofMillis(100), Duration.ofMillis(100), Duration.ofSeconds(1)))
                .withRetryOnResult(status -> !((JobStatus) status).isTerminal())
                .withAfterAttempt(attempt -> logger.info("Job not finished after poll {}", attempt))
                .build());
    }

    public JobStatus awaitCompletion(Supplier<JobStatus> statusSource) {
        return retryer.execute(statusSource::get);
    }

    public static void main(String[] args) {
        var polls = new int[1];
        var status = new PollUntilReadyExample()
                .awaitCompletion(() -> ++polls[0] < 4 ? JobStatus.RUNNING : JobStatus.SUCCEEDED);
        logger.info("Job finished with status {} after {} polls", status, polls[0]);
    }
}
