// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.Retryer;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.time.Clock;
import software.amazon.retrying.wait.WaitStrategies;

/**
 * Simple example demonstrating retries against a flaky API.
 *
 * <p>This example shows:
 *
 * <ul>
 *   <li>Exponential backoff with jitter, bounded by both attempts and elapsed time
 *   <li>Retrying only I/O failures while letting programming errors through
 *   <li>Time-based failure simulation for realistic retry behavior
 * </ul>
 */
public class FlakyApiExample {

    private static final Logger logger = LoggerFactory.getLogger(FlakyApiExample.class);

    static final Duration FAIL_FOR = Duration.ofSeconds(2);

    private final RetryConfig config;

    public FlakyApiExample() {
        this(RetryConfig.builder());
    }

    FlakyApiExample(RetryConfig.Builder builder) {
        this.config = builder.withName("flaky-api")
                .withStopStrategy(StopStrategies.anyOf(
                        StopStrategies.afterAttempt(10), StopStrategies.afterDelay(Duration.ofSeconds(30))))
                .withWaitStrategy(WaitStrategies.exponential(Duration.ofMillis(100), Duration.ofSeconds(2)))
                .withWaitJitterMax(Duration.ofMillis(100))
                .withRetryOnExceptionTypes(IOException.class)
                .build();
    }

    public String call() {
        var clock = config.getClock();
        var startMillis = clock.millis();
        return Retryer.create(config).execute(() -> flakyApi(clock, startMillis));
    }

    private static String flakyApi(Clock clock, long startMillis) throws IOException {
        var elapsed = Duration.ofMillis(clock.millis() - startMillis);
        if (elapsed.compareTo(FAIL_FOR) < 0) {
            var message = String.format(
                    "Flaky API failing - elapsed time (%.1fs) < %.1fs",
                    elapsed.toMillis() / 1000.0, FAIL_FOR.toMillis() / 1000.0);
            logger.warn(message);
            throw new IOException(message);
        }
        var message = String.format("Flaky API succeeded - elapsed time (%.1fs)", elapsed.toMillis() / 1000.0);
        logger.info(message);
        return message;
    }

    public static void main(String[] args) {
        logger.info("Flaky API result: {}", new FlakyApiExample().call());
    }
}
