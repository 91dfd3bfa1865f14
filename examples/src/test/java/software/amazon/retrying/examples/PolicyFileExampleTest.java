// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import software.amazon.retrying.testing.RetryTestRunner;
import software.amazon.retrying.testing.ScriptedOperation;

class PolicyFileExampleTest {

    @Test
    void testBundledPolicy() {
        var config = PolicyFileExample.loadPolicy().build();

        assertEquals("greeting-service", config.getName());
        assertEquals(Duration.ofMillis(100), config.getWaitJitterMax());
        assertFalse(config.isWrapException());
    }

    @Test
    void testBundledPolicyRetriesIoAndTimeouts() {
        var runner = RetryTestRunner.create(PolicyFileExample.loadPolicy().build());

        var result = runner.run(ScriptedOperation.<String>builder()
                .thenThrow(() -> new IOException("unavailable"))
                .thenThrow(() -> new TimeoutException("slow"))
                .thenReturn("hello")
                .build());

        assertEquals("hello", result.getResult());
        assertEquals(3, result.getInvocations());
    }

    @Test
    void testBundledPolicyStopsAfterFiveAttempts() {
        var runner = RetryTestRunner.create(PolicyFileExample.loadPolicy().build());

        var result = runner.run(ScriptedOperation.<String>alwaysFailing(() -> new IOException("down")));

        assertEquals(5, result.getInvocations());
        assertEquals(4, result.getDelays().size());
        assertInstanceOf(IOException.class, result.getError().orElseThrow());
    }

    @Test
    void testBundledPolicyDoesNotRetryOtherErrors() {
        var runner = RetryTestRunner.create(PolicyFileExample.loadPolicy().build());

        var result = runner.run(ScriptedOperation.<String>alwaysFailing(() -> new IllegalStateException("bug")));

        assertEquals(1, result.getInvocations());
    }

    @Test
    void testHealthCheckPolicyPollsUntilReady() {
        var config = PolicyFileExample.healthCheckConfig();
        var runner = RetryTestRunner.create(config);

        var result = runner.run(ScriptedOperation.failingTimes(6, () -> new IOException("not ready"), "up"));

        assertEquals("health-check", config.getName());
        assertEquals("up", result.getResult());
        assertEquals(7, result.getInvocations());
        assertEquals(Duration.ofMillis(300), result.getTotalDelay());
    }
}
