// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.retrying.Attempt;
import software.amazon.retrying.exception.SerDesException;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.wait.WaitType;

class RetryPoliciesTest {

    private static final String FULL_POLICY = """
            {
              "name": "inventory",
              "stop": {"afterAttempt": 5, "afterDelay": "PT30S"},
              "wait": {"type": "EXPONENTIAL", "multiplier": "PT0.1S", "max": "PT10S"},
              "waitJitterMax": "PT0.05S",
              "wrapException": true,
              "retryOn": ["java.io.IOException"]
            }
            """;

    @Test
    void testParsesFullPolicy() {
        var policy = RetryPolicies.fromJson(FULL_POLICY);

        assertEquals("inventory", policy.name());
        assertEquals(new StopPolicy(5, Duration.ofSeconds(30), null), policy.stopPolicy());
        assertEquals(WaitType.EXPONENTIAL, policy.waitPolicy().type());
        assertEquals(Duration.ofMillis(100), policy.waitPolicy().multiplier());
        assertEquals(Duration.ofSeconds(10), policy.waitPolicy().max());
        assertEquals(Duration.ofMillis(50), policy.waitJitterMax());
        assertTrue(policy.wrapException());
        assertEquals(List.of("java.io.IOException"), policy.retryOn());
    }

    @Test
    void testConvertsToRetryConfig() {
        var config = RetryPolicies.toRetryConfig(FULL_POLICY);

        assertEquals("inventory", config.getName());
        assertFalse(config.getStopStrategy().shouldStop(4, Duration.ofSeconds(29)));
        assertTrue(config.getStopStrategy().shouldStop(5, Duration.ZERO));
        assertTrue(config.getStopStrategy().shouldStop(1, Duration.ofSeconds(30)));
        assertEquals(Duration.ofMillis(400), config.getWaitStrategy().computeDelay(2, Duration.ZERO));
        assertEquals(Duration.ofSeconds(10), config.getWaitStrategy().computeDelay(20, Duration.ZERO));
        assertEquals(Duration.ofMillis(50), config.getWaitJitterMax());
        assertTrue(config.isWrapException());
        assertTrue(config.getRejectStrategy().shouldReject(Attempt.failure(new FileNotFoundException(), 1)));
        assertFalse(config.getRejectStrategy().shouldReject(Attempt.failure(new IllegalStateException(), 1)));
    }

    @Test
    void testMinimalPolicyUsesDefaults() {
        var config = RetryPolicies.toRetryConfig("{\"stop\": {\"afterAttempt\": 2}}");

        assertEquals("retry", config.getName());
        assertEquals(Duration.ZERO, config.getWaitStrategy().computeDelay(1, Duration.ZERO));
        assertNull(config.getWaitJitterMax());
        assertFalse(config.isWrapException());
        assertTrue(config.getRejectStrategy().shouldReject(Attempt.failure(new IllegalStateException(), 1)));
    }

    @Test
    void testNeverStopIsExplicit() {
        var config = RetryPolicies.toRetryConfig("{\"stop\": {\"never\": true}}");

        assertSame(StopStrategies.never(), config.getStopStrategy());
    }

    @Test
    void testMissingStopIsRejected() {
        var policy = RetryPolicies.fromJson("{\"name\": \"unbounded\"}");

        var exception = assertThrows(IllegalArgumentException.class, policy::toRetryConfig);

        assertEquals("stop cannot be null", exception.getMessage());
    }

    @Test
    void testEmptyStopIsRejected() {
        var policy = RetryPolicies.fromJson("{\"stop\": {}}");

        assertThrows(IllegalArgumentException.class, policy::toRetryConfig);
    }

    @Test
    void testNeverCombinedWithBoundIsRejected() {
        var policy = RetryPolicies.fromJson("{\"stop\": {\"never\": true, \"afterAttempt\": 3}}");

        assertThrows(IllegalArgumentException.class, policy::toRetryConfig);
    }

    @Test
    void testUnknownPropertyIsRejected() {
        assertThrows(
                SerDesException.class, () -> RetryPolicies.fromJson("{\"stop\": {\"afterAttempts\": 3}}"));
    }

    @Test
    void testUnknownExceptionTypeIsRejected() {
        var policy = RetryPolicies.fromJson("{\"stop\": {\"afterAttempt\": 3}, \"retryOn\": [\"com.example.Missing\"]}");

        var exception = assertThrows(IllegalArgumentException.class, policy::toRetryConfig);

        assertEquals("Unknown exception type in retryOn: com.example.Missing", exception.getMessage());
    }

    @Test
    void testNonThrowableTypeIsRejected() {
        var policy = RetryPolicies.fromJson("{\"stop\": {\"afterAttempt\": 3}, \"retryOn\": [\"java.lang.String\"]}");

        assertThrows(IllegalArgumentException.class, policy::toRetryConfig);
    }

    @Test
    void testWaitPolicyDefaultsPerType() {
        var random = new WaitPolicy(WaitType.RANDOM, null, null, null, null, null, null, null).toWaitStrategy();
        var delay = random.computeDelay(1, Duration.ZERO).toMillis();
        assertTrue(delay >= 0 && delay <= 1000);

        var incrementing =
                new WaitPolicy(WaitType.INCREMENTING, null, null, null, null, null, null, null).toWaitStrategy();
        assertEquals(Duration.ofMillis(200), incrementing.computeDelay(3, Duration.ZERO));

        var exponential =
                new WaitPolicy(WaitType.EXPONENTIAL, null, null, null, null, null, null, 3).toWaitStrategy();
        assertEquals(Duration.ofMillis(9), exponential.computeDelay(2, Duration.ZERO));

        var none = new WaitPolicy(null, null, null, null, null, null, null, null).toWaitStrategy();
        assertEquals(Duration.ZERO, none.computeDelay(5, Duration.ZERO));
    }

    @Test
    void testFixedWaitRequiresDelay() {
        var policy = new WaitPolicy(WaitType.FIXED, null, null, null, null, null, null, null);

        assertThrows(IllegalArgumentException.class, policy::toWaitStrategy);
        assertEquals(
                Duration.ofSeconds(2),
                WaitPolicy.ofFixed(Duration.ofSeconds(2)).toWaitStrategy().computeDelay(1, Duration.ZERO));
    }

    @Test
    void testLoadsFromFile(@TempDir Path directory) throws IOException {
        var file = directory.resolve("retry.json");
        Files.writeString(file, FULL_POLICY);

        var policy = RetryPolicies.load(file);

        assertEquals("inventory", policy.name());
    }

    @Test
    void testLoadMissingFileFails(@TempDir Path directory) {
        var exception = assertThrows(SerDesException.class, () -> RetryPolicies.load(directory.resolve("absent.json")));

        assertInstanceOf(IOException.class, exception.getCause());
    }

    @Test
    void testWritesPolicyAsJson() {
        var policy = new RetryPolicy(
                "orders",
                StopPolicy.ofAttempts(3),
                WaitPolicy.ofExponential(Duration.ofMillis(100), Duration.ofSeconds(5)),
                null,
                null,
                null);

        var json = RetryPolicies.toJson(policy);

        assertEquals(
                "{\"name\":\"orders\",\"stop\":{\"afterAttempt\":3},"
                        + "\"wait\":{\"type\":\"EXPONENTIAL\",\"max\":\"PT5S\",\"multiplier\":\"PT0.1S\"}}",
                json);
        assertEquals(policy, RetryPolicies.fromJson(json));
    }
}
