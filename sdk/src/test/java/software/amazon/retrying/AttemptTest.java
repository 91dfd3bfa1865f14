// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import software.amazon.retrying.exception.RetryException;

class AttemptTest {

    @Test
    void successHoldsResult() {
        var attempt = Attempt.success("value", 2);

        assertFalse(attempt.hasException());
        assertEquals("value", attempt.getResult());
        assertNull(attempt.getException());
        assertEquals(2, attempt.getAttemptNumber());
        assertEquals("value", attempt.get());
        assertEquals("value", attempt.get(true));
    }

    @Test
    void successMayHoldNull() {
        var attempt = Attempt.success(null, 1);

        assertFalse(attempt.hasException());
        assertNull(attempt.get());
    }

    @Test
    void failureRethrowsOriginalCheckedException() {
        var error = new IOException("disk gone");
        Attempt<String> attempt = Attempt.failure(error, 3);

        var thrown = assertThrows(IOException.class, attempt::get);

        assertSame(error, thrown);
    }

    @Test
    void failureWrappedThrowsRetryException() {
        var error = new IllegalStateException("boom");
        Attempt<String> attempt = Attempt.failure(error, 3);

        var thrown = assertThrows(RetryException.class, () -> attempt.get(true));

        assertSame(attempt, thrown.getLastAttempt());
        assertSame(error, thrown.getCause());
        assertEquals(3, thrown.getAttemptNumber());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Attempt.success("x", 0));
        assertThrows(IllegalArgumentException.class, () -> Attempt.failure(null, 1));
    }

    @Test
    void toStringDescribesOutcome() {
        assertEquals("Attempts: 1, Value: 42", Attempt.success(42, 1).toString());
        assertEquals(
                "Attempts: 2, Error: java.lang.IllegalStateException: boom",
                Attempt.failure(new IllegalStateException("boom"), 2).toString());
    }

    @Test
    void equalityCoversAllFields() {
        assertEquals(Attempt.success("a", 1), Attempt.success("a", 1));
        assertEquals(Attempt.success("a", 1).hashCode(), Attempt.success("a", 1).hashCode());
        assertNotEquals(Attempt.success("a", 1), Attempt.success("a", 2));
        assertNotEquals(Attempt.success("a", 1), Attempt.success("b", 1));
    }
}
