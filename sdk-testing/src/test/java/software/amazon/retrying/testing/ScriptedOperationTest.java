// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.testing;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ScriptedOperationTest {

    @Test
    void playsScriptAndRepeatsLastStep() throws Exception {
        var operation = ScriptedOperation.<String>builder()
                .thenThrow(() -> new IOException("down"))
                .thenReturn(null)
                .thenReturn("ready")
                .build();

        assertThrows(IOException.class, operation::call);
        assertNull(operation.call());
        assertEquals("ready", operation.call());
        assertEquals("ready", operation.call());
        assertEquals(4, operation.getInvocations());
    }

    @Test
    void failingTimesThenReturns() throws Exception {
        var operation = ScriptedOperation.failingTimes(2, () -> new IllegalStateException("x"), 42);

        assertThrows(IllegalStateException.class, operation::call);
        assertThrows(IllegalStateException.class, operation::call);
        assertEquals(42, operation.call());
    }

    @Test
    void eachFailureIsAFreshException() {
        var operation = ScriptedOperation.<String>alwaysFailing(() -> new IOException("again"));

        var first = assertThrows(IOException.class, operation::call);
        var second = assertThrows(IOException.class, operation::call);

        assertNotSame(first, second);
    }

    @Test
    void takingAdvancesClockPerCall() throws Exception {
        var clock = new FakeClock();
        var operation = ScriptedOperation.<String>builder()
                .thenReturn("ok")
                .taking(clock, Duration.ofMillis(300))
                .build();

        operation.call();
        operation.call();

        assertEquals(600, clock.millis());
    }

    @Test
    void emptyScriptIsRejected() {
        assertThrows(IllegalStateException.class, () -> ScriptedOperation.<String>builder().build());
    }
}
