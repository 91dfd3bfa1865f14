// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.serde;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import software.amazon.retrying.exception.SerDesException;

class JacksonSerDesTest {

    record Settings(String name, Duration timeout) {}

    private final SerDes serDes = new JacksonSerDes();

    @Test
    void testWritesDurationsAsIso8601() {
        var json = serDes.serialize(new Settings("db", Duration.ofMillis(1500)));

        assertEquals("{\"name\":\"db\",\"timeout\":\"PT1.5S\"}", json);
    }

    @Test
    void testOmitsNullProperties() {
        assertEquals("{\"name\":\"db\"}", serDes.serialize(new Settings("db", null)));
    }

    @Test
    void testReadsIso8601AndNumericDurations() {
        assertEquals(
                Duration.ofMillis(250),
                serDes.deserialize("{\"timeout\":\"PT0.25S\"}", Settings.class).timeout());
        assertEquals(
                Duration.ofSeconds(30), serDes.deserialize("{\"timeout\":30}", Settings.class).timeout());
    }

    @Test
    void testUnknownPropertyFails() {
        var exception = assertThrows(
                SerDesException.class, () -> serDes.deserialize("{\"nmae\":\"typo\"}", Settings.class));

        assertTrue(exception.getMessage().contains(Settings.class.getName()));
        assertNotNull(exception.getCause());
    }

    @Test
    void testMalformedJsonFails() {
        assertThrows(SerDesException.class, () -> serDes.deserialize("{not json", Settings.class));
    }

    @Test
    void testNullPassesThrough() {
        assertNull(serDes.serialize(null));
        assertNull(serDes.deserialize(null, Settings.class));
    }
}
