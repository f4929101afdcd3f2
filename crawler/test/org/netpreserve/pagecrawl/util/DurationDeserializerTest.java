package org.netpreserve.pagecrawl.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationDeserializerTest {
    record Holder(@JsonDeserialize(using = DurationDeserializer.class) Duration value) {
    }

    @Test
    void testParse() {
        assertEquals(Duration.ofMillis(500), DurationDeserializer.parse("500ms"));
        assertEquals(Duration.ofMillis(750), DurationDeserializer.parse("750"));
        assertEquals(Duration.ofSeconds(30), DurationDeserializer.parse("30s"));
        assertEquals(Duration.ofMillis(1500), DurationDeserializer.parse("1.5s"));
        assertEquals(Duration.ofMinutes(2), DurationDeserializer.parse("2m"));
        assertEquals(Duration.ofHours(1), DurationDeserializer.parse("1h"));
        assertEquals(Duration.ofSeconds(30), DurationDeserializer.parse("PT30S"));
    }

    @Test
    void testDeserialize() throws Exception {
        var mapper = new ObjectMapper();
        assertEquals(Duration.ofMillis(200), mapper.readValue("{\"value\": 200}", Holder.class).value());
        assertEquals(Duration.ofSeconds(10), mapper.readValue("{\"value\": \"10s\"}", Holder.class).value());
        assertThrows(InvalidFormatException.class, () -> mapper.readValue("{\"value\": \"soon\"}", Holder.class));
    }
}
