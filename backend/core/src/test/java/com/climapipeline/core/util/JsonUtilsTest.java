package com.climapipeline.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilsTest {
    @Test
    void objectMapperIsSharedAndLenientOnUnknownFields() {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertSame(mapper, JsonUtils.objectMapper());
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void writesJavaTimeAsIsoStringsAndSkipsNulls() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        Payload payload = new Payload("run", null, Instant.parse("2024-05-01T00:00:00Z"), LocalDate.of(2024, 5, 1));

        var tree = mapper.readTree(mapper.writeValueAsString(payload));

        assertEquals("2024-05-01T00:00:00Z", tree.get("at").asText());
        assertEquals("2024-05-01", tree.get("day").asText());
        assertFalse(tree.has("note"));

        Payload parsed = mapper.readValue(
                "{\"name\":\"run\",\"at\":\"2024-05-01T00:00:00Z\",\"day\":\"2024-05-01\",\"extra\":true}",
                Payload.class
        );
        assertEquals(payload, parsed);
        assertNull(parsed.note());
    }

    private record Payload(String name, String note, Instant at, LocalDate day) {
    }
}
