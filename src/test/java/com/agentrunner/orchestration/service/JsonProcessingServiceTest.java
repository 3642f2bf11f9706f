package com.agentrunner.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    @Test
    void testReadTree() {
        JsonNode node = service.readTree("{\"name\":\"John\"}");
        assertNotNull(node);
        assertEquals("John", node.get("name").asText());
    }

    @Test
    void testReadTreeInvalidOrBlank() {
        assertNull(service.readTree("{invalid-json}"));
        assertNull(service.readTree(""));
        assertNull(service.readTree(null));
    }

    @Test
    void testReadMap() {
        Map<String, Object> map = service.readMap("test", "{\"status\":\"ok\",\"count\":2}");
        assertEquals("ok", map.get("status"));
        assertEquals(2, map.get("count"));
    }

    @Test
    void testReadMapNonObjectReturnsEmpty() {
        assertTrue(service.readMap("test", "[1,2]").isEmpty());
        assertTrue(service.readMap("test", "not json").isEmpty());
        assertTrue(service.readMap("test", null).isEmpty());
    }

    @Test
    void testToJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "Alice");
        data.put("age", 20);
        assertEquals("{\"name\":\"Alice\",\"age\":20}", service.toJson(data));
    }

    @Test
    void testTruncate() {
        assertEquals("abc", service.truncate("abcdef", 3));
        assertEquals("abc", service.truncate("abc", 10));
        assertEquals("", service.truncate(null, 3));
    }

    @Test
    void testSnippet() {
        assertEquals("line one line two", service.snippet("line one\nline two", 100));
        assertEquals("abc...", service.snippet("abcdef", 3));
    }
}
