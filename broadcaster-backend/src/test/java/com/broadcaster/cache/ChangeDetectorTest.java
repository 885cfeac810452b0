package com.broadcaster.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector();
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Absent on either side is a change, absent on both is not")
    void absence() throws Exception {
        assertFalse(detector.changed(null, null));
        assertTrue(detector.changed(null, json("[]")));
        assertTrue(detector.changed(json("[]"), null));
    }

    @Test
    @DisplayName("Reordered object keys are not a change, at any depth")
    void keyOrderIgnored() throws Exception {
        JsonNode a = json("{\"data\":{\"equity\":\"10\",\"marginRatio\":\"0.1\"},\"status\":\"OK\"}");
        JsonNode b = json("{\"status\":\"OK\",\"data\":{\"marginRatio\":\"0.1\",\"equity\":\"10\"}}");

        assertFalse(detector.changed(a, b));
        assertEquals(detector.canonical(a), detector.canonical(b));
    }

    @Test
    @DisplayName("Array order still matters")
    void arrayOrderMatters() throws Exception {
        assertTrue(detector.changed(json("[1,2]"), json("[2,1]")));
    }

    @Test
    @DisplayName("Any value difference is a change")
    void valueChange() throws Exception {
        assertTrue(detector.changed(json("{\"size\":\"1.0\"}"), json("{\"size\":\"1.5\"}")));
        assertTrue(detector.changed(json("{\"size\":\"1.0\"}"), json("{\"size\":\"1.0\",\"extra\":null}")));
    }
}
