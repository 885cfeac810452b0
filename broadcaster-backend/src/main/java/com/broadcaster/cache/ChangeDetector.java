package com.broadcaster.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural comparison of cached and freshly fetched payloads.
 *
 * Both sides are rendered to canonical JSON with object keys sorted, so
 * {@code {"a":1,"b":2}} and {@code {"b":2,"a":1}} compare equal.
 */
public final class ChangeDetector {
    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private final ObjectMapper canonicalMapper = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /**
     * @return true when exactly one side is absent, or when the canonical forms differ
     */
    public boolean changed(JsonNode previous, JsonNode fresh) {
        if (previous == null && fresh == null) {
            return false;
        }
        if (previous == null || fresh == null) {
            return true;
        }
        return !canonical(previous).equals(canonical(fresh));
    }

    String canonical(JsonNode node) {
        try {
            Object plain = canonicalMapper.treeToValue(node, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            // A tree Jackson produced itself always converts; fall back to its own rendering.
            logger.debug("Canonical rendering failed, using raw tree: {}", e.getMessage());
            return node.toString();
        }
    }
}
