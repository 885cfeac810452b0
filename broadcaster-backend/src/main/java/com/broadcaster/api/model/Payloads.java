package com.broadcaster.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for reading the loosely shaped JSON the exchange returns.
 * Numbers arrive either as JSON numbers or as decimal strings.
 */
public final class Payloads {

    private Payloads() {
    }

    /**
     * Returns the {@code data} member when the payload is an envelope, otherwise the payload itself.
     */
    public static JsonNode unwrapData(JsonNode payload) {
        if (payload != null && payload.isObject() && payload.has("data")) {
            return payload.get("data");
        }
        return payload;
    }

    /**
     * Records of a list payload. Tolerates a {@code data} envelope; a single object counts as one record.
     */
    public static List<JsonNode> records(JsonNode payload) {
        JsonNode body = unwrapData(payload);
        List<JsonNode> result = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode()) {
            return result;
        }
        if (body.isArray()) {
            body.forEach(result::add);
        } else if (body.isObject()) {
            result.add(body);
        }
        return result;
    }

    /**
     * First field among {@code names} that holds a parseable number.
     */
    public static Optional<Double> decimal(JsonNode node, String... names) {
        if (node == null) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return Optional.of(value.asDouble());
            }
            if (value.isTextual() && isNumeric(value.asText())) {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            }
        }
        return Optional.empty();
    }

    private static boolean isNumeric(String raw) {
        String trimmed = raw.trim();
        return !trimmed.isEmpty() && trimmed.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    }

    public static double decimalOrZero(JsonNode node, String... names) {
        return decimal(node, names).orElse(0.0);
    }

    /**
     * First non-blank textual field among {@code names}; numeric ids are rendered as text.
     */
    public static Optional<String> text(JsonNode node, String... names) {
        if (node == null) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    public static Optional<Long> epochMillis(JsonNode node, String... names) {
        return decimal(node, names).map(Double::longValue);
    }
}
