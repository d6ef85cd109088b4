package com.doctext.text;

import java.io.IOException;
import java.util.Optional;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON validation and parsing that never throws. Malformed input is an
 * expected outcome and comes back as {@code false} or an empty Optional.
 */
public final class JsonGate {

    // exactly one JSON value; trailing content makes the document invalid
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private JsonGate() {
    }

    public static boolean isValidJson(String text) {
        return parse(text).isPresent();
    }

    public static Optional<JsonNode> parse(String text) {
        if (text == null) return Optional.empty();
        try {
            return present(MAPPER.readTree(text));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts strings, other char sequences and UTF-8 byte arrays; anything
     * else yields an empty Optional.
     */
    public static Optional<JsonNode> parseValue(Object raw) {
        if (raw instanceof CharSequence chars) {
            return parse(chars.toString());
        }
        if (raw instanceof byte[] bytes) {
            try {
                return present(MAPPER.readTree(bytes));
            } catch (IOException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> present(JsonNode node) {
        // blank input parses to a missing node rather than failing
        if (node == null || node.isMissingNode()) return Optional.empty();
        return Optional.of(node);
    }
}
