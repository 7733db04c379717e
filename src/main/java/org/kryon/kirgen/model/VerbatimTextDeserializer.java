package org.kryon.kirgen.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads preserved source text that KIR writers store in one of three shapes:
 * a plain string, an object with a {@code source} (or {@code name}) field, or
 * an array of either, joined with newlines.
 */
public class VerbatimTextDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        String text = toText(node);
        if (text == null) {
            throw MismatchedInputException.from(p, String.class,
                    "Expected source text, got " + node.getNodeType());
        }
        return text;
    }

    @Override
    public String getNullValue(DeserializationContext ctxt) {
        return null;
    }

    static String toText(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isObject()) {
            JsonNode source = node.has("source") ? node.get("source") : node.get("name");
            return source != null && source.isTextual() ? source.asText() : null;
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : node) {
                String part = toText(element);
                if (part == null) return null;
                parts.add(part);
            }
            return String.join("\n", parts);
        }
        return null;
    }
}
