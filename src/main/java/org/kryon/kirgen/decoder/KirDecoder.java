package org.kryon.kirgen.decoder;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.kryon.kirgen.model.KirDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes KIR JSON into a {@link KirDocument}. Absent optional sections decode
 * to empty values rather than errors.
 */
public class KirDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
            .setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP));

    /**
     * Bytes are read as UTF-8; invalid sequences are {@code MALFORMED} rather
     * than replaced.
     */
    public KirDocument decode(byte[] raw) throws KirDecodeException {
        // Remove BOM if present
        int offset = hasByteOrderMark(raw) ? 3 : 0;

        JsonNode tree;
        try {
            tree = MAPPER.readTree(raw, offset, raw.length - offset);
        } catch (IOException e) {
            throw malformedJson(e);
        }
        return bind(tree);
    }

    public KirDocument decode(String json) throws KirDecodeException {
        // Remove BOM if present
        if (json.startsWith("\uFEFF")) {
            json = json.substring(1);
        }

        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw malformedJson(e);
        }
        return bind(tree);
    }

    private static KirDocument bind(JsonNode tree) throws KirDecodeException {
        if (tree == null || tree.isMissingNode() || !tree.isObject()) {
            String found = tree == null || tree.isMissingNode() ? "empty input" : tree.getNodeType().toString();
            throw new KirDecodeException(KirDecodeException.Reason.MISSING_ROOT,
                    "KIR document must be a JSON object, got " + found);
        }

        try {
            return MAPPER.treeToValue(tree, KirDocument.class);
        } catch (JsonProcessingException e) {
            throw new KirDecodeException(KirDecodeException.Reason.MALFORMED,
                    "Malformed KIR section: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new KirDecodeException(KirDecodeException.Reason.MALFORMED,
                    "Malformed KIR section: " + e.getMessage(), e);
        }
    }

    private static KirDecodeException malformedJson(IOException e) {
        String message = e instanceof JsonProcessingException
                ? ((JsonProcessingException) e).getOriginalMessage()
                : e.getMessage();
        return new KirDecodeException(KirDecodeException.Reason.MALFORMED, "Invalid KIR JSON: " + message, e);
    }

    private static boolean hasByteOrderMark(byte[] raw) {
        return raw.length >= 3 && (raw[0] & 0xFF) == 0xEF && (raw[1] & 0xFF) == 0xBB && (raw[2] & 0xFF) == 0xBF;
    }

    public KirDocument decode(Path kirFile) throws IOException, KirDecodeException {
        return decode(Files.readAllBytes(kirFile));
    }
}
