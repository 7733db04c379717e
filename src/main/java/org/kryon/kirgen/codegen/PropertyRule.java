package org.kryon.kirgen.codegen;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Predicate;

/**
 * One emitted component property: where it is read from, the key it is
 * written under, the value shapes it accepts and its implicit default.
 */
public final class PropertyRule {

    public enum Shape {
        STRING,
        NUMBER,
        BOOLEAN,
        DIMENSION
    }

    /** Fixed emission order. */
    public static final List<PropertyRule> RULES = List.of(
            dimension("width"),
            dimension("height"),
            positive("padding"),
            positive("fontSize"),
            new PropertyRule("fontWeight", "fontWeight", Shape.NUMBER, v -> v.doubleValue() == 400),
            string("text"),
            string("backgroundColor"),
            string("background"),
            string("color"),
            positive("borderRadius"),
            positive("borderWidth"),
            string("borderColor"),
            positive("gap"),
            positive("margin"),
            new PropertyRule("opacity", "opacity", Shape.NUMBER, v -> v.doubleValue() >= 1.0),
            string("alignItems"),
            string("justifyContent"),
            string("textAlign"),
            string("placeholder"),
            string("value"),
            bool("checked"),
            bool("disabled"),
            new PropertyRule("visible", "visible", Shape.BOOLEAN, JsonNode::booleanValue),
            string("windowTitle"),
            dimension("minWidth"),
            dimension("minHeight"),
            dimension("maxWidth"),
            dimension("maxHeight"),
            new PropertyRule("flexDirection", "layoutDirection", Shape.STRING, v -> !"column".equals(v.textValue())));

    private final String sourceKey;
    private final String outputKey;
    private final Shape shape;
    private final Predicate<JsonNode> isDefault;

    private PropertyRule(String sourceKey, String outputKey, Shape shape, Predicate<JsonNode> isDefault) {
        this.sourceKey = sourceKey;
        this.outputKey = outputKey;
        this.shape = shape;
        this.isDefault = isDefault;
    }

    private static PropertyRule string(String key) {
        return new PropertyRule(key, key, Shape.STRING, v -> false);
    }

    private static PropertyRule bool(String key) {
        return new PropertyRule(key, key, Shape.BOOLEAN, v -> false);
    }

    private static PropertyRule positive(String key) {
        return new PropertyRule(key, key, Shape.NUMBER, v -> v.doubleValue() <= 0);
    }

    private static PropertyRule dimension(String key) {
        return new PropertyRule(key, key, Shape.DIMENSION, PropertyRule::isZeroDimension);
    }

    private static boolean isZeroDimension(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue() == 0;
        }
        String text = value.textValue();
        return "0px".equals(text) || "0.0px".equals(text);
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public String getOutputKey() {
        return outputKey;
    }

    /**
     * Whether {@code value} should be written at all: it has an accepted shape
     * and differs from the implicit default.
     */
    public boolean shouldEmit(JsonNode value) {
        if (value == null || !accepts(value)) {
            return false;
        }
        return !isDefault.test(value);
    }

    private boolean accepts(JsonNode value) {
        return switch (shape) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case DIMENSION -> value.isTextual() || value.isNumber();
        };
    }
}
