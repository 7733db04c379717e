package org.kryon.kirgen.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a nested KIR component object into a {@link ComponentTree} arena.
 *
 * Properties are read from the flat top-level keys of each component and from
 * the nested {@code properties}, {@code style} and {@code layout} objects.
 */
public class ComponentTreeDeserializer extends JsonDeserializer<ComponentTree> {

    private static final Set<String> STRUCTURAL_KEYS = Set.of(
            "id", "type", "children", "custom_data", "properties", "style", "layout", "parent");

    private static final String[] NESTED_PROPERTY_GROUPS = {"properties", "style", "layout"};

    @Override
    public ComponentTree deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        ComponentTree tree = new ComponentTree();
        if (node == null || node.isNull()) {
            return tree;
        }
        addNode(p, tree, node, Component.NO_PARENT);
        return tree;
    }

    private void addNode(JsonParser p, ComponentTree tree, JsonNode node, int parentIndex) throws IOException {
        if (!node.isObject()) {
            throw MismatchedInputException.from(p, ComponentTree.class,
                    "Component must be a JSON object, got " + node.getNodeType());
        }

        Component component = new Component();
        component.id = readId(node.get("id"));
        JsonNode type = node.get("type");
        if (type != null && type.isTextual()) {
            component.type = type.asText();
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!STRUCTURAL_KEYS.contains(field.getKey())) {
                component.properties.put(field.getKey(), field.getValue());
            }
        }
        for (String group : NESTED_PROPERTY_GROUPS) {
            JsonNode nested = node.get(group);
            if (nested != null && nested.isObject()) {
                nested.fields().forEachRemaining(e -> component.properties.put(e.getKey(), e.getValue()));
            }
        }

        JsonNode customData = node.get("custom_data");
        if (customData != null && customData.isObject()) {
            customData.fields().forEachRemaining(e -> component.customData.put(e.getKey(), e.getValue()));
        }

        tree.add(component, parentIndex);

        JsonNode children = node.get("children");
        if (children == null || children.isNull()) {
            return;
        }
        if (!children.isArray()) {
            throw MismatchedInputException.from(p, ComponentTree.class,
                    "Component children must be a JSON array");
        }
        for (JsonNode child : children) {
            addNode(p, tree, child, component.index);
        }
    }

    private static int readId(JsonNode id) {
        if (id == null) return Component.NO_ID;
        if (id.canConvertToInt()) return id.intValue();
        if (id.isTextual()) {
            try {
                return Integer.parseInt(id.asText().trim());
            } catch (NumberFormatException e) {
                return Component.NO_ID;
            }
        }
        return Component.NO_ID;
    }
}
