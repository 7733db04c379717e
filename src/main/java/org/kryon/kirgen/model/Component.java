package org.kryon.kirgen.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a {@link ComponentTree}. Links to the parent and children are
 * indices into the owning tree, never object references.
 */
public class Component {
    public static final int NO_ID = -1;
    public static final int NO_PARENT = -1;

    public int id = NO_ID;
    public String type = "Container";
    public Map<String, JsonNode> properties = new LinkedHashMap<>();
    public Map<String, JsonNode> customData = new LinkedHashMap<>();

    public int index;
    public int parent = NO_PARENT;
    public List<Integer> children = new ArrayList<>();

    public JsonNode property(String key) {
        return properties.get(key);
    }

    public String customString(String key) {
        JsonNode value = customData.get(key);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
