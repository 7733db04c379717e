package org.kryon.kirgen.model.reactive;

import com.fasterxml.jackson.databind.JsonNode;

public class ReactiveVariable {
    public int id;
    public String name;
    public String type;
    public JsonNode initialValue;
    public String setterName;
    public String scope;

    public boolean isStringTyped() {
        return "string".equalsIgnoreCase(type);
    }
}
