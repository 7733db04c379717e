package org.kryon.kirgen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public class PropDefinition {
    public String name;
    public String type;

    @JsonProperty("default")
    @JsonAlias("default_value")
    public JsonNode defaultValue;
}
