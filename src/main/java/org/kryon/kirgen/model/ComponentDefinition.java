package org.kryon.kirgen.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.List;

/**
 * A reusable component declared by a module, either with its verbatim
 * {@link #source} or with a {@link #template} to reconstruct it from.
 */
public class ComponentDefinition {
    public String name;
    public List<PropDefinition> props = new ArrayList<>();

    @JsonAlias("template_component")
    public ComponentTree template;

    @JsonAlias("preserved_source")
    public String source;

    public boolean hasSource() {
        return source != null && !source.isBlank();
    }

    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }
}
