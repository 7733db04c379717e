package org.kryon.kirgen.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Arena-owned component tree. The root lives at index 0; every other node is
 * reachable from it through {@link Component#children} indices.
 */
@JsonDeserialize(using = ComponentTreeDeserializer.class)
public class ComponentTree {
    private final List<Component> nodes = new ArrayList<>();

    public Component add(Component component, int parentIndex) {
        component.index = nodes.size();
        component.parent = parentIndex;
        nodes.add(component);
        if (parentIndex != Component.NO_PARENT) {
            nodes.get(parentIndex).children.add(component.index);
        }
        return component;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public Component root() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public Component get(int index) {
        return nodes.get(index);
    }

    public Component parentOf(Component component) {
        return component.parent == Component.NO_PARENT ? null : nodes.get(component.parent);
    }

    public List<Component> childrenOf(Component component) {
        List<Component> result = new ArrayList<>(component.children.size());
        for (int childIndex : component.children) {
            result.add(nodes.get(childIndex));
        }
        return result;
    }

    public List<Component> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Visits nodes depth-first in document order.
     */
    public void walk(Consumer<Component> visitor) {
        if (!nodes.isEmpty()) {
            walk(nodes.get(0), visitor);
        }
    }

    private void walk(Component component, Consumer<Component> visitor) {
        visitor.accept(component);
        for (int childIndex : component.children) {
            walk(nodes.get(childIndex), visitor);
        }
    }
}
