package org.kryon.kirgen.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import org.kryon.kirgen.model.Component;
import org.kryon.kirgen.model.ComponentTree;
import org.kryon.kirgen.model.logic.LogicBlock;

import java.util.List;
import java.util.Optional;

/**
 * Recursive emitter for a component subtree as nested constructor
 * expressions. Targets implement the syntax hooks; the walk, property
 * filtering and ForEach handling live here.
 */
public abstract class ComponentEmitter {

    public static final String FOR_EACH = "ForEach";
    public static final String DEFAULT_ITEM_NAME = "item";
    public static final String DEFAULT_INDEX_NAME = "index";

    /** DSL constructors; a KIR type maps to the constructor of the same name. */
    public static final List<String> DSL_TYPES = List.of(
            "Container", "Row", "Column", "Center",
            "Text", "Button", "Checkbox", "Input", "Dropdown", "Textarea",
            "Image", "Canvas", "Markdown", "Modal",
            "TabGroup", "TabBar", "Tab", "TabContent", "TabPanel",
            FOR_EACH);

    protected final LiteralConverter literals;
    protected final EventHandlerResolver events;
    protected final LogicBlock logic;

    protected ComponentEmitter(LiteralConverter literals, EventHandlerResolver events, LogicBlock logic) {
        this.literals = literals;
        this.events = events;
        this.logic = logic;
    }

    /**
     * Unlisted types degrade to a plain Container.
     */
    public static String constructorName(String type) {
        return DSL_TYPES.contains(type) ? type : "Container";
    }

    /**
     * Writes {@code component} and its subtree.
     *
     * @param closingSuffix appended to the closing line, {@code ","} between siblings
     */
    public void emit(ComponentTree tree, Component component, EmitMode mode,
                     SourceWriter out, int indent, String closingSuffix) {
        String constructor = constructorName(component.type);
        boolean forEach = FOR_EACH.equals(constructor);

        out.line(indent, openLine(constructor, mode));
        int inner = indent + 1;

        for (PropertyRule rule : PropertyRule.RULES) {
            JsonNode value = component.property(rule.getSourceKey());
            if (rule.shouldEmit(value)) {
                out.line(inner, propertyLine(rule.getOutputKey(), literals.toLiteral(value)));
            }
        }

        for (String eventType : EventHandlerResolver.EVENT_TYPES) {
            Optional<String> handler = events.resolve(logic, component.id, eventType);
            handler.ifPresent(source -> emitEvent(component, eventType, source, out, inner));
        }

        if (forEach) {
            emitForEachProperties(component, out, inner);
        }

        List<Component> children = tree.childrenOf(component);
        if (!children.isEmpty()) {
            if (forEach) {
                String itemName = itemName(component);
                openRender(itemName, out, inner);
                emitChildren(tree, children, out, inner + renderDepth());
                closeRender(out, inner);
            } else {
                openChildren(out, inner);
                emitChildren(tree, children, out, inner + childrenDepth());
                closeChildren(out, inner);
            }
        }

        out.line(indent, closeLine() + closingSuffix);
    }

    private void emitChildren(ComponentTree tree, List<Component> children, SourceWriter out, int indent) {
        for (int i = 0; i < children.size(); i++) {
            String separator = i < children.size() - 1 ? "," : "";
            emit(tree, children.get(i), EmitMode.inline(), out, indent, separator);
        }
    }

    private void emitForEachProperties(Component component, SourceWriter out, int indent) {
        String itemName = component.customString("each_item_name");
        if (itemName != null) {
            out.line(indent, propertyLine(forEachItemKey(), literals.stringLiteral(itemName)));
        }
        String indexName = component.customString("each_index_name");
        if (indexName != null && !DEFAULT_INDEX_NAME.equals(indexName)) {
            out.line(indent, propertyLine("index", literals.stringLiteral(indexName)));
        }
        JsonNode source = component.customData.get("each_source");
        if (source != null) {
            out.line(indent, propertyLine("each", literals.toLiteral(source)));
        }
    }

    protected static String itemName(Component component) {
        String itemName = component.customString("each_item_name");
        return itemName != null ? itemName : DEFAULT_ITEM_NAME;
    }

    protected abstract String openLine(String constructor, EmitMode mode);

    protected abstract String closeLine();

    protected abstract String propertyLine(String key, String literal);

    protected abstract String forEachItemKey();

    protected abstract void emitEvent(Component component, String eventType, String source,
                                      SourceWriter out, int indent);

    protected abstract void openChildren(SourceWriter out, int indent);

    protected abstract void closeChildren(SourceWriter out, int indent);

    /** Extra indentation of children relative to the component body. */
    protected abstract int childrenDepth();

    protected abstract void openRender(String itemName, SourceWriter out, int indent);

    protected abstract void closeRender(SourceWriter out, int indent);

    /** Extra indentation of render-function children relative to the component body. */
    protected abstract int renderDepth();
}
