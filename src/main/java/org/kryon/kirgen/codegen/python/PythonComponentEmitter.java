package org.kryon.kirgen.codegen.python;

import org.kryon.kirgen.codegen.ComponentEmitter;
import org.kryon.kirgen.codegen.EmitMode;
import org.kryon.kirgen.codegen.EventHandlerResolver;
import org.kryon.kirgen.codegen.SourceWriter;
import org.kryon.kirgen.model.Component;
import org.kryon.kirgen.model.logic.LogicBlock;

/**
 * Emits components as Kryon Python DSL calls with keyword arguments
 * ({@code Column(padding=10, children=[...])}).
 */
public class PythonComponentEmitter extends ComponentEmitter {

    public PythonComponentEmitter(PythonLiteralConverter literals, EventHandlerResolver events, LogicBlock logic) {
        super(literals, events, logic);
    }

    /**
     * Name of the module-level function the engine emits for a resolved handler.
     */
    public static String handlerFunctionName(Component component, String eventType) {
        return "_on_" + eventType + "_" + component.id;
    }

    static String snakeCase(String camel) {
        StringBuilder sb = new StringBuilder(camel.length() + 4);
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                sb.append('_').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    protected String openLine(String constructor, EmitMode mode) {
        return switch (mode.getKind()) {
            case INLINE -> constructor + "(";
            case NAMED -> mode.getVariableName() + " = " + constructor + "(";
            case RETURN -> "return " + constructor + "(";
        };
    }

    @Override
    protected String closeLine() {
        return ")";
    }

    @Override
    protected String propertyLine(String key, String literal) {
        return snakeCase(key) + "=" + literal + ",";
    }

    @Override
    protected String forEachItemKey() {
        // "as" is a keyword
        return "as_";
    }

    @Override
    protected void emitEvent(Component component, String eventType, String source, SourceWriter out, int indent) {
        out.line(indent, "on_" + eventType + "=" + handlerFunctionName(component, eventType) + ",");
    }

    @Override
    protected void openChildren(SourceWriter out, int indent) {
        out.line(indent, "children=[");
    }

    @Override
    protected void closeChildren(SourceWriter out, int indent) {
        out.line(indent, "],");
    }

    @Override
    protected int childrenDepth() {
        return 1;
    }

    @Override
    protected void openRender(String itemName, SourceWriter out, int indent) {
        out.line(indent, "render=lambda " + itemName + ", " + itemName + "_index: [");
    }

    @Override
    protected void closeRender(SourceWriter out, int indent) {
        out.line(indent, "],");
    }

    @Override
    protected int renderDepth() {
        return 1;
    }
}
