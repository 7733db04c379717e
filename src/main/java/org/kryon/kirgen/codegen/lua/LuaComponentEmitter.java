package org.kryon.kirgen.codegen.lua;

import org.kryon.kirgen.codegen.ComponentEmitter;
import org.kryon.kirgen.codegen.EmitMode;
import org.kryon.kirgen.codegen.EventHandlerResolver;
import org.kryon.kirgen.codegen.SourceWriter;
import org.kryon.kirgen.model.Component;
import org.kryon.kirgen.model.logic.LogicBlock;

/**
 * Emits components as Kryon Lua DSL table constructors ({@code UI.Column { ... }}).
 */
public class LuaComponentEmitter extends ComponentEmitter {

    public LuaComponentEmitter(LuaLiteralConverter literals, EventHandlerResolver events, LogicBlock logic) {
        super(literals, events, logic);
    }

    @Override
    protected String openLine(String constructor, EmitMode mode) {
        return switch (mode.getKind()) {
            case INLINE -> "UI." + constructor + " {";
            case NAMED -> "local " + mode.getVariableName() + " = UI." + constructor + " {";
            case RETURN -> "return UI." + constructor + " {";
        };
    }

    @Override
    protected String closeLine() {
        return "}";
    }

    @Override
    protected String propertyLine(String key, String literal) {
        return key + " = " + literal + ",";
    }

    @Override
    protected String forEachItemKey() {
        return "as";
    }

    @Override
    protected void emitEvent(Component component, String eventType, String source, SourceWriter out, int indent) {
        out.line(indent, eventKey(eventType) + " = function()");
        if (!source.isBlank()) {
            out.block(indent + 1, source, literals);
        }
        out.line(indent, "end,");
    }

    static String eventKey(String eventType) {
        return "on" + Character.toUpperCase(eventType.charAt(0)) + eventType.substring(1);
    }

    @Override
    protected void openChildren(SourceWriter out, int indent) {
        out.line(indent, "");
    }

    @Override
    protected void closeChildren(SourceWriter out, int indent) {
    }

    @Override
    protected int childrenDepth() {
        return 0;
    }

    @Override
    protected void openRender(String itemName, SourceWriter out, int indent) {
        out.line(indent, "");
        out.line(indent, "render = function(" + itemName + ", " + itemName + "_index)");
        out.line(indent + 1, "return");
    }

    @Override
    protected void closeRender(SourceWriter out, int indent) {
        out.line(indent, "end,");
    }

    @Override
    protected int renderDepth() {
        return 2;
    }
}
