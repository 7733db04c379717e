package org.kryon.kirgen.codegen.lua;

import org.kryon.kirgen.KirgenConfig;
import org.kryon.kirgen.TargetLanguage;
import org.kryon.kirgen.codegen.ComponentEmitter;
import org.kryon.kirgen.codegen.EmitMode;
import org.kryon.kirgen.codegen.SourceCodeGenerator;
import org.kryon.kirgen.codegen.SourceWriter;
import org.kryon.kirgen.model.AppWindow;
import org.kryon.kirgen.model.ComponentTree;
import org.kryon.kirgen.model.logic.LogicBlock;
import org.kryon.kirgen.model.source.RequireDeclaration;

import java.util.List;

/**
 * Generates Kryon Lua DSL modules from KIR.
 */
public class LuaCodeGenerator extends SourceCodeGenerator {

    private final LuaLiteralConverter luaLiterals;

    public LuaCodeGenerator(KirgenConfig config) {
        this(config, new LuaLiteralConverter());
    }

    private LuaCodeGenerator(KirgenConfig config, LuaLiteralConverter literals) {
        super(TargetLanguage.LUA, config, literals);
        this.luaLiterals = literals;
    }

    @Override
    protected ComponentEmitter createEmitter(LogicBlock logic) {
        return new LuaComponentEmitter(luaLiterals, events, logic);
    }

    @Override
    protected boolean isIdentifier(String name) {
        return LuaLiteralConverter.isIdentifier(name);
    }

    @Override
    protected String comment(String text) {
        return "-- " + text;
    }

    @Override
    protected void emitHeader(SourceWriter out) {
        out.line(0, comment("Generated from .kir by Kryon Code Generator"));
        out.line(0, comment("Do not edit manually - regenerate from source"));
    }

    @Override
    protected void emitDefaultRequires(SourceWriter out) {
        out.line(0, "local Reactive = require(\"kryon.reactive\")");
        out.line(0, "local UI = require(\"kryon.dsl\")");
    }

    @Override
    protected String requireLine(RequireDeclaration require) {
        String call = "require(" + luaLiterals.stringLiteral(require.module) + ")";
        if (require.variable == null || require.variable.isBlank()) {
            return call;
        }
        return "local " + require.variable + " = " + call;
    }

    @Override
    protected String stateInitializer(String name, String initialLiteral) {
        return "local " + name + " = Reactive.state(" + initialLiteral + ")";
    }

    @Override
    protected void emitHelperFunction(SourceWriter out, String name, String body) {
        out.line(0, "local function " + name + "()");
        if (!body.isBlank()) {
            out.block(1, body, luaLiterals);
        }
        out.line(0, "end");
    }

    @Override
    protected void emitAppExport(SourceWriter out, AppWindow window) {
        if (window == null || !window.hasMetadata()) {
            out.line(0, "return root");
            return;
        }
        out.line(0, "return {");
        out.line(1, "root = root,");
        out.line(1, "window = {");
        if (window.windowTitle != null) {
            out.line(2, "title = " + luaLiterals.stringLiteral(window.windowTitle) + ",");
        }
        if (window.windowWidth != null) {
            out.line(2, "width = " + window.windowWidth + ",");
        }
        if (window.windowHeight != null) {
            out.line(2, "height = " + window.windowHeight + ",");
        }
        out.line(1, "},");
        out.line(0, "}");
    }

    @Override
    protected void emitDefinitionFunction(SourceWriter out, String name, ComponentTree template,
                                          ComponentEmitter emitter) {
        out.line(0, "local function " + name + "(props)");
        emitter.emit(template, template.root(), EmitMode.returned(), out, 1, "");
        out.line(0, "end");
    }

    /**
     * Names that cannot be referenced as Lua locals are left out of the map.
     */
    @Override
    protected void emitExportMap(SourceWriter out, List<String> names) {
        List<String> exportable = names.stream().filter(LuaLiteralConverter::isIdentifier).toList();
        if (exportable.isEmpty()) {
            out.line(0, "return {}");
            return;
        }
        out.line(0, "return {");
        for (String name : exportable) {
            out.line(1, name + " = " + name + ",");
        }
        out.line(0, "}");
    }
}
