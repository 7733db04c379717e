package org.kryon.kirgen.codegen.python;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.kryon.kirgen.KirgenConfig;
import org.kryon.kirgen.TargetLanguage;
import org.kryon.kirgen.codegen.ComponentEmitter;
import org.kryon.kirgen.codegen.EmitMode;
import org.kryon.kirgen.codegen.EventHandlerResolver;
import org.kryon.kirgen.codegen.SourceCodeGenerator;
import org.kryon.kirgen.codegen.SourceWriter;
import org.kryon.kirgen.model.AppWindow;
import org.kryon.kirgen.model.Component;
import org.kryon.kirgen.model.ComponentDefinition;
import org.kryon.kirgen.model.ComponentTree;
import org.kryon.kirgen.model.KirDocument;
import org.kryon.kirgen.model.logic.LogicBlock;
import org.kryon.kirgen.model.source.RequireDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates Kryon Python DSL modules from KIR.
 *
 * Python lambdas cannot hold statements, so resolved event handlers become
 * module-level functions declared ahead of the component tree.
 */
public class PythonCodeGenerator extends SourceCodeGenerator {

    private static final int IMPORTS_PER_LINE = 6;

    private final PythonLiteralConverter pythonLiterals;

    public PythonCodeGenerator(KirgenConfig config) {
        this(config, new PythonLiteralConverter());
    }

    private PythonCodeGenerator(KirgenConfig config, PythonLiteralConverter literals) {
        super(TargetLanguage.PYTHON, config, literals);
        this.pythonLiterals = literals;
    }

    @Override
    protected ComponentEmitter createEmitter(LogicBlock logic) {
        return new PythonComponentEmitter(pythonLiterals, events, logic);
    }

    @Override
    protected boolean isIdentifier(String name) {
        return PythonLiteralConverter.isIdentifier(name);
    }

    /**
     * The imported {@code state} factory and DSL constructors, and the
     * exported {@code window}.
     */
    @Override
    protected boolean isRuntimeName(String name) {
        return "state".equals(name) || "window".equals(name) || ComponentEmitter.DSL_TYPES.contains(name);
    }

    @Override
    protected String comment(String text) {
        return "# " + text;
    }

    @Override
    protected void emitHeader(SourceWriter out) {
        out.line(0, comment("Generated from .kir by Kryon Code Generator"));
        out.line(0, comment("Do not edit manually - regenerate from source"));
    }

    @Override
    protected void emitDefaultRequires(SourceWriter out) {
        List<String> types = ComponentEmitter.DSL_TYPES;
        out.line(0, "from kryon.dsl import (");
        for (int i = 0; i < types.size(); i += IMPORTS_PER_LINE) {
            List<String> group = types.subList(i, Math.min(i + IMPORTS_PER_LINE, types.size()));
            out.line(1, String.join(", ", group) + ",");
        }
        out.line(0, ")");
        out.line(0, "from kryon.reactive import state");
    }

    @Override
    protected String requireLine(RequireDeclaration require) {
        if (require.variable == null || require.variable.isBlank() || require.variable.equals(require.module)) {
            return "import " + require.module;
        }
        return "import " + require.module + " as " + require.variable;
    }

    @Override
    protected String stateInitializer(String name, String initialLiteral) {
        return name + " = state(" + initialLiteral + ")";
    }

    @Override
    protected void emitHelperFunction(SourceWriter out, String name, String body) {
        out.line(0, "def " + name + "():");
        if (body.isBlank()) {
            out.line(1, "pass");
        } else {
            out.block(1, body, pythonLiterals);
        }
    }

    @Override
    protected void emitEventHandlerFunctions(SourceWriter out, KirDocument document) {
        List<ComponentTree> trees = new ArrayList<>();
        if (document.hasRoot()) {
            trees.add(document.root);
        } else {
            for (ComponentDefinition definition : document.allComponentDefinitions()) {
                if (definition.hasTemplate()) {
                    trees.add(definition.template);
                }
            }
        }

        Map<String, String> handlers = new LinkedHashMap<>();
        for (ComponentTree tree : trees) {
            tree.walk(component -> collectHandlers(document.logicBlock, component, handlers));
        }
        if (handlers.isEmpty()) return;

        out.blankLine();
        out.line(0, comment("Event Handlers"));
        for (Map.Entry<String, String> handler : handlers.entrySet()) {
            out.blankLine();
            emitHelperFunction(out, handler.getKey(), handler.getValue());
        }
    }

    private void collectHandlers(LogicBlock logic, Component component, Map<String, String> handlers) {
        for (String eventType : EventHandlerResolver.EVENT_TYPES) {
            Optional<String> source = events.resolve(logic, component.id, eventType);
            source.ifPresent(s -> handlers.putIfAbsent(
                    PythonComponentEmitter.handlerFunctionName(component, eventType), s));
        }
    }

    @Override
    protected void emitAppExport(SourceWriter out, AppWindow window) {
        ArrayNode exported = JsonNodeFactory.instance.arrayNode().add("root");
        if (window != null && window.hasMetadata()) {
            ObjectNode metadata = JsonNodeFactory.instance.objectNode();
            if (window.windowTitle != null) metadata.put("title", window.windowTitle);
            if (window.windowWidth != null) metadata.put("width", window.windowWidth);
            if (window.windowHeight != null) metadata.put("height", window.windowHeight);
            out.line(0, "window = " + pythonLiterals.toLiteral(metadata));
            exported.add("window");
        }
        out.line(0, "__all__ = " + pythonLiterals.toLiteral(exported));
    }

    @Override
    protected void emitDefinitionFunction(SourceWriter out, String name, ComponentTree template,
                                          ComponentEmitter emitter) {
        out.line(0, "def " + name + "(props=None):");
        emitter.emit(template, template.root(), EmitMode.returned(), out, 1, "");
    }

    @Override
    protected void emitExportMap(SourceWriter out, List<String> names) {
        ArrayNode exported = JsonNodeFactory.instance.arrayNode();
        names.stream().filter(PythonLiteralConverter::isIdentifier).forEach(exported::add);
        out.line(0, "__all__ = " + pythonLiterals.toLiteral(exported));
    }
}
