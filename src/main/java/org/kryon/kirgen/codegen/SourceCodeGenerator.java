package org.kryon.kirgen.codegen;

import org.kryon.kirgen.KirgenConfig;
import org.kryon.kirgen.TargetLanguage;
import org.kryon.kirgen.model.AppWindow;
import org.kryon.kirgen.model.Component;
import org.kryon.kirgen.model.ComponentDefinition;
import org.kryon.kirgen.model.ComponentTree;
import org.kryon.kirgen.model.KirDocument;
import org.kryon.kirgen.model.logic.FunctionSource;
import org.kryon.kirgen.model.logic.LogicBlock;
import org.kryon.kirgen.model.logic.LogicFunction;
import org.kryon.kirgen.model.reactive.ReactiveVariable;
import org.kryon.kirgen.model.source.PreservedFunction;
import org.kryon.kirgen.model.source.RequireDeclaration;
import org.kryon.kirgen.model.source.SourceDeclarations;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Source-reconstruction engine shared by all targets.
 *
 * Preserved text always wins over reconstruction, from the most to the least
 * specific: the module's whole original source, the app export, preserved
 * functions, per-definition sources, and finally a structural walk of the
 * component tree. Sections are written in a fixed order: header, requires,
 * module-level declarations, reactive state, functions, component tree or
 * definitions, export.
 *
 * Generators are stateless and may be shared between threads.
 */
public abstract class SourceCodeGenerator implements CodeGenerator {

    protected final TargetLanguage target;
    protected final KirgenConfig config;
    protected final LiteralConverter literals;
    protected final EventHandlerResolver events;

    protected SourceCodeGenerator(TargetLanguage target, KirgenConfig config, LiteralConverter literals) {
        this.target = target;
        this.config = config;
        this.literals = literals;
        this.events = new EventHandlerResolver(target.getName());
    }

    @Override
    public TargetLanguage getTarget() {
        return target;
    }

    @Override
    public String generate(KirDocument document, String moduleId) {
        boolean preserve = document.isPreservableFor(target.getName());

        if (preserve && moduleId != null) {
            String original = document.sources.get(moduleId);
            if (original != null) {
                return original.isEmpty() || original.endsWith("\n") ? original : original + "\n";
            }
        }

        SourceDeclarations declarations = preserve ? document.sourceDeclarations : new SourceDeclarations();
        ComponentEmitter emitter = createEmitter(document.logicBlock);
        SourceWriter out = new SourceWriter(config.getIndentWidth());

        emitHeader(out);
        out.blankLine();
        if (declarations.requires.isEmpty()) {
            emitDefaultRequires(out);
        } else {
            for (RequireDeclaration require : declarations.requires) {
                if (require.module != null) {
                    out.line(0, requireLine(require));
                }
            }
        }

        emitVerbatimSection(out, declarations.moduleInit);
        emitVerbatimSection(out, declarations.moduleConstants);
        emitVerbatimSection(out, declarations.nonReactiveState);
        emitReactiveState(out, document, declarations);
        List<String> functionNames = emitFunctions(out, document, declarations);
        emitEventHandlerFunctions(out, document);
        emitVerbatimSection(out, declarations.initialization);
        emitVerbatimSection(out, declarations.conditionalBlocks);

        switch (ModuleKind.classify(document)) {
            case APP -> emitApp(out, document, declarations, emitter);
            case COMPONENT_DEFINITIONS -> emitDefinitions(out, document, declarations, emitter, preserve);
            case LIBRARY -> emitLibrary(out, document, functionNames);
        }
        return out.build();
    }

    private void emitVerbatimSection(SourceWriter out, String text) {
        if (text == null || text.isBlank()) return;
        out.blankLine();
        out.verbatim(text);
    }

    private void emitReactiveState(SourceWriter out, KirDocument document, SourceDeclarations declarations) {
        Optional<String> stateInit = declarations.stateInitExpression();
        if (stateInit.isPresent()) {
            out.blankLine();
            out.verbatim(stateInit.get());
            return;
        }

        List<ReactiveVariable> variables = new ArrayList<>();
        for (ReactiveVariable variable : document.reactiveManifest.variables) {
            if (isIdentifier(variable.name) && !config.isReservedStateName(variable.name)
                    && !isRuntimeName(variable.name)) {
                variables.add(variable);
            }
        }
        if (variables.isEmpty()) return;

        out.blankLine();
        out.line(0, comment("Reactive State"));
        for (ReactiveVariable variable : variables) {
            out.line(0, stateInitializer(variable.name, initialValueLiteral(variable)));
        }
    }

    /**
     * String-typed values are quoted unless already written as a quoted
     * literal; any other textual value is taken as an expression.
     */
    protected String initialValueLiteral(ReactiveVariable variable) {
        if (variable.initialValue == null || variable.initialValue.isNull()) {
            return literals.nullLiteral();
        }
        if (!variable.initialValue.isTextual()) {
            return literals.toLiteral(variable.initialValue);
        }
        String text = variable.initialValue.textValue();
        if (variable.isStringTyped()) {
            return isQuoted(text) ? text : literals.stringLiteral(text);
        }
        return text.isBlank() ? literals.nullLiteral() : text.strip();
    }

    private static boolean isQuoted(String text) {
        return text.length() >= 2
                && ((text.startsWith("\"") && text.endsWith("\"")) || (text.startsWith("'") && text.endsWith("'")));
    }

    /**
     * Preserved functions verbatim, otherwise logic-block functions that have a
     * target-language source and are not bound as event handlers.
     *
     * @return names of the functions written
     */
    private List<String> emitFunctions(SourceWriter out, KirDocument document, SourceDeclarations declarations) {
        List<String> names = new ArrayList<>();
        if (!declarations.functions.isEmpty()) {
            for (PreservedFunction function : declarations.functions) {
                if (function.source == null || function.source.isBlank()) continue;
                out.blankLine();
                out.verbatim(function.source);
                if (function.name != null) {
                    names.add(function.name);
                }
            }
            return names;
        }

        LogicBlock logic = document.logicBlock;
        Set<String> handlers = events.handlerNames(logic);
        for (LogicFunction function : logic.functions) {
            if (function.name == null || handlers.contains(function.name)) continue;
            Optional<FunctionSource> source = function.sourceFor(target.getName());
            if (source.isEmpty()) continue;
            out.blankLine();
            emitHelperFunction(out, function.name, source.get().source);
            names.add(function.name);
        }
        return names;
    }

    private void emitApp(SourceWriter out, KirDocument document, SourceDeclarations declarations,
                         ComponentEmitter emitter) {
        if (declarations.appExport != null && !declarations.appExport.isBlank()) {
            out.blankLine();
            out.verbatim(declarations.appExport);
            return;
        }

        out.blankLine();
        out.line(0, comment("UI Component Tree"));
        ComponentTree tree = document.root;
        emitter.emit(tree, tree.root(), EmitMode.named("root"), out, 0, "");
        out.blankLine();
        emitAppExport(out, document.app);
    }

    private void emitDefinitions(SourceWriter out, KirDocument document, SourceDeclarations declarations,
                                 ComponentEmitter emitter, boolean preserve) {
        List<String> exported = new ArrayList<>();
        for (ComponentDefinition definition : document.allComponentDefinitions()) {
            if (!isIdentifier(definition.name)) continue;
            exported.add(definition.name);

            // already written with the preserved functions
            if (declarations.hasFunction(definition.name)) continue;

            out.blankLine();
            if (preserve && definition.hasSource()) {
                out.verbatim(definition.source);
            } else {
                emitDefinitionFunction(out, definition.name, templateOf(definition), emitter);
            }
        }
        out.blankLine();
        emitExportMap(out, exported);
    }

    private void emitLibrary(SourceWriter out, KirDocument document, List<String> functionNames) {
        List<String> exported = new ArrayList<>();
        for (String name : document.exports.isEmpty() ? functionNames : document.exports) {
            if (name != null && !name.isBlank()) {
                exported.add(name);
            }
        }
        out.blankLine();
        emitExportMap(out, exported);
    }

    /**
     * A definition without a template reconstructs to an empty Container.
     */
    protected static ComponentTree templateOf(ComponentDefinition definition) {
        if (definition.hasTemplate()) {
            return definition.template;
        }
        ComponentTree empty = new ComponentTree();
        empty.add(new Component(), Component.NO_PARENT);
        return empty;
    }

    protected abstract ComponentEmitter createEmitter(LogicBlock logic);

    /**
     * Whether {@code name} can be declared as a module-level name in the target.
     */
    protected abstract boolean isIdentifier(String name);

    /**
     * Names the generated module binds for itself, beyond the configured
     * reserved state names.
     */
    protected boolean isRuntimeName(String name) {
        return false;
    }

    protected abstract String comment(String text);

    protected abstract void emitHeader(SourceWriter out);

    protected abstract void emitDefaultRequires(SourceWriter out);

    protected abstract String requireLine(RequireDeclaration require);

    protected abstract String stateInitializer(String name, String initialLiteral);

    protected abstract void emitHelperFunction(SourceWriter out, String name, String body);

    /**
     * Targets without inline anonymous functions declare event handlers here,
     * before the component tree that references them.
     */
    protected void emitEventHandlerFunctions(SourceWriter out, KirDocument document) {
    }

    protected abstract void emitAppExport(SourceWriter out, AppWindow window);

    protected abstract void emitDefinitionFunction(SourceWriter out, String name, ComponentTree template,
                                                   ComponentEmitter emitter);

    protected abstract void emitExportMap(SourceWriter out, List<String> names);
}
