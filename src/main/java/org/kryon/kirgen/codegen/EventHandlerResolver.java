package org.kryon.kirgen.codegen;

import org.kryon.kirgen.model.logic.EventBinding;
import org.kryon.kirgen.model.logic.FunctionSource;
import org.kryon.kirgen.model.logic.LogicBlock;
import org.kryon.kirgen.model.logic.LogicFunction;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps (component id, event type) to handler source text for one target language.
 */
public class EventHandlerResolver {

    public static final List<String> EVENT_TYPES = List.of("click", "change", "hover", "focus", "blur");

    // dialects whose handler bodies are wrapped in a brace block
    private static final Set<String> STRUCTURAL_DIALECTS = Set.of("kry", "kir");

    private final String targetLanguage;

    public EventHandlerResolver(String targetLanguage) {
        this.targetLanguage = targetLanguage;
    }

    /**
     * The first binding for the pair whose handler function exists wins; later
     * duplicates are ignored.
     */
    public Optional<String> resolve(LogicBlock logic, int componentId, String eventType) {
        if (logic == null || componentId < 0) {
            return Optional.empty();
        }
        for (EventBinding binding : logic.eventBindings) {
            if (!binding.matches(componentId, eventType)) continue;

            Optional<LogicFunction> function = logic.findFunction(binding.handlerName);
            if (function.isEmpty()) continue;

            return sourceOf(function.get());
        }
        return Optional.empty();
    }

    private Optional<String> sourceOf(LogicFunction function) {
        Optional<FunctionSource> exact = function.sourceFor(targetLanguage);
        if (exact.isPresent()) {
            return Optional.of(exact.get().source.strip());
        }
        for (FunctionSource fallback : function.sources) {
            if (fallback.source == null) continue;
            if (isStructuralDialect(fallback.language)) {
                return Optional.of(cleanStructural(fallback.source));
            }
            return Optional.of(fallback.source.strip());
        }
        return Optional.empty();
    }

    /**
     * Names of all functions referenced by at least one event binding.
     */
    public Set<String> handlerNames(LogicBlock logic) {
        Set<String> names = new LinkedHashSet<>();
        for (EventBinding binding : logic.eventBindings) {
            if (binding.handlerName != null) {
                names.add(binding.handlerName);
            }
        }
        return names;
    }

    static boolean isStructuralDialect(String language) {
        return language == null || language.isBlank() || STRUCTURAL_DIALECTS.contains(language.toLowerCase());
    }

    /**
     * Trims whitespace and one enclosing pair of braces.
     */
    static String cleanStructural(String source) {
        String cleaned = source.strip();
        if (cleaned.length() >= 2 && cleaned.startsWith("{") && cleaned.endsWith("}")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
        }
        return cleaned;
    }
}
