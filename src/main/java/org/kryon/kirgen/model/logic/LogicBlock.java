package org.kryon.kirgen.model.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Event handler bodies of a document and the bindings that attach them to
 * components.
 */
public class LogicBlock {
    public List<LogicFunction> functions = new ArrayList<>();
    public List<EventBinding> eventBindings = new ArrayList<>();

    public Optional<LogicFunction> findFunction(String name) {
        if (name == null) return Optional.empty();
        for (LogicFunction function : functions) {
            if (name.equals(function.name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
