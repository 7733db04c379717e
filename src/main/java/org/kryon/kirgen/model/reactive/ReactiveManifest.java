package org.kryon.kirgen.model.reactive;

import org.kryon.kirgen.model.ComponentDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * State variables, bindings and hooks that drive UI updates.
 */
public class ReactiveManifest {
    public List<ReactiveVariable> variables = new ArrayList<>();
    public List<ReactiveBinding> bindings = new ArrayList<>();
    public List<ReactiveConditional> conditionals = new ArrayList<>();
    public List<ReactiveForLoop> forLoops = new ArrayList<>();
    public List<ComponentDefinition> componentDefinitions = new ArrayList<>();
    public List<ReactiveHook> hooks = new ArrayList<>();
}
