package org.kryon.kirgen.codegen;

import org.kryon.kirgen.model.KirDocument;

/**
 * Module classification, decided once per document.
 */
public enum ModuleKind {
    APP,
    COMPONENT_DEFINITIONS,
    LIBRARY;

    /**
     * A document with both a root and component definitions is an App.
     */
    public static ModuleKind classify(KirDocument document) {
        if (document.hasRoot()) {
            return APP;
        }
        if (!document.allComponentDefinitions().isEmpty()) {
            return COMPONENT_DEFINITIONS;
        }
        return LIBRARY;
    }
}
