package org.kryon.kirgen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.kryon.kirgen.model.logic.LogicBlock;
import org.kryon.kirgen.model.reactive.ReactiveManifest;
import org.kryon.kirgen.model.source.SourceDeclarations;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a decoded KIR document.
 *
 * Every optional section is initialized to an empty value, so consumers never
 * need to null-check anything except {@link #root}, whose absence is meaningful
 * (it decides whether the module is an App).
 */
public class KirDocument {
    public String format;
    public KirMetadata metadata = new KirMetadata();
    public AppWindow app;
    public ReactiveManifest reactiveManifest = new ReactiveManifest();
    public LogicBlock logicBlock = new LogicBlock();
    public List<ComponentDefinition> componentDefinitions = new ArrayList<>();

    @JsonAlias({"component", "root_component"})
    public ComponentTree root;

    @JsonDeserialize(contentUsing = VerbatimTextDeserializer.class)
    public List<String> exports = new ArrayList<>();
    public List<String> imports = new ArrayList<>();
    public SourceDeclarations sourceDeclarations = new SourceDeclarations();

    // module id -> original source text
    @JsonDeserialize(contentUsing = VerbatimTextDeserializer.class)
    public Map<String, String> sources = new LinkedHashMap<>();

    public boolean hasRoot() {
        return root != null && !root.isEmpty();
    }

    /**
     * Component definitions declared at the top level, or those carried by the
     * reactive manifest when the top level has none.
     */
    public List<ComponentDefinition> allComponentDefinitions() {
        if (!componentDefinitions.isEmpty()) {
            return componentDefinitions;
        }
        return reactiveManifest.componentDefinitions;
    }

    /**
     * Preserved text in this document was captured from source written in
     * {@code targetLanguage}. Documents without a recorded source language are
     * assumed to come from the same language.
     */
    public boolean isPreservableFor(String targetLanguage) {
        String sourceLanguage = metadata.sourceLanguage;
        return sourceLanguage == null || sourceLanguage.isBlank()
                || sourceLanguage.equalsIgnoreCase(targetLanguage);
    }
}
