package org.kryon.kirgen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class KirgenConfig {

    private static final String CONFIG_FILE_NAME = "kirgen-config.yml";
    private static final TargetLanguage DEFAULT_TARGET = TargetLanguage.LUA;
    private static final int DEFAULT_INDENT_WIDTH = 4;
    private static final boolean DEFAULT_PARALLEL = false;

    // Kryon runtime modules, provided by the runtime rather than generated
    private static final List<String> DEFAULT_INTERNAL_MODULES =
            List.of("dsl", "ffi", "runtime", "reactive", "kryon", "kryon/");
    private static final List<String> DEFAULT_EXTERNAL_PLUGINS = List.of("plugins/");
    // names of the generated module's own locals
    private static final List<String> DEFAULT_RESERVED_STATE_NAMES = List.of("root", "UI", "Reactive");

    private final TargetLanguage target;
    private final int indentWidth;
    private final List<String> internalModules;
    private final List<String> externalPlugins;
    private final List<String> reservedStateNames;
    private final boolean parallel;

    private KirgenConfig(TargetLanguage target, int indentWidth, List<String> internalModules,
                         List<String> externalPlugins, List<String> reservedStateNames, boolean parallel) {
        this.target = target;
        this.indentWidth = indentWidth;
        this.internalModules = List.copyOf(internalModules);
        this.externalPlugins = List.copyOf(externalPlugins);
        this.reservedStateNames = List.copyOf(reservedStateNames);
        this.parallel = parallel;
    }

    public TargetLanguage getTarget() {
        return target;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public List<String> getInternalModules() {
        return internalModules;
    }

    public List<String> getExternalPlugins() {
        return externalPlugins;
    }

    public List<String> getReservedStateNames() {
        return reservedStateNames;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isInternalModule(String moduleId) {
        return matchesAny(internalModules, moduleId);
    }

    public boolean isExternalPlugin(String moduleId) {
        return matchesAny(externalPlugins, moduleId);
    }

    public boolean isReservedStateName(String name) {
        return reservedStateNames.contains(name);
    }

    /**
     * Entries ending in {@code /} match every module id under that prefix.
     */
    private static boolean matchesAny(List<String> entries, String moduleId) {
        for (String entry : entries) {
            if (entry.endsWith("/") ? moduleId.startsWith(entry) : moduleId.equals(entry)) {
                return true;
            }
        }
        return false;
    }

    public static KirgenConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static KirgenConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                TargetLanguage effectiveTarget = yamlConfig.target == null
                        ? DEFAULT_TARGET
                        : TargetLanguage.fromName(yamlConfig.target).orElseThrow(() ->
                                new IllegalArgumentException("Unknown target in " + configPath + ": " + yamlConfig.target));
                int effectiveIndentWidth = (yamlConfig.indentWidth != null && yamlConfig.indentWidth >= 0)
                        ? yamlConfig.indentWidth
                        : DEFAULT_INDENT_WIDTH;
                boolean effectiveParallel = (yamlConfig.parallel != null)
                        ? yamlConfig.parallel
                        : DEFAULT_PARALLEL;

                return new KirgenConfig(effectiveTarget, effectiveIndentWidth,
                        orDefault(yamlConfig.internalModules, DEFAULT_INTERNAL_MODULES),
                        orDefault(yamlConfig.externalPlugins, DEFAULT_EXTERNAL_PLUGINS),
                        orDefault(yamlConfig.reservedStateNames, DEFAULT_RESERVED_STATE_NAMES),
                        effectiveParallel);
            }
        } catch (IOException e) {
            System.err.println("Warning: Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static KirgenConfig defaults() {
        return new KirgenConfig(DEFAULT_TARGET, DEFAULT_INDENT_WIDTH, DEFAULT_INTERNAL_MODULES,
                DEFAULT_EXTERNAL_PLUGINS, DEFAULT_RESERVED_STATE_NAMES, DEFAULT_PARALLEL);
    }

    public static KirgenConfig with(TargetLanguage target, boolean parallel) {
        return new KirgenConfig(target, DEFAULT_INDENT_WIDTH, DEFAULT_INTERNAL_MODULES,
                DEFAULT_EXTERNAL_PLUGINS, DEFAULT_RESERVED_STATE_NAMES, parallel);
    }

    public KirgenConfig withTarget(TargetLanguage target) {
        return new KirgenConfig(target, indentWidth, internalModules, externalPlugins, reservedStateNames, parallel);
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured != null ? configured : fallback;
    }

    private static class YamlConfig {
        public String target;
        public Integer indentWidth;
        public List<String> internalModules;
        public List<String> externalPlugins;
        public List<String> reservedStateNames;
        public Boolean parallel;
    }
}
