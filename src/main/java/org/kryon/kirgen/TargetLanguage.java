package org.kryon.kirgen;

import java.util.Optional;

public enum TargetLanguage {
    LUA("lua", "lua"),
    PYTHON("python", "py");

    private final String name;
    private final String extension;

    TargetLanguage(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public String fileName(String moduleId) {
        return moduleId + "." + extension;
    }

    public boolean matchesFileName(String fileName) {
        return fileName.toLowerCase().endsWith("." + extension);
    }

    public static Optional<TargetLanguage> fromName(String name) {
        if (name == null) return Optional.empty();
        for (TargetLanguage target : values()) {
            if (target.name.equalsIgnoreCase(name.trim()) || target.extension.equalsIgnoreCase(name.trim())) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
