package org.kryon.kirgen.generator;

/**
 * A module that could not be generated. Warnings never abort the rest of the
 * module tree.
 */
public class GenerationWarning {

    public enum Kind {
        UNRESOLVED_IMPORT,
        DECODE_FAILED,
        EMPTY_OUTPUT,
        IO_ERROR
    }

    private final Kind kind;
    private final String moduleId;
    private final String message;

    public GenerationWarning(Kind kind, String moduleId, String message) {
        this.kind = kind;
        this.moduleId = moduleId;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + " " + moduleId + ": " + message;
    }
}
