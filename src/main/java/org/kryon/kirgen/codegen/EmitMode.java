package org.kryon.kirgen.codegen;

/**
 * How a component's constructor expression is introduced.
 */
public final class EmitMode {

    public enum Kind {
        INLINE,
        NAMED,
        RETURN
    }

    private static final EmitMode INLINE = new EmitMode(Kind.INLINE, null);
    private static final EmitMode RETURN = new EmitMode(Kind.RETURN, null);

    private final Kind kind;
    private final String variableName;

    private EmitMode(Kind kind, String variableName) {
        this.kind = kind;
        this.variableName = variableName;
    }

    public static EmitMode inline() {
        return INLINE;
    }

    public static EmitMode named(String variableName) {
        return new EmitMode(Kind.NAMED, variableName);
    }

    public static EmitMode returned() {
        return RETURN;
    }

    public Kind getKind() {
        return kind;
    }

    public String getVariableName() {
        return variableName;
    }
}
