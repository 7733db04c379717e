package org.kryon.kirgen.model.source;

public class RequireDeclaration {
    public String variable;
    public String module;
}
