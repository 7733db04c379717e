package org.kryon.kirgen.model.source;

public class PreservedFunction {
    public String name;
    public String source;
}
