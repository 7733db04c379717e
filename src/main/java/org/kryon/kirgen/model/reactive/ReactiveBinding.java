package org.kryon.kirgen.model.reactive;

public class ReactiveBinding {
    public int componentId = -1;
    public int variableId = -1;
    public String bindingType;
    public String expression;
}
