package org.kryon.kirgen.model.reactive;

import java.util.ArrayList;
import java.util.List;

public class ReactiveConditional {
    public int componentId = -1;
    public String condition;
    public List<Integer> dependentVarIds = new ArrayList<>();
}
