package org.kryon.kirgen.model.reactive;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.List;

/**
 * useEffect / useMemo / useCallback / useReducer metadata.
 */
public class ReactiveHook {
    @JsonAlias("hook_type")
    public String type;
    public List<String> dependencies = new ArrayList<>();
    public String variableName;
    public String callbackSource;
}
