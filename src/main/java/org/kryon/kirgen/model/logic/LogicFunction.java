package org.kryon.kirgen.model.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class LogicFunction {
    public String name;
    public List<FunctionSource> sources = new ArrayList<>();

    public Optional<FunctionSource> sourceFor(String language) {
        for (FunctionSource source : sources) {
            if (source.language != null && source.language.equalsIgnoreCase(language) && source.source != null) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
