package org.kryon.kirgen.model.logic;

import com.fasterxml.jackson.annotation.JsonAlias;

public class FunctionSource {
    public String language;

    @JsonAlias("source_text")
    public String source;
}
