package org.kryon.kirgen.model.source;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.kryon.kirgen.model.VerbatimTextDeserializer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verbatim pieces of the original source, kept so that regeneration in the
 * same language reproduces them exactly.
 */
public class SourceDeclarations {
    public List<RequireDeclaration> requires = new ArrayList<>();
    public List<PreservedFunction> functions = new ArrayList<>();

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String moduleInit;

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String initialization;

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String conditionalBlocks;

    public StateInit stateInit;

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String nonReactiveState;

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String moduleConstants;

    @JsonDeserialize(using = VerbatimTextDeserializer.class)
    public String appExport;

    public Optional<String> stateInitExpression() {
        if (stateInit == null || stateInit.expression == null || stateInit.expression.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(stateInit.expression);
    }

    /**
     * Whether a preserved function of that name has source text to copy.
     */
    public boolean hasFunction(String name) {
        for (PreservedFunction function : functions) {
            if (function.name != null && function.name.equals(name)
                    && function.source != null && !function.source.isBlank()) {
                return true;
            }
        }
        return false;
    }
}
