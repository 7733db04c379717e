package org.kryon.kirgen.codegen;

import org.kryon.kirgen.TargetLanguage;
import org.kryon.kirgen.model.KirDocument;

public interface CodeGenerator {
    TargetLanguage getTarget();

    /**
     * Emits the source of one module. The document is never modified.
     *
     * @param moduleId id of the module being generated, used to look up its
     *                 preserved original text in {@link KirDocument#sources}
     */
    String generate(KirDocument document, String moduleId);
}
