package org.kryon.kirgen.generator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation run. Safe to fill from parallel workers.
 */
public class GenerationReport {

    private final List<Path> filesWritten = new ArrayList<>();
    private final List<GenerationWarning> warnings = new ArrayList<>();

    synchronized void fileWritten(Path file) {
        filesWritten.add(file);
    }

    synchronized void warn(GenerationWarning warning) {
        warnings.add(warning);
    }

    public synchronized List<Path> getFilesWritten() {
        return List.copyOf(filesWritten);
    }

    public synchronized List<GenerationWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public synchronized boolean hasWarning(GenerationWarning.Kind kind) {
        return warnings.stream().anyMatch(w -> w.getKind() == kind);
    }

    /**
     * A run succeeds when at least one file was written.
     */
    public synchronized boolean isSuccess() {
        return !filesWritten.isEmpty();
    }
}
