package org.kryon.kirgen.generator;

import org.kryon.kirgen.KirgenConfig;
import org.kryon.kirgen.TargetLanguage;
import org.kryon.kirgen.TargetRegistry;
import org.kryon.kirgen.codegen.CodeGenerator;
import org.kryon.kirgen.decoder.KirDecodeException;
import org.kryon.kirgen.decoder.KirDecoder;
import org.kryon.kirgen.model.KirDocument;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Generates an entry module and, transitively, every module it imports.
 *
 * Imported module {@code id} is read from {@code <kirDir>/<id>.kir}, next to
 * the entry file, and written to {@code <outputDir>/<id>.<ext>}, so nested ids
 * such as {@code components/card} keep their directory layout. Each module id
 * is generated at most once per run, which also makes import cycles harmless.
 */
public class ModuleTreeGenerator {

    public static final String ENTRY_MODULE_ID = "main";
    private static final String KIR_EXTENSION = ".kir";

    private final KirgenConfig config;
    private final CodeGenerator generator;
    private final KirDecoder decoder = new KirDecoder();
    private final PrintStream log;

    public ModuleTreeGenerator(KirgenConfig config) {
        this(config, System.err);
    }

    public ModuleTreeGenerator(KirgenConfig config, PrintStream log) {
        this.config = config;
        this.generator = TargetRegistry.createGenerator(config.getTarget(), config);
        this.log = log;
    }

    /**
     * Writes a single file when {@code outputPath} carries the target's
     * extension, otherwise the whole module tree under {@code outputPath}.
     *
     * @return false only when no file was written
     */
    public boolean generate(Path kirPath, Path outputPath) {
        TargetLanguage target = generator.getTarget();
        Path fileName = outputPath.getFileName();
        GenerationReport report = fileName != null && target.matchesFileName(fileName.toString())
                ? generateFile(kirPath, outputPath)
                : generateTree(kirPath, outputPath);
        return report.isSuccess();
    }

    /**
     * Generates only the entry module; its imports are ignored.
     */
    public GenerationReport generateFile(Path kirPath, Path outputFile) {
        GenerationReport report = new GenerationReport();
        KirDocument entry = load(ENTRY_MODULE_ID, kirPath, report);
        if (entry != null) {
            write(ENTRY_MODULE_ID, generator.generate(entry, ENTRY_MODULE_ID), outputFile, report);
        }
        return report;
    }

    public GenerationReport generateTree(Path entryKir, Path outputDir) {
        GenerationReport report = new GenerationReport();
        KirDocument entry = load(ENTRY_MODULE_ID, entryKir, report);
        if (entry == null) {
            return report;
        }

        Path root = outputDir.toAbsolutePath().normalize();
        Path kirDir = entryKir.toAbsolutePath().normalize().getParent();
        TreeRun run = new TreeRun(entry, kirDir, root, report);
        run.visited.add(ENTRY_MODULE_ID);

        write(ENTRY_MODULE_ID, generator.generate(entry, ENTRY_MODULE_ID),
                root.resolve(generator.getTarget().fileName(ENTRY_MODULE_ID)), report);
        processImports(entry.imports, run);

        List<Path> written = report.getFilesWritten();
        if (written.isEmpty()) {
            log("Warning: No " + generator.getTarget().getName() + " files were generated");
        } else {
            log("Generated " + written.size() + " " + generator.getTarget().getName() + " files in " + root);
        }
        return report;
    }

    private void processImports(List<String> imports, TreeRun run) {
        Stream<String> moduleIds = config.isParallel() ? imports.parallelStream() : imports.stream();
        moduleIds.forEach(moduleId -> processModule(moduleId, run));
    }

    private void processModule(String moduleId, TreeRun run) {
        if (moduleId == null || moduleId.isBlank()) return;
        if (!run.visited.add(moduleId)) return;
        if (config.isInternalModule(moduleId) || config.isExternalPlugin(moduleId)) return;

        Path outputFile = run.outputDir.resolve(generator.getTarget().fileName(moduleId)).normalize();
        Path kirFile = run.kirDir.resolve(moduleId + KIR_EXTENSION).normalize();
        if (!outputFile.startsWith(run.outputDir) || !kirFile.startsWith(run.kirDir)) {
            warn(run.report, GenerationWarning.Kind.UNRESOLVED_IMPORT, moduleId,
                    "module id points outside the module tree");
            return;
        }

        if (!Files.isRegularFile(kirFile)) {
            String preserved = run.entry.isPreservableFor(generator.getTarget().getName())
                    ? run.entry.sources.get(moduleId)
                    : null;
            if (preserved != null) {
                write(moduleId, preserved.isEmpty() || preserved.endsWith("\n") ? preserved : preserved + "\n",
                        outputFile, run.report);
            } else {
                warn(run.report, GenerationWarning.Kind.UNRESOLVED_IMPORT, moduleId,
                        "no KIR file at " + kirFile);
            }
            return;
        }

        KirDocument document = load(moduleId, kirFile, run.report);
        if (document == null) return;

        write(moduleId, generator.generate(document, moduleId), outputFile, run.report);
        processImports(document.imports, run);
    }

    private KirDocument load(String moduleId, Path kirFile, GenerationReport report) {
        try {
            return decoder.decode(kirFile);
        } catch (KirDecodeException e) {
            warn(report, GenerationWarning.Kind.DECODE_FAILED, moduleId, e.getMessage());
        } catch (IOException e) {
            warn(report, GenerationWarning.Kind.IO_ERROR, moduleId, "cannot read " + kirFile + ": " + e.getMessage());
        }
        return null;
    }

    private void write(String moduleId, String source, Path outputFile, GenerationReport report) {
        if (source == null || source.isBlank()) {
            warn(report, GenerationWarning.Kind.EMPTY_OUTPUT, moduleId, "generated no output");
            return;
        }

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, source, StandardCharsets.UTF_8);
            report.fileWritten(outputFile);
            log("Generated: " + outputFile.getFileName());
        } catch (IOException e) {
            warn(report, GenerationWarning.Kind.IO_ERROR, moduleId, "cannot write " + outputFile + ": " + e.getMessage());
        }
    }

    private void warn(GenerationReport report, GenerationWarning.Kind kind, String moduleId, String message) {
        GenerationWarning warning = new GenerationWarning(kind, moduleId, message);
        report.warn(warning);
        log("Warning: " + warning);
    }

    private void log(String line) {
        synchronized (log) {
            log.println(line);
        }
    }

    private static final class TreeRun {
        final KirDocument entry;
        final Path kirDir;
        final Path outputDir;
        final GenerationReport report;
        final Set<String> visited = ConcurrentHashMap.newKeySet();

        TreeRun(KirDocument entry, Path kirDir, Path outputDir, GenerationReport report) {
            this.entry = entry;
            this.kirDir = kirDir;
            this.outputDir = outputDir;
            this.report = report;
        }
    }
}
