package org.kryon.kirgen;

import org.kryon.kirgen.generator.ModuleTreeGenerator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

public class App {

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 3) {
            printUsage();
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: KIR file does not exist: " + input);
            System.exit(1);
        }
        Path output = Paths.get(args[1]);

        KirgenConfig config;
        try {
            config = KirgenConfig.load();
            config = config.withTarget(resolveTarget(args, output, config));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        System.out.println("Starting code generation...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Target: " + config.getTarget().getName());

        Instant startTime = Instant.now();
        boolean success = new ModuleTreeGenerator(config).generate(input, output);

        System.out.println("\n" + "=".repeat(60));
        System.out.println(success ? "Generation complete!" : "Generation failed!");
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("=".repeat(60));

        if (!success) {
            System.exit(1);
        }
    }

    /**
     * Explicit argument first, then the output file's extension, then the
     * configured target.
     */
    static TargetLanguage resolveTarget(String[] args, Path output, KirgenConfig config) {
        if (args.length == 3) {
            return TargetLanguage.fromName(args[2])
                    .orElseThrow(() -> new IllegalArgumentException("Unknown target: " + args[2]));
        }
        return TargetRegistry.detectTarget(output).orElse(config.getTarget());
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar kirgen.jar <kir-file> <output-path> [target]");
        System.err.println("  <kir-file>:    Path to the entry .kir module");
        System.err.println("  <output-path>: Output directory, or a single file named after the target");
        System.err.println("  [target]:      Target language (default from kirgen-config.yml)");
        System.err.println("Supported targets: " + String.join(", ", TargetRegistry.allTargetNames()));
    }
}
