package org.kryon.kirgen;

import org.kryon.kirgen.codegen.CodeGenerator;
import org.kryon.kirgen.codegen.lua.LuaCodeGenerator;
import org.kryon.kirgen.codegen.python.PythonCodeGenerator;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public class TargetRegistry {

    public static Optional<TargetLanguage> detectTarget(Path outputPath) {
        Path fileName = outputPath.getFileName();
        if (fileName == null) return Optional.empty();
        for (TargetLanguage target : TargetLanguage.values()) {
            if (target.matchesFileName(fileName.toString())) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    public static Set<String> allTargetNames() {
        return Arrays.stream(TargetLanguage.values())
                .map(TargetLanguage::getName)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public static CodeGenerator createGenerator(TargetLanguage target, KirgenConfig config) {
        return switch (target) {
            case LUA -> new LuaCodeGenerator(config);
            case PYTHON -> new PythonCodeGenerator(config);
        };
    }
}
