package it.unimib.datai.autolayer.core.build;

import java.nio.file.Path;
import java.util.List;

/**
 * One build unit of the upstream build. Several functions sharing code and runtime are built once
 * and listed together in {@code functions}.
 */
public record FunctionBuildDefinition(
        String runtime,
        Path codeDir,
        Path dependenciesDir,
        List<String> functions
) {
    public FunctionBuildDefinition {
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public boolean builds(String functionLogicalId) {
        return functions.contains(functionLogicalId);
    }
}
