package it.unimib.datai.autolayer.core.build;

import java.util.List;
import java.util.Optional;

public record BuildGraph(List<FunctionBuildDefinition> functionBuildDefinitions) {
    public BuildGraph {
        functionBuildDefinitions = functionBuildDefinitions == null ? List.of() : List.copyOf(functionBuildDefinitions);
    }

    public static BuildGraph empty() {
        return new BuildGraph(List.of());
    }

    public Optional<FunctionBuildDefinition> functionBuildDefinition(String functionLogicalId) {
        return functionBuildDefinitions.stream()
                .filter(definition -> definition.builds(functionLogicalId))
                .findFirst();
    }
}
