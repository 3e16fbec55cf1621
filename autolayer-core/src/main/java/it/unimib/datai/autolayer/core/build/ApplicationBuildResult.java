package it.unimib.datai.autolayer.core.build;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the upstream build: the build graph and, per built function, its artifact location.
 */
public record ApplicationBuildResult(BuildGraph buildGraph, Map<String, Path> artifacts) {
    public ApplicationBuildResult {
        buildGraph = buildGraph == null ? BuildGraph.empty() : buildGraph;
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public boolean isBuilt(String functionLogicalId) {
        return artifacts.containsKey(functionLogicalId);
    }
}
