package it.unimib.datai.autolayer.core.build;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the build result descriptor written by the build step:
 * <pre>
 * artifacts:
 *   Fn1: build/Fn1
 * buildDefinitions:
 *   - runtime: python3.11
 *     codeDir: src/fn1
 *     dependenciesDir: deps/fn1
 *     functions: [Fn1]
 * </pre>
 * Relative paths are resolved against the directory holding the descriptor.
 */
public final class BuildResultLoader {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    private BuildResultLoader() {}

    public static ApplicationBuildResult load(Path descriptor) {
        JsonNode root = readTree(descriptor);
        Path base = descriptor.toAbsolutePath().getParent();

        Map<String, Path> artifacts = new LinkedHashMap<>();
        JsonNode artifactsNode = root.path("artifacts");
        if (artifactsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = artifactsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                artifacts.put(e.getKey(), resolve(base, text(e.getValue())));
            }
        }

        List<FunctionBuildDefinition> definitions = new ArrayList<>();
        JsonNode definitionsNode = root.path("buildDefinitions");
        if (definitionsNode.isArray()) {
            int index = 0;
            for (JsonNode node : definitionsNode) {
                definitions.add(definition(node, base, descriptor, index++));
            }
        }

        return new ApplicationBuildResult(new BuildGraph(definitions), artifacts);
    }

    private static FunctionBuildDefinition definition(JsonNode node, Path base, Path descriptor, int index) {
        JsonNode functionsNode = node.path("functions");
        if (!functionsNode.isArray() || functionsNode.isEmpty()) {
            throw new IllegalArgumentException(
                    "Missing buildDefinitions[" + index + "].functions in " + descriptor);
        }
        List<String> functions = new ArrayList<>();
        for (JsonNode fn : functionsNode) {
            functions.add(fn.asText());
        }
        return new FunctionBuildDefinition(
                text(node.get("runtime")),
                resolve(base, text(node.get("codeDir"))),
                resolve(base, text(node.get("dependenciesDir"))),
                functions
        );
    }

    private static JsonNode readTree(Path path) {
        try {
            JsonNode root = YAML.readTree(path.toFile());
            return root == null ? YAML.createObjectNode() : root;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read build result: " + path, e);
        }
    }

    private static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) {
            return null;
        }
        String s = v.asText();
        return (s == null || s.isBlank()) ? null : s;
    }

    private static Path resolve(Path base, String value) {
        if (value == null) {
            return null;
        }
        Path p = Path.of(value);
        return (p.isAbsolute() || base == null) ? p : base.resolve(p).normalize();
    }
}
