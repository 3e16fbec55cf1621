package it.unimib.datai.autolayer.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.autolayer.common.model.ResourceType;
import it.unimib.datai.autolayer.common.template.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a template to a new location, rewriting the local paths it carries so they keep pointing
 * at the same files. Paths are relative to the directory of the template that declares them.
 */
public final class TemplateMover {
    private static final Logger log = LoggerFactory.getLogger(TemplateMover.class);

    private static final Map<ResourceType, List<String>> LOCAL_PATH_PROPERTIES = Map.of(
            ResourceType.SERVERLESS_FUNCTION, List.of("CodeUri"),
            ResourceType.LAMBDA_FUNCTION, List.of("Code"),
            ResourceType.SERVERLESS_LAYER_VERSION, List.of("ContentUri"),
            ResourceType.LAMBDA_LAYER_VERSION, List.of("Content"),
            ResourceType.CLOUDFORMATION_STACK, List.of("TemplateURL"),
            ResourceType.SERVERLESS_APPLICATION, List.of("Location"),
            ResourceType.SERVERLESS_API, List.of("DefinitionUri"),
            ResourceType.SERVERLESS_STATE_MACHINE, List.of("DefinitionUri")
    );

    private TemplateMover() {}

    /**
     * Rewrites relative paths from {@code originalTemplate}'s directory to {@code destinationTemplate}'s,
     * writes the result to {@code destinationTemplate} and returns it.
     */
    public static Template move(Path originalTemplate, Path destinationTemplate, Template template) {
        Path originalRoot = parentOf(originalTemplate);
        Path newRoot = parentOf(destinationTemplate);

        Template moved = updateRelativePaths(template, originalRoot, newRoot);
        TemplateIO.write(destinationTemplate, moved);
        return moved;
    }

    static Template updateRelativePaths(Template template, Path originalRoot, Path newRoot) {
        Template result = template;
        for (String logicalId : template.resourceIds()) {
            Optional<ObjectNode> resource = template.resource(logicalId);
            if (resource.isEmpty()) {
                continue;
            }
            ObjectNode node = resource.get();
            Optional<ResourceType> type = ResourceType.fromType(node.path(Template.TYPE).asText(null));
            List<String> pathProperties = type.map(LOCAL_PATH_PROPERTIES::get).orElse(null);
            if (pathProperties == null || !node.path(Template.PROPERTIES).isObject()) {
                continue;
            }

            ObjectNode properties = (ObjectNode) node.get(Template.PROPERTIES);
            boolean changed = false;
            for (String property : pathProperties) {
                String updated = resolveRelativeTo(properties.get(property), originalRoot, newRoot);
                if (updated != null) {
                    log.debug("Rewriting {}.{} from {} to {}", logicalId, property, properties.get(property).asText(), updated);
                    properties.put(property, updated);
                    changed = true;
                }
            }
            if (changed) {
                result = result.withResource(logicalId, node);
            }
        }
        return result;
    }

    /**
     * Returns the path rewritten for the new root, or null when the value is not a local relative path.
     */
    static String resolveRelativeTo(JsonNode value, Path originalRoot, Path newRoot) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        String path = value.asText();
        if (path.isBlank() || path.startsWith("s3://") || path.startsWith("http://") || path.startsWith("https://")) {
            return null;
        }
        Path local = Path.of(path);
        if (local.isAbsolute()) {
            return null;
        }
        Path target = originalRoot.resolve(local).normalize();
        String relative = newRoot.relativize(target).toString();
        return relative.isEmpty() ? "." : relative;
    }

    private static Path parentOf(Path templatePath) {
        Path parent = templatePath.toAbsolutePath().normalize().getParent();
        return parent == null ? templatePath.toAbsolutePath().getRoot() : parent;
    }
}
