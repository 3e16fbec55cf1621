package it.unimib.datai.autolayer.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import it.unimib.datai.autolayer.common.model.FunctionDefinition;
import it.unimib.datai.autolayer.common.model.PackageType;
import it.unimib.datai.autolayer.common.model.ResourceType;
import it.unimib.datai.autolayer.common.template.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists the function resources of a template in declaration order. Serverless functions inherit
 * {@code Runtime}, {@code PackageType} and {@code CodeUri} from {@code Globals.Function}.
 */
public class TemplateFunctionResolver {
    private static final Logger log = LoggerFactory.getLogger(TemplateFunctionResolver.class);

    public List<FunctionDefinition> resolve(Template template) {
        JsonNode globals = template.section("Globals")
                .map(node -> node.path("Function"))
                .orElse(MissingNode.getInstance());

        List<FunctionDefinition> functions = new ArrayList<>();
        for (String logicalId : template.resourceIds()) {
            template.resource(logicalId)
                    .flatMap(resource -> toFunction(logicalId, resource, globals))
                    .ifPresent(functions::add);
        }
        return functions;
    }

    private Optional<FunctionDefinition> toFunction(String logicalId, JsonNode resource, JsonNode globals) {
        Optional<ResourceType> type = ResourceType.fromType(text(resource.get(Template.TYPE)));
        if (type.isEmpty() || !type.get().isFunction()) {
            return Optional.empty();
        }

        JsonNode properties = resource.path(Template.PROPERTIES);
        if (type.get() == ResourceType.SERVERLESS_FUNCTION) {
            return Optional.of(new FunctionDefinition(
                    logicalId,
                    ResourceType.SERVERLESS_FUNCTION,
                    packageType(logicalId, property(properties, globals, "PackageType")),
                    property(properties, globals, "Runtime"),
                    property(properties, globals, "CodeUri")
            ));
        }
        return Optional.of(new FunctionDefinition(
                logicalId,
                ResourceType.LAMBDA_FUNCTION,
                packageType(logicalId, text(properties.get("PackageType"))),
                text(properties.get("Runtime")),
                text(properties.get("Code"))
        ));
    }

    private static PackageType packageType(String logicalId, String value) {
        try {
            return PackageType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid PackageType of function " + logicalId + ": " + value, e);
        }
    }

    private static String property(JsonNode properties, JsonNode globals, String name) {
        if (properties.has(name)) {
            return text(properties.get(name));
        }
        return text(globals.get(name));
    }

    private static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) {
            return null;
        }
        if (!v.isValueNode()) {
            log.debug("Ignoring non-literal value {}", v);
            return null;
        }
        String s = v.asText();
        return (s == null || s.isBlank()) ? null : s;
    }
}
