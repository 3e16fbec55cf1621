package it.unimib.datai.autolayer.core.nested;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.autolayer.common.model.ResourceType;
import it.unimib.datai.autolayer.common.template.Template;

import java.util.List;

/**
 * {@code AWS::Lambda::LayerVersion} holding the dependencies of one function.
 */
public record LayerVersionResource(
        String layerName,
        String description,
        String content,
        List<String> compatibleRuntimes
) {
    public LayerVersionResource {
        compatibleRuntimes = compatibleRuntimes == null ? List.of() : List.copyOf(compatibleRuntimes);
    }

    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(Template.TYPE, ResourceType.LAMBDA_LAYER_VERSION.type());

        ObjectNode properties = node.putObject(Template.PROPERTIES);
        properties.put("LayerName", layerName);
        properties.put("Description", description);
        properties.put("Content", content);
        properties.put("RetentionPolicy", "Delete");
        ArrayNode runtimes = properties.putArray("CompatibleRuntimes");
        compatibleRuntimes.forEach(runtimes::add);

        node.set("Metadata", CreatedBy.metadata());
        return node;
    }
}
