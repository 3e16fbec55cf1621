package it.unimib.datai.autolayer.common.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable CloudFormation template. Every accessor hands out copies and every {@code with*}
 * operation returns a new template, so a template passed in by a caller is never modified.
 */
public final class Template {
    public static final String RESOURCES = "Resources";
    public static final String PROPERTIES = "Properties";
    public static final String LAYERS = "Layers";
    public static final String TYPE = "Type";

    private final ObjectNode root;

    private Template(ObjectNode root) {
        this.root = root;
    }

    public static Template of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Template root must be a mapping, got " + node.getNodeType());
        }
        return new Template(((ObjectNode) node).deepCopy());
    }

    public static Template empty() {
        return new Template(JsonNodeFactory.instance.objectNode());
    }

    public ObjectNode toNode() {
        return root.deepCopy();
    }

    public Optional<JsonNode> section(String name) {
        JsonNode node = root.get(name);
        return node == null ? Optional.empty() : Optional.of(node.deepCopy());
    }

    public List<String> resourceIds() {
        JsonNode resources = root.path(RESOURCES);
        List<String> ids = new ArrayList<>();
        Iterator<String> it = resources.fieldNames();
        while (it.hasNext()) {
            ids.add(it.next());
        }
        return ids;
    }

    public boolean hasResource(String logicalId) {
        return root.path(RESOURCES).has(logicalId);
    }

    public Optional<ObjectNode> resource(String logicalId) {
        JsonNode node = root.path(RESOURCES).get(logicalId);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(((ObjectNode) node).deepCopy());
    }

    /**
     * Returns a template with {@code resource} stored under {@code logicalId}, replacing any existing entry.
     */
    public Template withResource(String logicalId, JsonNode resource) {
        Objects.requireNonNull(logicalId, "logicalId");
        Objects.requireNonNull(resource, "resource");
        ObjectNode copy = root.deepCopy();
        resourcesOf(copy).set(logicalId, resource.deepCopy());
        return new Template(copy);
    }

    /**
     * Returns a template where {@code layer} is appended to {@code Properties.Layers} of the given function.
     * Missing {@code Properties} and {@code Layers} are created.
     */
    public Template withAppendedLayer(String functionLogicalId, JsonNode layer) {
        Objects.requireNonNull(layer, "layer");
        ObjectNode copy = root.deepCopy();
        JsonNode function = resourcesOf(copy).get(functionLogicalId);
        if (function == null || !function.isObject()) {
            throw new IllegalArgumentException("Resource not found in template: " + functionLogicalId);
        }

        ObjectNode properties = childObject((ObjectNode) function, PROPERTIES, functionLogicalId);
        JsonNode layers = properties.get(LAYERS);
        ArrayNode layerList;
        if (layers == null || layers.isNull()) {
            layerList = properties.putArray(LAYERS);
        } else if (layers.isArray()) {
            layerList = (ArrayNode) layers;
        } else {
            throw new IllegalArgumentException("Layers of " + functionLogicalId + " must be a list, got " + layers.getNodeType());
        }
        layerList.add(layer.deepCopy());
        return new Template(copy);
    }

    private static ObjectNode resourcesOf(ObjectNode node) {
        return childObject(node, RESOURCES, "template");
    }

    private static ObjectNode childObject(ObjectNode parent, String field, String owner) {
        JsonNode child = parent.get(field);
        if (child == null || child.isNull()) {
            return parent.putObject(field);
        }
        if (!child.isObject()) {
            throw new IllegalArgumentException(field + " of " + owner + " must be a mapping, got " + child.getNodeType());
        }
        return (ObjectNode) child;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Template other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
