package it.unimib.datai.autolayer.core.nested;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.autolayer.common.model.FunctionDefinition;
import it.unimib.datai.autolayer.common.template.Intrinsics;
import it.unimib.datai.autolayer.common.template.Template;
import it.unimib.datai.autolayer.core.layer.InvalidRuntimeDefinitionException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates one layer resource and one output per function into the nested template.
 * Entries are only ever added.
 */
public class NestedStackBuilder {
    static final String DESCRIPTION = "Nested stack holding the auto created dependency layers";

    private final Map<String, LayerVersionResource> resources = new LinkedHashMap<>();
    private final Map<String, StackOutput> outputs = new LinkedHashMap<>();
    private int registeredFunctions;

    /**
     * Registers the layer of {@code function} and returns the output key exporting its reference.
     * Not idempotent: call it once per function.
     */
    public String addFunction(String stackName, Path layerContentsFolder, FunctionDefinition function) {
        if (function.runtime() == null || function.runtime().isBlank()) {
            throw new InvalidRuntimeDefinitionException(function.name());
        }
        String layerLogicalId = layerLogicalId(function.name());
        LayerVersionResource layer = new LayerVersionResource(
                layerName(stackName, function.name()),
                "Auto created layer for dependencies of function " + function.name(),
                layerContentsFolder.toString(),
                List.of(function.runtime())
        );
        resources.put(layerLogicalId, layer);
        outputs.put(layerLogicalId, new StackOutput(Intrinsics.ref(layerLogicalId)));
        registeredFunctions++;
        return layerLogicalId;
    }

    public boolean isAnyFunctionAdded() {
        return registeredFunctions > 0;
    }

    public int registeredFunctions() {
        return registeredFunctions;
    }

    public ObjectNode build() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("AWSTemplateFormatVersion", "2010-09-09");
        root.put("Description", DESCRIPTION);
        root.set("Metadata", CreatedBy.metadata());

        ObjectNode resourcesNode = root.putObject(Template.RESOURCES);
        resources.forEach((id, layer) -> resourcesNode.set(id, layer.toNode()));
        ObjectNode outputsNode = root.putObject("Outputs");
        outputs.forEach((id, output) -> outputsNode.set(id, output.toNode()));
        return root;
    }

    public Template buildTemplate() {
        return Template.of(build());
    }

    public static ObjectNode nestedStackReferenceResource(String nestedTemplateLocation) {
        return new NestedStackResource(nestedTemplateLocation).toNode();
    }

    public static String layerLogicalId(String functionLogicalId) {
        return truncate(functionLogicalId, 48) + checksum(functionLogicalId).substring(0, 8) + "DepLayer";
    }

    public static String layerName(String stackName, String functionLogicalId) {
        return truncate(stackName, 16) + checksum(stackName).substring(0, 8)
                + "-" + truncate(functionLogicalId, 22) + checksum(functionLogicalId).substring(0, 8)
                + "-DepLayer";
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    static String checksum(String value) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
