package it.unimib.datai.autolayer.common.template;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Long-form CloudFormation intrinsic functions.
 */
public final class Intrinsics {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Intrinsics() {}

    public static ObjectNode ref(String logicalId) {
        ObjectNode node = NODES.objectNode();
        node.put("Ref", logicalId);
        return node;
    }

    public static ObjectNode getAtt(String logicalId, String attribute) {
        ObjectNode node = NODES.objectNode();
        node.putArray("Fn::GetAtt").add(logicalId).add(attribute);
        return node;
    }
}
