package it.unimib.datai.autolayer.core.nested;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

final class CreatedBy {
    static final String METADATA_KEY = "CreatedBy";
    static final String METADATA_VALUE = "autolayer";

    private CreatedBy() {}

    static ObjectNode metadata() {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put(METADATA_KEY, METADATA_VALUE);
        return metadata;
    }
}
