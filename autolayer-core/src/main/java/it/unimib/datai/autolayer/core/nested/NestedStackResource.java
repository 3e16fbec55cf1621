package it.unimib.datai.autolayer.core.nested;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.autolayer.common.model.ResourceType;
import it.unimib.datai.autolayer.common.template.Template;

/**
 * {@code AWS::CloudFormation::Stack} pointing the parent template at the nested layer template.
 */
public record NestedStackResource(String templateUrl) {
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(Template.TYPE, ResourceType.CLOUDFORMATION_STACK.type());
        node.put("DeletionPolicy", "Delete");
        node.putObject(Template.PROPERTIES).put("TemplateURL", templateUrl);
        node.set("Metadata", CreatedBy.metadata());
        return node;
    }
}
