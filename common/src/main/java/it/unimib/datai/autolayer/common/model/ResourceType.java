package it.unimib.datai.autolayer.common.model;

import java.util.Optional;

public enum ResourceType {
    SERVERLESS_FUNCTION("AWS::Serverless::Function"),
    LAMBDA_FUNCTION("AWS::Lambda::Function"),
    LAMBDA_LAYER_VERSION("AWS::Lambda::LayerVersion"),
    SERVERLESS_LAYER_VERSION("AWS::Serverless::LayerVersion"),
    CLOUDFORMATION_STACK("AWS::CloudFormation::Stack"),
    SERVERLESS_APPLICATION("AWS::Serverless::Application"),
    SERVERLESS_API("AWS::Serverless::Api"),
    SERVERLESS_STATE_MACHINE("AWS::Serverless::StateMachine");

    private final String type;

    ResourceType(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    /**
     * Function resource types whose dependencies can be moved into a layer.
     */
    public boolean isFunction() {
        return this == SERVERLESS_FUNCTION || this == LAMBDA_FUNCTION;
    }

    public static Optional<ResourceType> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (ResourceType resourceType : values()) {
            if (resourceType.type.equals(type)) {
                return Optional.of(resourceType);
            }
        }
        return Optional.empty();
    }
}
