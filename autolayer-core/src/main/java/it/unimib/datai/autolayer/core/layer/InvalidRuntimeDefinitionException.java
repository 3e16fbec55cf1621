package it.unimib.datai.autolayer.core.layer;

/**
 * A function selected for a dependency layer has no runtime, so the layer layout can't be chosen.
 */
public final class InvalidRuntimeDefinitionException extends RuntimeException {
    private final String functionLogicalId;

    public InvalidRuntimeDefinitionException(String functionLogicalId) {
        super("No Runtime information found for function " + functionLogicalId
                + ". Please check that the function has a Runtime property or a Globals.Function.Runtime default.");
        this.functionLogicalId = functionLogicalId;
    }

    public String functionLogicalId() {
        return functionLogicalId;
    }
}
