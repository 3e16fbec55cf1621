package it.unimib.datai.autolayer.common.model;

/**
 * A function resource as declared in a template.
 *
 * @param name         logical id of the resource
 * @param resourceType one of the function resource types
 * @param packageType  package format, never null
 * @param runtime      runtime identifier, null when not declared or not a literal
 * @param codeUri      local code location, null when not a literal path
 */
public record FunctionDefinition(
        String name,
        ResourceType resourceType,
        PackageType packageType,
        String runtime,
        String codeUri
) {
    public FunctionDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        packageType = packageType == null ? PackageType.ZIP : packageType;
    }

    public FunctionDefinition(String name, ResourceType resourceType, PackageType packageType, String runtime) {
        this(name, resourceType, packageType, runtime, null);
    }
}
