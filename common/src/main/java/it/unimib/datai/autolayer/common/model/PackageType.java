package it.unimib.datai.autolayer.common.model;

/**
 * Deployment package format of a function. A missing {@code PackageType} property means {@link #ZIP}.
 */
public enum PackageType {
    ZIP("Zip"),
    IMAGE("Image");

    private final String value;

    PackageType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PackageType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ZIP;
        }
        for (PackageType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown package type: " + value);
    }
}
