package it.unimib.datai.autolayer.common.model;

import java.util.Optional;

/**
 * Language families supported for dependency layers, matched by runtime identifier prefix
 * ({@code python3.11}, {@code nodejs20.x}, {@code java17}).
 */
public enum RuntimeFamily {
    PYTHON("python") {
        @Override
        public String layerSubfolder(String runtime) {
            return "python/lib/" + runtime + "/site-packages";
        }
    },
    NODEJS("nodejs") {
        @Override
        public String layerSubfolder(String runtime) {
            return "nodejs";
        }
    },
    JAVA("java") {
        @Override
        public String layerSubfolder(String runtime) {
            return "java/lib";
        }
    };

    private final String prefix;

    RuntimeFamily(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Relative folder, inside the layer root, where the runtime looks for layer contents.
     */
    public abstract String layerSubfolder(String runtime);

    public static Optional<RuntimeFamily> of(String runtime) {
        if (runtime == null || runtime.isBlank()) {
            return Optional.empty();
        }
        for (RuntimeFamily family : values()) {
            if (runtime.startsWith(family.prefix)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    public static String layerSubfolderFor(String runtime) {
        return of(runtime)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported runtime for layers: " + runtime))
                .layerSubfolder(runtime);
    }
}
