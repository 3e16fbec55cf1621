package it.unimib.datai.autolayer.cli.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

public final class ConfigStore {
    public static final String ENV_PROFILE = "AUTOLAYER_PROFILE";
    public static final String ENV_STACK_NAME = "AUTOLAYER_STACK_NAME";
    public static final String ENV_BUILD_DIR = "AUTOLAYER_BUILD_DIR";

    private final Path path;
    private final ObjectMapper yaml;
    private final Function<String, String> getenv;

    public ConfigStore() {
        this(defaultPath(), System::getenv);
    }

    public ConfigStore(Path path) {
        this(path, System::getenv);
    }

    public ConfigStore(Path path, Function<String, String> getenv) {
        this.path = path;
        this.getenv = getenv;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Config load() {
        if (!Files.exists(path)) {
            return new Config();
        }
        try {
            Config config = yaml.readValue(path.toFile(), Config.class);
            return config == null ? new Config() : config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    public void save(Config config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            yaml.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write config: " + path, e);
        }
    }

    public ResolvedProfile loadResolvedProfile() {
        Config cfg = load();

        String profileName = firstNonBlank(getenv.apply(ENV_PROFILE), cfg.getCurrentProfile());
        Profile profile = (profileName == null || cfg.getProfiles() == null) ? null : cfg.getProfiles().get(profileName);

        String stackName = firstNonBlank(getenv.apply(ENV_STACK_NAME), profile == null ? null : profile.getStackName());
        String buildDir = firstNonBlank(getenv.apply(ENV_BUILD_DIR), profile == null ? null : profile.getBuildDir());

        return new ResolvedProfile(profileName, stackName, buildDir);
    }

    public Path getPath() {
        return path;
    }

    private static Path defaultPath() {
        String home = System.getProperty("user.home");
        return Path.of(home, ".config", "autolayer", "config.yaml");
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
