package it.unimib.datai.autolayer.cli.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigStoreTest {

    @TempDir
    Path tmp;

    private static Config config(String current, Map<String, Profile> profiles) {
        Config cfg = new Config();
        cfg.setCurrentProfile(current);
        cfg.setProfiles(profiles);
        return cfg;
    }

    private static Profile profile(String stackName, String buildDir) {
        Profile p = new Profile();
        p.setStackName(stackName);
        p.setBuildDir(buildDir);
        return p;
    }

    @Test
    void roundTripYamlConfig() {
        ConfigStore store = new ConfigStore(tmp.resolve("config.yaml"), k -> null);

        store.save(config("dev", Map.of("dev", profile("orders-dev", ".aws-sam/layers"))));
        Config loaded = store.load();

        assertThat(loaded.getCurrentProfile()).isEqualTo("dev");
        assertThat(loaded.getProfiles()).containsKey("dev");
        assertThat(loaded.getProfiles().get("dev").getStackName()).isEqualTo("orders-dev");
        assertThat(loaded.getProfiles().get("dev").getBuildDir()).isEqualTo(".aws-sam/layers");
    }

    @Test
    void resolvesCurrentProfile() {
        ConfigStore store = new ConfigStore(tmp.resolve("config.yaml"), k -> null);
        store.save(config("dev", Map.of("dev", profile("orders-dev", "build/dev"))));

        ResolvedProfile resolved = store.loadResolvedProfile();

        assertThat(resolved).isEqualTo(new ResolvedProfile("dev", "orders-dev", "build/dev"));
    }

    @Test
    void stackNameEnvOverrideWins() {
        ConfigStore store = new ConfigStore(tmp.resolve("config.yaml"),
                k -> k.equals(ConfigStore.ENV_STACK_NAME) ? "from-env" : null);
        store.save(config("dev", Map.of("dev", profile("orders-dev", "build/dev"))));

        ResolvedProfile resolved = store.loadResolvedProfile();

        assertThat(resolved.stackName()).isEqualTo("from-env");
        assertThat(resolved.buildDir()).isEqualTo("build/dev");
    }

    @Test
    void profileEnvOverrideSelectsDifferentProfile() {
        ConfigStore store = new ConfigStore(tmp.resolve("config.yaml"),
                k -> k.equals(ConfigStore.ENV_PROFILE) ? "prod" : null);
        store.save(config("dev", Map.of(
                "dev", profile("orders-dev", "build/dev"),
                "prod", profile("orders-prod", "build/prod"))));

        ResolvedProfile resolved = store.loadResolvedProfile();

        assertThat(resolved).isEqualTo(new ResolvedProfile("prod", "orders-prod", "build/prod"));
    }

    @Test
    void buildDirEnvOverrideWithoutConfigFile() {
        ConfigStore store = new ConfigStore(tmp.resolve("nonexistent/config.yaml"),
                k -> k.equals(ConfigStore.ENV_BUILD_DIR) ? "/tmp/layers" : null);

        ResolvedProfile resolved = store.loadResolvedProfile();

        assertThat(resolved.profileName()).isNull();
        assertThat(resolved.stackName()).isNull();
        assertThat(resolved.buildDir()).isEqualTo("/tmp/layers");
    }

    @Test
    void setProfilesNullCreatesEmptyMap() {
        Config cfg = new Config();
        cfg.setProfiles(null);
        assertThat(cfg.getProfiles()).isNotNull().isEmpty();
    }

    @Test
    void malformedConfigThrowsUncheckedIOException() throws Exception {
        Path p = tmp.resolve("config.yaml");
        Files.writeString(p, "profiles: [not, a, map\n");
        ConfigStore store = new ConfigStore(p, k -> null);

        assertThatThrownBy(store::load)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read config");
    }
}
