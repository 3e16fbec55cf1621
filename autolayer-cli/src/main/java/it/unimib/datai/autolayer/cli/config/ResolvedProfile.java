package it.unimib.datai.autolayer.cli.config;

/**
 * Settings after applying environment overrides to the selected profile. Any field may be null.
 */
public record ResolvedProfile(String profileName, String stackName, String buildDir) {
}
