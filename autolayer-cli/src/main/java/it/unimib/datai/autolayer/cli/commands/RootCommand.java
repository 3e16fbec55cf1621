package it.unimib.datai.autolayer.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import it.unimib.datai.autolayer.cli.config.ConfigStore;
import it.unimib.datai.autolayer.cli.config.ResolvedProfile;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Command(
        name = "autolayer",
        mixinStandardHelpOptions = true,
        description = "Moves built function dependencies into per-function layers declared in a nested stack.",
        subcommands = {
                GenerateCommand.class
        }
)
public class RootCommand {
    static final String DEFAULT_BUILD_DIR = ".aws-sam/auto-dependency-layer";

    @Option(names = {"--config"}, description = "Path to config file (default: ~/.config/autolayer/config.yaml).")
    Path configPath;

    @Option(names = {"--stack-name", "-s"}, description = "Stack name used to name the layers (overrides config/env).")
    String stackName;

    @Option(names = {"--build-dir"}, description = "Directory for layer folders and the nested template (overrides config/env).")
    String buildDir;

    @Option(names = {"--verbose", "-v"}, description = "Log skipped functions and rewritten paths.")
    void setVerbose(boolean verbose) {
        Logger logger = (Logger) LoggerFactory.getLogger("it.unimib.datai.autolayer");
        logger.setLevel(verbose ? Level.DEBUG : Level.INFO);
    }

    private ConfigStore store;
    private ResolvedProfile resolved;

    public ConfigStore configStore() {
        if (store == null) {
            store = (configPath == null) ? new ConfigStore() : new ConfigStore(configPath);
        }
        return store;
    }

    public ResolvedProfile resolvedProfile() {
        if (resolved == null) {
            ResolvedProfile base = configStore().loadResolvedProfile();
            String stack = firstNonBlank(stackName, base.stackName());
            String dir = firstNonBlank(buildDir, base.buildDir());
            resolved = new ResolvedProfile(base.profileName(), stack, dir);
        }
        return resolved;
    }

    public String requireStackName() {
        String stack = resolvedProfile().stackName();
        if (stack == null) {
            throw new IllegalArgumentException("Missing stack name. Set --stack-name or AUTOLAYER_STACK_NAME or configure a profile.");
        }
        return stack;
    }

    public Path buildDirectory() {
        String dir = resolvedProfile().buildDir();
        return Path.of(dir == null ? DEFAULT_BUILD_DIR : dir).toAbsolutePath().normalize();
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        return null;
    }
}
