package it.unimib.datai.autolayer.cli;

import it.unimib.datai.autolayer.cli.commands.RootCommand;
import picocli.CommandLine;

public final class AutolayerCli {
    private AutolayerCli() {}

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new RootCommand());
        cli.setExpandAtFiles(false);
        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }
}
