package it.unimib.datai.localfaas.cli;

import it.unimib.datai.localfaas.cli.commands.RootCommand;
import picocli.CommandLine;

public final class LocalfaasCli {
    private LocalfaasCli() {}

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new RootCommand());
        cli.setExpandAtFiles(false);
        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }
}
