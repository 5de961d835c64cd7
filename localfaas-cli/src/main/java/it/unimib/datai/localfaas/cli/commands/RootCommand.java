package it.unimib.datai.localfaas.cli.commands;

import it.unimib.datai.localfaas.cli.commands.event.GenerateEventCommand;
import it.unimib.datai.localfaas.cli.config.Settings;
import it.unimib.datai.localfaas.cli.config.SettingsStore;
import it.unimib.datai.localfaas.emulator.lifecycle.ExitHandler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.function.Function;

@Command(
        name = "localfaas",
        mixinStandardHelpOptions = true,
        description = "Runs a function bootstrap against a local emulation of the function runtime API.",
        subcommands = {
                InvokeCommand.class,
                StartCommand.class,
                GenerateEventCommand.class
        }
)
public class RootCommand {

    @Option(names = {"--config"}, description = "Path to settings file (default: ./localfaas.yaml when present).")
    Path configPath;

    private Function<String, String> getenv = System::getenv;
    private ExitHandler exitHandler = ExitHandler.SYSTEM;
    private SettingsStore store;

    public SettingsStore settingsStore() {
        if (store == null) {
            store = (configPath == null) ? new SettingsStore() : new SettingsStore(configPath);
        }
        return store;
    }

    public Settings settings() {
        return settingsStore().load();
    }

    /**
     * Process environment, falling back to the settings file for unset variables.
     */
    public Function<String, String> environment() {
        return settingsStore().environment(getenv);
    }

    public ExitHandler exitHandler() {
        return exitHandler;
    }

    // Visible for testing
    public RootCommand withEnvironment(Function<String, String> getenv) {
        this.getenv = getenv;
        return this;
    }

    // Visible for testing
    public RootCommand withExitHandler(ExitHandler exitHandler) {
        this.exitHandler = exitHandler;
        return this;
    }
}
