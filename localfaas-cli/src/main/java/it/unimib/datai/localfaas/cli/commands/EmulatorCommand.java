package it.unimib.datai.localfaas.cli.commands;

import it.unimib.datai.localfaas.cli.config.EnvVarsFile;
import it.unimib.datai.localfaas.cli.config.Settings;
import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Options shared by the commands that run the emulator.
 */
public abstract class EmulatorCommand {

    @ParentCommand
    protected RootCommand root;

    @Option(names = {"-f", "--function-name"}, description = "Function name (env: AWS_LAMBDA_FUNCTION_NAME).")
    String functionName;

    @Option(names = {"--handler"}, description = "Handler passed to the worker as _HANDLER.")
    String handler;

    @Option(names = {"-t", "--timeout"}, description = "Invocation timeout in seconds (env: AWS_LAMBDA_FUNCTION_TIMEOUT).")
    Integer timeoutSeconds;

    @Option(names = {"-m", "--memory"}, description = "Memory size in MB (env: AWS_LAMBDA_FUNCTION_MEMORY_SIZE).")
    Integer memorySizeMb;

    @Option(names = {"--region"}, description = "Region (env: AWS_REGION).")
    String region;

    @Option(names = {"--bootstrap"}, description = "Bootstrap candidate; repeatable (default: /var/task/bootstrap, /opt/bootstrap).")
    List<Path> bootstrap = new ArrayList<>();

    @Option(names = {"--bootstrap-arg"}, description = "Argument passed to the bootstrap; repeatable.")
    List<String> bootstrapArgs = new ArrayList<>();

    @Option(names = {"--runtime-port"}, description = "Runtime API port (env: DOCKER_LAMBDA_RUNTIME_PORT, default 9001).")
    Integer runtimePort;

    @Option(names = {"--env-vars", "-n"}, description = "JSON file with function environment overrides.")
    Path envVars;

    protected EmulatorConfig.Builder configBuilder() {
        Settings settings = root.settings();
        EmulatorConfig.Builder builder = EmulatorConfig.builder(root.environment())
                .functionName(functionName)
                .handler(handler)
                .timeoutSeconds(timeoutSeconds)
                .memorySizeMb(memorySizeMb)
                .region(region)
                .runtimeApiPort(runtimePort)
                .bootstrapArgs(bootstrapArgs)
                .functionEnvironment(settings.getEnvironment());
        if (!bootstrap.isEmpty()) {
            builder.bootstrapCandidates(bootstrap);
        } else if (!settings.getBootstrap().isEmpty()) {
            builder.bootstrapCandidates(settings.getBootstrap().stream().map(Path::of).toList());
        }
        if (!settings.getWatchPaths().isEmpty()) {
            builder.watchRoots(settings.getWatchPaths().stream().map(Path::of).toList());
        }

        Path envFile = envVars != null ? envVars
                : (settings.getEnvVars() == null ? null : Path.of(settings.getEnvVars()));
        if (envFile != null) {
            String resolvedName = builder.build().functionName();
            Map<String, String> overrides = EnvVarsFile.load(envFile, resolvedName);
            builder.functionEnvironment(overrides);
        }
        return builder;
    }
}
