package it.unimib.datai.localfaas.cli.commands;

import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class RootCommandTest {

    @TempDir
    Path tmp;

    @Test
    void helpPrintsUsage() {
        CommandLine cli = new CommandLine(new RootCommand());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        cli.setOut(new PrintWriter(out, true));

        int exit = cli.execute("--help");

        assertThat(exit).isEqualTo(0);
        assertThat(out.toString()).contains("Usage:").contains("invoke").contains("start").contains("generate-event");
    }

    @Test
    void unknownOptionExitsNonZero() {
        CommandLine cli = new CommandLine(new RootCommand());
        cli.setErr(new PrintWriter(new ByteArrayOutputStream(), true));

        assertThat(cli.execute("invoke", "--no-such-option")).isNotEqualTo(0);
    }

    @Test
    void configOptionSuppliesEnvironmentDefaults() throws Exception {
        Path cfgPath = Files.writeString(tmp.resolve("custom.yaml"), """
                functionName: from-settings
                timeout: 42
                """);

        RootCommand cmd = new RootCommand().withEnvironment(Map.of("AWS_LAMBDA_FUNCTION_TIMEOUT", "7")::get);
        new CommandLine(cmd).parseArgs("--config", cfgPath.toString(), "invoke");

        Function<String, String> env = cmd.environment();
        assertThat(env.apply("AWS_LAMBDA_FUNCTION_NAME")).isEqualTo("from-settings");
        assertThat(env.apply("AWS_LAMBDA_FUNCTION_TIMEOUT")).isEqualTo("7");
        assertThat(env.apply("AWS_REGION")).isNull();
    }

    @Test
    void commandLineOptionsWinOverSettings() throws Exception {
        Path cfgPath = Files.writeString(tmp.resolve("localfaas.yaml"), """
                functionName: from-settings
                memorySize: 256
                bootstrap:
                  - /srv/fn/bootstrap
                """);

        CommandLine cli = new CommandLine(new RootCommand().withEnvironment(name -> null));
        cli.parseArgs("--config", cfgPath.toString(), "invoke", "--function-name", "from-flag");
        InvokeCommand invoke = cli.getSubcommands().get("invoke").getCommand();

        EmulatorConfig config = invoke.configBuilder().build();
        assertThat(config.functionName()).isEqualTo("from-flag");
        assertThat(config.memorySizeMb()).isEqualTo(256);
        assertThat(config.bootstrapCandidates()).containsExactly(Path.of("/srv/fn/bootstrap"));
    }
}
