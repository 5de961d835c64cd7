package it.unimib.datai.localfaas.cli.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvVarsFileTest {

    @TempDir
    Path tmp;

    @Test
    void functionSectionOverridesParameters() throws Exception {
        Path file = Files.writeString(tmp.resolve("env.json"), """
                {
                  "Parameters": {"STAGE": "dev", "TABLE": "shared"},
                  "orders": {"TABLE": "orders-table", "RETRIES": 3, "DEBUG": true},
                  "other": {"TABLE": "other-table"}
                }
                """);

        Map<String, String> env = EnvVarsFile.load(file, "orders");

        assertThat(env)
                .containsEntry("STAGE", "dev")
                .containsEntry("TABLE", "orders-table")
                .containsEntry("RETRIES", "3")
                .containsEntry("DEBUG", "true")
                .hasSize(4);
    }

    @Test
    void unknownFunctionGetsOnlyParameters() throws Exception {
        Path file = Files.writeString(tmp.resolve("env.json"), "{\"Parameters\":{\"STAGE\":\"dev\"}}");

        assertThat(EnvVarsFile.load(file, "missing")).containsExactly(Map.entry("STAGE", "dev"));
    }

    @Test
    void nestedAndNullValuesAreSkipped() throws Exception {
        Path file = Files.writeString(tmp.resolve("env.json"),
                "{\"fn\":{\"A\":null,\"B\":{\"x\":1},\"C\":\"c\"}}");

        assertThat(EnvVarsFile.load(file, "fn")).containsExactly(Map.entry("C", "c"));
    }

    @Test
    void nonObjectFileIsRejected() throws Exception {
        Path file = Files.writeString(tmp.resolve("env.json"), "[1,2]");

        assertThatThrownBy(() -> EnvVarsFile.load(file, "fn"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unreadableFileFails() {
        assertThatThrownBy(() -> EnvVarsFile.load(tmp.resolve("absent.json"), "fn"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
