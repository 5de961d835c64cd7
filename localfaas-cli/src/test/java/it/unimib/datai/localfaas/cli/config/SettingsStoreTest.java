package it.unimib.datai.localfaas.cli.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsStoreTest {

    @TempDir
    Path tmp;

    @Test
    void loadsYamlSettings() throws Exception {
        Path path = Files.writeString(tmp.resolve("localfaas.yaml"), """
                functionName: thumbnailer
                memorySize: 512
                bootstrap:
                  - /var/task/bootstrap
                environment:
                  BUCKET: images
                """);

        Settings loaded = new SettingsStore(path).load();

        assertThat(loaded.getFunctionName()).isEqualTo("thumbnailer");
        assertThat(loaded.getMemorySize()).isEqualTo(512);
        assertThat(loaded.getBootstrap()).containsExactly("/var/task/bootstrap");
        assertThat(loaded.getEnvironment()).containsEntry("BUCKET", "images");
    }

    @Test
    void readsHandWrittenYaml() throws Exception {
        Path path = Files.writeString(tmp.resolve("localfaas.yaml"), """
                functionName: orders
                timeout: 30
                region: eu-west-1
                runtimePort: 9101
                somethingElse: ignored
                """);

        Map<String, String> env = new SettingsStore(path).load().asEnvironmentDefaults();

        assertThat(env)
                .containsEntry("AWS_LAMBDA_FUNCTION_NAME", "orders")
                .containsEntry("AWS_LAMBDA_FUNCTION_TIMEOUT", "30")
                .containsEntry("AWS_REGION", "eu-west-1")
                .containsEntry("DOCKER_LAMBDA_RUNTIME_PORT", "9101")
                .doesNotContainKey("AWS_LAMBDA_FUNCTION_MEMORY_SIZE");
    }

    @Test
    void missingFileYieldsEmptySettings() {
        Settings settings = new SettingsStore(tmp.resolve("nonexistent/localfaas.yaml")).load();

        assertThat(settings.getFunctionName()).isNull();
        assertThat(settings.getBootstrap()).isEmpty();
        assertThat(settings.asEnvironmentDefaults()).isEmpty();
    }

    @Test
    void environmentWinsOverSettings() throws Exception {
        SettingsStore store = new SettingsStore(Files.writeString(tmp.resolve("localfaas.yaml"), """
                functionName: from-settings
                region: eu-south-1
                """));

        Function<String, String> env = store.environment(
                name -> name.equals("AWS_LAMBDA_FUNCTION_NAME") ? "from-env" : null);

        assertThat(env.apply("AWS_LAMBDA_FUNCTION_NAME")).isEqualTo("from-env");
        assertThat(env.apply("AWS_REGION")).isEqualTo("eu-south-1");
    }

    @Test
    void malformedYamlFails() throws Exception {
        Path path = Files.writeString(tmp.resolve("localfaas.yaml"), "timeout: [not, a, number]\n");

        assertThatThrownBy(() -> new SettingsStore(path).load())
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read settings");
    }

    @Test
    void setEnvironmentNullCreatesEmptyMap() {
        Settings settings = new Settings();
        settings.setEnvironment(null);
        assertThat(settings.getEnvironment()).isNotNull().isEmpty();
    }
}
