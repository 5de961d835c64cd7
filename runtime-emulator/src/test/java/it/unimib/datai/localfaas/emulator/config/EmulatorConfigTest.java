package it.unimib.datai.localfaas.emulator.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmulatorConfigTest {

    @Test
    void defaultsWithEmptyEnvironment() {
        EmulatorConfig config = EmulatorConfig.builder(name -> null).build();

        assertThat(config.functionName()).isEqualTo("test");
        assertThat(config.functionVersion()).isEqualTo("$LATEST");
        assertThat(config.memorySizeMb()).isEqualTo(1536);
        assertThat(config.timeoutSeconds()).isEqualTo(300);
        assertThat(config.region()).isEqualTo("us-east-1");
        assertThat(config.accountId()).isEqualTo("000000000000");
        assertThat(config.handler()).isEqualTo("handler");
        assertThat(config.traceId()).isNull();
        assertThat(config.runtimeApiPort()).isEqualTo(9001);
        assertThat(config.invokePort()).isEqualTo(9002);
        assertThat(config.bootstrapCandidates()).containsExactly(Path.of("/var/task/bootstrap"), Path.of("/opt/bootstrap"));
        assertThat(config.stayOpen()).isFalse();
        assertThat(config.watch()).isFalse();
        assertThat(config.invokedFunctionArn()).isEqualTo("arn:aws:lambda:us-east-1:000000000000:function:test");
        assertThat(config.logGroupName()).isEqualTo("/aws/lambda/test");
    }

    @Test
    void environmentOverridesDefaults() {
        Map<String, String> env = Map.of(
                "AWS_LAMBDA_FUNCTION_NAME", "thumbnailer",
                "AWS_LAMBDA_FUNCTION_TIMEOUT", "15",
                "AWS_LAMBDA_FUNCTION_MEMORY_SIZE", "512",
                "AWS_DEFAULT_REGION", "eu-south-1",
                "_HANDLER", "app.handler",
                "DOCKER_LAMBDA_STAY_OPEN", "1",
                "DOCKER_LAMBDA_RUNTIME_PORT", "9101");

        EmulatorConfig config = EmulatorConfig.builder(env::get).build();

        assertThat(config.functionName()).isEqualTo("thumbnailer");
        assertThat(config.timeoutSeconds()).isEqualTo(15);
        assertThat(config.memorySizeMb()).isEqualTo(512);
        assertThat(config.region()).isEqualTo("eu-south-1");
        assertThat(config.handler()).isEqualTo("app.handler");
        assertThat(config.stayOpen()).isTrue();
        assertThat(config.runtimeApiPort()).isEqualTo(9101);
        assertThat(config.invokePort()).isZero();
    }

    @Test
    void explicitValuesWinOverEnvironment() {
        Map<String, String> env = Map.of("AWS_LAMBDA_FUNCTION_NAME", "from-env", "AWS_REGION", "ap-east-1");

        EmulatorConfig config = EmulatorConfig.builder(env::get)
                .functionName("explicit")
                .bootstrapCandidates(List.of(Path.of("/tmp/bootstrap")))
                .build();

        assertThat(config.functionName()).isEqualTo("explicit");
        assertThat(config.region()).isEqualTo("ap-east-1");
        assertThat(config.bootstrapCandidates()).containsExactly(Path.of("/tmp/bootstrap"));
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> EmulatorConfig.builder(name -> null).timeoutSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonNumericEnvironment() {
        assertThatThrownBy(() -> EmulatorConfig.builder(Map.of("AWS_LAMBDA_FUNCTION_TIMEOUT", "soon")::get).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("AWS_LAMBDA_FUNCTION_TIMEOUT");
    }
}
