package it.unimib.datai.localfaas.emulator.supervisor;

import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerEnvironmentTest {

    private static EmulatorConfig config(Map<String, String> functionEnv) {
        return EmulatorConfig.builder(name -> null)
                .functionName("orders")
                .memorySizeMb(256)
                .region("eu-west-1")
                .handler("index.handler")
                .functionEnvironment(functionEnv)
                .build();
    }

    @Test
    void advertisesRuntimeApiAndFunctionIdentity() {
        Map<String, String> env = new WorkerEnvironment(config(Map.of()), () -> Map.of("PATH", "/usr/bin"))
                .build("127.0.0.1:9001");

        assertThat(env)
                .containsEntry("PATH", "/usr/bin")
                .containsEntry("AWS_LAMBDA_RUNTIME_API", "127.0.0.1:9001")
                .containsEntry("AWS_LAMBDA_FUNCTION_NAME", "orders")
                .containsEntry("AWS_LAMBDA_FUNCTION_VERSION", "$LATEST")
                .containsEntry("AWS_LAMBDA_FUNCTION_MEMORY_SIZE", "256")
                .containsEntry("AWS_LAMBDA_LOG_GROUP_NAME", "/aws/lambda/orders")
                .containsEntry("AWS_REGION", "eu-west-1")
                .containsEntry("AWS_DEFAULT_REGION", "eu-west-1")
                .containsEntry("_HANDLER", "index.handler")
                .containsEntry("AWS_ACCESS_KEY_ID", "SOME_ACCESS_KEY_ID")
                .containsEntry("AWS_SECRET_ACCESS_KEY", "SOME_SECRET_ACCESS_KEY");
        assertThat(env.get("AWS_LAMBDA_LOG_STREAM_NAME")).matches("\\d{4}/\\d{2}/\\d{2}/\\[\\$LATEST][0-9a-f]{32}");
    }

    @Test
    void existingCredentialsAreKept() {
        Map<String, String> env = new WorkerEnvironment(config(Map.of("AWS_ACCESS_KEY_ID", "AKIAREAL")),
                () -> Map.of("AWS_SECRET_ACCESS_KEY", "real-secret"))
                .build("127.0.0.1:9001");

        assertThat(env)
                .containsEntry("AWS_ACCESS_KEY_ID", "AKIAREAL")
                .containsEntry("AWS_SECRET_ACCESS_KEY", "real-secret");
    }

    @Test
    void functionOverridesCannotRedirectRuntimeApi() {
        Map<String, String> env = new WorkerEnvironment(
                config(Map.of("AWS_LAMBDA_RUNTIME_API", "elsewhere:1", "TABLE_NAME", "orders-table")), Map::of)
                .build("127.0.0.1:9001");

        assertThat(env)
                .containsEntry("AWS_LAMBDA_RUNTIME_API", "127.0.0.1:9001")
                .containsEntry("TABLE_NAME", "orders-table");
    }
}
