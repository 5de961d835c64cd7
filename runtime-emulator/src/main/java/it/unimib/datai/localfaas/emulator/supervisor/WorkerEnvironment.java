package it.unimib.datai.localfaas.emulator.supervisor;

import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Environment handed to the worker: the emulator's own environment, the function overrides,
 * then the runtime variables the worker needs to find the runtime API.
 */
public final class WorkerEnvironment {
    static final String DEFAULT_ACCESS_KEY_ID = "SOME_ACCESS_KEY_ID";
    static final String DEFAULT_SECRET_ACCESS_KEY = "SOME_SECRET_ACCESS_KEY";

    private static final DateTimeFormatter STREAM_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final SecureRandom RANDOM = new SecureRandom();

    private final EmulatorConfig config;
    private final Supplier<Map<String, String>> inherited;

    public WorkerEnvironment(EmulatorConfig config) {
        this(config, System::getenv);
    }

    WorkerEnvironment(EmulatorConfig config, Supplier<Map<String, String>> inherited) {
        this.config = config;
        this.inherited = inherited;
    }

    public Map<String, String> build(String runtimeApiAddress) {
        Map<String, String> env = new LinkedHashMap<>(inherited.get());
        env.putAll(config.functionEnvironment());

        env.put("AWS_LAMBDA_RUNTIME_API", runtimeApiAddress);
        env.put("AWS_LAMBDA_FUNCTION_NAME", config.functionName());
        env.put("AWS_LAMBDA_FUNCTION_VERSION", config.functionVersion());
        env.put("AWS_LAMBDA_FUNCTION_MEMORY_SIZE", String.valueOf(config.memorySizeMb()));
        env.put("AWS_LAMBDA_LOG_GROUP_NAME", config.logGroupName());
        env.put("AWS_LAMBDA_LOG_STREAM_NAME", logStreamName(config.functionVersion()));
        env.put("AWS_REGION", config.region());
        env.put("AWS_DEFAULT_REGION", config.region());
        env.put("_HANDLER", config.handler());

        env.putIfAbsent("AWS_ACCESS_KEY_ID", DEFAULT_ACCESS_KEY_ID);
        env.putIfAbsent("AWS_SECRET_ACCESS_KEY", DEFAULT_SECRET_ACCESS_KEY);
        return env;
    }

    static String logStreamName(String version) {
        byte[] id = new byte[16];
        RANDOM.nextBytes(id);
        return LocalDate.now(ZoneOffset.UTC).format(STREAM_DATE) + "/[" + version + "]" + HexFormat.of().formatHex(id);
    }
}
