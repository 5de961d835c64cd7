package it.unimib.datai.localfaas.emulator.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolved emulator settings. Every value has a fixed fallback; explicit builder values win over
 * environment variables.
 */
public record EmulatorConfig(
        String functionName,
        String functionVersion,
        int memorySizeMb,
        int timeoutSeconds,
        String region,
        String accountId,
        String handler,
        String traceId,
        String clientContext,
        String cognitoIdentity,
        String runtimeApiHost,
        int runtimeApiPort,
        int invokePort,
        List<Path> bootstrapCandidates,
        List<String> bootstrapArgs,
        Map<String, String> functionEnvironment,
        boolean stayOpen,
        boolean watch,
        List<Path> watchRoots
) {
    public static final String DEFAULT_FUNCTION_NAME = "test";
    public static final String DEFAULT_VERSION = "$LATEST";
    public static final int DEFAULT_MEMORY_MB = 1536;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_ACCOUNT_ID = "000000000000";
    public static final String DEFAULT_HANDLER = "handler";
    public static final int DEFAULT_RUNTIME_API_PORT = 9001;
    public static final List<Path> DEFAULT_BOOTSTRAP_CANDIDATES =
            List.of(Path.of("/var/task/bootstrap"), Path.of("/opt/bootstrap"));
    public static final List<Path> DEFAULT_WATCH_ROOTS = List.of(Path.of("/var/task"), Path.of("/opt"));

    public EmulatorConfig {
        bootstrapCandidates = List.copyOf(bootstrapCandidates);
        bootstrapArgs = List.copyOf(bootstrapArgs);
        functionEnvironment = Map.copyOf(functionEnvironment);
        watchRoots = List.copyOf(watchRoots);
    }

    public String invokedFunctionArn() {
        return "arn:aws:lambda:" + region + ":" + accountId + ":function:" + functionName;
    }

    public String logGroupName() {
        return "/aws/lambda/" + functionName;
    }

    public static Builder builder() {
        return new Builder(System::getenv);
    }

    public static Builder builder(Function<String, String> getenv) {
        return new Builder(getenv);
    }

    public static final class Builder {
        private final Function<String, String> getenv;

        private String functionName;
        private String functionVersion;
        private Integer memorySizeMb;
        private Integer timeoutSeconds;
        private String region;
        private String accountId;
        private String handler;
        private String traceId;
        private String clientContext;
        private String cognitoIdentity;
        private String runtimeApiHost;
        private Integer runtimeApiPort;
        private Integer invokePort;
        private List<Path> bootstrapCandidates;
        private final List<String> bootstrapArgs = new ArrayList<>();
        private final Map<String, String> functionEnvironment = new LinkedHashMap<>();
        private Boolean stayOpen;
        private Boolean watch;
        private List<Path> watchRoots;

        private Builder(Function<String, String> getenv) {
            this.getenv = getenv;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder functionVersion(String functionVersion) {
            this.functionVersion = functionVersion;
            return this;
        }

        public Builder memorySizeMb(Integer memorySizeMb) {
            this.memorySizeMb = memorySizeMb;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder clientContext(String clientContext) {
            this.clientContext = clientContext;
            return this;
        }

        public Builder cognitoIdentity(String cognitoIdentity) {
            this.cognitoIdentity = cognitoIdentity;
            return this;
        }

        public Builder runtimeApiHost(String runtimeApiHost) {
            this.runtimeApiHost = runtimeApiHost;
            return this;
        }

        public Builder runtimeApiPort(Integer runtimeApiPort) {
            this.runtimeApiPort = runtimeApiPort;
            return this;
        }

        public Builder invokePort(Integer invokePort) {
            this.invokePort = invokePort;
            return this;
        }

        public Builder bootstrapCandidates(List<Path> bootstrapCandidates) {
            this.bootstrapCandidates = bootstrapCandidates;
            return this;
        }

        public Builder bootstrapArgs(List<String> args) {
            if (args != null) {
                this.bootstrapArgs.addAll(args);
            }
            return this;
        }

        public Builder functionEnvironment(Map<String, String> environment) {
            if (environment != null) {
                this.functionEnvironment.putAll(environment);
            }
            return this;
        }

        public Builder stayOpen(Boolean stayOpen) {
            this.stayOpen = stayOpen;
            return this;
        }

        public Builder watch(Boolean watch) {
            this.watch = watch;
            return this;
        }

        public Builder watchRoots(List<Path> watchRoots) {
            this.watchRoots = watchRoots;
            return this;
        }

        public EmulatorConfig build() {
            int effectiveRuntimePort = firstNonNull(runtimeApiPort,
                    parseInt("DOCKER_LAMBDA_RUNTIME_PORT"), DEFAULT_RUNTIME_API_PORT);
            int defaultInvokePort = effectiveRuntimePort == DEFAULT_RUNTIME_API_PORT
                    ? DEFAULT_RUNTIME_API_PORT + 1
                    : 0;
            int effectiveTimeout = firstNonNull(timeoutSeconds,
                    parseInt("AWS_LAMBDA_FUNCTION_TIMEOUT"), DEFAULT_TIMEOUT_SECONDS);
            if (effectiveTimeout <= 0) {
                throw new IllegalArgumentException("Timeout must be positive, got " + effectiveTimeout);
            }

            return new EmulatorConfig(
                    firstNonBlank(functionName, env("AWS_LAMBDA_FUNCTION_NAME"), DEFAULT_FUNCTION_NAME),
                    firstNonBlank(functionVersion, env("AWS_LAMBDA_FUNCTION_VERSION"), DEFAULT_VERSION),
                    firstNonNull(memorySizeMb, parseInt("AWS_LAMBDA_FUNCTION_MEMORY_SIZE"), DEFAULT_MEMORY_MB),
                    effectiveTimeout,
                    firstNonBlank(region, env("AWS_REGION"), env("AWS_DEFAULT_REGION"), DEFAULT_REGION),
                    firstNonBlank(accountId, env("AWS_ACCOUNT_ID"), DEFAULT_ACCOUNT_ID),
                    firstNonBlank(handler, env("AWS_LAMBDA_FUNCTION_HANDLER"), env("_HANDLER"), DEFAULT_HANDLER),
                    firstNonBlank(traceId, env("_X_AMZN_TRACE_ID")),
                    firstNonBlank(clientContext, env("AWS_LAMBDA_CLIENT_CONTEXT")),
                    firstNonBlank(cognitoIdentity, env("AWS_LAMBDA_COGNITO_IDENTITY")),
                    firstNonBlank(runtimeApiHost, "127.0.0.1"),
                    effectiveRuntimePort,
                    firstNonNull(invokePort, parseInt("DOCKER_LAMBDA_API_PORT"), defaultInvokePort),
                    bootstrapCandidates == null || bootstrapCandidates.isEmpty()
                            ? DEFAULT_BOOTSTRAP_CANDIDATES : bootstrapCandidates,
                    bootstrapArgs,
                    functionEnvironment,
                    firstNonNull(stayOpen, parseBoolean("DOCKER_LAMBDA_STAY_OPEN"), false),
                    firstNonNull(watch, parseBoolean("DOCKER_LAMBDA_WATCH"), false),
                    watchRoots == null || watchRoots.isEmpty() ? DEFAULT_WATCH_ROOTS : watchRoots
            );
        }

        private String env(String name) {
            return getenv.apply(name);
        }

        private Integer parseInt(String name) {
            String raw = env(name);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Environment variable " + name + " is not a number: " + raw, e);
            }
        }

        private Boolean parseBoolean(String name) {
            String raw = env(name);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            return raw.equals("1") || raw.equalsIgnoreCase("true");
        }

        @SafeVarargs
        private static <T> T firstNonNull(T... values) {
            for (T v : values) {
                if (v != null) {
                    return v;
                }
            }
            return null;
        }

        private static String firstNonBlank(String... values) {
            for (String v : values) {
                if (v != null && !v.isBlank()) {
                    return v;
                }
            }
            return null;
        }
    }
}
