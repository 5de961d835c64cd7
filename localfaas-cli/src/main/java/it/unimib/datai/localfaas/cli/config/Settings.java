package it.unimib.datai.localfaas.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of the YAML settings file. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Settings {
    private String functionName;
    private String functionVersion;
    private Integer memorySize;
    private Integer timeout;
    private String region;
    private String accountId;
    private String handler;
    private Integer runtimePort;
    private Integer invokePort;
    private List<String> bootstrap = new ArrayList<>();
    private List<String> watchPaths = new ArrayList<>();
    private String envVars;
    private Map<String, String> environment = new LinkedHashMap<>();

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionVersion() {
        return functionVersion;
    }

    public void setFunctionVersion(String functionVersion) {
        this.functionVersion = functionVersion;
    }

    public Integer getMemorySize() {
        return memorySize;
    }

    public void setMemorySize(Integer memorySize) {
        this.memorySize = memorySize;
    }

    public Integer getTimeout() {
        return timeout;
    }

    public void setTimeout(Integer timeout) {
        this.timeout = timeout;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getHandler() {
        return handler;
    }

    public void setHandler(String handler) {
        this.handler = handler;
    }

    public Integer getRuntimePort() {
        return runtimePort;
    }

    public void setRuntimePort(Integer runtimePort) {
        this.runtimePort = runtimePort;
    }

    public Integer getInvokePort() {
        return invokePort;
    }

    public void setInvokePort(Integer invokePort) {
        this.invokePort = invokePort;
    }

    public List<String> getBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(List<String> bootstrap) {
        this.bootstrap = (bootstrap == null) ? new ArrayList<>() : new ArrayList<>(bootstrap);
    }

    public List<String> getWatchPaths() {
        return watchPaths;
    }

    public void setWatchPaths(List<String> watchPaths) {
        this.watchPaths = (watchPaths == null) ? new ArrayList<>() : new ArrayList<>(watchPaths);
    }

    public String getEnvVars() {
        return envVars;
    }

    public void setEnvVars(String envVars) {
        this.envVars = envVars;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public void setEnvironment(Map<String, String> environment) {
        this.environment = (environment == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(environment);
    }

    /**
     * The scalar settings keyed by the environment variable each one stands in for.
     */
    public Map<String, String> asEnvironmentDefaults() {
        Map<String, String> env = new LinkedHashMap<>();
        put(env, "AWS_LAMBDA_FUNCTION_NAME", functionName);
        put(env, "AWS_LAMBDA_FUNCTION_VERSION", functionVersion);
        put(env, "AWS_LAMBDA_FUNCTION_MEMORY_SIZE", memorySize);
        put(env, "AWS_LAMBDA_FUNCTION_TIMEOUT", timeout);
        put(env, "AWS_REGION", region);
        put(env, "AWS_ACCOUNT_ID", accountId);
        put(env, "AWS_LAMBDA_FUNCTION_HANDLER", handler);
        put(env, "DOCKER_LAMBDA_RUNTIME_PORT", runtimePort);
        put(env, "DOCKER_LAMBDA_API_PORT", invokePort);
        return env;
    }

    private static void put(Map<String, String> env, String name, Object value) {
        if (value != null) {
            env.put(name, value.toString());
        }
    }
}
