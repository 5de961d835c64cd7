package it.unimib.datai.localfaas.common.runtime;

/**
 * Header names and path prefixes of the emulated runtime and invoke APIs.
 */
public final class RuntimeApiHeaders {
    private RuntimeApiHeaders() {}

    public static final String RUNTIME_API_VERSION = "2018-06-01";
    public static final String INVOKE_API_VERSION = "2015-03-31";

    // control plane -> worker
    public static final String REQUEST_ID = "Lambda-Runtime-Aws-Request-Id";
    public static final String DEADLINE_MS = "Lambda-Runtime-Deadline-Ms";
    public static final String INVOKED_FUNCTION_ARN = "Lambda-Runtime-Invoked-Function-Arn";
    public static final String TRACE_ID = "Lambda-Runtime-Trace-Id";
    public static final String CLIENT_CONTEXT = "Lambda-Runtime-Client-Context";
    public static final String COGNITO_IDENTITY = "Lambda-Runtime-Cognito-Identity";
    public static final String LOG_TYPE = "Docker-Lambda-Log-Type";

    // worker -> control plane
    public static final String INVOKE_WAIT = "Docker-Lambda-Invoke-Wait";
    public static final String INIT_END = "Docker-Lambda-Init-End";
    public static final String LOG_RESULT = "Docker-Lambda-Log-Result";
    public static final String FUNCTION_ERROR_TYPE = "Lambda-Runtime-Function-Error-Type";

    // invoke API
    public static final String AMZ_INVOCATION_TYPE = "X-Amz-Invocation-Type";
    public static final String AMZ_CLIENT_CONTEXT = "X-Amz-Client-Context";
    public static final String AMZ_LOG_TYPE = "X-Amz-Log-Type";
    public static final String AMZ_LOG_RESULT = "X-Amz-Log-Result";
    public static final String AMZ_FUNCTION_ERROR = "X-Amz-Function-Error";
    public static final String AMZ_EXECUTED_VERSION = "X-Amz-Executed-Version";

    public static final String LOG_TYPE_TAIL = "Tail";
    public static final String FUNCTION_ERROR_UNHANDLED = "Unhandled";

    public static String runtimePath(String suffix) {
        return "/" + RUNTIME_API_VERSION + suffix;
    }

    public static String invokePath(String functionName) {
        return "/" + INVOKE_API_VERSION + "/functions/" + functionName + "/invocations";
    }
}
