package it.unimib.datai.localfaas.emulator.error;

/**
 * Protocol-level failure of a runtime API call. Reported to the caller of the endpoint only;
 * it never completes the in-flight invocation.
 */
public class RuntimeApiException extends RuntimeException {
    private final int status;
    private final String errorType;

    public RuntimeApiException(int status, String errorType, String message) {
        super(message);
        this.status = status;
        this.errorType = errorType;
    }

    public RuntimeApiException(int status, String errorType, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorType = errorType;
    }

    public int status() {
        return status;
    }

    public String errorType() {
        return errorType;
    }
}
