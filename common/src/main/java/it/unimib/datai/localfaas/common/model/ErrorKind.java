package it.unimib.datai.localfaas.common.model;

/**
 * Origin of an invocation failure. The label is the {@code errorType} reported
 * to the caller when the failure carries no type of its own.
 */
public enum ErrorKind {
    UNHANDLED("Unhandled"),
    INIT_ERROR("Runtime.InitError"),
    CRASH("Runtime.ExitError"),
    TIMEOUT("Sandbox.Timedout"),
    INVALID_ERROR_SHAPE("InvalidErrorShape");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
