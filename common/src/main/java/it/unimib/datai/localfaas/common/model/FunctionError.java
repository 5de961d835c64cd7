package it.unimib.datai.localfaas.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Error body returned to whoever triggered an invocation.
 * Serializes to {@code {"errorMessage", "errorType", "stackTrace", "cause"}}, omitting absent fields.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"errorMessage", "errorType", "stackTrace", "cause"})
public record FunctionError(
        @JsonIgnore ErrorKind kind,
        String errorMessage,
        String errorType,
        List<String> stackTrace,
        FunctionError cause
) {
    public static final String INVALID_ERROR_SHAPE_MESSAGE = "Unable to parse error payload returned by the runtime";

    private static final DateTimeFormatter TIMEOUT_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public FunctionError {
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
    }

    public static FunctionError unhandled(String message, String type, List<String> stackTrace, FunctionError cause) {
        return new FunctionError(ErrorKind.UNHANDLED, message, type, stackTrace, cause);
    }

    public static FunctionError initError(String message, String type, List<String> stackTrace) {
        String effectiveType = (type == null || type.isBlank()) ? ErrorKind.INIT_ERROR.label() : type;
        return new FunctionError(ErrorKind.INIT_ERROR, message, effectiveType, stackTrace, null);
    }

    public static FunctionError crash(String requestId, Integer exitStatus) {
        String message = "RequestId: " + requestId + " Error: Runtime exited without providing a reason";
        if (exitStatus != null) {
            message = message + " (exit status " + exitStatus + ")";
        }
        return new FunctionError(ErrorKind.CRASH, message, ErrorKind.CRASH.label(), null, null);
    }

    public static FunctionError timeout(Instant at, String requestId, long timeoutSeconds) {
        String message = TIMEOUT_TIMESTAMP.format(at) + " " + requestId
                + " Task timed out after " + timeoutSeconds + ".00 seconds";
        return new FunctionError(ErrorKind.TIMEOUT, message, ErrorKind.TIMEOUT.label(), null, null);
    }

    public static FunctionError invalidShape() {
        return new FunctionError(ErrorKind.INVALID_ERROR_SHAPE, INVALID_ERROR_SHAPE_MESSAGE,
                ErrorKind.INVALID_ERROR_SHAPE.label(), null, null);
    }

    /**
     * Type reported to the caller: the worker-supplied type, or the kind's label.
     */
    @JsonIgnore
    public String effectiveType() {
        return (errorType == null || errorType.isBlank()) ? kind.label() : errorType;
    }
}
