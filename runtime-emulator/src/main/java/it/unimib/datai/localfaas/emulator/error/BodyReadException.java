package it.unimib.datai.localfaas.emulator.error;

public final class BodyReadException extends RuntimeApiException {

    public BodyReadException(int status, String message) {
        super(status, "BodyReadError", message);
    }

    public BodyReadException(String message, Throwable cause) {
        super(400, "BodyReadError", message, cause);
    }
}
