package it.unimib.datai.localfaas.emulator.error;

public final class InvalidRequestIdException extends RuntimeApiException {

    public InvalidRequestIdException(String requestId) {
        super(400, "InvalidRequestID", "Invalid request ID: " + requestId);
    }
}
