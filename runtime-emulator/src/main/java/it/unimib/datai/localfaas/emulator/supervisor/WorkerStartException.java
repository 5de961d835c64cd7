package it.unimib.datai.localfaas.emulator.supervisor;

/**
 * The worker could not be started. Not recoverable by retrying the invocation.
 */
public class WorkerStartException extends RuntimeException {

    public WorkerStartException(String message) {
        super(message);
    }

    public WorkerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
