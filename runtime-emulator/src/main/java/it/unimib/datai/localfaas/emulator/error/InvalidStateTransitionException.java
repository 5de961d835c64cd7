package it.unimib.datai.localfaas.emulator.error;

import it.unimib.datai.localfaas.emulator.state.RuntimeState;

public final class InvalidStateTransitionException extends RuntimeApiException {

    public InvalidStateTransitionException(RuntimeState from, RuntimeState to) {
        super(403, "InvalidStateTransition", "Transition from " + from + " to " + to + " is not allowed");
    }
}
