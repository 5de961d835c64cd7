package it.unimib.datai.localfaas.emulator.handoff;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;

/**
 * Message passed from the dispatcher to a waiting "next invocation" request.
 */
public sealed interface HandoffMessage permits HandoffMessage.Work, HandoffMessage.WakeUp {

    /**
     * Real work: an invocation to serve to the worker.
     */
    record Work(InvocationContext context) implements HandoffMessage {
    }

    /**
     * Carries no work; only releases a blocked waiter so it can re-check whether it is still wanted.
     */
    record WakeUp() implements HandoffMessage {
    }

    static HandoffMessage work(InvocationContext context) {
        return new Work(context);
    }

    static HandoffMessage wakeUp() {
        return new WakeUp();
    }
}
