package it.unimib.datai.localfaas.emulator.state;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.error.InvalidStateTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the emulator's shared mutable state: the protocol state, the invocation the dispatcher
 * has in flight, and the invocation last handed to the worker.
 *
 * State changes go through {@link #enter} or {@link #transition}, both under one lock.
 * The context references are volatile so the worker exit watcher can read them without the lock.
 */
public final class RuntimeSession {
    private static final Logger log = LoggerFactory.getLogger(RuntimeSession.class);

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by 'lock'
    private RuntimeState state = RuntimeState.INIT;

    private volatile InvocationContext current;
    private volatile InvocationContext served;

    @FunctionalInterface
    public interface GuardedAction<T> {
        T run() throws IOException;
    }

    /**
     * Checks that {@code target} may follow the current state and commits it immediately.
     */
    public void enter(RuntimeState target) {
        lock.lock();
        try {
            check(target);
            state = target;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks that {@code target} may follow the current state, runs {@code action}, and commits
     * {@code target} only if the action returns normally.
     */
    public <T> T transition(RuntimeState target, GuardedAction<T> action) throws IOException {
        lock.lock();
        try {
            check(target);
            T result = action.run();
            state = target;
            return result;
        } finally {
            lock.unlock();
        }
    }

    private void check(RuntimeState target) {
        if (!target.canFollow(state)) {
            log.warn("Rejected runtime API transition {} -> {}", state, target);
            throw new InvalidStateTransitionException(state, target);
        }
    }

    public void reset() {
        lock.lock();
        try {
            if (state != RuntimeState.INIT) {
                log.debug("Resetting runtime state {} -> INIT", state);
            }
            state = RuntimeState.INIT;
            served = null;
        } finally {
            lock.unlock();
        }
    }

    public RuntimeState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers the invocation the dispatcher is about to hand to the worker.
     */
    public void begin(InvocationContext context) {
        this.current = context;
    }

    public InvocationContext current() {
        return current;
    }

    public void markServed(InvocationContext context) {
        this.served = context;
    }

    /**
     * Forgets {@code context} as the served invocation, if it still is.
     */
    public void clearServed(InvocationContext context) {
        lock.lock();
        try {
            if (served == context) {
                served = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public InvocationContext served() {
        return served;
    }
}
