package it.unimib.datai.localfaas.emulator.handoff;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unbuffered single-slot channel between the dispatcher and the "next invocation" endpoint.
 * A publish only succeeds once a waiter has taken the message, so at most one invocation is ever queued.
 */
public final class Handoff {
    private static final Logger log = LoggerFactory.getLogger(Handoff.class);
    // A waiter is counted just before it parks in take().
    private static final long WAKE_GRACE_MS = 50;

    private final SynchronousQueue<HandoffMessage> slot = new SynchronousQueue<>(true);
    private final AtomicInteger waiters = new AtomicInteger();

    /**
     * Offers an invocation to a waiter, blocking up to {@code timeout}.
     *
     * @return true if a waiter took it
     */
    public boolean publish(InvocationContext context, Duration timeout) throws InterruptedException {
        return slot.offer(HandoffMessage.work(context), Math.max(timeout.toMillis(), 0), TimeUnit.MILLISECONDS);
    }

    /**
     * Blocks until a message arrives.
     */
    public HandoffMessage take() throws InterruptedException {
        waiters.incrementAndGet();
        try {
            return slot.take();
        } finally {
            waiters.decrementAndGet();
        }
    }

    /**
     * Wakes every waiter currently blocked in {@link #take()} with a {@link HandoffMessage.WakeUp}.
     * Blocks at most briefly per counted waiter.
     *
     * @return number of waiters woken
     */
    public int wakeWaiters() {
        int woken = 0;
        int pending = waiters.get();
        for (int i = 0; i < pending; i++) {
            try {
                if (slot.offer(HandoffMessage.wakeUp(), WAKE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    woken++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (woken > 0) {
            log.debug("Woke {} waiting next-invocation request(s)", woken);
        }
        return woken;
    }

    public int waiting() {
        return waiters.get();
    }
}
