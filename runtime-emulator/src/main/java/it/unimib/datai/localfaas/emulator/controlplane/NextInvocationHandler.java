package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.handoff.HandoffMessage;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.state.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * {@code GET /2018-06-01/runtime/invocation/next}: blocks until the dispatcher hands over an
 * invocation, then serves its payload and identity headers to the worker.
 *
 * Only the newest waiter is wanted. The worker runs one invocation at a time, so a fresh fetch means
 * any older waiter belongs to a connection the worker gave up on; those are woken and dropped.
 */
public final class NextInvocationHandler extends RuntimeApiHandler {
    private static final Logger log = LoggerFactory.getLogger(NextInvocationHandler.class);

    private final RuntimeSession session;
    private final Handoff handoff;
    private final LongSupplier liveGeneration;
    private final AtomicLong newestWaiter = new AtomicLong();

    /**
     * @param liveGeneration generation of the running worker; changes when that worker exits
     */
    public NextInvocationHandler(ObjectMapper objectMapper, RuntimeSession session, Handoff handoff,
                                 LongSupplier liveGeneration) {
        super(objectMapper, "GET");
        this.session = session;
        this.handoff = handoff;
        this.liveGeneration = liveGeneration;
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        session.enter(RuntimeState.INVOKE_NEXT);
        completeUnacknowledged();

        long generation = liveGeneration.getAsLong();
        long ticket = newestWaiter.incrementAndGet();
        if (handoff.waiting() > 0) {
            handoff.wakeWaiters();
        }
        while (true) {
            HandoffMessage message;
            try {
                message = handoff.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }

            boolean stale = liveGeneration.getAsLong() != generation;
            boolean superseded = newestWaiter.get() != ticket;
            if (message instanceof HandoffMessage.WakeUp) {
                if (stale || superseded) {
                    log.debug("Dropping next-invocation request {} of worker generation {} (stale={}, superseded={})",
                            ticket, generation, stale, superseded);
                    exchange.close();
                    return;
                }
                continue;
            }

            InvocationContext context = ((HandoffMessage.Work) message).context();
            if (stale || superseded) {
                handBack(context, "request " + ticket + " of worker generation " + generation + " is gone");
                exchange.close();
                return;
            }
            if (context.isCompleted()) {
                log.debug("Skipping invocation {}: already completed", context.requestId());
                continue;
            }
            deliver(exchange, context);
            return;
        }
    }

    // A worker may fetch the next event without acknowledging the previous one.
    private void completeUnacknowledged() {
        InvocationContext previous = session.served();
        if (previous != null && !previous.isCompleted()) {
            log.info("Invocation {} was not acknowledged before the next fetch, completing it", previous.requestId());
            previous.complete(null);
        }
    }

    private void handBack(InvocationContext context, String reason) {
        log.debug("Handing invocation {} back: {}", context.requestId(), reason);
        try {
            if (!context.isCompleted() && !handoff.publish(context, context.remaining())) {
                context.complete(FunctionError.crash(context.requestId(), null));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.complete(FunctionError.crash(context.requestId(), null));
        }
    }

    private void deliver(HttpExchange exchange, InvocationContext context) throws IOException {
        session.markServed(context);
        context.markServed();

        Headers headers = exchange.getResponseHeaders();
        headers.set(RuntimeApiHeaders.REQUEST_ID, context.requestId());
        headers.set(RuntimeApiHeaders.DEADLINE_MS, String.valueOf(context.deadline().toEpochMilli()));
        headers.set(RuntimeApiHeaders.INVOKED_FUNCTION_ARN, context.invokedFunctionArn());
        if (context.traceId() != null) {
            headers.set(RuntimeApiHeaders.TRACE_ID, context.traceId());
        }
        if (context.clientContext() != null) {
            headers.set(RuntimeApiHeaders.CLIENT_CONTEXT, context.clientContext());
        }
        if (context.cognitoIdentity() != null) {
            headers.set(RuntimeApiHeaders.COGNITO_IDENTITY, context.cognitoIdentity());
        }
        if (context.tailLogs()) {
            headers.set(RuntimeApiHeaders.LOG_TYPE, RuntimeApiHeaders.LOG_TYPE_TAIL);
        }
        try {
            HttpExchanges.sendBytes(exchange, 200, HttpExchanges.APPLICATION_JSON, context.payload());
        } catch (IOException e) {
            log.warn("Failed to deliver invocation {} to the worker: {}", context.requestId(), e.getMessage());
            session.clearServed(context);
            handBack(context, "delivery failed");
            exchange.close();
        }
    }
}
