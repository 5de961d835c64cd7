package it.unimib.datai.localfaas.emulator.dispatch;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.context.InvocationContextFactory;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.http.NamedThreadFactory;
import it.unimib.datai.localfaas.emulator.lifecycle.RestartReason;
import it.unimib.datai.localfaas.emulator.lifecycle.RestartRequests;
import it.unimib.datai.localfaas.emulator.metrics.EmulatorMetrics;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Runs invocations against the worker one at a time.
 *
 * Each call takes the single permit, creates the context (which fixes its deadline), makes sure
 * the worker is running, hands the context over and waits for it to complete. Every wait is
 * bounded by the context's deadline; on expiry the context completes with the timeout error.
 */
public class InvocationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(InvocationDispatcher.class);
    private static final Duration PUBLISH_SLICE = Duration.ofMillis(100);

    private final Semaphore permit = new Semaphore(1, true);
    private final InvocationContextFactory contexts;
    private final RuntimeSession session;
    private final Handoff handoff;
    private final WorkerSupervisor supervisor;
    private final RestartRequests restarts;
    private final EmulatorMetrics metrics;
    private final boolean restartOnTimeout;
    private final ExecutorService background =
            Executors.newSingleThreadExecutor(new NamedThreadFactory("localfaas-event-"));

    public InvocationDispatcher(InvocationContextFactory contexts, RuntimeSession session, Handoff handoff,
                                WorkerSupervisor supervisor, RestartRequests restarts, EmulatorMetrics metrics,
                                boolean restartOnTimeout) {
        this.contexts = contexts;
        this.session = session;
        this.handoff = handoff;
        this.supervisor = supervisor;
        this.restarts = restarts;
        this.metrics = metrics;
        this.restartOnTimeout = restartOnTimeout;
    }

    /**
     * Runs one invocation and blocks until it completes or its deadline passes.
     *
     * @throws it.unimib.datai.localfaas.emulator.supervisor.WorkerStartException if the worker cannot be started
     */
    public InvocationContext invoke(InvocationRequest request) throws InterruptedException {
        permit.acquire();
        metrics.incInFlight();
        try {
            InvocationContext context = contexts.create(request);
            run(context);
            metrics.recordCompletion(context);
            return context;
        } finally {
            metrics.decInFlight();
            permit.release();
        }
    }

    /**
     * Queues an {@code Event} invocation. The result is only logged.
     */
    public CompletableFuture<InvocationContext> invokeAsync(InvocationRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                InvocationContext context = invoke(request);
                if (context.failed()) {
                    log.warn("Event invocation {} failed: {}", context.requestId(), context.error().errorMessage());
                } else {
                    log.info("Event invocation {} completed", context.requestId());
                }
                return context;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while running event invocation", e);
            } catch (RuntimeException e) {
                log.error("Event invocation failed to run: {}", e.getMessage(), e);
                throw e;
            }
        }, background);
    }

    private void run(InvocationContext context) throws InterruptedException {
        session.begin(context);
        Instant workerStartedAt = supervisor.ensureRunning(context);
        if (workerStartedAt != null) {
            context.markColdStart(workerStartedAt);
        }
        supervisor.attach(context);

        boolean delivered = false;
        while (!delivered && !context.isCompleted() && !context.hasExpired()) {
            Duration remaining = context.remaining();
            delivered = handoff.publish(context, remaining.compareTo(PUBLISH_SLICE) < 0 ? remaining : PUBLISH_SLICE);
        }
        if (!delivered && !context.isCompleted()) {
            log.warn("Invocation {} was not picked up by the worker before its deadline", context.requestId());
        }

        while (!context.isCompleted() && !context.hasExpired()) {
            context.awaitCompletion(context.remaining());
        }
        if (context.timeOut()) {
            log.warn("Invocation {} timed out after {}s ({} ms elapsed)",
                    context.requestId(), context.timeoutSeconds(), context.elapsed().toMillis());
            if (restartOnTimeout) {
                restarts.request(RestartReason.TIMEOUT);
            }
        }
        // Another path may have claimed the invocation and still be writing its reply.
        context.completion().join();
    }

    public void shutdown() {
        background.shutdownNow();
    }
}
