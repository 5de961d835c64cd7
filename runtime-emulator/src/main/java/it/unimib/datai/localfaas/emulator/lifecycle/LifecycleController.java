package it.unimib.datai.localfaas.emulator.lifecycle;

import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.metrics.EmulatorMetrics;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Consumes restart requests and owns process shutdown.
 *
 * In stay-open mode a restart kills the worker, fails the invocation it was running and puts the
 * protocol back to INIT; the next invocation starts a fresh worker. Without a persistent server
 * a restart request ends the process with {@link #EXIT_RESTART}.
 */
public final class LifecycleController {
    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVOCATION_ERROR = 1;
    public static final int EXIT_RESTART = 2;

    private static final Duration POLL = Duration.ofMillis(250);

    private final RestartRequests restarts;
    private final WorkerSupervisor supervisor;
    private final RuntimeSession session;
    private final Handoff handoff;
    private final EmulatorMetrics metrics;
    private final boolean stayOpen;
    private final ExitHandler exitHandler;
    private final Runnable releaseResources;

    private volatile boolean running;
    private Thread thread;

    public LifecycleController(RestartRequests restarts, WorkerSupervisor supervisor, RuntimeSession session,
                               Handoff handoff, EmulatorMetrics metrics, boolean stayOpen,
                               ExitHandler exitHandler, Runnable releaseResources) {
        this.restarts = restarts;
        this.supervisor = supervisor;
        this.session = session;
        this.handoff = handoff;
        this.metrics = metrics;
        this.stayOpen = stayOpen;
        this.exitHandler = exitHandler;
        this.releaseResources = releaseResources;
    }

    public void start() {
        running = true;
        thread = new Thread(this::loop, "localfaas-lifecycle");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * SIGHUP restarts the worker; SIGINT and SIGTERM shut down with status 0.
     */
    public void installSignalHandlers() {
        SignalBridge.install("HUP", () -> restarts.request(RestartReason.SIGNAL));
        Runnable shutdown = () -> {
            Thread t = new Thread(() -> shutdown(EXIT_OK), "localfaas-shutdown");
            t.start();
        };
        SignalBridge.install("INT", shutdown);
        SignalBridge.install("TERM", shutdown);
    }

    private void loop() {
        while (running) {
            try {
                RestartReason reason = restarts.poll(POLL);
                if (reason != null) {
                    restart(reason);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Worker restart failed", e);
            }
        }
    }

    public void restart(RestartReason reason) {
        metrics.recordRestart(reason);
        if (!stayOpen) {
            log.info("Restart requested ({}) without a persistent server, exiting", reason);
            shutdown(EXIT_RESTART);
            return;
        }
        InvocationContext inFlight = session.current();
        boolean killed = supervisor.kill();
        if (inFlight != null && !inFlight.isCompleted()) {
            inFlight.complete(FunctionError.crash(inFlight.requestId(), null));
        }
        session.reset();
        handoff.wakeWaiters();
        int coalesced = restarts.drain();
        log.info("Worker restarted ({}){}{}", reason, killed ? "" : ", no worker was running",
                coalesced > 0 ? ", " + coalesced + " further request(s) coalesced" : "");
    }

    /**
     * Kills the worker, releases the servers and exits with {@code status}.
     */
    public void shutdown(int status) {
        running = false;
        supervisor.kill();
        try {
            releaseResources.run();
        } catch (RuntimeException e) {
            log.warn("Error while shutting down: {}", e.getMessage());
        }
        log.info("Exiting with status {}", status);
        exitHandler.exit(status);
    }

    /**
     * The worker can never start: log the cause and exit with status 1.
     */
    public void fatal(RuntimeException cause) {
        log.error("Fatal: {}", cause.getMessage());
        shutdown(EXIT_INVOCATION_ERROR);
    }
}
