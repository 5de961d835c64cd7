package it.unimib.datai.localfaas.emulator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.context.InvocationContextFactory;
import it.unimib.datai.localfaas.emulator.context.MemoryProbe;
import it.unimib.datai.localfaas.emulator.controlplane.ControlPlaneServer;
import it.unimib.datai.localfaas.emulator.dispatch.InvocationDispatcher;
import it.unimib.datai.localfaas.emulator.dispatch.InvocationRequest;
import it.unimib.datai.localfaas.emulator.dispatch.InvokeServer;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.lifecycle.ExitHandler;
import it.unimib.datai.localfaas.emulator.lifecycle.FileWatcher;
import it.unimib.datai.localfaas.emulator.lifecycle.LifecycleController;
import it.unimib.datai.localfaas.emulator.lifecycle.RestartRequests;
import it.unimib.datai.localfaas.emulator.metrics.EmulatorMetrics;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.supervisor.BootstrapLocator;
import it.unimib.datai.localfaas.emulator.supervisor.ReadinessProbe;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerEnvironment;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerListener;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One emulated function: runtime API, worker supervisor, dispatcher and, in stay-open mode,
 * the invoke API.
 */
public final class LocalEmulator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocalEmulator.class);

    private final EmulatorConfig config;
    private final RuntimeSession session = new RuntimeSession();
    private final Handoff handoff = new Handoff();
    private final RestartRequests restarts = new RestartRequests();
    private final EmulatorMetrics metrics;
    private final WorkerSupervisor supervisor;
    private final ControlPlaneServer controlPlane;
    private final InvocationDispatcher dispatcher;
    private final LifecycleController lifecycle;
    private final InvokeServer invokeServer;
    private final FileWatcher fileWatcher;
    private final AtomicBoolean closed = new AtomicBoolean();

    private LocalEmulator(Builder b) {
        this.config = b.config;
        ObjectMapper objectMapper = b.objectMapper;
        this.metrics = new EmulatorMetrics(config.functionName());

        this.controlPlane = new ControlPlaneServer(config.runtimeApiHost(), config.runtimeApiPort(), objectMapper,
                session, handoff, this::liveGeneration);
        this.supervisor = new WorkerSupervisor(new BootstrapLocator(config.bootstrapCandidates()),
                config.bootstrapArgs(), new WorkerEnvironment(config), this::runtimeApiAddress,
                b.readinessProbe, session);
        supervisor.addListener(new WorkerListener() {
            @Override
            public void onSpawn(long generation) {
                session.reset();
                metrics.recordWorkerStart();
            }

            @Override
            public void onExit(long generation, int exitCode, boolean intentional) {
                handoff.wakeWaiters();
            }
        });

        MemoryProbe memoryProbe = new MemoryProbe();
        InvocationContextFactory contexts = new InvocationContextFactory(config,
                () -> memoryProbe.maxMemoryUsedMb(supervisor.workerPid()));
        this.dispatcher = new InvocationDispatcher(contexts, session, handoff, supervisor, restarts, metrics,
                config.stayOpen());
        this.lifecycle = new LifecycleController(restarts, supervisor, session, handoff, metrics,
                config.stayOpen(), b.exitHandler, this::close);
        this.invokeServer = config.stayOpen()
                ? new InvokeServer(config.runtimeApiHost(), config.invokePort(), dispatcher, objectMapper,
                        metrics.getRegistry(), lifecycle::fatal)
                : null;
        this.fileWatcher = config.watch()
                ? new FileWatcher(config.watchRoots(), restarts, FileWatcher.DEFAULT_DEBOUNCE)
                : null;
    }

    public static Builder builder(EmulatorConfig config) {
        return new Builder(config);
    }

    public void start() {
        controlPlane.start();
        if (invokeServer != null) {
            invokeServer.start();
        }
        lifecycle.start();
        if (fileWatcher != null) {
            try {
                fileWatcher.start();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to watch " + config.watchRoots(), e);
            }
        }
        log.info("Emulating function '{}' ({} MB, {}s timeout, {})", config.functionName(), config.memorySizeMb(),
                config.timeoutSeconds(), config.stayOpen() ? "stay-open" : "one-shot");
    }

    /**
     * Runs one invocation to completion.
     */
    public InvocationContext invoke(InvocationRequest request) throws InterruptedException {
        return dispatcher.invoke(request);
    }

    public LifecycleController lifecycle() {
        return lifecycle;
    }

    public RestartRequests restarts() {
        return restarts;
    }

    public EmulatorMetrics metrics() {
        return metrics;
    }

    public WorkerSupervisor supervisor() {
        return supervisor;
    }

    public RuntimeSession session() {
        return session;
    }

    public EmulatorConfig config() {
        return config;
    }

    public int runtimeApiPort() {
        return controlPlane.port();
    }

    /**
     * Port of the invoke API, or -1 in one-shot mode.
     */
    public int invokePort() {
        return invokeServer == null ? -1 : invokeServer.port();
    }

    String runtimeApiAddress() {
        return config.runtimeApiHost() + ":" + controlPlane.port();
    }

    private long liveGeneration() {
        return supervisor.liveGeneration();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        lifecycle.stop();
        if (fileWatcher != null) {
            try {
                fileWatcher.close();
            } catch (IOException e) {
                log.warn("Failed to close file watcher: {}", e.getMessage());
            }
        }
        supervisor.kill();
        handoff.wakeWaiters();
        if (invokeServer != null) {
            invokeServer.stop();
        }
        controlPlane.stop();
        dispatcher.shutdown();
    }

    public static final class Builder {
        private final EmulatorConfig config;
        private ObjectMapper objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        private ExitHandler exitHandler = ExitHandler.SYSTEM;
        private ReadinessProbe readinessProbe = new ReadinessProbe();

        private Builder(EmulatorConfig config) {
            this.config = config;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder exitHandler(ExitHandler exitHandler) {
            this.exitHandler = exitHandler;
            return this;
        }

        public Builder readinessProbe(ReadinessProbe readinessProbe) {
            this.readinessProbe = readinessProbe;
            return this;
        }

        public LocalEmulator build() {
            if (config == null) {
                throw new IllegalStateException("EmulatorConfig must be set");
            }
            return new LocalEmulator(this);
        }
    }
}
