package it.unimib.datai.localfaas.emulator.supervisor;

import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Starts the worker executable at most once per lifetime and reports its unexpected exit as a
 * crash of the invocation in flight.
 */
public class WorkerSupervisor {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);
    private static final long KILL_WAIT_SECONDS = 5;

    private final ReentrantLock startLock = new ReentrantLock();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong liveGeneration = new AtomicLong(-1);
    private final AtomicReference<WorkerHandle> current = new AtomicReference<>();
    private final List<WorkerListener> listeners = new CopyOnWriteArrayList<>();

    private final BootstrapLocator locator;
    private final List<String> bootstrapArgs;
    private final Supplier<Map<String, String>> environment;
    private final Supplier<String> runtimeApiAddress;
    private final ReadinessProbe probe;
    private final RuntimeSession session;
    private final OutputStream passthrough;

    private volatile InvocationContext attached;

    public WorkerSupervisor(BootstrapLocator locator, List<String> bootstrapArgs, WorkerEnvironment environment,
                            Supplier<String> runtimeApiAddress, ReadinessProbe probe, RuntimeSession session) {
        this(locator, bootstrapArgs, () -> environment.build(runtimeApiAddress.get()), runtimeApiAddress,
                probe, session, System.err);
    }

    WorkerSupervisor(BootstrapLocator locator, List<String> bootstrapArgs, Supplier<Map<String, String>> environment,
                     Supplier<String> runtimeApiAddress, ReadinessProbe probe, RuntimeSession session,
                     OutputStream passthrough) {
        this.locator = locator;
        this.bootstrapArgs = List.copyOf(bootstrapArgs);
        this.environment = environment;
        this.runtimeApiAddress = runtimeApiAddress;
        this.probe = probe;
        this.session = session;
        this.passthrough = passthrough;
    }

    public void addListener(WorkerListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts the worker unless one is already running.
     *
     * @return the instant the worker was started if this call started it, otherwise {@code null}
     * @throws WorkerStartException if no bootstrap exists, the runtime API is unreachable or the process fails to start
     */
    public Instant ensureRunning(InvocationContext context) {
        startLock.lock();
        try {
            if (current.get() != null) {
                return null;
            }
            String address = runtimeApiAddress.get();
            if (!probe.awaitReady(address, context)) {
                throw new WorkerStartException("Runtime API at " + address + " is not reachable");
            }
            Path bootstrap = locator.locate();
            List<String> command = new ArrayList<>();
            command.add(bootstrap.toString());
            command.addAll(bootstrapArgs);

            ProcessBuilder builder = new ProcessBuilder(command);
            builder.environment().clear();
            builder.environment().putAll(environment.get());
            Path parent = bootstrap.toAbsolutePath().getParent();
            if (parent != null) {
                builder.directory(parent.toFile());
            }

            // The worker may call the runtime API before start() returns.
            long generation = generations.incrementAndGet();
            for (WorkerListener listener : listeners) {
                listener.onSpawn(generation);
            }
            liveGeneration.set(generation);
            Instant startedAt = Instant.now();
            Process process;
            try {
                process = builder.start();
            } catch (IOException e) {
                liveGeneration.set(-1);
                throw new WorkerStartException("Failed to start " + bootstrap + ": " + e.getMessage(), e);
            }
            WorkerHandle handle = new WorkerHandle(generation, process);
            current.set(handle);
            log.info("Started worker {} (pid {}, generation {})", bootstrap, process.pid(), generation);

            StreamPump.start("localfaas-worker-stdout-" + generation, process.getInputStream(), passthrough, this::attached);
            StreamPump.start("localfaas-worker-stderr-" + generation, process.getErrorStream(), passthrough, this::attached);
            Thread watcher = new Thread(() -> watch(handle), "localfaas-worker-watcher-" + generation);
            watcher.setDaemon(true);
            watcher.start();
            return startedAt;
        } finally {
            startLock.unlock();
        }
    }

    private void watch(WorkerHandle handle) {
        int exitCode;
        try {
            exitCode = handle.process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        release(handle);
        boolean intentional = handle.intentional.get();
        if (intentional) {
            log.info("Worker generation {} stopped (exit code {})", handle.generation, exitCode);
        } else {
            log.warn("Worker generation {} exited unexpectedly with code {}", handle.generation, exitCode);
            InvocationContext context = session.current();
            if (context != null && !context.isCompleted()) {
                context.complete(FunctionError.crash(context.requestId(), exitCode));
            }
        }
        for (WorkerListener listener : listeners) {
            listener.onExit(handle.generation, exitCode, intentional);
        }
    }

    /**
     * Forcibly stops the worker and everything it spawned. The exit is not reported as a crash.
     *
     * @return true if a worker was running
     */
    public boolean kill() {
        WorkerHandle handle = current.get();
        if (handle == null) {
            return false;
        }
        handle.intentional.set(true);
        handle.process.descendants().forEach(ProcessHandle::destroyForcibly);
        handle.process.destroyForcibly();
        try {
            if (!handle.process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pid {} did not exit within {}s of being killed", handle.process.pid(), KILL_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        release(handle);
        return true;
    }

    private void release(WorkerHandle handle) {
        liveGeneration.compareAndSet(handle.generation, -1);
        current.compareAndSet(handle, null);
    }

    public boolean isRunning() {
        return current.get() != null;
    }

    /**
     * Generation of the running worker, or -1 when none is running.
     */
    public long liveGeneration() {
        return liveGeneration.get();
    }

    public OptionalLong workerPid() {
        WorkerHandle handle = current.get();
        return handle == null ? OptionalLong.empty() : OptionalLong.of(handle.process.pid());
    }

    /**
     * Routes the worker's output into {@code context}'s log tail until another context is attached.
     */
    public void attach(InvocationContext context) {
        this.attached = context;
    }

    InvocationContext attached() {
        return attached;
    }

    private static final class WorkerHandle {
        final long generation;
        final Process process;
        final AtomicBoolean intentional = new AtomicBoolean();

        WorkerHandle(long generation, Process process) {
            this.generation = generation;
            this.process = process;
        }
    }
}
