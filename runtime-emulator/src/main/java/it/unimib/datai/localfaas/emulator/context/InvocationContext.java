package it.unimib.datai.localfaas.emulator.context;

import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.common.model.InvocationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * State of a single invocation attempt.
 *
 * Identity, payload and deadline are fixed at creation. The reply, timing headers and
 * memory sample are written once, by whichever path completes the invocation first;
 * every later {@link #complete} call is a no-op.
 */
public final class InvocationContext {
    private static final Logger log = LoggerFactory.getLogger(InvocationContext.class);

    private final String requestId;
    private final String invokedFunctionArn;
    private final String functionVersion;
    private final int memorySizeMb;
    private final String traceId;
    private final String clientContext;
    private final String cognitoIdentity;
    private final byte[] payload;
    private final InvocationType invocationType;
    private final boolean tailLogs;
    private final Instant startTime;
    private final long timeoutSeconds;
    private final Clock clock;
    private final InvocationReporter reporter;
    private final LongSupplier memorySampler;

    private final LogTail logTail = new LogTail();
    private final AtomicBoolean completed = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<InvocationContext> completion = new CompletableFuture<>();

    // Guarded by 'this'
    private byte[] response;
    private FunctionError error;
    private Instant endTime;
    private long maxMemoryUsedMb;
    private Instant invokeWait;
    private Instant initEnd;
    private Instant workerStartedAt;

    private InvocationContext(Builder b) {
        this.requestId = Objects.requireNonNull(b.requestId, "requestId");
        this.invokedFunctionArn = b.invokedFunctionArn;
        this.functionVersion = b.functionVersion;
        this.memorySizeMb = b.memorySizeMb;
        this.traceId = b.traceId;
        this.clientContext = b.clientContext;
        this.cognitoIdentity = b.cognitoIdentity;
        this.payload = b.payload == null ? new byte[0] : b.payload;
        this.invocationType = b.invocationType;
        this.tailLogs = b.tailLogs;
        this.clock = b.clock;
        this.startTime = clock.instant();
        this.timeoutSeconds = b.timeoutSeconds;
        this.reporter = b.reporter;
        this.memorySampler = b.memorySampler;
    }

    public static Builder builder(String requestId) {
        return new Builder(requestId);
    }

    public String requestId() {
        return requestId;
    }

    public String invokedFunctionArn() {
        return invokedFunctionArn;
    }

    public String functionVersion() {
        return functionVersion;
    }

    public int memorySizeMb() {
        return memorySizeMb;
    }

    public String traceId() {
        return traceId;
    }

    public String clientContext() {
        return clientContext;
    }

    public String cognitoIdentity() {
        return cognitoIdentity;
    }

    public byte[] payload() {
        return payload;
    }

    public InvocationType invocationType() {
        return invocationType;
    }

    public boolean tailLogs() {
        return tailLogs;
    }

    public Instant startTime() {
        return startTime;
    }

    public long timeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant deadline() {
        return startTime.plusSeconds(timeoutSeconds);
    }

    public Duration elapsed() {
        return Duration.between(startTime, clock.instant());
    }

    /**
     * Time left before the deadline; zero once expired.
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline());
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean hasExpired() {
        return hasExpiredAt(clock.instant());
    }

    public boolean hasExpiredAt(Instant instant) {
        return !instant.isBefore(deadline());
    }

    public LogTail logTail() {
        return logTail;
    }

    public void recordLogTail(byte[] raw) {
        if (raw != null && raw.length > 0) {
            logTail.write(raw, 0, raw.length);
        }
    }

    /**
     * Records the timing headers a worker may attach to its reply. Values are epoch milliseconds;
     * either may be null.
     */
    public synchronized void recordInitEnd(Long invokeWaitMs, Long initEndMs) {
        if (invokeWaitMs != null) {
            this.invokeWait = Instant.ofEpochMilli(invokeWaitMs);
        }
        if (initEndMs != null) {
            this.initEnd = Instant.ofEpochMilli(initEndMs);
        }
    }

    /**
     * Marks this invocation as the one that started the worker.
     */
    public synchronized void markColdStart(Instant workerStartedAt) {
        this.workerStartedAt = workerStartedAt;
    }

    public synchronized boolean coldStart() {
        return workerStartedAt != null;
    }

    public synchronized Optional<Duration> initDuration() {
        if (workerStartedAt == null || initEnd == null || initEnd.isBefore(workerStartedAt)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(workerStartedAt, initEnd));
    }

    /**
     * Run time from the later of creation and the worker's reported wait start, capped at the timeout.
     */
    public synchronized Duration duration() {
        Instant from = (invokeWait != null && invokeWait.isAfter(startTime)) ? invokeWait : startTime;
        Instant to = endTime != null ? endTime : clock.instant();
        Duration d = Duration.between(from, to);
        if (d.isNegative()) {
            return Duration.ZERO;
        }
        Duration cap = Duration.ofSeconds(timeoutSeconds);
        return d.compareTo(cap) > 0 ? cap : d;
    }

    /**
     * Reports the start of the invocation; only the first call has an effect.
     */
    public void markServed() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        MDC.put("requestId", requestId);
        try {
            reporter.started(this);
        } finally {
            MDC.remove("requestId");
        }
    }

    public boolean complete(FunctionError error) {
        return completeWith(null, error);
    }

    public boolean completeWithResponse(byte[] response) {
        return completeWith(response == null ? new byte[0] : response, null);
    }

    /**
     * Completes with the timeout error, regardless of how close to the deadline the caller woke up.
     */
    public boolean timeOut() {
        return completeWith(null, FunctionError.timeout(clock.instant(), requestId, timeoutSeconds));
    }

    private boolean completeWith(byte[] reply, FunctionError failure) {
        if (!completed.compareAndSet(false, true)) {
            log.debug("Invocation {} already completed, ignoring", requestId);
            return false;
        }
        Instant now = clock.instant();
        FunctionError effectiveError = failure;
        if (effectiveError == null && hasExpiredAt(now)) {
            effectiveError = FunctionError.timeout(now, requestId, timeoutSeconds);
        }
        long memory = memorySampler.getAsLong();
        synchronized (this) {
            this.endTime = now;
            this.error = effectiveError;
            this.response = effectiveError == null ? reply : null;
            this.maxMemoryUsedMb = memory;
        }
        MDC.put("requestId", requestId);
        try {
            reporter.finished(this);
        } finally {
            MDC.remove("requestId");
        }
        completion.complete(this);
        return true;
    }

    /**
     * True once the reply is readable. A concurrent {@link #complete} that has claimed the
     * invocation but not yet written the reply does not count.
     */
    public boolean isCompleted() {
        return completion.isDone();
    }

    public synchronized byte[] response() {
        return response;
    }

    public synchronized FunctionError error() {
        return error;
    }

    public synchronized boolean failed() {
        return error != null;
    }

    public synchronized long maxMemoryUsedMb() {
        return maxMemoryUsedMb;
    }

    public CompletableFuture<InvocationContext> completion() {
        return completion;
    }

    /**
     * Waits for completion up to {@code timeout}.
     *
     * @return true if the context completed in time
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        try {
            completion.get(Math.max(timeout.toMillis(), 0), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion future failed for " + requestId, e.getCause());
        }
    }

    public static final class Builder {
        private final String requestId;
        private String invokedFunctionArn;
        private String functionVersion = "$LATEST";
        private int memorySizeMb = 128;
        private String traceId;
        private String clientContext;
        private String cognitoIdentity;
        private byte[] payload;
        private InvocationType invocationType = InvocationType.REQUEST_RESPONSE;
        private boolean tailLogs;
        private long timeoutSeconds = 3;
        private Clock clock = Clock.systemUTC();
        private InvocationReporter reporter = new InvocationReporter();
        private LongSupplier memorySampler = () -> 0L;

        private Builder(String requestId) {
            this.requestId = requestId;
        }

        public Builder invokedFunctionArn(String invokedFunctionArn) {
            this.invokedFunctionArn = invokedFunctionArn;
            return this;
        }

        public Builder functionVersion(String functionVersion) {
            this.functionVersion = functionVersion;
            return this;
        }

        public Builder memorySizeMb(int memorySizeMb) {
            this.memorySizeMb = memorySizeMb;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder clientContext(String clientContext) {
            this.clientContext = clientContext;
            return this;
        }

        public Builder cognitoIdentity(String cognitoIdentity) {
            this.cognitoIdentity = cognitoIdentity;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder invocationType(InvocationType invocationType) {
            this.invocationType = invocationType;
            return this;
        }

        public Builder tailLogs(boolean tailLogs) {
            this.tailLogs = tailLogs;
            return this;
        }

        public Builder timeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder reporter(InvocationReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder memorySampler(LongSupplier memorySampler) {
            this.memorySampler = memorySampler;
            return this;
        }

        public InvocationContext build() {
            return new InvocationContext(this);
        }
    }
}
