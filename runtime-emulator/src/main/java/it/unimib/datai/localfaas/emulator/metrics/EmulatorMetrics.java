package it.unimib.datai.localfaas.emulator.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.lifecycle.RestartReason;

public final class EmulatorMetrics {
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";

    private final PrometheusRegistry registry;
    private final String functionName;
    private final Counter invocationsTotal;
    private final Counter workerStarts;
    private final Counter restarts;
    private final Histogram invocationDuration;
    private final Gauge inFlight;

    public EmulatorMetrics(String functionName) {
        this.registry = new PrometheusRegistry();
        this.functionName = functionName;

        this.invocationsTotal = Counter.builder()
                .name("localfaas_invocations_total")
                .help("Total number of completed invocations")
                .labelNames("function", "outcome")
                .register(registry);

        this.workerStarts = Counter.builder()
                .name("localfaas_worker_starts_total")
                .help("Total number of worker process starts")
                .labelNames("function")
                .register(registry);

        this.restarts = Counter.builder()
                .name("localfaas_restarts_total")
                .help("Total number of requested worker restarts")
                .labelNames("reason")
                .register(registry);

        this.invocationDuration = Histogram.builder()
                .name("localfaas_invocation_duration_seconds")
                .help("Invocation duration in seconds")
                .labelNames("function")
                .classicUpperBounds(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0)
                .register(registry);

        this.inFlight = Gauge.builder()
                .name("localfaas_in_flight")
                .help("Number of invocations currently in progress")
                .labelNames("function")
                .register(registry);

        invocationsTotal.labelValues(functionName, OUTCOME_SUCCESS);
        invocationsTotal.labelValues(functionName, OUTCOME_ERROR);
        workerStarts.labelValues(functionName);
    }

    public PrometheusRegistry getRegistry() {
        return registry;
    }

    public void recordCompletion(InvocationContext context) {
        invocationsTotal.labelValues(functionName, context.failed() ? OUTCOME_ERROR : OUTCOME_SUCCESS).inc();
        invocationDuration.labelValues(functionName).observe(context.duration().toNanos() / 1_000_000_000.0);
    }

    public void recordWorkerStart() {
        workerStarts.labelValues(functionName).inc();
    }

    public void recordRestart(RestartReason reason) {
        restarts.labelValues(reason.name()).inc();
    }

    public void incInFlight() {
        inFlight.labelValues(functionName).inc();
    }

    public void decInFlight() {
        inFlight.labelValues(functionName).dec();
    }
}
