package it.unimib.datai.localfaas.emulator.context;

import it.unimib.datai.localfaas.emulator.config.EmulatorConfig;
import it.unimib.datai.localfaas.emulator.dispatch.InvocationRequest;

import java.time.Clock;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Creates invocation contexts whose defaults come from the emulator configuration.
 */
public class InvocationContextFactory {
    private final EmulatorConfig config;
    private final Clock clock;
    private final InvocationReporter reporter;
    private final LongSupplier memorySampler;
    private final Supplier<String> requestIds;

    public InvocationContextFactory(EmulatorConfig config, LongSupplier memorySampler) {
        this(config, Clock.systemUTC(), new InvocationReporter(), memorySampler, () -> UUID.randomUUID().toString());
    }

    public InvocationContextFactory(EmulatorConfig config, Clock clock, InvocationReporter reporter,
                                    LongSupplier memorySampler, Supplier<String> requestIds) {
        this.config = config;
        this.clock = clock;
        this.reporter = reporter;
        this.memorySampler = memorySampler;
        this.requestIds = requestIds;
    }

    public InvocationContext create(InvocationRequest request) {
        String clientContext = request.clientContext() != null ? request.clientContext() : config.clientContext();
        return InvocationContext.builder(requestIds.get())
                .invokedFunctionArn(config.invokedFunctionArn())
                .functionVersion(config.functionVersion())
                .memorySizeMb(config.memorySizeMb())
                .traceId(config.traceId())
                .clientContext(clientContext)
                .cognitoIdentity(config.cognitoIdentity())
                .payload(request.payload())
                .invocationType(request.invocationType())
                .tailLogs(request.tailLogs())
                .timeoutSeconds(config.timeoutSeconds())
                .clock(clock)
                .reporter(reporter)
                .memorySampler(memorySampler)
                .build();
    }
}
