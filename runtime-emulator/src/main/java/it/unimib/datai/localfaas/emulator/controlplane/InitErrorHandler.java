package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.state.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@code POST /2018-06-01/runtime/init/error}: the worker failed before fetching any work.
 * Fails the invocation that caused the worker to start.
 */
public final class InitErrorHandler extends RuntimeApiHandler {
    private static final Logger log = LoggerFactory.getLogger(InitErrorHandler.class);

    private final RuntimeSession session;
    private final ErrorPayloadParser errorParser;

    public InitErrorHandler(ObjectMapper objectMapper, RuntimeSession session) {
        super(objectMapper, "POST");
        this.session = session;
        this.errorParser = new ErrorPayloadParser(objectMapper);
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        session.transition(RuntimeState.INIT_ERROR, () -> {
            byte[] body = HttpExchanges.readBody(exchange);
            String headerType = exchange.getRequestHeaders().getFirst(RuntimeApiHeaders.FUNCTION_ERROR_TYPE);
            FunctionError error = errorParser.parseInitError(body, headerType);
            log.error("Worker reported an init error: {} ({})", error.errorMessage(), error.effectiveType());
            InvocationContext context = session.current();
            if (context != null) {
                context.complete(error);
            }
            return null;
        });
        sendAccepted(exchange);
    }
}
