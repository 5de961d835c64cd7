package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import it.unimib.datai.localfaas.common.model.FunctionError;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.error.InvalidRequestIdException;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import it.unimib.datai.localfaas.emulator.state.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Base64;

/**
 * {@code POST /2018-06-01/runtime/invocation/{id}/response} and {@code .../{id}/error}.
 */
public final class InvocationResultHandler extends RuntimeApiHandler {
    private static final Logger log = LoggerFactory.getLogger(InvocationResultHandler.class);
    static final String PREFIX = RuntimeApiHeaders.runtimePath("/runtime/invocation/");

    private final RuntimeSession session;
    private final ErrorPayloadParser errorParser;

    public InvocationResultHandler(ObjectMapper objectMapper, RuntimeSession session) {
        super(objectMapper, "POST");
        this.session = session;
        this.errorParser = new ErrorPayloadParser(objectMapper);
    }

    @Override
    protected void serve(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.startsWith(PREFIX) ? path.substring(PREFIX.length()) : "";
        int slash = rest.indexOf('/');
        if (slash <= 0) {
            HttpExchanges.sendStatus(exchange, 404);
            return;
        }
        String requestId = rest.substring(0, slash);
        String action = rest.substring(slash + 1);

        switch (action) {
            case "response" -> session.transition(RuntimeState.INVOKE_RESPONSE, () -> {
                InvocationContext context = servedContext(requestId);
                byte[] body = HttpExchanges.readBody(exchange);
                recordWorkerHeaders(exchange, context);
                context.completeWithResponse(body);
                return null;
            });
            case "error" -> session.transition(RuntimeState.INVOKE_ERROR, () -> {
                InvocationContext context = servedContext(requestId);
                byte[] body = HttpExchanges.readBody(exchange);
                recordWorkerHeaders(exchange, context);
                String headerType = exchange.getRequestHeaders().getFirst(RuntimeApiHeaders.FUNCTION_ERROR_TYPE);
                FunctionError error = errorParser.parseUnhandled(body, headerType);
                log.debug("Invocation {} failed: {}", requestId, error.errorMessage());
                context.complete(error);
                return null;
            });
            default -> {
                HttpExchanges.sendStatus(exchange, 404);
                return;
            }
        }
        sendAccepted(exchange);
    }

    private InvocationContext servedContext(String requestId) {
        InvocationContext context = session.served();
        if (context == null || !context.requestId().equals(requestId)) {
            throw new InvalidRequestIdException(requestId);
        }
        return context;
    }

    private static void recordWorkerHeaders(HttpExchange exchange, InvocationContext context) {
        context.recordInitEnd(
                HttpExchanges.parseEpochMillis(exchange.getRequestHeaders().getFirst(RuntimeApiHeaders.INVOKE_WAIT)),
                HttpExchanges.parseEpochMillis(exchange.getRequestHeaders().getFirst(RuntimeApiHeaders.INIT_END)));
        String logResult = exchange.getRequestHeaders().getFirst(RuntimeApiHeaders.LOG_RESULT);
        if (logResult != null && !logResult.isBlank()) {
            try {
                context.recordLogTail(Base64.getDecoder().decode(logResult.trim()));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed {} header for {}", RuntimeApiHeaders.LOG_RESULT, context.requestId());
            }
        }
    }
}
