package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import it.unimib.datai.localfaas.emulator.error.RuntimeApiException;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Base for the runtime API endpoints: checks the method and turns protocol violations into
 * JSON error responses for the worker.
 */
abstract class RuntimeApiHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(RuntimeApiHandler.class);
    static final Map<String, String> ACCEPTED = Map.of("status", "OK");

    protected final ObjectMapper objectMapper;
    private final String method;

    RuntimeApiHandler(ObjectMapper objectMapper, String method) {
        this.objectMapper = objectMapper;
        this.method = method;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpExchanges.sendStatus(exchange, 405);
            return;
        }
        try {
            serve(exchange);
        } catch (RuntimeApiException e) {
            log.warn("{} {} rejected: {} ({})", exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                    e.getMessage(), e.errorType());
            HttpExchanges.sendError(exchange, objectMapper, e.status(), e.errorType(), e.getMessage());
        }
    }

    protected abstract void serve(HttpExchange exchange) throws IOException;

    protected void sendAccepted(HttpExchange exchange) throws IOException {
        HttpExchanges.sendJson(exchange, objectMapper, 202, ACCEPTED);
    }
}
