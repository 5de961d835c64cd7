package it.unimib.datai.localfaas.emulator.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import it.unimib.datai.localfaas.common.model.InvocationType;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.error.BodyReadException;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.function.Consumer;

/**
 * {@code POST /2015-03-31/functions/{name}/invocations}, the cloud-invoke-compatible trigger.
 */
public final class InvokeHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(InvokeHandler.class);
    static final String PREFIX = "/" + RuntimeApiHeaders.INVOKE_API_VERSION + "/functions/";
    private static final String SUFFIX = "/invocations";

    private final InvocationDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Consumer<WorkerStartException> onFatal;

    public InvokeHandler(InvocationDispatcher dispatcher, ObjectMapper objectMapper,
                         Consumer<WorkerStartException> onFatal) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.onFatal = onFatal;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpExchanges.sendStatus(exchange, 405);
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (!path.startsWith(PREFIX) || !path.endsWith(SUFFIX) || path.length() <= PREFIX.length() + SUFFIX.length()) {
            HttpExchanges.sendStatus(exchange, 404);
            return;
        }

        Headers requestHeaders = exchange.getRequestHeaders();
        InvocationType type;
        try {
            type = InvocationType.fromHeader(requestHeaders.getFirst(RuntimeApiHeaders.AMZ_INVOCATION_TYPE));
        } catch (IllegalArgumentException e) {
            HttpExchanges.sendError(exchange, objectMapper, 400, "InvalidParameterValueException", e.getMessage());
            return;
        }
        String clientContext;
        try {
            clientContext = decodeClientContext(requestHeaders.getFirst(RuntimeApiHeaders.AMZ_CLIENT_CONTEXT));
        } catch (IllegalArgumentException e) {
            HttpExchanges.sendError(exchange, objectMapper, 400, "InvalidRequestContentException",
                    "Client context must be a valid Base64-encoded JSON object.");
            return;
        }
        boolean tail = RuntimeApiHeaders.LOG_TYPE_TAIL.equalsIgnoreCase(requestHeaders.getFirst(RuntimeApiHeaders.AMZ_LOG_TYPE));

        byte[] payload;
        try {
            payload = HttpExchanges.readBody(exchange);
        } catch (BodyReadException e) {
            HttpExchanges.sendError(exchange, objectMapper, e.status(), e.errorType(), e.getMessage());
            return;
        }
        InvocationRequest request = new InvocationRequest(payload, type, clientContext, tail);

        switch (type) {
            case DRY_RUN -> HttpExchanges.sendStatus(exchange, 204);
            case EVENT -> {
                dispatcher.invokeAsync(request);
                HttpExchanges.sendStatus(exchange, 202);
            }
            default -> invokeSync(exchange, request);
        }
    }

    private void invokeSync(HttpExchange exchange, InvocationRequest request) throws IOException {
        InvocationContext context;
        try {
            context = dispatcher.invoke(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            HttpExchanges.sendError(exchange, objectMapper, 503, "ServiceException", "Interrupted");
            return;
        } catch (WorkerStartException e) {
            log.error("Cannot start the function runtime: {}", e.getMessage());
            HttpExchanges.sendError(exchange, objectMapper, 500, "ServiceException", e.getMessage());
            onFatal.accept(e);
            return;
        }

        Headers headers = exchange.getResponseHeaders();
        headers.set(RuntimeApiHeaders.AMZ_EXECUTED_VERSION, context.functionVersion());
        if (context.tailLogs()) {
            headers.set(RuntimeApiHeaders.AMZ_LOG_RESULT, context.logTail().toBase64());
        }
        if (context.failed()) {
            headers.set(RuntimeApiHeaders.AMZ_FUNCTION_ERROR, RuntimeApiHeaders.FUNCTION_ERROR_UNHANDLED);
            HttpExchanges.sendJson(exchange, objectMapper, 200, context.error());
        } else {
            HttpExchanges.sendBytes(exchange, 200, HttpExchanges.APPLICATION_JSON, context.response());
        }
    }

    private String decodeClientContext(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        byte[] raw = Base64.getDecoder().decode(header.trim());
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Client context is not a JSON object");
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Client context is not valid JSON", e);
        }
        return new String(raw, StandardCharsets.UTF_8);
    }
}
