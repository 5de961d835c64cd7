package it.unimib.datai.localfaas.emulator.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import it.unimib.datai.localfaas.emulator.error.BodyReadException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Helpers shared by the emulator's {@link com.sun.net.httpserver.HttpHandler}s.
 */
public final class HttpExchanges {
    public static final int MAX_BODY_BYTES = 6 * 1024 * 1024;
    public static final String APPLICATION_JSON = "application/json";

    private HttpExchanges() {}

    public static ExecutorService handlerPool(String threadPrefix) {
        return Executors.newCachedThreadPool(new NamedThreadFactory(threadPrefix));
    }

    /**
     * Creates a server running its handlers on {@code executor}. The caller owns the executor and
     * shuts it down after {@link HttpServer#stop}, which does not interrupt running handlers.
     */
    public static HttpServer createServer(String host, int port, ExecutorService executor) {
        try {
            HttpServer server = HttpServer.create(new InetSocketAddress(host, port), 0);
            server.setExecutor(executor);
            return server;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create HTTP server on " + host + ":" + port, e);
        }
    }

    /**
     * Reads the whole request body, refusing bodies above {@link #MAX_BODY_BYTES}.
     */
    public static byte[] readBody(HttpExchange exchange) {
        try (InputStream in = exchange.getRequestBody()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int total = 0;
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (total > MAX_BODY_BYTES) {
                    throw new BodyReadException(413, "Request body exceeds " + MAX_BODY_BYTES + " bytes");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new BodyReadException("Failed to read request body: " + e.getMessage(), e);
        }
    }

    public static void sendBytes(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        if (contentType != null) {
            exchange.getResponseHeaders().set("Content-Type", contentType);
        }
        if (body == null || body.length == 0) {
            exchange.sendResponseHeaders(status, -1);
        } else {
            exchange.sendResponseHeaders(status, body.length);
            exchange.getResponseBody().write(body);
        }
        exchange.close();
    }

    public static void sendJson(HttpExchange exchange, ObjectMapper objectMapper, int status, Object body) throws IOException {
        sendBytes(exchange, status, APPLICATION_JSON, objectMapper.writeValueAsBytes(body));
    }

    public static void sendError(HttpExchange exchange, ObjectMapper objectMapper, int status,
                                 String errorType, String message) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("errorMessage", message);
        body.put("errorType", errorType);
        sendJson(exchange, objectMapper, status, body);
    }

    public static void sendStatus(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    public static Long parseEpochMillis(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
