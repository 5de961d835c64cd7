package it.unimib.datai.localfaas.emulator.controlplane;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class PingHandler implements HttpHandler {
    private static final byte[] RESPONSE = "pong".getBytes(StandardCharsets.UTF_8);

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpExchanges.sendStatus(exchange, 405);
            return;
        }
        HttpExchanges.sendBytes(exchange, 200, "text/plain", RESPONSE);
    }
}
