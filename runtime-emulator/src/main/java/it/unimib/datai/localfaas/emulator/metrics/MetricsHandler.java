package it.unimib.datai.localfaas.emulator.metrics;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

public final class MetricsHandler implements HttpHandler {
    private final PrometheusRegistry registry;
    private final PrometheusTextFormatWriter writer = new PrometheusTextFormatWriter(true);

    public MetricsHandler(PrometheusRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpExchanges.sendStatus(exchange, 405);
            return;
        }
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        writer.write(baos, registry.scrape());
        HttpExchanges.sendBytes(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", baos.toByteArray());
    }
}
