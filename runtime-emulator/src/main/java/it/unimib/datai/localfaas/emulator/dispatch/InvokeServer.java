package it.unimib.datai.localfaas.emulator.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.metrics.MetricsHandler;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Stay-open invoke surface plus the metrics endpoint.
 */
public final class InvokeServer {
    private static final Logger log = LoggerFactory.getLogger(InvokeServer.class);

    private final ExecutorService handlers = HttpExchanges.handlerPool("localfaas-invoke-");
    private final HttpServer server;

    public InvokeServer(String host, int port, InvocationDispatcher dispatcher, ObjectMapper objectMapper,
                        PrometheusRegistry registry, Consumer<WorkerStartException> onFatal) {
        this.server = HttpExchanges.createServer(host, port, handlers);
        server.createContext(InvokeHandler.PREFIX, new InvokeHandler(dispatcher, objectMapper, onFatal));
        server.createContext("/metrics", new MetricsHandler(registry));
    }

    public void start() {
        server.start();
        log.info("Invoke API listening on {}:{}", server.getAddress().getHostString(), port());
    }

    public void stop() {
        server.stop(0);
        handlers.shutdownNow();
    }

    public int port() {
        return server.getAddress().getPort();
    }
}
