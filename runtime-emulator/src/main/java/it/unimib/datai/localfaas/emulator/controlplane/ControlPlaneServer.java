package it.unimib.datai.localfaas.emulator.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.handoff.Handoff;
import it.unimib.datai.localfaas.emulator.http.HttpExchanges;
import it.unimib.datai.localfaas.emulator.state.RuntimeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.function.LongSupplier;

/**
 * The runtime API the worker talks to.
 */
public final class ControlPlaneServer {
    private static final Logger log = LoggerFactory.getLogger(ControlPlaneServer.class);

    private final ExecutorService handlers = HttpExchanges.handlerPool("localfaas-runtime-api-");
    private final HttpServer server;

    public ControlPlaneServer(String host, int port, ObjectMapper objectMapper, RuntimeSession session,
                              Handoff handoff, LongSupplier liveGeneration) {
        this.server = HttpExchanges.createServer(host, port, handlers);
        server.createContext(RuntimeApiHeaders.runtimePath("/ping"), new PingHandler());
        server.createContext(RuntimeApiHeaders.runtimePath("/runtime/invocation/next"),
                new NextInvocationHandler(objectMapper, session, handoff, liveGeneration));
        server.createContext(InvocationResultHandler.PREFIX, new InvocationResultHandler(objectMapper, session));
        server.createContext(RuntimeApiHeaders.runtimePath("/runtime/init/error"),
                new InitErrorHandler(objectMapper, session));
    }

    public void start() {
        server.start();
        log.info("Runtime API listening on {}", address());
    }

    public void stop() {
        server.stop(0);
        handlers.shutdownNow();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String address() {
        return server.getAddress().getHostString() + ":" + port();
    }
}
