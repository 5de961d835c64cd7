package it.unimib.datai.localfaas.emulator.supervisor;

import it.unimib.datai.localfaas.common.runtime.RuntimeApiHeaders;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Confirms the runtime API answers before a worker is pointed at it.
 */
public class ReadinessProbe {
    private static final Logger log = LoggerFactory.getLogger(ReadinessProbe.class);
    private static final int MAX_RETRIES = 3;
    private static final int[] RETRY_DELAYS_MS = {100, 500, 2000};

    private final HttpClient httpClient;

    public ReadinessProbe() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build());
    }

    // Visible for testing
    ReadinessProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * @return true once the ping endpoint answered 200, false after the retries or the
     *         invocation's deadline ran out
     */
    public boolean awaitReady(String runtimeApiAddress, InvocationContext context) {
        URI uri = URI.create("http://" + runtimeApiAddress + RuntimeApiHeaders.runtimePath("/ping"));
        for (int attempt = 0; attempt < MAX_RETRIES; attempt++) {
            if (context != null && context.hasExpired()) {
                log.warn("Invocation {} expired while waiting for the runtime API", context.requestId());
                return false;
            }
            try {
                HttpResponse<Void> response = httpClient.send(
                        HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(2)).GET().build(),
                        HttpResponse.BodyHandlers.discarding());
                if (response.statusCode() == 200) {
                    return true;
                }
                log.warn("Runtime API ping returned HTTP {} (attempt {})", response.statusCode(), attempt + 1);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            } catch (Exception ex) {
                log.warn("Runtime API ping failed (attempt {}): {}", attempt + 1, ex.getMessage());
            }
            if (attempt < MAX_RETRIES - 1) {
                try {
                    Thread.sleep(RETRY_DELAYS_MS[attempt]);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        log.error("Runtime API at {} not reachable after {} attempts", runtimeApiAddress, MAX_RETRIES);
        return false;
    }
}
