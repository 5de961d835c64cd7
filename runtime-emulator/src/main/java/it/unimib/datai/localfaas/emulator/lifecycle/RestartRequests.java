package it.unimib.datai.localfaas.emulator.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single source of restart events. Signal handlers, the file watcher and the dispatcher only
 * publish here; {@link LifecycleController} is the only consumer.
 */
public final class RestartRequests {
    private static final Logger log = LoggerFactory.getLogger(RestartRequests.class);

    private final LinkedBlockingQueue<RestartReason> queue = new LinkedBlockingQueue<>();

    public void request(RestartReason reason) {
        log.debug("Restart requested: {}", reason);
        queue.offer(reason);
    }

    /**
     * @return the next reason, or null if none arrived within {@code timeout}
     */
    public RestartReason poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Discards requests that piled up while a restart was already under way.
     */
    public int drain() {
        int dropped = 0;
        while (queue.poll() != null) {
            dropped++;
        }
        return dropped;
    }
}
