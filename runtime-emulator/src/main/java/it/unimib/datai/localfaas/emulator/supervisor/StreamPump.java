package it.unimib.datai.localfaas.emulator.supervisor;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.Supplier;

/**
 * Copies one of the worker's output streams to the emulator's stderr and, when the attached
 * invocation asked for it, into that invocation's log tail.
 */
final class StreamPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StreamPump.class);

    private final InputStream source;
    private final OutputStream passthrough;
    private final Supplier<InvocationContext> attached;

    StreamPump(InputStream source, OutputStream passthrough, Supplier<InvocationContext> attached) {
        this.source = source;
        this.passthrough = passthrough;
        this.attached = attached;
    }

    static Thread start(String name, InputStream source, OutputStream passthrough,
                        Supplier<InvocationContext> attached) {
        Thread t = new Thread(new StreamPump(source, passthrough, attached), name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public void run() {
        byte[] buffer = new byte[4096];
        try (InputStream in = source) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                synchronized (passthrough) {
                    passthrough.write(buffer, 0, n);
                    passthrough.flush();
                }
                InvocationContext context = attached.get();
                if (context != null && context.tailLogs() && !context.isCompleted()) {
                    context.logTail().write(buffer, 0, n);
                }
            }
        } catch (IOException e) {
            log.debug("Worker stream closed: {}", e.getMessage());
        }
    }
}
