package it.unimib.datai.localfaas.emulator.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Writes the platform-style START / END / REPORT lines for an invocation.
 * The lines go to the {@code localfaas.report} logger, which is configured to print the bare message.
 */
public class InvocationReporter {
    public static final String REPORT_LOGGER = "localfaas.report";

    private static final Logger report = LoggerFactory.getLogger(REPORT_LOGGER);

    public void started(InvocationContext context) {
        report.info(startLine(context));
    }

    public void finished(InvocationContext context) {
        report.info(endLine(context));
        report.info(reportLine(context));
    }

    public static String startLine(InvocationContext context) {
        return "START RequestId: " + context.requestId() + " Version: " + context.functionVersion();
    }

    public static String endLine(InvocationContext context) {
        return "END RequestId: " + context.requestId();
    }

    public static String reportLine(InvocationContext context) {
        Duration duration = context.duration();
        StringBuilder line = new StringBuilder("REPORT RequestId: ").append(context.requestId());
        context.initDuration().ifPresent(init ->
                line.append("\tInit Duration: ").append(millis(init)).append(" ms"));
        line.append("\tDuration: ").append(millis(duration)).append(" ms")
                .append("\tBilled Duration: ").append(billedMillis(duration)).append(" ms")
                .append("\tMemory Size: ").append(context.memorySizeMb()).append(" MB")
                .append("\tMax Memory Used: ").append(context.maxMemoryUsedMb()).append(" MB");
        return line.toString();
    }

    static String millis(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000.0);
    }

    /**
     * Rounded up to the next 100 ms, minimum 100.
     */
    static long billedMillis(Duration duration) {
        long ms = (long) Math.ceil(duration.toNanos() / 1_000_000.0);
        long billed = ((ms + 99) / 100) * 100;
        return Math.max(billed, 100);
    }
}
