package it.unimib.datai.localfaas.emulator.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Samples the memory high-watermark of the sandbox, in megabytes.
 * Tries the cgroup v1 and v2 counters, then the worker's {@code VmHWM}.
 */
public final class MemoryProbe {
    private static final Logger log = LoggerFactory.getLogger(MemoryProbe.class);
    private static final long MB = 1024L * 1024L;

    private final List<Path> cgroupCounters;
    private final Path procRoot;

    public MemoryProbe() {
        this(List.of(
                Path.of("/sys/fs/cgroup/memory/memory.max_usage_in_bytes"),
                Path.of("/sys/fs/cgroup/memory.peak")), Path.of("/proc"));
    }

    MemoryProbe(List<Path> cgroupCounters, Path procRoot) {
        this.cgroupCounters = cgroupCounters;
        this.procRoot = procRoot;
    }

    public long maxMemoryUsedMb(OptionalLong workerPid) {
        for (Path counter : cgroupCounters) {
            OptionalLong bytes = readLong(counter);
            if (bytes.isPresent()) {
                return bytes.getAsLong() / MB;
            }
        }
        if (workerPid.isPresent()) {
            OptionalLong kb = readVmHwmKb(procRoot.resolve(Long.toString(workerPid.getAsLong())).resolve("status"));
            if (kb.isPresent()) {
                return kb.getAsLong() / 1024L;
            }
        }
        return 0L;
    }

    private static OptionalLong readLong(Path path) {
        if (!Files.isReadable(path)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(Files.readString(path).trim()));
        } catch (IOException | NumberFormatException e) {
            log.debug("Unable to read memory counter {}: {}", path, e.getMessage());
            return OptionalLong.empty();
        }
    }

    private static OptionalLong readVmHwmKb(Path status) {
        if (!Files.isReadable(status)) {
            return OptionalLong.empty();
        }
        try {
            for (String line : Files.readAllLines(status)) {
                if (line.startsWith("VmHWM:")) {
                    String value = line.substring("VmHWM:".length()).replace("kB", "").trim();
                    return OptionalLong.of(Long.parseLong(value));
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Unable to read {}: {}", status, e.getMessage());
        }
        return OptionalLong.empty();
    }
}
