package it.unimib.datai.localfaas.emulator.supervisor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the first candidate path that is an executable regular file.
 */
public final class BootstrapLocator {
    private final List<Path> candidates;

    public BootstrapLocator(List<Path> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    public Path locate() {
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        throw new BootstrapNotFoundException(candidates);
    }
}
