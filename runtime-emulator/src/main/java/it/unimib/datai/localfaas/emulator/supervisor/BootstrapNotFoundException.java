package it.unimib.datai.localfaas.emulator.supervisor;

import java.nio.file.Path;
import java.util.List;

/**
 * None of the bootstrap candidates is an executable file. Fatal: only a working sandbox fixes it.
 */
public final class BootstrapNotFoundException extends WorkerStartException {

    public BootstrapNotFoundException(List<Path> candidates) {
        super("Couldn't find valid bootstrap(s): " + candidates);
    }
}
