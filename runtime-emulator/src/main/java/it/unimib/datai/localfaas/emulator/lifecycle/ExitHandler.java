package it.unimib.datai.localfaas.emulator.lifecycle;

/**
 * Terminates the process. Replaced in tests.
 */
@FunctionalInterface
public interface ExitHandler {
    ExitHandler SYSTEM = System::exit;

    void exit(int status);
}
