package it.unimib.datai.localfaas.emulator.supervisor;

/**
 * Callbacks around a worker lifetime. Invoked on the supervisor's threads; must not block.
 */
public interface WorkerListener {

    default void onSpawn(long generation) {
    }

    default void onExit(long generation, int exitCode, boolean intentional) {
    }
}
