package it.unimib.datai.localfaas.emulator.lifecycle;

public enum RestartReason {
    SIGNAL,
    FILE_CHANGE,
    TIMEOUT
}
