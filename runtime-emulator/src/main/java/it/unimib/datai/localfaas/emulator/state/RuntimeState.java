package it.unimib.datai.localfaas.emulator.state;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Protocol state of the single worker connection, named after the last accepted runtime API call.
 */
public enum RuntimeState {
    INIT,
    INIT_ERROR,
    INVOKE_NEXT,
    INVOKE_RESPONSE,
    INVOKE_ERROR;

    private static final Map<RuntimeState, EnumSet<RuntimeState>> LEGAL_PREDECESSORS;

    static {
        LEGAL_PREDECESSORS = new EnumMap<>(RuntimeState.class);
        LEGAL_PREDECESSORS.put(INIT, EnumSet.noneOf(RuntimeState.class));
        LEGAL_PREDECESSORS.put(INIT_ERROR, EnumSet.of(INIT));
        LEGAL_PREDECESSORS.put(INVOKE_NEXT, EnumSet.of(INIT, INVOKE_NEXT, INVOKE_RESPONSE, INVOKE_ERROR));
        LEGAL_PREDECESSORS.put(INVOKE_RESPONSE, EnumSet.of(INVOKE_NEXT));
        LEGAL_PREDECESSORS.put(INVOKE_ERROR, EnumSet.of(INVOKE_NEXT));
    }

    public boolean canFollow(RuntimeState current) {
        return LEGAL_PREDECESSORS.get(this).contains(current);
    }
}
