package it.unimib.datai.localfaas.emulator.state;

import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.error.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuntimeSessionTest {

    @Test
    void enterCommitsLegalTransition() {
        RuntimeSession session = new RuntimeSession();
        session.enter(RuntimeState.INVOKE_NEXT);
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_NEXT);
    }

    @Test
    void illegalTransitionIsRejectedWith403() {
        RuntimeSession session = new RuntimeSession();

        assertThatThrownBy(() -> session.transition(RuntimeState.INVOKE_RESPONSE, () -> null))
                .isInstanceOf(InvalidStateTransitionException.class)
                .satisfies(e -> {
                    InvalidStateTransitionException ex = (InvalidStateTransitionException) e;
                    assertThat(ex.status()).isEqualTo(403);
                    assertThat(ex.errorType()).isEqualTo("InvalidStateTransition");
                    assertThat(ex.getMessage()).isEqualTo("Transition from INIT to INVOKE_RESPONSE is not allowed");
                });
        assertThat(session.state()).isEqualTo(RuntimeState.INIT);
    }

    @Test
    void transitionDoesNotCommitWhenActionFails() {
        RuntimeSession session = new RuntimeSession();
        session.enter(RuntimeState.INVOKE_NEXT);

        assertThatThrownBy(() -> session.transition(RuntimeState.INVOKE_RESPONSE, () -> {
            throw new IOException("broken body");
        })).isInstanceOf(IOException.class);

        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_NEXT);
    }

    @Test
    void transitionReturnsActionResult() throws IOException {
        RuntimeSession session = new RuntimeSession();
        session.enter(RuntimeState.INVOKE_NEXT);

        String result = session.transition(RuntimeState.INVOKE_ERROR, () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(session.state()).isEqualTo(RuntimeState.INVOKE_ERROR);
    }

    @Test
    void resetReturnsToInitAndForgetsServedContext() {
        RuntimeSession session = new RuntimeSession();
        session.enter(RuntimeState.INVOKE_NEXT);
        session.markServed(InvocationContext.builder("req-1").build());

        session.reset();

        assertThat(session.state()).isEqualTo(RuntimeState.INIT);
        assertThat(session.served()).isNull();
    }
}
