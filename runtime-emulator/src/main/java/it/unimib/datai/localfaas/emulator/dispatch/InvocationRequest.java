package it.unimib.datai.localfaas.emulator.dispatch;

import it.unimib.datai.localfaas.common.model.InvocationType;

import java.nio.charset.StandardCharsets;

/**
 * An accepted invocation as seen by the dispatcher: raw payload plus the caller's options.
 * {@code clientContext} is already decoded JSON text, or null.
 */
public record InvocationRequest(
        byte[] payload,
        InvocationType invocationType,
        String clientContext,
        boolean tailLogs
) {
    public InvocationRequest {
        payload = payload == null ? new byte[0] : payload;
        invocationType = invocationType == null ? InvocationType.REQUEST_RESPONSE : invocationType;
    }

    public static InvocationRequest sync(String payload) {
        return new InvocationRequest(payload.getBytes(StandardCharsets.UTF_8), InvocationType.REQUEST_RESPONSE, null, false);
    }
}
