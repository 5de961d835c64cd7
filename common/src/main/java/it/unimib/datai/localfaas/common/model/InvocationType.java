package it.unimib.datai.localfaas.common.model;

import java.util.Locale;

/**
 * Value of the {@code X-Amz-Invocation-Type} header.
 */
public enum InvocationType {
    REQUEST_RESPONSE("RequestResponse"),
    EVENT("Event"),
    DRY_RUN("DryRun");

    private final String headerValue;

    InvocationType(String headerValue) {
        this.headerValue = headerValue;
    }

    public String headerValue() {
        return headerValue;
    }

    public static InvocationType fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return REQUEST_RESPONSE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InvocationType type : values()) {
            if (type.headerValue.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported invocation type: " + value);
    }
}
