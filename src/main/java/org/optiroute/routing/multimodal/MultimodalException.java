package org.optiroute.routing.multimodal;

import lombok.Getter;

/**
 * Reason-coded multimodal planning failure.
 */
@Getter
public final class MultimodalException extends RuntimeException {
    public static final String REASON_INVALID_LOCATION = "MM_INVALID_LOCATION";
    public static final String REASON_INVALID_CARGO = "MM_INVALID_CARGO";
    public static final String REASON_BROKEN_CHAIN = "MM_BROKEN_CHAIN";
    public static final String REASON_BAD_SEQUENCE = "MM_BAD_SEQUENCE";
    public static final String REASON_NO_TEMPLATE = "MM_NO_APPLICABLE_TEMPLATE";

    private final String reasonCode;

    public MultimodalException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }
}
