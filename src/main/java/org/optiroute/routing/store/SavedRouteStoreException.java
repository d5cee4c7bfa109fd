package org.optiroute.routing.store;

import lombok.Getter;

/**
 * Reason-coded failure raised by saved-route stores and the payload codec.
 */
@Getter
public class SavedRouteStoreException extends RuntimeException {
    public static final String REASON_NOT_FOUND = "STORE_NOT_FOUND";
    public static final String REASON_INVALID_INPUT = "STORE_INVALID_INPUT";
    public static final String REASON_PAYLOAD_INVALID = "STORE_PAYLOAD_INVALID";
    public static final String REASON_UNAVAILABLE = "STORE_UNAVAILABLE";

    private final String reasonCode;

    public SavedRouteStoreException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }

    public SavedRouteStoreException(String reasonCode, String message, Throwable cause) {
        super("[" + reasonCode + "] " + message, cause);
        this.reasonCode = reasonCode;
    }
}
