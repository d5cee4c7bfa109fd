package org.optiroute.routing.scoring;

import lombok.Getter;

/**
 * Reason-coded ranking or comparison contract failure.
 */
@Getter
public final class ScoringException extends RuntimeException {
    public static final String REASON_INVALID_WEIGHTS = "SCORE_INVALID_WEIGHTS";
    public static final String REASON_EMPTY_INPUT = "SCORE_EMPTY_INPUT";
    public static final String REASON_DUPLICATE_ROUTE_ID = "SCORE_DUPLICATE_ROUTE_ID";
    public static final String REASON_UNKNOWN_CRITERION = "SCORE_UNKNOWN_CRITERION";

    private final String reasonCode;

    public ScoringException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }
}
