package org.optiroute.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Caller-facing optimization failure with a stable reason code.
 */
@Getter
public final class OptimizationException extends RuntimeException {
    public static final String REASON_REQUEST_REQUIRED = "OPT_REQUEST_REQUIRED";
    public static final String REASON_ORIGIN_REQUIRED = "OPT_ORIGIN_REQUIRED";
    public static final String REASON_VEHICLE_REQUIRED = "OPT_VEHICLE_REQUIRED";
    public static final String REASON_DESTINATION_REQUIRED = "OPT_DESTINATION_REQUIRED";
    public static final String REASON_CARGO_REQUIRED = "OPT_CARGO_REQUIRED";
    public static final String REASON_ROUTE_REQUIRED = "OPT_ROUTE_REQUIRED";
    public static final String REASON_SCENARIOS_REQUIRED = "OPT_SCENARIOS_REQUIRED";
    public static final String REASON_NAME_REQUIRED = "OPT_NAME_REQUIRED";
    public static final String REASON_INVALID_COORDINATES = "OPT_INVALID_COORDINATES";
    public static final String REASON_INVALID_CAPACITY = "OPT_INVALID_CAPACITY";
    public static final String REASON_INVALID_DESTINATION = "OPT_INVALID_DESTINATION";
    public static final String REASON_INVALID_TIME_WINDOW = "OPT_INVALID_TIME_WINDOW";
    public static final String REASON_INVALID_CONSTRAINTS = "OPT_INVALID_CONSTRAINTS";
    public static final String REASON_INVALID_DEADLINE = "OPT_INVALID_DEADLINE";
    public static final String REASON_INVALID_CRITERIA = "OPT_INVALID_CRITERIA";
    public static final String REASON_INVALID_SCENARIO = "OPT_INVALID_SCENARIO";
    public static final String REASON_ALL_SOLVERS_FAILED = "OPT_ALL_SOLVERS_FAILED";
    public static final String REASON_DEADLINE_EXCEEDED = "OPT_DEADLINE_EXCEEDED";
    public static final String REASON_PERSISTENCE_FAILED = "OPT_PERSISTENCE_FAILED";
    public static final String REASON_SAVED_ROUTE_NOT_FOUND = "OPT_SAVED_ROUTE_NOT_FOUND";

    private final String reasonCode;

    public OptimizationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public OptimizationException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
