package org.optiroute.routing.validation;

public enum ViolationSeverity {
    ERROR,
    WARNING
}
