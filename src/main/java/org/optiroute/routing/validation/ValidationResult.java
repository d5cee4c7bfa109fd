package org.optiroute.routing.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of validating one route.
 */
@Value
@Builder
public class ValidationResult {
    boolean valid;
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;
    @Singular
    List<ConstraintViolation> violations;
    /** {@code 1 - min(1, 0.25 * errors + 0.05 * warnings)}. */
    double feasibilityScore;
}
