package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.ViolationTag;

import java.util.List;

/**
 * Outcome of validating one stage output. passed is true exactly when no
 * violation was detected.
 */
public record ValidationVerdict(
        boolean            passed,
        int                itemCountEstimate,
        List<ViolationTag> detectedViolations
) {
    public ValidationVerdict {
        detectedViolations = detectedViolations == null ? List.of() : List.copyOf(detectedViolations);
        if (passed != detectedViolations.isEmpty()) {
            throw new IllegalArgumentException("passed must equal detectedViolations.isEmpty()");
        }
    }

    public static ValidationVerdict of(int itemCountEstimate, List<ViolationTag> violations) {
        return new ValidationVerdict(violations.isEmpty(), itemCountEstimate, violations);
    }
}
