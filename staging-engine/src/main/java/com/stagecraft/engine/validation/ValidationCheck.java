package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;

import java.util.Optional;

/**
 * One named heuristic run by {@link StageValidator}.
 *
 * Declare an implementation as a Spring {@code @Component} and the validator
 * picks it up; {@link #appliesTo} decides for which stage kinds it runs.
 */
public interface ValidationCheck {

    String name();

    boolean appliesTo(StageKind kind);

    /** The violation found, or empty when the pair passes this check. */
    Optional<ViolationTag> evaluate(ValidationContext ctx);
}
