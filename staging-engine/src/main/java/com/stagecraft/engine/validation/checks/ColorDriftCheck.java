package com.stagecraft.engine.validation.checks;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import com.stagecraft.engine.validation.ValidationCheck;
import com.stagecraft.engine.validation.ValidationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags a global tint or exposure change: the mean channel intensity may
 * move by at most 15% relative to the input.
 */
@Component
public class ColorDriftCheck implements ValidationCheck {

    static final double MAX_RELATIVE_DRIFT = 0.15;

    @Override
    public String name() { return "color-drift"; }

    @Override
    public boolean appliesTo(StageKind kind) { return true; }

    @Override
    public Optional<ViolationTag> evaluate(ValidationContext ctx) {
        double before = ctx.before().meanIntensity();
        double after  = ctx.after().meanIntensity();
        if (before <= 0) return Optional.empty();   // black input: nothing to compare against

        double drift = Math.abs(after - before) / before;
        return drift > MAX_RELATIVE_DRIFT ? Optional.of(ViolationTag.COLOR_DRIFT_DETECTED) : Optional.empty();
    }
}
