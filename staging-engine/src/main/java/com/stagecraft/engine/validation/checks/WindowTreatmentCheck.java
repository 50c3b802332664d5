package com.stagecraft.engine.validation.checks;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import com.stagecraft.engine.validation.ImageSample;
import com.stagecraft.engine.validation.ValidationCheck;
import com.stagecraft.engine.validation.ValidationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.stagecraft.engine.validation.ImageSample.Axis.HORIZONTAL;
import static com.stagecraft.engine.validation.ImageSample.Axis.VERTICAL;

/**
 * Detects curtains and blinds: a strong gain in vertical-line density
 * (folds, slats seen edge-on) that is not matched by horizontal lines.
 *
 * Forbidden in every stage except window treatment itself.
 */
@Component
public class WindowTreatmentCheck implements ValidationCheck {

    static final double EDGE_THRESHOLD = 40.0;
    static final double MIN_GAIN       = 0.08;
    static final double MAX_CROSS_RATIO = 1.0 / 3.0;

    @Override
    public String name() { return "window-treatment"; }

    @Override
    public boolean appliesTo(StageKind kind) {
        return kind != StageKind.WINDOW_TREATMENT;
    }

    @Override
    public Optional<ViolationTag> evaluate(ValidationContext ctx) {
        double dxGain = density(ctx.after(), HORIZONTAL) - density(ctx.before(), HORIZONTAL);
        double dyGain = density(ctx.after(), VERTICAL)   - density(ctx.before(), VERTICAL);
        return dxGain > MIN_GAIN && dyGain < dxGain * MAX_CROSS_RATIO
                ? Optional.of(ViolationTag.WINDOW_TREATMENT_PRESENT)
                : Optional.empty();
    }

    private static double density(ImageSample s, ImageSample.Axis axis) {
        return s.edgeDensity(axis, 0, 0, ImageSample.GRID, ImageSample.GRID, EDGE_THRESHOLD);
    }
}
