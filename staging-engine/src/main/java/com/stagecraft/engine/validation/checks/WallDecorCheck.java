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
 * Detects new framed objects on the walls: edge density in the upper half
 * of the frame grows along both axes (frames, mirrors and shelves have
 * horizontal and vertical borders).
 *
 * Forbidden in every stage except wall decor itself.
 */
@Component
public class WallDecorCheck implements ValidationCheck {

    static final double EDGE_THRESHOLD = 40.0;
    static final double MIN_GAIN       = 0.04;

    @Override
    public String name() { return "wall-decor"; }

    @Override
    public boolean appliesTo(StageKind kind) {
        return kind != StageKind.WALL_DECOR;
    }

    @Override
    public Optional<ViolationTag> evaluate(ValidationContext ctx) {
        int half = ImageSample.GRID / 2;
        double dxGain = upperDensity(ctx.after(), HORIZONTAL, half) - upperDensity(ctx.before(), HORIZONTAL, half);
        double dyGain = upperDensity(ctx.after(), VERTICAL, half)   - upperDensity(ctx.before(), VERTICAL, half);
        return dxGain > MIN_GAIN && dyGain > MIN_GAIN
                ? Optional.of(ViolationTag.WALL_DECOR_PRESENT)
                : Optional.empty();
    }

    private static double upperDensity(ImageSample s, ImageSample.Axis axis, int half) {
        return s.edgeDensity(axis, 0, 0, ImageSample.GRID, half, EDGE_THRESHOLD);
    }
}
