package com.stagecraft.engine.validation.checks;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import com.stagecraft.engine.validation.ValidationCheck;
import com.stagecraft.engine.validation.ValidationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The floor band (bottom quarter of the frame) must keep a walkable gap:
 * if nearly every cell there changed, furniture spans the whole path.
 */
@Component
public class CirculationCheck implements ValidationCheck {

    static final int    FLOOR_ROWS   = 2;
    static final double MAX_COVERAGE = 0.9;

    @Override
    public String name() { return "circulation"; }

    @Override
    public boolean appliesTo(StageKind kind) { return true; }

    @Override
    public Optional<ViolationTag> evaluate(ValidationContext ctx) {
        return ctx.changes().coverageOfBottomRows(FLOOR_ROWS) > MAX_COVERAGE
                ? Optional.of(ViolationTag.CIRCULATION_BLOCKED)
                : Optional.empty();
    }
}
