package com.stagecraft.engine.validation.checks;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import com.stagecraft.engine.validation.ValidationCheck;
import com.stagecraft.engine.validation.ValidationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The number of changed regions must fall within the stage's
 * [minItems, maxItems].
 */
@Component
public class ItemCountCheck implements ValidationCheck {

    @Override
    public String name() { return "item-count"; }

    @Override
    public boolean appliesTo(StageKind kind) { return true; }

    @Override
    public Optional<ViolationTag> evaluate(ValidationContext ctx) {
        int estimate = ctx.itemCountEstimate();
        boolean inRange = estimate >= ctx.stage().minItems() && estimate <= ctx.stage().maxItems();
        return inRange ? Optional.empty() : Optional.of(ViolationTag.ITEM_COUNT_OUT_OF_RANGE);
    }
}
