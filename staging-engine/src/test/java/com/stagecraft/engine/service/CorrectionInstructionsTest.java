package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorrectionInstructionsTest {

    CorrectionInstructions corrections = new CorrectionInstructions();

    @Test
    void correct_keepsOriginalAndAppendsOneLinePerViolation() {
        String out = corrections.correct("Add a sofa.", StageKind.PRIMARY_FURNITURE,
                List.of(ViolationTag.WALL_DECOR_PRESENT, ViolationTag.COLOR_DRIFT_DETECTED));

        assertThat(out).startsWith("Add a sofa.\n\nCORRECTIONS REQUIRED");
        assertThat(out).contains("\n- Remove any wall decor");
        assertThat(out).contains("\n- Keep the original colors");
        assertThat(out).doesNotContain("REINFORCEMENT");
    }

    @Test
    void correct_itemCountNamesTheStage() {
        String out = corrections.correct("x", StageKind.WALL_DECOR, List.of(ViolationTag.ITEM_COUNT_OUT_OF_RANGE));

        assertThat(out).contains("wall decor stage");
    }

    @Test
    void correct_transportFailure_appendsReinforcementOnly() {
        String out = corrections.correct("Add curtains.", StageKind.WINDOW_TREATMENT,
                List.of(ViolationTag.PROVIDER_TIMEOUT));

        assertThat(out).isEqualTo("Add curtains.\n\nREINFORCEMENT: "
                + CorrectionInstructions.reinforcementFor(StageKind.WINDOW_TREATMENT));
        assertThat(out).doesNotContain("CORRECTIONS REQUIRED");
    }

    @Test
    void correct_noViolations_returnsInstructionUnchanged() {
        assertThat(corrections.correct("Add a rug.", StageKind.COMPLEMENTARY, List.of())).isEqualTo("Add a rug.");
    }
}
