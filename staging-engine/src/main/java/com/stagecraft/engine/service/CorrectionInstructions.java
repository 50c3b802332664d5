package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.ViolationTag;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the instruction for a stage's corrective retry.
 *
 * The retry keeps the stage's original instruction and appends one
 * correction line per violation. When the first attempt never produced an
 * image (provider error or timeout) a stage-specific reinforcement line is
 * appended instead of a correction for that tag.
 */
@Component
public class CorrectionInstructions {

    static final String CORRECTIONS_HEADER   = "CORRECTIONS REQUIRED (the previous attempt was rejected):";
    static final String REINFORCEMENT_HEADER = "REINFORCEMENT:";

    public String correct(String instruction, StageKind kind, List<ViolationTag> violations) {
        Set<String> corrections = new LinkedHashSet<>();
        boolean transport = false;
        for (ViolationTag tag : violations) {
            if (tag.isTransport()) {
                transport = true;
            } else {
                corrections.add(correctionFor(tag, kind));
            }
        }

        StringBuilder sb = new StringBuilder(instruction);
        if (!corrections.isEmpty()) {
            sb.append("\n\n").append(CORRECTIONS_HEADER);
            corrections.forEach(line -> sb.append("\n- ").append(line));
        }
        if (transport) {
            sb.append("\n\n").append(REINFORCEMENT_HEADER).append(' ').append(reinforcementFor(kind));
        }
        return sb.toString();
    }

    static String correctionFor(ViolationTag tag, StageKind kind) {
        return switch (tag) {
            case WALL_DECOR_PRESENT ->
                    "Remove any wall decor (frames, mirrors, prints, shelves, sconces).";
            case WINDOW_TREATMENT_PRESENT ->
                    "Remove any window treatments (curtains, blinds, shades).";
            case CIRCULATION_BLOCKED ->
                    "Keep at least 90 cm of clear circulation; do not block doors, stairs or walkways.";
            case COLOR_DRIFT_DETECTED ->
                    "Keep the original colors, white balance and exposure of the photo; do not recolor walls or floor.";
            case ITEM_COUNT_OUT_OF_RANGE ->
                    "Respect the item count for this " + describe(kind) + " stage exactly; add neither more nor fewer.";
            case PROVIDER_ERROR, PROVIDER_TIMEOUT ->
                    reinforcementFor(kind);
        };
    }

    static String reinforcementFor(StageKind kind) {
        return switch (kind) {
            case PRIMARY_FURNITURE -> "No wall decor or window treatments. Stairs and doors are no-placement zones.";
            case COMPLEMENTARY     -> "Only add items where space is clearly available. Prefer fewer items.";
            case WINDOW_TREATMENT  -> "Only treat windows that are clearly visible. Add nothing else.";
            case WALL_DECOR        -> "Only use free wall space. Better fewer items than a crowded wall.";
        };
    }

    private static String describe(StageKind kind) {
        return kind.name().toLowerCase().replace('_', ' ');
    }
}
