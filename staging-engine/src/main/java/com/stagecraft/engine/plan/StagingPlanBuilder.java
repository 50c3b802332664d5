package com.stagecraft.engine.plan;

import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StageConfig;
import com.stagecraft.engine.model.StageKind;
import com.stagecraft.engine.model.StageSelection;
import com.stagecraft.engine.model.StagingPlan;
import com.stagecraft.engine.model.StyleProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the ordered stage plan for a (room, style) pair.
 *
 * The plan always runs primary furniture, complementary items, window
 * treatments and wall decor, in that order. Each stage gets:
 * <ul>
 *   <li>its item range and permitted items from the {@link RoomCatalogue},</li>
 *   <li>an instruction made of the stage's global rule, the stage body with a
 *       sampled subset of the permitted items, and the {@link StyleGuide} block.</li>
 * </ul>
 *
 * Deterministic apart from the example sampling done by {@link ExampleSampler}.
 */
@Component
public class StagingPlanBuilder {

    /** How many example items each stage instruction quotes. */
    static final Map<StageKind, Integer> EXAMPLE_COUNTS = new EnumMap<>(Map.of(
            StageKind.PRIMARY_FURNITURE, 3,
            StageKind.COMPLEMENTARY,     10,
            StageKind.WINDOW_TREATMENT,  3,
            StageKind.WALL_DECOR,        2));

    private final RoomCatalogue  catalogue;
    private final ExampleSampler sampler;

    public StagingPlanBuilder(RoomCatalogue catalogue, ExampleSampler sampler) {
        this.catalogue = catalogue;
        this.sampler   = sampler;
    }

    /**
     * @param selection which stages to keep; null keeps all four
     * @throws IllegalArgumentException if the selection keeps no stage or the room has no catalogue
     * @throws IllegalStateException    if the catalogue lets two stages share an item
     */
    public StagingPlan buildPlan(RoomCategory room, StyleProfile style, StageSelection selection) {
        if (!catalogue.supports(room)) {
            throw new IllegalArgumentException("No catalogue for room category " + room);
        }
        String styleBlock = StyleGuide.guidance(style);

        List<StageConfig> stages = new ArrayList<>();
        for (StageKind kind : StageKind.values()) {
            stages.add(buildStage(room, style, kind, styleBlock));
        }
        requireDisjointCategories(stages);

        // Filter after generation so the kept stages keep their relative order.
        StageSelection keep = selection == null ? StageSelection.all() : selection;
        List<StageConfig> kept = stages.stream()
                .filter(s -> keep.includes(s.stageKind()))
                .toList();
        if (kept.isEmpty()) {
            throw new IllegalArgumentException("Stage selection excludes every stage");
        }
        return new StagingPlan(room, style, kept);
    }

    // ------------------------------------------------------------------
    // Stage construction
    // ------------------------------------------------------------------

    private StageConfig buildStage(RoomCategory room, StyleProfile style, StageKind kind, String styleBlock) {
        CatalogueEntry entry = catalogue.entry(room, kind);
        if (entry.items().isEmpty()) {
            return new StageConfig(kind, 0, 0, List.of(),
                    globalRule(kind) + "\n" + nothingToAdd(kind, room) + styleBlock);
        }

        List<String> examples = sampler.sample(entry.items(), EXAMPLE_COUNTS.get(kind));
        String body = stageBody(kind, room.label(), style.label(),
                entry.minItems(), entry.maxItems(), String.join(", ", examples));
        return new StageConfig(kind, entry.minItems(), entry.maxItems(), entry.items(),
                globalRule(kind) + "\n" + body + styleBlock);
    }

    private static void requireDisjointCategories(List<StageConfig> stages) {
        Set<String> seen = new HashSet<>();
        for (StageConfig stage : stages) {
            for (String category : stage.allowedCategories()) {
                if (!seen.add(category)) {
                    throw new IllegalStateException(
                            "Category '" + category + "' appears in more than one stage");
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Instruction text
    // ------------------------------------------------------------------

    static String globalRule(StageKind kind) {
        String scope = switch (kind) {
            case PRIMARY_FURNITURE -> "Add only furniture items, on top of the original photo; "
                    + "never modify, move, or substitute any existing structures or surfaces.";
            case COMPLEMENTARY     -> "Add only decor items, on top of the original photo; "
                    + "never modify, move, or substitute any existing structures or surfaces.";
            case WINDOW_TREATMENT  -> "Add only window treatments and window decoration items, on top of the "
                    + "original photo; never modify, move, or substitute any existing structures, "
                    + "furniture, decor or surfaces.";
            case WALL_DECOR        -> "Add only wall decoration items, on top of the original photo; "
                    + "never modify, move, or substitute any existing structures, furniture, decor or surfaces.";
        };
        return scope + " Maintain the same composition, perspective, and natural lighting.\n"
                + "Do not alter or replace any fixed architectural or material elements: keep the floor, "
                + "walls, ceiling, doors, windows, countertops, cabinetry, stair parts, lighting fixtures, "
                + "trims, and all existing colors identical.";
    }

    private static String stageBody(StageKind kind, String room, String style,
                                    int min, int max, String examples) {
        return switch (kind) {
            case PRIMARY_FURNITURE -> """
                    Add main furniture appropriate to this %s in %s style.
                    Select only between %d-%d essential main pieces from the list: %s.
                    """.formatted(room, style, min, max, examples);
            case COMPLEMENTARY -> """
                    Add appropriate complementary items to this %s in %s style.
                    Select only between %d-%d complementary items from the list below to complete the scene.
                    %s

                    Maintain at least 90 cm (36") of clear circulation. Rugs must anchor the zone and lie \
                    fully on the floor; do not cover stair treads or thresholds.
                    If in doubt about fit or clearance, skip the item.
                    """.formatted(room, style, min, max, examples);
            case WINDOW_TREATMENT -> """
                    Add appropriate window decoration items and treatments to this %s in %s style.
                    Select only between %d-%d window treatments from the list below to complete the scene.
                    %s

                    Install window treatments only where windows actually exist in the image.
                    If unsure about window presence or clearance, SKIP.
                    """.formatted(room, style, min, max, examples);
            case WALL_DECOR -> """
                    Add appropriate wall decoration items and accessories to this %s in %s style.
                    Select only between %d-%d wall decor items from the list below to complete the scene.
                    %s

                    If no free wall space exists (due to windows/doors), SKIP.
                    """.formatted(room, style, min, max, examples);
        };
    }

    private static String nothingToAdd(StageKind kind, RoomCategory room) {
        return "This " + room.label() + " takes no "
                + kind.name().toLowerCase().replace('_', ' ')
                + " items. Leave the scene exactly as it is.\n";
    }
}
