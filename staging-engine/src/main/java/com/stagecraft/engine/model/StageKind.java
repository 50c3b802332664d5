package com.stagecraft.engine.model;

/**
 * The four generation stages, in the only order a plan may run them.
 *
 * Each later stage assumes the furnishing state left by the earlier ones,
 * so the declaration order here is the execution order.
 */
public enum StageKind {
    PRIMARY_FURNITURE,  // sofas, beds, tables: the structural pieces
    COMPLEMENTARY,      // rugs, lamps, plants, textiles, small objects
    WINDOW_TREATMENT,   // curtains, blinds, shades on existing windows
    WALL_DECOR          // art, mirrors, shelves, plug-in sconces
}
