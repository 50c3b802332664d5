package com.stagecraft.engine.plan;

import com.stagecraft.engine.model.StyleProfile;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Style-guidance blocks appended to every stage instruction.
 *
 * Each profile pins palette, blocked colors, materials and proportions so the
 * provider keeps one coherent look across all stages of a run.
 */
public final class StyleGuide {

    /** Descriptors for one style. Empty lists are simply left out of the block. */
    public record StyleDetail(
            List<String> palette,
            List<String> paletteAccents,
            List<String> blockedColors,
            List<String> materials,
            List<String> silhouettes,
            List<String> details,
            List<String> hardware,
            List<String> patterns
    ) {}

    private static final Map<StyleProfile, StyleDetail> PROFILES = new EnumMap<>(StyleProfile.class);

    static {
        PROFILES.put(StyleProfile.STANDARD, new StyleDetail(
                List.of("warm greige", "taupe", "soft warm gray", "cream", "ecru"),
                List.of("muted olive", "warm beige"),
                List.of("navy", "cobalt blue", "electric blue", "icy blue"),
                List.of("oak/walnut veneer", "solid oak legs", "linen/cotton weaves", "brushed nickel"),
                List.of("soft rounded edges", "balanced proportions", "box cushions (medium firmness)"),
                List.of("edge radius 10-25 mm", "top-stitch seams", "tone-on-tone piping"),
                List.of("brushed nickel", "matte black (limited)"),
                List.of("subtle herringbone", "micro-chevron", "tone-on-tone weave")));

        PROFILES.put(StyleProfile.MODERN, new StyleDetail(
                List.of("greige", "taupe", "warm gray", "cream", "earthy charcoal"),
                List.of("desaturated olive", "warm sand"),
                List.of("blue upholstery", "navy", "steel-blue", "cold gray fabric"),
                List.of("matte lacquer", "powder-coated metal", "smoked glass", "stone (travertine/basalt)"),
                List.of("clean lines", "low-profile", "rectilinear with soft curves", "thin sled or blade legs"),
                List.of("flush fronts", "shadow gaps", "fluted wood panels (limited)"),
                List.of("matte black", "satin chrome"),
                List.of("plain weave", "micro-texture (no bold prints)")));

        PROFILES.put(StyleProfile.SCANDINAVIAN, new StyleDetail(
                List.of("white", "cream", "light oak", "beech", "warm gray", "soft pastel accents"),
                List.of("sage", "dusty pink (very subtle)"),
                List.of("navy", "cobalt", "high-saturation jewel tones"),
                List.of("boucle/wool", "oiled light wood", "stoneware", "cotton-linen"),
                List.of("organic curves", "minimal ornament", "airy forms", "tapered round legs"),
                List.of("visible wood grain", "softly rounded corners"),
                List.of("light wood pulls", "matte white/black minimal"),
                List.of("fine stripes", "subtle checks", "knit textures")));

        PROFILES.put(StyleProfile.INDUSTRIAL, new StyleDetail(
                List.of("charcoal", "ink", "tobacco", "warm gray", "rust brown"),
                List.of("aged brass (subtle)"),
                List.of("bright white glossy", "pastels", "navy velvet"),
                List.of("blackened steel", "raw/reclaimed wood", "concrete/stone", "oiled leather"),
                List.of("robust forms", "exposed joinery", "square tube frames"),
                List.of("visible welds (clean)", "bolted brackets"),
                List.of("blackened steel", "antique brass"),
                List.of("distressed leather grain", "muted geometric weaves")));

        PROFILES.put(StyleProfile.MIDCENTURY, new StyleDetail(
                List.of("walnut", "teak", "cream", "warm white", "olive", "mustard", "teal (muted)"),
                List.of("burnt orange (small doses)"),
                List.of("navy velvet", "chrome mirror-finish"),
                List.of("walnut/teak veneer", "solid wood tapered legs", "linen tweed", "boucle"),
                List.of("tapered legs", "slim profiles", "boxy cushions", "loose back cushions"),
                List.of("button tuft (light)", "piping", "finger joints (visible)"),
                List.of("brass", "matte black"),
                List.of("geometric/atomic", "fine houndstooth (small scale)")));

        PROFILES.put(StyleProfile.LUXURY, new StyleDetail(
                List.of("rich neutrals", "cream", "taupe", "jewel accents (emerald/sapphire)"),
                List.of("champagne gold"),
                List.of("rustic orange", "distressed wood tones", "matte-black overload"),
                List.of("velvet", "silk-blend", "marble", "mirror", "ribbed/fluted glass"),
                List.of("sculptural", "sumptuous", "softly curved arms"),
                List.of("deep plush seats", "mitered stone edges", "polished reveals"),
                List.of("polished brass", "champagne gold"),
                List.of("subtle sheen weaves", "fine ribbing")));

        PROFILES.put(StyleProfile.COASTAL, new StyleDetail(
                List.of("white", "sand", "driftwood", "warm gray", "soft seafoam"),
                List.of("powder blue (very light)"),
                List.of("navy lacquer", "heavy black metal"),
                List.of("rattan", "jute", "light woods", "linen/cotton", "washed finishes"),
                List.of("breezy", "casual", "rounded edges"),
                List.of("loose linen slipcovers", "open-weave panels"),
                List.of("brushed nickel", "light bronze"),
                List.of("subtle stripes", "botanical prints (muted)")));

        PROFILES.put(StyleProfile.FARMHOUSE, new StyleDetail(
                List.of("warm whites", "earth tones", "natural wood", "greige"),
                List.of("sage", "muted clay"),
                List.of("high-gloss lacquer", "mirror-chrome"),
                List.of("reclaimed/knotty wood", "stoneware", "textured cotton", "linen"),
                List.of("shaker profiles", "sturdy frames", "X-brace (limited, neat)"),
                List.of("visible grain", "soft distress (light)"),
                List.of("black/antique bronze"),
                List.of("gingham", "ticking stripes", "basket weaves")));
    }

    private StyleGuide() {}

    public static StyleDetail detail(StyleProfile style) {
        return PROFILES.get(style);
    }

    /**
     * Render the guidance block for a style. Lists are truncated so the
     * block stays short enough to leave room for the stage text.
     */
    public static String guidance(StyleProfile style) {
        StyleDetail s = PROFILES.get(style);
        if (s == null) return "";

        StringBuilder out = new StringBuilder();
        out.append("\nStyle requirements - ").append(style.label()).append(":\n");

        if (!s.palette().isEmpty() || !s.paletteAccents().isEmpty()) {
            out.append("* Color/Palette - prefer: ").append(take(s.palette(), 6));
            if (!s.paletteAccents().isEmpty()) {
                out.append("; subtle accents: ").append(take(s.paletteAccents(), 3));
            }
            out.append(".\n");
        }
        line(out, "* Color control - avoid strictly: ", s.blockedColors(), 6);
        line(out, "* Materials/Finishes - use: ",       s.materials(),     6);
        line(out, "* Silhouettes/Proportions - target: ", s.silhouettes(), 6);
        line(out, "* Hardware/Accents - ",              s.hardware(),      5);
        line(out, "* Construction details - ",          s.details(),       5);
        line(out, "* Textiles/Patterns - ",             s.patterns(),      5);
        return out.toString();
    }

    private static void line(StringBuilder out, String prefix, List<String> values, int limit) {
        if (values.isEmpty()) return;
        out.append(prefix).append(take(values, limit)).append(".\n");
    }

    private static String take(List<String> values, int n) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .limit(n)
                .collect(Collectors.joining(", "));
    }
}
