package com.stagecraft.engine.plan;

import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StageKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-room furnishing catalogue: for every stage kind, how many items to add
 * and which items are safe to add.
 *
 * The item lists act as semantic guardrails. Every list only holds freestanding
 * or surface-mounted pieces; nothing that would need construction work.
 */
public class RoomCatalogue {

    private final Map<RoomCategory, Map<StageKind, CatalogueEntry>> entries;

    public RoomCatalogue(Map<RoomCategory, Map<StageKind, CatalogueEntry>> entries) {
        this.entries = new EnumMap<>(RoomCategory.class);
        entries.forEach((room, byKind) -> this.entries.put(room, new EnumMap<>(byKind)));
    }

    public boolean supports(RoomCategory room) {
        return entries.containsKey(room);
    }

    /** Entry for a room/stage pair; a missing entry means "nothing to add" (0..0, no items). */
    public CatalogueEntry entry(RoomCategory room, StageKind kind) {
        Map<StageKind, CatalogueEntry> byKind = entries.get(room);
        if (byKind == null) {
            throw new IllegalArgumentException("No catalogue for room category " + room);
        }
        return byKind.getOrDefault(kind, CatalogueEntry.of(0, 0));
    }

    // ------------------------------------------------------------------
    // Built-in catalogue
    // ------------------------------------------------------------------

    public static RoomCatalogue standard() {
        Map<RoomCategory, Map<StageKind, CatalogueEntry>> m = new EnumMap<>(RoomCategory.class);

        m.put(RoomCategory.LIVING_ROOM, room(
                CatalogueEntry.of(2, 4,
                        "modular sectional (low-profile, neutral tones)",
                        "compact 2-3 seat sofa (straight arms, slim legs)",
                        "accent swivel chair (boucle or fabric)",
                        "barrel lounge chair (sculptural, upholstered)",
                        "chaise lounge (slim, modern profile)",
                        "smoked-glass coffee table with slim metal base",
                        "clear tempered-glass coffee table",
                        "marble or travertine coffee table",
                        "nesting coffee tables (glass or stone top, metal frame)",
                        "plinth-style coffee table",
                        "cylinder side table (stone, glass or lacquer)",
                        "round glass side table with metal legs",
                        "sculptural pedestal side table"),
                CatalogueEntry.of(3, 5,
                        "large area rug anchoring the front legs of the seating",
                        "layered rug (patterned rug over a neutral base rug)",
                        "arc floor lamp or slim linear floor lamp",
                        "reading floor lamp (slim, matte black or brass)",
                        "portable cordless table lamp",
                        "small sculptural table lamp (stone, ceramic or smoked glass)",
                        "contrasting throw pillows in complementary textures",
                        "neutral boucle or linen throw draped on the sofa",
                        "pouf or small ottoman",
                        "oversized floor cushion",
                        "indoor tree (olive, fiddle-leaf) in a matte planter",
                        "medium plant (monstera, rubber plant) in a ceramic planter",
                        "tall snake plant in a slim pedestal planter",
                        "tabletop plant in a small ceramic pot",
                        "dried pampas arrangement in a tall vase",
                        "cluster of ceramic or stone vases in varied heights",
                        "ribbed glass vase with a single branch",
                        "travertine tray with candles",
                        "sculptural object for the coffee table",
                        "stack of coffee table books",
                        "set of decorative stone bowls",
                        "pillar candles in glass holders",
                        "woven basket for throws",
                        "small decorative box for remotes"),
                CatalogueEntry.of(1, 4,
                        "linen curtains (floor-length, neutral tones)",
                        "sheer curtains (white or cream, light filtering)",
                        "double-layer curtains (sheer + blackout)",
                        "minimal curtain rod or ceiling track"),
                CatalogueEntry.of(0, 2,
                        "small framed artwork (abstract or botanical)",
                        "small round or pill mirror",
                        "plug-in wall sconces (pair, no hardwiring)",
                        "plug-in picture light over artwork")));

        m.put(RoomCategory.BEDROOM, room(
                CatalogueEntry.of(1, 1,
                        "queen or king-size bed"),
                CatalogueEntry.of(1, 2,
                        "bedside lamps proportional to the nightstand",
                        "slim floor lamp in a corner",
                        "layered bedding with decorative pillows and throw",
                        "area rug extending beyond the bed sides",
                        "freestanding leaner floor mirror",
                        "potted plant in a neutral planter",
                        "tray with small decorative objects on the dresser",
                        "stack of books on the nightstand",
                        "ceramic vase with greenery",
                        "woven basket for extra blankets",
                        "compact lidded laundry hamper"),
                CatalogueEntry.of(1, 1,
                        "blackout curtains (neutral fabric, floor length)"),
                CatalogueEntry.of(0, 1,
                        "framed artwork above the headboard",
                        "oversized round or arched mirror above the dresser",
                        "paired framed prints over the nightstands",
                        "picture ledge for photos (surface-mounted)",
                        "plug-in sconces above the nightstands")));

        m.put(RoomCategory.KITCHEN, room(
                CatalogueEntry.of(1, 3,
                        "counter or island stools (backless or low-back)",
                        "compact bistro set (small round table + 2 chairs)",
                        "narrow freestanding bar table with 2 stools",
                        "bar cart on casters"),
                CatalogueEntry.of(1, 3,
                        "low-pile runner rug along the circulation zone",
                        "compact floor plant in a corner away from work zones",
                        "tabletop bowl or vase on the bistro table",
                        "seat cushions for the stools"),
                CatalogueEntry.of(0, 2,
                        "cafe curtains (lower window only)",
                        "simple washable valance",
                        "moisture-resistant roman shades",
                        "easy-clean mini blinds",
                        "simple tie-up shades"),
                CatalogueEntry.of(0, 1,
                        "small framed print on a free wall",
                        "modern wall clock",
                        "slim surface-mounted picture ledge")));

        m.put(RoomCategory.BATHROOM, room(
                CatalogueEntry.of(0, 1,
                        "small stool (wood or stone)",
                        "slim freestanding console table",
                        "freestanding ladder towel rack",
                        "slim freestanding shelving tower"),
                CatalogueEntry.of(2, 4,
                        "coordinated towels",
                        "vanity tray with soap dispenser and jar",
                        "low-pile bath mat",
                        "small humidity-tolerant plant",
                        "compact lidded hamper",
                        "reed diffuser or LED candle"),
                CatalogueEntry.of(0, 1,
                        "frosted window film",
                        "moisture-resistant roman shade",
                        "washable cafe curtain",
                        "waterproof roller shade",
                        "moisture-resistant venetian blind"),
                CatalogueEntry.of(0, 1,
                        "small framed print on a free wall",
                        "auxiliary mirror on a free wall",
                        "slim wall shelf above the toilet")));

        m.put(RoomCategory.DINING_ROOM, room(
                CatalogueEntry.of(1, 2,
                        "extendable dining table (oak or walnut top, slim legs)",
                        "rectangular dining table with matte ceramic top",
                        "round pedestal dining table",
                        "set of dining chairs (upholstered or cane back)",
                        "cushioned bench for one side of the table",
                        "slim sideboard in a matching wood tone",
                        "slim bar console with glass doors"),
                CatalogueEntry.of(2, 4,
                        "area rug sized for the table with chairs pulled back",
                        "ceramic vase centerpiece with seasonal greenery",
                        "linen table runner in a muted color",
                        "pair of buffet lamps with fabric shades",
                        "corner plant in a tall ceramic planter",
                        "compact bar cart"),
                CatalogueEntry.of(1, 2,
                        "floor-length formal curtains",
                        "layered sheer and drape treatment",
                        "linen roman shades",
                        "wooden blinds matching the furniture",
                        "decorative curtain tiebacks"),
                CatalogueEntry.of(1, 2,
                        "large framed abstract artwork in muted tones",
                        "round oak-framed mirror proportional to the table",
                        "minimal floating shelf (max 20 cm deep)",
                        "pair of slim plug-in wall sconces")));

        m.put(RoomCategory.HOME_OFFICE, room(
                CatalogueEntry.of(2, 3,
                        "freestanding sit-stand desk",
                        "ergonomic task chair",
                        "guest or lounge chair",
                        "low credenza",
                        "bookcase or shelving unit",
                        "slim filing cabinet"),
                CatalogueEntry.of(2, 4,
                        "task desk lamp",
                        "floor lamp",
                        "area rug under the desk zone",
                        "low-light plant (snake plant or ZZ)",
                        "desktop organizers",
                        "monitor stand",
                        "cable management box"),
                CatalogueEntry.of(1, 2,
                        "light-filtering blinds",
                        "adjustable roman shades",
                        "vertical blinds",
                        "cordless cellular shades",
                        "neutral office curtains"),
                CatalogueEntry.of(0, 2,
                        "framed artwork or photography",
                        "whiteboard or cork board",
                        "pegboard organizer",
                        "shallow surface-mounted floating shelves",
                        "decorative acoustic panels")));

        m.put(RoomCategory.KIDS_ROOM, room(
                CatalogueEntry.of(2, 4,
                        "twin or full bed",
                        "nightstand",
                        "small desk with chair",
                        "bookshelf or cubby storage",
                        "toy organizer shelf",
                        "storage or reading bench"),
                CatalogueEntry.of(2, 4,
                        "soft area rug",
                        "toy baskets",
                        "beanbag or floor cushion",
                        "freestanding reading teepee",
                        "table lamp or night light",
                        "small plant out of reach"),
                CatalogueEntry.of(1, 2,
                        "blackout curtains",
                        "age-appropriate patterned curtains",
                        "cordless blinds",
                        "room darkening shades"),
                CatalogueEntry.of(1, 2,
                        "playful framed prints",
                        "name or initial framed art",
                        "shatterproof mirror at a safe height",
                        "shallow picture ledge for books",
                        "surface-mounted peg rail with hooks")));

        m.put(RoomCategory.OUTDOOR, room(
                CatalogueEntry.of(2, 4,
                        "modular outdoor sectional",
                        "pair of lounge chairs",
                        "outdoor coffee table",
                        "small bistro or dining set",
                        "chaise lounge",
                        "freestanding cantilever umbrella"),
                CatalogueEntry.of(2, 4,
                        "UV-resistant outdoor rug",
                        "planters with greenery in varied heights",
                        "lanterns or string lights on freestanding posts",
                        "outdoor cushions and throws",
                        "small side tables",
                        "decor tray for the table"),
                CatalogueEntry.of(0, 1,
                        "weather-resistant outdoor curtains",
                        "bamboo roll-up shades",
                        "outdoor privacy screen"),
                CatalogueEntry.of(0, 1,
                        "outdoor-safe wall art",
                        "shatterproof outdoor mirror",
                        "surface-mounted wall planter rack")));

        return new RoomCatalogue(m);
    }

    private static Map<StageKind, CatalogueEntry> room(CatalogueEntry primary, CatalogueEntry complementary,
                                                       CatalogueEntry windows, CatalogueEntry wall) {
        Map<StageKind, CatalogueEntry> byKind = new EnumMap<>(StageKind.class);
        byKind.put(StageKind.PRIMARY_FURNITURE, primary);
        byKind.put(StageKind.COMPLEMENTARY, complementary);
        byKind.put(StageKind.WINDOW_TREATMENT, windows);
        byKind.put(StageKind.WALL_DECOR, wall);
        return byKind;
    }
}
