package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StyleProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which provider adapter stages a (room, style) pair.
 *
 * All {@link ImageProvider} beans are collected at startup. Resolution order:
 * <ol>
 *   <li>the adapter routed for the room ({@code stagecraft.provider.routes},
 *       comma-separated {@code room=adapter} pairs), else the default adapter;</li>
 *   <li>if that adapter does not support the pair, any other adapter that does
 *       (by name);</li>
 *   <li>otherwise {@link UnsupportedStagingException}.</li>
 * </ol>
 *
 * The chosen name is stored on the run, so later stages never re-resolve.
 */
@Component
public class ProviderCapabilityTable {

    private static final Logger log = LoggerFactory.getLogger(ProviderCapabilityTable.class);

    private final Map<String, ImageProvider>       providers = new ConcurrentHashMap<>();
    private final Map<RoomCategory, String>        routes    = new EnumMap<>(RoomCategory.class);
    private final String                           defaultProvider;

    public ProviderCapabilityTable(
            List<ImageProvider> allProviders,
            @Value("${stagecraft.provider.default:" + FluxKontextProvider.NAME + "}") String defaultProvider,
            @Value("${stagecraft.provider.routes:}") String routeSpec) {
        for (ImageProvider provider : allProviders) {
            providers.put(provider.name(), provider);
            log.info("Registered image provider '{}' [{}]", provider.name(), provider.sizeConstraints());
        }
        this.defaultProvider = defaultProvider;
        this.routes.putAll(parseRoutes(routeSpec));
        if (!providers.containsKey(defaultProvider)) {
            log.warn("Default image provider '{}' is not registered (known: {})",
                    defaultProvider, providerNames());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public ImageProvider byName(String name) {
        ImageProvider provider = providers.get(name);
        if (provider == null) {
            throw new ProviderNotFoundException(name);
        }
        return provider;
    }

    public Optional<ImageProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<String> providerNames() {
        return providers.keySet().stream().sorted().toList();
    }

    /**
     * @throws UnsupportedStagingException if no registered adapter serves the pair
     */
    public ImageProvider resolve(RoomCategory room, StyleProfile style) {
        String preferred = routes.getOrDefault(room, defaultProvider);
        ImageProvider candidate = providers.get(preferred);
        if (candidate != null && candidate.supports(room, style)) {
            return candidate;
        }
        return providers.values().stream()
                .sorted(Comparator.comparing(ImageProvider::name))
                .filter(p -> p.supports(room, style))
                .findFirst()
                .orElseThrow(() -> new UnsupportedStagingException(room, style));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    static Map<RoomCategory, String> parseRoutes(String spec) {
        Map<RoomCategory, String> parsed = new EnumMap<>(RoomCategory.class);
        if (spec == null || spec.isBlank()) return parsed;

        for (String pair : spec.split(",")) {
            String[] kv = pair.split("=", 2);
            if (kv.length != 2 || kv[1].isBlank()) {
                throw new IllegalArgumentException("Malformed provider route '" + pair.trim()
                        + "' (expected room=adapter)");
            }
            RoomCategory room = RoomCategory.fromWire(kv[0])
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown room category in provider route: '" + kv[0].trim() + "'"));
            parsed.put(room, kv[1].trim());
        }
        return parsed;
    }
}
