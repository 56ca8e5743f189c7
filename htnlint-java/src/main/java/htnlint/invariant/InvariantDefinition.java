package htnlint.invariant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Serializable metadata of a registered invariant. Immutable; the registry replaces it on change. */
public record InvariantDefinition(
        String id,
        String name,
        String description,
        String category,
        boolean enabled,
        Map<String, Object> config
) {
    public InvariantDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        category = category == null ? "general" : category;
        config = freeze(config);
    }

    public InvariantDefinition withEnabled(boolean on) {
        return new InvariantDefinition(id, name, description, category, on, config);
    }

    /** Returns a copy whose config holds {@code updates} merged over the current entries. */
    public InvariantDefinition withConfig(Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(config);
        merged.putAll(updates);
        return new InvariantDefinition(id, name, description, category, enabled, merged);
    }

    static Map<String, Object> freeze(Map<String, Object> config) {
        if (config == null || config.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
