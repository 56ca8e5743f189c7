package htnlint.io;

import com.fasterxml.jackson.databind.JsonNode;
import htnlint.invariant.InvariantDefinition;
import htnlint.invariant.InvariantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies an invariant configuration file to a registry. The file maps invariant ids to
 * {@code {"enabled": bool, "config": {...}}}; both members are optional.
 */
public final class InvariantConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(InvariantConfigLoader.class);

    private InvariantConfigLoader() {}

    /** Returns the number of entries applied. */
    public static int apply(Path file, InvariantRegistry registry) throws IOException {
        log.info("Loading invariant configuration from {}", file);
        return apply(Files.readString(file), registry);
    }

    public static int apply(String json, InvariantRegistry registry) throws IOException {
        JsonNode root = JsonReports.mapper().readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Invariant configuration must be a JSON object");
        }

        int applied = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String id = entry.getKey();
            JsonNode settings = entry.getValue();

            if (registry.get(id) == null) {
                log.warn("Skipping unknown invariant '{}'", id);
                continue;
            }
            if (!settings.isObject()) {
                throw new IOException("Settings of invariant '" + id + "' must be a JSON object");
            }

            JsonNode enabled = settings.get("enabled");
            if (enabled != null) {
                if (!enabled.isBoolean()) throw new IOException("'enabled' of invariant '" + id + "' must be a boolean");
                registry.enable(id, enabled.booleanValue());
            }

            JsonNode config = settings.get("config");
            if (config != null) {
                if (!config.isObject()) throw new IOException("'config' of invariant '" + id + "' must be a JSON object");
                registry.configure(id, toMap(config));
            }
            applied++;
        }
        return applied;
    }

    /** Writes every invariant's enabled flag and configuration in the format {@link #apply} reads. */
    public static void save(Path file, InvariantRegistry registry) throws IOException {
        Map<String, Object> out = new LinkedHashMap<>();
        for (InvariantDefinition d : registry.list()) {
            Map<String, Object> settings = new LinkedHashMap<>();
            settings.put("enabled", d.enabled());
            settings.put("config", d.config());
            out.put(d.id(), settings);
        }
        Files.writeString(file, JsonReports.toJson(out));
        log.info("Saved invariant configuration to {}", file);
    }

    private static Map<String, Object> toMap(JsonNode object) {
        Map<String, Object> out = new LinkedHashMap<>();
        object.fields().forEachRemaining(e ->
                out.put(e.getKey(), JsonReports.mapper().convertValue(e.getValue(), Object.class)));
        return out;
    }
}
