package htnlint.io;

import htnlint.invariant.InvariantRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InvariantConfigLoaderTest {

    @Test
    void applies_enabled_and_config() throws IOException {
        var registry = InvariantRegistry.withDefaults();
        int applied = InvariantConfigLoader.apply("""
                {
                  "delete_exists": {"enabled": true},
                  "tile_capacity": {"config": {"max_capacity": 3}},
                  "state_consistency": {"config": {"conflicts": [["open\\\\(", "closed\\\\("]]}},
                  "nope": {"enabled": false}
                }
                """, registry);

        assertEquals(3, applied);
        assertTrue(registry.get("delete_exists").enabled());

        Map<String, Object> tile = registry.get("tile_capacity").definition().config();
        assertEquals(3, tile.get("max_capacity"));
        assertTrue(tile.containsKey("pattern"));

        Object conflicts = registry.get("state_consistency").definition().config().get("conflicts");
        assertEquals(List.of(List.of("open\\(", "closed\\(")), conflicts);
    }

    @Test
    void configured_conflicts_are_checked() throws IOException {
        var registry = InvariantRegistry.withDefaults();
        InvariantConfigLoader.apply("{\"state_consistency\": {\"config\": {\"conflicts\": [[\"open\", \"closed\"]]}}}",
                registry);
        String message = registry.get("state_consistency")
                .checkOperator("toggle", List.of(), List.of("open(d)", "closed(d)"), List.of());
        assertEquals("Potentially conflicting facts added: open(d) and closed(d)", message);
    }

    @Test
    void rejects_malformed_files() {
        var registry = InvariantRegistry.withDefaults();
        assertThrows(IOException.class, () -> InvariantConfigLoader.apply("[]", registry));
        assertThrows(IOException.class, () -> InvariantConfigLoader.apply("{\"single_position\": 1}", registry));
        assertThrows(IOException.class,
                () -> InvariantConfigLoader.apply("{\"single_position\": {\"enabled\": \"yes\"}}", registry));
        assertThrows(IOException.class,
                () -> InvariantConfigLoader.apply("{\"single_position\": {\"config\": []}}", registry));
        assertThrows(IOException.class, () -> InvariantConfigLoader.apply("{not json", registry));
    }

    @Test
    void missing_file_propagates(@TempDir Path dir) {
        assertThrows(IOException.class,
                () -> InvariantConfigLoader.apply(dir.resolve("absent.json"), InvariantRegistry.withDefaults()));
    }

    @Test
    void saved_file_restores_state(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("invariants.json");
        var changed = InvariantRegistry.withDefaults();
        changed.enable("single_position", false);
        changed.configure("tile_capacity", Map.of("max_capacity", 4));
        InvariantConfigLoader.save(file, changed);
        assertTrue(Files.readString(file).contains("\"max_capacity\" : 4"));

        var restored = InvariantRegistry.withDefaults();
        assertEquals(5, InvariantConfigLoader.apply(file, restored));
        assertFalse(restored.get("single_position").enabled());
        assertEquals(4, restored.get("tile_capacity").definition().config().get("max_capacity"));
    }
}
