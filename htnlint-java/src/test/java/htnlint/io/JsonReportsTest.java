package htnlint.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import htnlint.analysis.Analyzer;
import htnlint.invariant.InvariantRegistry;
import htnlint.sema.Linter;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JsonReportsTest {

    private static final ObjectMapper READER = new ObjectMapper();

    private static JsonNode read(String json) throws Exception {
        return READER.readTree(json);
    }

    private static final String SRC = """
            goals(main()).
            at(u1, t1).
            main() :- if(at(u1, t1)), do(move()).
            move() :- del(at(u1, t1)), add(at(u1, t2)).
            """;

    @Test
    void analysis_uses_snake_case_keys() throws Exception {
        JsonNode root = read(JsonReports.toJson(new Analyzer(SRC).analyze(InvariantRegistry.withDefaults().enabled())));
        Set<String> keys = new HashSet<>();
        root.fieldNames().forEachRemaining(keys::add);
        assertEquals(Set.of("nodes", "edges", "goals", "reachable", "unreachable", "cycles", "diagnostics",
                "initial_facts", "state_changes", "invariant_violations", "stats"), keys);

        assertEquals("at(u1, t1)", root.get("initial_facts").get(0).asText());
        assertEquals("-{at(u1, t1)} +{at(u1, t2)}", root.get("state_changes").get("move/0").get("net_effect").asText());
        assertEquals(1, root.get("stats").get("goals").asInt());
    }

    @Test
    void node_and_edge_shape() throws Exception {
        JsonNode root = read(JsonReports.toJson(new Analyzer(SRC).analyze()));
        JsonNode move = root.get("nodes").get("move/0");
        assertEquals("operator", move.get("type").asText());
        assertEquals("main/0", move.get("called_by").get(0).asText());
        assertEquals(1, move.get("definition_count").asInt());
        assertFalse(move.has("defined"));

        JsonNode edge = root.get("edges").get(0);
        assertEquals("main/0", edge.get("from").asText());
        assertEquals("move/0", edge.get("to").asText());
        assertEquals("calls", edge.get("type").asText());
    }

    @Test
    void method_modifier_keys() throws Exception {
        JsonNode root = read(JsonReports.toJson(new Analyzer("m() :- if(), allOf, do(m()).").analyze()));
        JsonNode m = root.get("nodes").get("m/0");
        assertTrue(m.get("has_allof").asBoolean());
        assertFalse(m.get("has_anyof").asBoolean());
        assertFalse(m.has("has_all_of"));
        assertFalse(m.has("has_any_of"));
        assertTrue(root.get("diagnostics").get(0).has("col"));
    }

    @Test
    void violation_and_diagnostic_shape() throws Exception {
        JsonNode root = read(JsonReports.toJson(new Analyzer(SRC).analyze(InvariantRegistry.withDefaults().enabled())));
        JsonNode violation = root.get("invariant_violations").get(0);
        assertEquals("Tile Capacity", violation.get("invariant").asText());
        assertEquals("move/0", violation.get("operator").asText());
        assertEquals(4, violation.get("line").asInt());

        JsonNode diagnostic = root.get("diagnostics").get(0);
        assertEquals("warning", diagnostic.get("severity").asText());
        assertEquals("INV001", diagnostic.get("code").asText());
        assertFalse(diagnostic.has("error"));
    }

    @Test
    void lint_diagnostics_wrapped() throws Exception {
        JsonNode root = read(JsonReports.toJson(new Linter("m() :- if(), do(x()).").lint()));
        JsonNode first = root.get("diagnostics").get(0);
        assertEquals("error", first.get("severity").asText());
        assertEquals("SEM001", first.get("code").asText());
        assertEquals(1, first.get("line").asInt());
        assertEquals(17, first.get("col").asInt());
        assertFalse(first.has("column"));
    }

    @Test
    void registry_listing() throws Exception {
        JsonNode root = read(JsonReports.toJson(InvariantRegistry.withDefaults()));
        assertEquals(5, root.get("invariants").size());
        JsonNode first = root.get("invariants").get(0);
        assertEquals("single_position", first.get("id").asText());
        assertEquals("Single Position", first.get("name").asText());
        assertTrue(first.get("enabled").asBoolean());
        assertTrue(first.get("config").has("pattern"));
        assertEquals("position", root.get("categories").get(0).asText());
        assertEquals("consistency", root.get("categories").get(1).asText());
    }

    @Test
    void same_source_same_json() {
        var invariants = InvariantRegistry.withDefaults().enabled();
        assertEquals(JsonReports.toJson(new Analyzer(SRC).analyze(invariants)),
                JsonReports.toJson(new Analyzer(SRC).analyze(invariants)));
    }
}
