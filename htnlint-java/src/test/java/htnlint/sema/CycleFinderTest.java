package htnlint.sema;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CycleFinderTest {

    private static List<List<String>> cycles(Map<String, List<String>> graph, List<String> roots) {
        return new CycleFinder(roots, graph::get).find();
    }

    @Test
    void finds_open_cycles_in_discovery_order() {
        var graph = Map.of(
                "a", List.of("b"),
                "b", List.of("c"),
                "c", List.of("a"),
                "d", List.of("d"));
        assertEquals(List.of(List.of("a", "b", "c"), List.of("d")), cycles(graph, List.of("a", "d")));
    }

    @Test
    void acyclic_graph_has_no_cycles() {
        var graph = Map.of(
                "a", List.of("b", "c"),
                "b", List.of("c"),
                "c", List.<String>of());
        assertEquals(List.of(), cycles(graph, List.of("a", "b", "c")));
    }

    @Test
    void cycle_starts_at_back_edge_target() {
        var graph = Map.of(
                "root", List.of("x"),
                "x", List.of("y"),
                "y", List.of("x"));
        assertEquals(List.of(List.of("x", "y")), cycles(graph, List.of("root")));
    }

    @Test
    void missing_successors_are_leaves() {
        assertEquals(List.of(), cycles(Map.of("a", List.of("ghost")), List.of("a")));
    }

    @Test
    void deep_chain_does_not_overflow() {
        int n = 200_000;
        var finder = new CycleFinder(List.of("0"), key -> {
            int i = Integer.parseInt(key);
            return i < n ? List.of(String.valueOf(i + 1)) : List.of("0");
        });
        var found = finder.find();
        assertEquals(1, found.size());
        assertEquals(n + 1, found.get(0).size());
    }
}
