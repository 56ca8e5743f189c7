package htnlint.analysis;

import htnlint.diag.Diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one analysis derived from one source text. All collections are unmodifiable and
 * iterate in a fixed order, so analyzing the same text twice gives equal results.
 */
public record AnalysisResult(
        Map<String, CallGraphNode> nodes,
        List<Edge> edges,
        List<String> goals,
        Set<String> reachable,
        Set<String> unreachable,
        List<List<String>> cycles,
        List<Diagnostic> diagnostics,
        List<String> initialFacts,
        Map<String, StateChange> stateChanges,
        List<InvariantViolation> invariantViolations,
        Map<String, Integer> stats
) {
    public CallGraphNode node(String key) {
        return nodes.get(key);
    }
}
