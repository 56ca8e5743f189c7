package htnlint.analysis;

import htnlint.ast.Rule;
import htnlint.ast.Term;
import htnlint.diag.Codes;
import htnlint.diag.Diagnostic;
import htnlint.diag.Severity;
import htnlint.invariant.StateInvariant;
import htnlint.parser.Parser;
import htnlint.sema.Builtins;
import htnlint.sema.CycleFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds the call graph of one source text and derives reachability, recursion cycles, the
 * state changes of every operator and invariant violations from it.
 *
 * <p>Reachability starts from the declared {@code goals(...)}. Without goals every method is a
 * root, which is looser than the linter's dead-code check.
 */
public final class Analyzer {
    private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

    private final String source;
    private final NodeArena arena = new NodeArena();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<String> goals = new ArrayList<>();
    private final List<String> initialFacts = new ArrayList<>();
    private final Set<String> reachable = new LinkedHashSet<>();
    private final Set<String> unreachable = new LinkedHashSet<>();
    private final List<List<String>> cycles = new ArrayList<>();
    private final List<InvariantViolation> violations = new ArrayList<>();
    private List<Rule> rules = List.of();

    public Analyzer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public AnalysisResult analyze() {
        return analyze(List.of());
    }

    public AnalysisResult analyze(List<StateInvariant> invariants) {
        Parser.Result parsed = new Parser(source).parse();
        rules = parsed.rules();
        diagnostics.addAll(parsed.diagnostics());

        buildCallGraph();
        computeReachability();
        detectCycles();
        Map<String, StateChange> stateChanges = analyzeStateFlow();
        checkInvariants(invariants);

        Map<String, CallGraphNode> nodes = arena.freeze();
        AnalysisResult result = new AnalysisResult(
                nodes,
                edges(nodes),
                List.copyOf(goals),
                Collections.unmodifiableSet(new LinkedHashSet<>(reachable)),
                Collections.unmodifiableSet(new LinkedHashSet<>(unreachable)),
                List.copyOf(cycles),
                List.copyOf(diagnostics),
                List.copyOf(initialFacts),
                stateChanges,
                List.copyOf(violations),
                stats(nodes));
        log.debug("Analyzed {} rules: {} nodes, {} cycles, {} violations",
                rules.size(), nodes.size(), cycles.size(), violations.size());
        return result;
    }

    // ---------- call graph ----------
    private void buildCallGraph() {
        for (Rule rule : rules) {
            NodeArena.Node node = arena.define(rule);

            if (rule.doClause() != null) {
                for (Term task : rule.doClause().args()) addCalls(node, task);
            }
            if (rule.ifClause() != null) {
                for (Term cond : rule.ifClause().args()) node.conditions.add(cond.toString());
            }
            if (rule.delClause() != null) {
                for (Term fact : rule.delClause().args()) node.deletes.add(fact.toString());
            }
            if (rule.addClause() != null) {
                for (Term fact : rule.addClause().args()) node.adds.add(fact.toString());
            }

            if (node.role == NodeRole.GOAL) {
                for (Term goal : rule.head().args()) goals.add(goal.key());
            } else if (rule.isFact()) {
                initialFacts.add(rule.head().toString());
            }
        }
    }

    private void addCalls(NodeArena.Node caller, Term task) {
        if (Builtins.isTaskWrapper(task.name())) {
            for (Term inner : task.args()) addCalls(caller, inner);
            return;
        }
        if (task.isVariable()) return;

        caller.calls.add(task.key());
        arena.reference(task).calledBy.add(caller.key);
    }

    // ---------- reachability ----------
    private void computeReachability() {
        if (goals.isEmpty()) {
            for (NodeArena.Node node : arena.all()) {
                if (node.role == NodeRole.METHOD) markReachable(node.key);
            }
        } else {
            for (String goal : goals) markReachable(goal);
        }

        for (NodeArena.Node node : arena.all()) {
            if (node.role != NodeRole.METHOD && node.role != NodeRole.OPERATOR) continue;
            // undefined callees are reported by the linter
            if (node.definitionCount == 0 || reachable.contains(node.key)) continue;
            unreachable.add(node.key);
            String kind = node.role == NodeRole.METHOD ? "Method" : "Operator";
            diagnostics.add(Diagnostic.warning(node.line, node.column, node.name.length(),
                    kind + " '" + node.name + "' is not reachable from any goal", Codes.UNREACHABLE));
        }
    }

    private void markReachable(String root) {
        Deque<String> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            String key = work.pop();
            if (!reachable.add(key)) continue;

            NodeArena.Node node = arena.get(key);
            if (node == null) continue;
            List<String> callees = new ArrayList<>(node.calls);
            Collections.reverse(callees);
            for (String callee : callees) {
                if (!reachable.contains(callee)) work.push(callee);
            }
        }
    }

    // ---------- cycles ----------
    private void detectCycles() {
        CycleFinder finder = new CycleFinder(new ArrayList<>(arena.keys()), key -> {
            NodeArena.Node node = arena.get(key);
            return node == null ? null : node.calls;
        });

        for (List<String> open : finder.find()) {
            List<String> normalized = normalize(open);
            if (!cycles.contains(normalized)) cycles.add(normalized);
        }

        for (List<String> cycle : cycles) {
            NodeArena.Node first = arena.get(cycle.get(0));
            String walk = cycle.stream().map(Analyzer::nameOf).collect(Collectors.joining(" -> "));
            diagnostics.add(Diagnostic.warning(first.line, first.column, first.name.length(),
                    "Potential infinite recursion: " + walk, Codes.RECURSION));
        }
    }

    /** Rotates an open cycle to start at its smallest key and closes it: [b, a] becomes [a, b, a]. */
    static List<String> normalize(List<String> open) {
        int start = open.indexOf(Collections.min(open));
        List<String> closed = new ArrayList<>(open.size() + 1);
        closed.addAll(open.subList(start, open.size()));
        closed.addAll(open.subList(0, start));
        closed.add(open.get(start));
        return List.copyOf(closed);
    }

    // ---------- state flow ----------
    private Map<String, StateChange> analyzeStateFlow() {
        Map<String, StateChange> changes = new LinkedHashMap<>();
        for (NodeArena.Node node : arena.all()) {
            if (node.role == NodeRole.OPERATOR) changes.put(node.key, StateChange.of(node.deletes, node.adds));
        }
        return Collections.unmodifiableMap(changes);
    }

    // ---------- invariants ----------
    private void checkInvariants(List<StateInvariant> invariants) {
        for (StateInvariant invariant : invariants) {
            if (!invariant.enabled()) continue;

            for (NodeArena.Node node : arena.all()) {
                if (node.role != NodeRole.OPERATOR) continue;

                String message;
                try {
                    message = invariant.checkOperator(node.name, node.deletes, node.adds, initialFacts);
                } catch (RuntimeException e) {
                    log.warn("Invariant {} failed on {}", invariant.id(), node.key, e);
                    message = "Error checking invariant: " + e.getMessage();
                }
                if (message == null) continue;

                violations.add(new InvariantViolation(invariant.name(), node.key, node.line, message));
                diagnostics.add(Diagnostic.warning(node.line, node.column, node.name.length(),
                        "Invariant '" + invariant.name() + "' may be violated: " + message,
                        Codes.INVARIANT_VIOLATION));
            }
        }
    }

    // ---------- summary ----------
    private static List<Edge> edges(Map<String, CallGraphNode> nodes) {
        List<Edge> edges = new ArrayList<>();
        for (CallGraphNode node : nodes.values()) {
            for (String callee : node.calls()) edges.add(new Edge(node.key(), callee, Edge.CALLS));
        }
        return List.copyOf(edges);
    }

    private Map<String, Integer> stats(Map<String, CallGraphNode> nodes) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("total_rules", rules.size());
        stats.put("methods", countRole(nodes, NodeRole.METHOD));
        stats.put("operators", countRole(nodes, NodeRole.OPERATOR));
        stats.put("facts", initialFacts.size());
        stats.put("goals", goals.size());
        stats.put("reachable", reachable.size());
        stats.put("unreachable", unreachable.size());
        stats.put("cycles", cycles.size());
        stats.put("invariant_violations", violations.size());
        stats.put("errors", countSeverity(Severity.ERROR));
        stats.put("warnings", countSeverity(Severity.WARNING));
        stats.put("infos", countSeverity(Severity.INFO));
        return Collections.unmodifiableMap(stats);
    }

    private static int countRole(Map<String, CallGraphNode> nodes, NodeRole role) {
        return (int) nodes.values().stream().filter(n -> n.role() == role && n.isDefined()).count();
    }

    private int countSeverity(Severity severity) {
        return (int) diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    private static String nameOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(0, slash);
    }
}
