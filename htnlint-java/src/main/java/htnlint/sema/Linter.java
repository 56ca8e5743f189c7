package htnlint.sema;

import htnlint.ast.Rule;
import htnlint.ast.Term;
import htnlint.diag.Codes;
import htnlint.diag.Diagnostic;
import htnlint.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Syntax and semantic checks over one source text.
 *
 * <p>Each check reads the parsed rules and the symbol table and appends to the shared diagnostic
 * list; no check depends on another's output.
 */
public final class Linter {
    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private final String source;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private List<Rule> rules = List.of();
    private SymbolTable symbols = new SymbolTable();

    public Linter(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public List<Diagnostic> lint() {
        Parser.Result parsed = new Parser(source).parse();
        rules = parsed.rules();
        diagnostics.addAll(parsed.diagnostics());

        symbols = SymbolTable.build(rules);

        checkVariableBinding();
        checkHtnShape();
        checkUndefinedReferences();
        checkArityConsistency();
        checkDuplicateOperators();
        checkDeadCode();
        checkCycles();
        checkElseUsage();
        checkEmptyClauses();
        checkSingletonVariables();

        log.debug("Linted {} rules: {} diagnostics", rules.size(), diagnostics.size());
        return List.copyOf(diagnostics);
    }

    // ---------- variable binding ----------
    private void checkVariableBinding() {
        for (Rule rule : rules) {
            if (!rule.isMethod() || rule.doClause() == null) continue;

            Set<String> bound = new HashSet<>(rule.head().variables());
            if (rule.ifClause() != null) bound.addAll(rule.ifClause().variables());

            for (Term task : rule.doClause().args()) {
                for (String var : task.variables()) {
                    if (bound.contains(var)) continue;
                    Term at = task.findVariable(var);
                    diagnostics.add(Diagnostic.error(at.line(), at.column(), var.length(),
                            "Variable '" + var + "' in do() is not bound in head or if()",
                            Codes.UNBOUND_DO_VARIABLE));
                }
            }
        }

        for (Rule rule : rules) {
            if (!rule.isOperator() || rule.addClause() == null) continue;

            Set<String> bound = new HashSet<>(rule.head().variables());
            if (rule.delClause() != null) bound.addAll(rule.delClause().variables());

            for (String var : rule.addClause().variables()) {
                if (bound.contains(var)) continue;
                Term at = rule.addClause().findVariable(var);
                diagnostics.add(Diagnostic.error(at.line(), at.column(), var.length(),
                        "Variable '" + var + "' in add() is not bound", Codes.UNBOUND_ADD_VARIABLE));
            }
        }
    }

    // ---------- HTN shape ----------
    private void checkHtnShape() {
        for (Rule rule : rules) {
            String name = rule.name();
            if (rule.isMethod() && (rule.delClause() != null || rule.addClause() != null)) {
                diagnostics.add(atHead(rule, true,
                        "Method '" + name + "' uses operator syntax (del/add). Use if/do instead.",
                        Codes.METHOD_WITH_EFFECTS));
            }
            if (rule.isOperator() && (rule.ifClause() != null || rule.doClause() != null)) {
                diagnostics.add(atHead(rule, true,
                        "Operator '" + name + "' uses method syntax (if/do). Use del/add instead.",
                        Codes.OPERATOR_WITH_DECOMPOSITION));
            }
            if (rule.isOperator() && (rule.hasAllOf() || rule.hasAnyOf())) {
                String modifier = rule.hasAllOf() ? "allOf" : "anyOf";
                diagnostics.add(atHead(rule, false,
                        "'" + modifier + "' modifier on operator '" + name + "' has no effect",
                        Codes.MODIFIER_ON_OPERATOR));
            }
        }
    }

    // ---------- undefined references ----------
    private void checkUndefinedReferences() {
        Set<String> known = new HashSet<>(symbols.definedKeys());
        known.addAll(Builtins.predicates());
        known.addAll(factAtoms());

        for (Rule rule : rules) {
            if (rule.doClause() != null) {
                for (Term task : rule.doClause().args()) checkTaskDefined(task, known);
            }
            if (rule.ifClause() != null) {
                for (Term cond : rule.ifClause().args()) checkPredicateDefined(cond, known);
            }
        }
    }

    /** Atoms used as arguments of facts: {@code at(person, downtown).} makes person/0 and downtown/0 known. */
    private Set<String> factAtoms() {
        Set<String> atoms = new HashSet<>();
        Deque<Term> work = new ArrayDeque<>();
        for (Rule rule : rules) {
            if (rule.isFact()) work.addAll(rule.head().args());
        }
        while (!work.isEmpty()) {
            Term t = work.pop();
            if (t.isVariable()) continue;
            if (t.args().isEmpty()) atoms.add(t.key());
            work.addAll(t.args());
        }
        return atoms;
    }

    private void checkTaskDefined(Term task, Set<String> known) {
        if (Builtins.isTaskWrapper(task.name())) {
            for (Term inner : task.args()) checkTaskDefined(inner, known);
            return;
        }
        if (task.isVariable()) return;

        if (!known.contains(task.key())) {
            diagnostics.add(Diagnostic.error(task.line(), task.column(), task.name().length(),
                    "Undefined method or operator: " + task.key(), Codes.UNDEFINED_TASK));
        }
    }

    private void checkPredicateDefined(Term pred, Set<String> known) {
        if (pred.isVariable() || pred.isLiteral()) return;

        boolean reportable = !pred.isList() && !Builtins.isOperator(pred.name());
        if (reportable && !known.contains(pred.key())) {
            diagnostics.add(Diagnostic.warning(pred.line(), pred.column(), pred.name().length(),
                    "Undefined predicate: " + pred.key(), Codes.UNDEFINED_PREDICATE));
        }
        for (Term arg : pred.args()) checkPredicateDefined(arg, known);
    }

    // ---------- arity consistency ----------
    private void checkArityConsistency() {
        Map<String, SortedSet<Integer>> arities = new LinkedHashMap<>();

        for (Role role : List.of(Role.METHOD, Role.OPERATOR, Role.PREDICATE, Role.FACT)) {
            for (List<SymbolInfo> infos : symbols.byRole(role).values()) {
                SymbolInfo first = infos.get(0);
                arities.computeIfAbsent(first.name(), k -> new TreeSet<>()).add(first.arity());
            }
        }

        for (Rule rule : rules) {
            for (Term clause : Arrays.asList(rule.ifClause(), rule.delClause(), rule.addClause())) {
                if (clause == null) continue;
                for (Term arg : clause.args()) collectArities(arg, arities);
            }
        }

        for (Map.Entry<String, SortedSet<Integer>> e : arities.entrySet()) {
            if (e.getValue().size() < 2) continue;
            String name = e.getKey();
            String list = e.getValue().stream().map(String::valueOf).collect(Collectors.joining(", "));
            firstRuleNamed(name).ifPresent(rule -> diagnostics.add(atHead(rule, false,
                    "'" + name + "' used with multiple arities: " + list, Codes.ARITY_MISMATCH)));
        }
    }

    private static void collectArities(Term term, Map<String, SortedSet<Integer>> arities) {
        if (term.isVariable() || term.isLiteral()) return;
        if (!term.isList() && !Builtins.isOperator(term.name())) {
            arities.computeIfAbsent(term.name(), k -> new TreeSet<>()).add(term.arity());
        }
        for (Term arg : term.args()) collectArities(arg, arities);
    }

    // ---------- duplicates ----------
    private void checkDuplicateOperators() {
        for (List<SymbolInfo> infos : symbols.byRole(Role.OPERATOR).values()) {
            SymbolInfo first = infos.get(0);
            for (SymbolInfo dup : infos.subList(1, infos.size())) {
                diagnostics.add(Diagnostic.warning(dup.line(), dup.column(), dup.name().length(),
                        "Duplicate operator '" + first.key() + "' (also defined on line " + first.line() + ")",
                        Codes.DUPLICATE_OPERATOR));
            }
        }
    }

    // ---------- dead code ----------
    private void checkDeadCode() {
        Set<String> live;
        String suffix;
        if (!symbols.goals().isEmpty()) {
            live = reachableFromGoals();
            suffix = "";
        } else {
            live = new HashSet<>();
            symbols.calls().values().forEach(live::addAll);
            suffix = " by any method";
        }

        for (Map.Entry<String, List<SymbolInfo>> e : symbols.byRole(Role.METHOD).entrySet()) {
            if (live.contains(e.getKey())) continue;
            SymbolInfo info = e.getValue().get(0);
            diagnostics.add(Diagnostic.warning(info.line(), info.column(), info.name().length(),
                    "Method '" + info.name() + "' is never called (dead code)", Codes.DEAD_METHOD));
        }
        for (Map.Entry<String, List<SymbolInfo>> e : symbols.byRole(Role.OPERATOR).entrySet()) {
            if (live.contains(e.getKey())) continue;
            SymbolInfo info = e.getValue().get(0);
            diagnostics.add(Diagnostic.warning(info.line(), info.column(), info.name().length(),
                    "Operator '" + info.name() + "' is never called" + suffix + " (dead code)", Codes.DEAD_OPERATOR));
        }
    }

    private Set<String> reachableFromGoals() {
        Set<String> reachable = new HashSet<>();
        Deque<String> work = new ArrayDeque<>();
        for (Term goal : symbols.goals()) work.push(goal.key());

        while (!work.isEmpty()) {
            String current = work.pop();
            if (!reachable.add(current)) continue;
            for (String callee : symbols.callees(current)) {
                if (!reachable.contains(callee)) work.push(callee);
            }
        }
        return reachable;
    }

    // ---------- cycles ----------
    private void checkCycles() {
        Set<String> seen = new HashSet<>();
        CycleFinder finder = new CycleFinder(symbols.calls().keySet(), symbols::callees);

        for (List<String> cycle : finder.find()) {
            String normalized = cycle.stream().sorted().collect(Collectors.joining("->"));
            if (!seen.add(normalized)) continue;

            String name = nameOf(cycle.get(0));
            String walk = cycle.stream().map(Linter::nameOf).collect(Collectors.joining(" -> "));
            firstRuleNamed(name).ifPresent(rule -> diagnostics.add(atHead(rule, false,
                    "Potential infinite recursion: " + walk + " -> " + name, Codes.CALL_CYCLE)));
        }
    }

    // ---------- else ----------
    private void checkElseUsage() {
        Map<String, List<Rule>> groups = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (rule.isMethod()) groups.computeIfAbsent(rule.key(), k -> new ArrayList<>()).add(rule);
        }

        for (List<Rule> group : groups.values()) {
            Rule first = group.get(0);
            if (!first.hasElse()) continue;
            String which = group.size() == 1 ? "first/only" : "first";
            diagnostics.add(atHead(first, true,
                    "'else' on " + which + " method '" + first.name() + "' - nothing to be else to",
                    Codes.ELSE_WITHOUT_PREDECESSOR));
        }
    }

    // ---------- empty clauses ----------
    private void checkEmptyClauses() {
        for (Rule rule : rules) {
            if (rule.isMethod() && rule.doClause() != null && rule.doClause().args().isEmpty()) {
                diagnostics.add(atHead(rule, false,
                        "Method '" + rule.name() + "' has empty do() clause - does nothing", Codes.EMPTY_DO));
            }
            if (rule.isOperator()
                    && rule.delClause() != null && rule.delClause().args().isEmpty()
                    && rule.addClause() != null && rule.addClause().args().isEmpty()) {
                diagnostics.add(atHead(rule, false,
                        "Operator '" + rule.name() + "' has empty del() and add() - does nothing", Codes.EMPTY_EFFECTS));
            }
        }
    }

    // ---------- singletons ----------
    private void checkSingletonVariables() {
        for (Rule rule : rules) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            countOccurrences(rule.head(), counts);
            for (Term term : rule.body()) countOccurrences(term, counts);

            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                String var = e.getKey();
                if (e.getValue() != 1 || isWildcard(var)) continue;
                Term at = firstOccurrence(rule, var);
                diagnostics.add(Diagnostic.warning(at.line(), at.column(), var.length(),
                        "Singleton variable '" + var + "' appears only once (typo?)", Codes.SINGLETON_VARIABLE));
            }
        }
    }

    private static void countOccurrences(Term term, Map<String, Integer> counts) {
        if (term.isVariable()) counts.merge(term.name(), 1, Integer::sum);
        for (Term arg : term.args()) countOccurrences(arg, counts);
    }

    private static boolean isWildcard(String var) {
        return var.startsWith("_") || var.startsWith("?_");
    }

    private static Term firstOccurrence(Rule rule, String var) {
        Term at = rule.head().findVariable(var);
        for (int i = 0; at == null && i < rule.body().size(); i++) {
            at = rule.body().get(i).findVariable(var);
        }
        return at;
    }

    // ---------- helpers ----------
    private Optional<Rule> firstRuleNamed(String name) {
        return rules.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    static String nameOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(0, slash);
    }

    private static Diagnostic atHead(Rule rule, boolean error, String message, String code) {
        Term head = rule.head();
        int length = head.name().length();
        return error
                ? Diagnostic.error(rule.line(), head.column(), length, message, code)
                : Diagnostic.warning(rule.line(), head.column(), length, message, code);
    }
}
