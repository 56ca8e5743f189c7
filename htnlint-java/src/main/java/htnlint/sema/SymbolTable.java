package htnlint.sema;

import htnlint.ast.Rule;
import htnlint.ast.Term;

import java.util.*;

/**
 * Definitions grouped by role and keyed by {@code name/arity}, plus the calls/calledBy index
 * built from {@code do()} tasks and {@code if()} conditions.
 */
public final class SymbolTable {
    private final Map<Role, Map<String, List<SymbolInfo>>> definitions = new EnumMap<>(Role.class);
    private final Map<String, Set<String>> calls = new LinkedHashMap<>();
    private final Map<String, Set<String>> calledBy = new LinkedHashMap<>();
    private final List<Term> goals = new ArrayList<>();

    public SymbolTable() {
        for (Role r : Role.values()) definitions.put(r, new LinkedHashMap<>());
    }

    public static SymbolTable build(List<Rule> rules) {
        SymbolTable table = new SymbolTable();
        for (Rule rule : rules) table.add(rule);
        return table;
    }

    public void add(Rule rule) {
        Term head = rule.head();
        String key = head.key();
        define(new SymbolInfo(head.name(), head.arity(), rule.line(), head.column(), Role.of(rule)));

        if (head.name().equals("goals")) goals.addAll(head.args());

        if (rule.doClause() != null) {
            for (Term task : rule.doClause().args()) addCall(key, task);
        }
        if (rule.ifClause() != null) {
            for (Term cond : rule.ifClause().args()) trackUsage(key, cond);
        }
    }

    public void define(SymbolInfo sym) {
        definitions.get(sym.role()).computeIfAbsent(sym.key(), k -> new ArrayList<>()).add(sym);
    }

    /** Definitions of {@code key} in the given role, in source order; empty if none. */
    public List<SymbolInfo> lookup(Role role, String key) {
        return definitions.get(role).getOrDefault(key, List.of());
    }

    public Map<String, List<SymbolInfo>> byRole(Role role) {
        return Collections.unmodifiableMap(definitions.get(role));
    }

    public Set<String> definedKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, List<SymbolInfo>> m : definitions.values()) keys.addAll(m.keySet());
        return keys;
    }

    public Map<String, Set<String>> calls() {
        return Collections.unmodifiableMap(calls);
    }

    public Set<String> callees(String key) {
        return calls.getOrDefault(key, Set.of());
    }

    public Set<String> callers(String key) {
        return calledBy.getOrDefault(key, Set.of());
    }

    public List<Term> goals() {
        return Collections.unmodifiableList(goals);
    }

    private void addCall(String caller, Term task) {
        if (Builtins.isTaskWrapper(task.name())) {
            for (Term inner : task.args()) addCall(caller, inner);
            return;
        }
        if (task.isVariable()) return;

        String callee = task.key();
        calls.computeIfAbsent(caller, k -> new LinkedHashSet<>()).add(callee);
        calledBy.computeIfAbsent(callee, k -> new LinkedHashSet<>()).add(caller);
    }

    private void trackUsage(String caller, Term term) {
        if (term.isVariable()) return;
        calledBy.computeIfAbsent(term.key(), k -> new LinkedHashSet<>()).add(caller);
        for (Term arg : term.args()) trackUsage(caller, arg);
    }
}
