package htnlint.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed term: atom, number, string, variable, compound {@code name(args...)} or list.
 * Lists are named {@code "."}, the empty list {@code "[]"}.
 */
public record Term(
        String name,
        List<Term> args,
        int line,
        int column,
        TermKind kind
) {
    public static final String LIST_NAME = ".";
    public static final String EMPTY_LIST_NAME = "[]";

    public Term {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        args = List.copyOf(args);
    }

    public static Term leaf(String name, TermKind kind, int line, int column) {
        return new Term(name, List.of(), line, column, kind);
    }

    public static Term compound(String name, List<Term> args, int line, int column) {
        return new Term(name, args, line, column, TermKind.COMPOUND);
    }

    public static Term list(List<Term> elements, int line, int column) {
        return new Term(elements.isEmpty() ? EMPTY_LIST_NAME : LIST_NAME, elements, line, column, TermKind.LIST);
    }

    public boolean isVariable() { return kind == TermKind.VARIABLE; }
    public boolean isList() { return kind == TermKind.LIST; }
    public boolean isLiteral() { return kind == TermKind.NUMBER || kind == TermKind.STRING; }

    public int arity() {
        return args.size();
    }

    /** {@code name/arity}, the identity of a symbol in symbol tables and call graphs. */
    public String key() {
        return name + "/" + args.size();
    }

    /** Variable names in order of first occurrence. */
    public Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        collectVariables(this, out);
        return out;
    }

    private static void collectVariables(Term t, Set<String> out) {
        if (t.isVariable()) out.add(t.name);
        for (Term a : t.args) collectVariables(a, out);
    }

    /** First variable occurrence named {@code variable}, or null. */
    public Term findVariable(String variable) {
        if (isVariable() && name.equals(variable)) return this;
        for (Term a : args) {
            Term found = a.findVariable(variable);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public String toString() {
        String inner = args.stream().map(Term::toString).collect(Collectors.joining(", "));
        if (isList()) return "[" + inner + "]";
        if (args.isEmpty()) return name;
        return name + "(" + inner + ")";
    }
}
