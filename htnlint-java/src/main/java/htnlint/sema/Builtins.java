package htnlint.sema;

import java.util.Set;

/** Predicates provided by the planner runtime, keyed {@code name/arity}. */
public final class Builtins {
    private Builtins() {}

    private static final Set<String> PREDICATES = Set.of(
            // control
            "true/0", "fail/0", "false/0", "!/0",
            // comparison
            "=/2", "\\=/2", "==/2", "\\==/2",
            "</2", ">/2", "=</2", ">=/2", "=:=/2", "=\\=/2",
            // arithmetic
            "is/2", "+/2", "-/2", "*/2", "//2", "mod/2", "+/1", "-/1",
            // negation
            "not/1", "\\+/1",
            // meta
            "call/1", "call/2", "call/3", "findall/3", "bagof/3", "setof/3", "forall/2",
            // type checks
            "atom/1", "number/1", "atomic/1", "compound/1",
            "var/1", "nonvar/1", "is_list/1", "integer/1", "float/1",
            // database
            "assert/1", "retract/1", "retractall/1", "abolish/1",
            // atoms and strings
            "atom_chars/2", "atom_concat/3", "downcase_atom/2", "upcase_atom/2",
            "atom_length/2", "atom_string/2", "char_code/2", "number_chars/2", "number_codes/2",
            // HTN runtime
            "count/2", "distinct/3", "sortBy/3",
            "first/1", "first/2", "first/3", "first/4", "first/5",
            // lists
            "append/3", "member/2", "length/2", "nth0/3", "nth1/3",
            "reverse/2", "sort/2", "msort/2", "last/2",
            // output
            "write/1", "writeln/1", "print/1", "nl/0",
            // terms
            "copy_term/2", "ground/1", "functor/3", "arg/3", "=../2"
    );

    /** Comparison, arithmetic and negation functors; their arguments are checked, not the functor. */
    private static final Set<String> OPERATORS = Set.of(
            "=", "\\=", "==", "\\==", "<", ">", "=<", ">=", "=:=", "=\\=",
            "is", "+", "-", "*", "/", "mod", "not", "\\+");

    /** Wrappers in do() whose arguments are the real tasks. */
    private static final Set<String> TASK_WRAPPERS = Set.of("try", "first");

    public static Set<String> predicates() {
        return PREDICATES;
    }

    public static boolean isOperator(String name) {
        return OPERATORS.contains(name);
    }

    public static boolean isTaskWrapper(String name) {
        return TASK_WRAPPERS.contains(name);
    }
}
