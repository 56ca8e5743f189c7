package htnlint.sema;

import htnlint.ast.Term;
import htnlint.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    private static SymbolTable table(String src) {
        return SymbolTable.build(new Parser(src).parse().rules());
    }

    @Test
    void definitions_grouped_by_role() {
        var t = table("""
                m(?x) :- if(p(?x)), do(op(?x)).
                op(?x) :- del(p(?x)), add(q(?x)).
                p(a).
                near(?a, ?b) :- p(?a), p(?b).
                """);
        assertEquals(Set.of("m/1"), t.byRole(Role.METHOD).keySet());
        assertEquals(Set.of("op/1"), t.byRole(Role.OPERATOR).keySet());
        assertEquals(Set.of("p/1"), t.byRole(Role.FACT).keySet());
        assertEquals(Set.of("near/2"), t.byRole(Role.PREDICATE).keySet());
        assertEquals(List.of("m/1", "op/1", "p/1", "near/2"), List.copyOf(t.definedKeys()));
    }

    @Test
    void calls_unwrap_try_and_first() {
        var t = table("m() :- if(), do(try(a()), first(b(), c()), ?task).");
        assertEquals(Set.of("a/0", "b/0", "c/0"), t.callees("m/0"));
        assertEquals(Set.of("m/0"), t.callers("b/0"));
    }

    @Test
    void conditions_are_tracked_as_usage() {
        var t = table("m() :- if(ready(x)), do().");
        assertEquals(Set.of("m/0"), t.callers("ready/1"));
        assertTrue(t.callees("m/0").isEmpty());
    }

    @Test
    void goals_collected_from_goals_facts() {
        var t = table("goals(a(), b(1)).");
        assertEquals(List.of("a/0", "b/1"), t.goals().stream().map(Term::key).toList());
    }

    @Test
    void repeated_definitions_kept_in_order() {
        var t = table("m() :- if(), do().\n\nm() :- else, if(), do().");
        var infos = t.lookup(Role.METHOD, "m/0");
        assertEquals(2, infos.size());
        assertEquals(1, infos.get(0).line());
        assertEquals(3, infos.get(1).line());
        assertEquals(List.of(), t.lookup(Role.OPERATOR, "m/0"));
    }
}
