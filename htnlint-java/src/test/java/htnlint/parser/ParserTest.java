package htnlint.parser;

import htnlint.ast.Rule;
import htnlint.ast.Term;
import htnlint.ast.TermKind;
import htnlint.diag.Codes;
import htnlint.diag.Diagnostic;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Parser.Result parse(String src) {
        return new Parser(src).parse();
    }

    private static Rule first(String src) {
        return parse(src).rules().get(0);
    }

    private static List<String> codes(Parser.Result r) {
        return r.diagnostics().stream().map(Diagnostic::code).toList();
    }

    @Test
    void parse_fact() {
        var r = first("at(taxi, downtown).");
        assertTrue(r.isFact());
        assertEquals("at/2", r.key());
        assertEquals("at(taxi, downtown)", r.head().toString());
    }

    @Test
    void parse_fact_head_renders_back() {
        var r = first("f(a,b).");
        assertEquals("f", r.head().name());
        assertEquals(List.of(TermKind.ATOM, TermKind.ATOM), r.head().args().stream().map(Term::kind).toList());
        assertEquals("f(a,b)", r.head().toString().replace(" ", ""));
    }

    @Test
    void parse_method() {
        var r = first("travel(?x, ?y) :- if(at(?x)), do(walk(?x, ?y)).");
        assertTrue(r.isMethod());
        assertFalse(r.isOperator());
        assertEquals("travel/2", r.key());
        assertEquals("if(at(?x))", r.ifClause().toString());
        assertEquals(1, r.doClause().args().size());
        assertNull(r.delClause());
    }

    @Test
    void parse_operator() {
        var r = first("walk(?x, ?y) :- del(at(?x)), add(at(?y)).");
        assertTrue(r.isOperator());
        assertFalse(r.isMethod());
        assertEquals("at(?x)", r.delClause().args().get(0).toString());
        assertEquals("at(?y)", r.addClause().args().get(0).toString());
        assertEquals(2, r.body().size());
    }

    @Test
    void parse_plain_prolog_rule_is_predicate() {
        var r = first("near(?a, ?b) :- adjacent(?a, ?b).");
        assertTrue(r.isPredicate());
    }

    @Test
    void parse_modifiers() {
        var r = first("m() :- else, allOf, if(), do().");
        assertTrue(r.hasElse());
        assertTrue(r.hasAllOf());
        assertFalse(r.hasAnyOf());

        var s = first("m() :- anyOf, hidden, if(), do().");
        assertTrue(s.hasAnyOf());
        assertTrue(s.hasHidden());
    }

    @Test
    void parse_lists() {
        var head = first("p([a, b | T]).").head();
        Term list = head.args().get(0);
        assertTrue(list.isList());
        assertEquals(3, list.args().size());
        assertEquals("[a, b, T]", list.toString());

        assertEquals("[]", first("p([]).").head().args().get(0).name());
    }

    @Test
    void parse_literals() {
        var args = first("cost(3.5, \"x\", -1).").head().args();
        assertEquals(TermKind.NUMBER, args.get(0).kind());
        assertEquals(TermKind.STRING, args.get(1).kind());
        assertEquals("-1", args.get(2).name());
    }

    @Test
    void parse_rule_line_numbers() {
        var rules = parse("a.\n\nm() :- if(), do().").rules();
        assertEquals(1, rules.get(0).line());
        assertEquals(3, rules.get(1).line());
    }

    @Test
    void parse_missing_paren_recovers() {
        var r = parse("a(. b(x).");
        assertEquals(List.of("a/0", "b/1"), r.rules().stream().map(Rule::key).toList());
        assertEquals(List.of(Codes.UNBALANCED_PARENS), codes(r));
        assertEquals(2, r.diagnostics().get(0).column());
    }

    @Test
    void parse_missing_rule_operator() {
        var r = parse("foo bar. baz.");
        assertEquals(List.of("baz/0"), r.rules().stream().map(Rule::key).toList());
        Diagnostic d = r.diagnostics().get(0);
        assertEquals(Codes.EXPECTED_TOKEN, d.code());
        assertEquals("Expected ':-' or '.' after 'foo'", d.message());
        assertEquals(5, d.column());
    }

    @Test
    void parse_missing_final_period_keeps_rule() {
        var r = parse("m() :- if(), do()");
        assertEquals(1, r.rules().size());
        assertTrue(r.rules().get(0).isMethod());
        assertEquals(List.of(Codes.EXPECTED_TOKEN), codes(r));
        assertEquals("Expected '.' at end of rule", r.diagnostics().get(0).message());
    }

    @Test
    void parse_bracket_for_arguments() {
        var r = parse("p[a, b].");
        assertEquals(List.of(Codes.BRACKET_FOR_ARGS), codes(r));
        assertEquals("p/2", r.rules().get(0).key());
        assertEquals(2, r.diagnostics().get(0).column());
    }

    @Test
    void parse_extra_paren() {
        var r = parse("m() :- if()), do().");
        assertTrue(codes(r).contains(Codes.UNBALANCED_PARENS));
        assertEquals("Unbalanced parentheses - extra ')'", r.diagnostics().get(0).message());
    }

    @Test
    void parse_unexpected_token_in_arguments() {
        var r = parse("p(|).");
        assertEquals(List.of(Codes.UNEXPECTED_TOKEN), codes(r));
        assertEquals("p/0", r.rules().get(0).key());
    }

    @Test
    void parse_missing_bracket() {
        var r = parse("p([a, b).");
        assertEquals(List.of(Codes.UNBALANCED_BRACKETS), codes(r));
        assertEquals(1, r.rules().size());
    }

    @Test
    void parse_lexer_diagnostics_come_first() {
        var r = parse("p(x) : q.");
        assertEquals(Codes.LONE_COLON, codes(r).get(0));
        assertTrue(codes(r).contains(Codes.EXPECTED_TOKEN));
    }

    @Test
    void parse_nesting_limit_abandons_rule() {
        var r = new Parser("p(a(b(c(d(e))))). q.", 3).parse();
        assertEquals(List.of("q/0"), r.rules().stream().map(Rule::key).toList());
        assertEquals(List.of(Codes.NESTING_TOO_DEEP), codes(r));
    }

    @Test
    void parse_very_deep_nesting_does_not_overflow() {
        String deep = "f(".repeat(10_000) + "x" + ")".repeat(10_000) + ". ok.";
        var r = assertDoesNotThrow(() -> parse(deep));
        assertTrue(codes(r).contains(Codes.NESTING_TOO_DEEP));
        assertEquals("ok/0", r.rules().get(r.rules().size() - 1).key());
    }

    @Test
    void parse_rejects_non_positive_depth() {
        assertThrows(IllegalArgumentException.class, () -> new Parser("a.", 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ")))", "(((", ":- :- .", "[|]", "'unterminated", "p(x", "% only a comment",
            "a :- b :- c.", "m() :- if(, do(.", "goals(", "?", "..."})
    void parse_never_throws(String src) {
        assertDoesNotThrow(() -> parse(src));
    }
}
