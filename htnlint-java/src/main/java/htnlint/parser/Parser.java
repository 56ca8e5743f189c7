package htnlint.parser;

import htnlint.ast.Rule;
import htnlint.ast.Term;
import htnlint.ast.TermKind;
import htnlint.diag.Codes;
import htnlint.diag.Diagnostic;
import htnlint.lexer.Lexer;
import htnlint.lexer.Token;
import htnlint.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for HTN/Prolog clauses.
 *
 * <p>Parsing never stops at the first error. A malformed rule is reported and the parser skips
 * to the next {@code '.'}, so one broken rule cannot hide the ones after it.
 */
public final class Parser {

    public record Result(List<Rule> rules, List<Diagnostic> diagnostics) {}

    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final Set<TokenType> FUNCTORS = EnumSet.of(
            TokenType.ATOM, TokenType.IF, TokenType.DO, TokenType.DEL, TokenType.ADD,
            TokenType.TRY, TokenType.FIRST, TokenType.GOALS);

    /** Abandons the rule being parsed; caught by {@link #parse()}. */
    private static final class ParseAbort extends RuntimeException {
        ParseAbort() {
            super(null, null, false, false);
        }
    }

    private final String source;
    private final int maxDepth;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private List<Token> tokens;
    private int pos = 0;

    public Parser(String source) {
        this(source, DEFAULT_MAX_DEPTH);
    }

    public Parser(String source, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.source = source;
        this.maxDepth = maxDepth;
    }

    // ---------- entry ----------
    public Result parse() {
        Lexer.Result lexed = new Lexer(source).tokenize();
        tokens = lexed.tokens();
        diagnostics.addAll(lexed.diagnostics());

        List<Rule> rules = new ArrayList<>();
        while (!isAtEnd()) {
            try {
                Rule rule = parseRule();
                if (rule != null) rules.add(rule);
            } catch (ParseAbort abort) {
                syncToPeriod();
            }
        }
        return new Result(List.copyOf(rules), List.copyOf(diagnostics));
    }

    // ---------- rules ----------
    private Rule parseRule() {
        // stray terminator between rules
        if (match(TokenType.PERIOD)) return null;

        int startLine = peek().line();
        Term head = parseTerm(0);
        if (head == null) {
            syncToPeriod();
            return null;
        }

        if (match(TokenType.PERIOD)) return Rule.fact(head, startLine);

        if (expect(TokenType.RULE_OP, "Expected ':-' or '.' after '" + head.name() + "'") == null) {
            syncToPeriod();
            return null;
        }

        Rule.Builder rule = new Rule.Builder(head, startLine);
        parseBody(rule);

        if (expect(TokenType.PERIOD, "Expected '.' at end of rule") == null) {
            syncToPeriod();
        }
        return rule.build();
    }

    private void parseBody(Rule.Builder rule) {
        while (!check(TokenType.PERIOD) && !check(TokenType.EOF)) {
            if (match(TokenType.ELSE)) {
                rule.markElse();
            } else if (match(TokenType.ALLOF)) {
                rule.markAllOf();
            } else if (match(TokenType.ANYOF)) {
                rule.markAnyOf();
            } else if (match(TokenType.HIDDEN)) {
                rule.markHidden();
            } else {
                Term term = parseTerm(0);
                if (term == null) break;
                rule.addClause(term);
            }
            match(TokenType.COMMA);
        }
    }

    // ---------- terms ----------
    private Term parseTerm(int depth) {
        Token token = peek();
        if (depth > maxDepth) {
            error(token, token.length(), "Term nesting exceeds maximum depth of " + maxDepth, Codes.NESTING_TOO_DEEP);
            throw new ParseAbort();
        }

        switch (token.type()) {
            case VARIABLE -> {
                advance();
                return Term.leaf(token.lexeme(), TermKind.VARIABLE, token.line(), token.column());
            }
            case NUMBER -> {
                advance();
                return Term.leaf(token.lexeme(), TermKind.NUMBER, token.line(), token.column());
            }
            case STRING -> {
                advance();
                return Term.leaf(token.lexeme(), TermKind.STRING, token.line(), token.column());
            }
            case LBRACKET -> {
                return parseList(depth);
            }
            case RPAREN -> {
                error(token, 1, "Unbalanced parentheses - extra ')'", Codes.UNBALANCED_PARENS);
                advance();
                return null;
            }
            case PERIOD, EOF, COMMA -> {
                return null;
            }
            default -> { }
        }

        if (FUNCTORS.contains(token.type())) {
            advance();
            if (check(TokenType.LPAREN)) {
                return Term.compound(token.lexeme(), parseArgs(depth), token.line(), token.column());
            }
            if (check(TokenType.LBRACKET)) {
                Token bracket = peek();
                error(bracket, 1, "Unexpected '[' - use '(' for function arguments", Codes.BRACKET_FOR_ARGS);
                Term list = parseList(depth);
                return Term.compound(token.lexeme(), list.args(), token.line(), token.column());
            }
            return Term.leaf(token.lexeme(), TermKind.ATOM, token.line(), token.column());
        }

        error(token, token.length(), "Unexpected token: " + token.lexeme(), Codes.UNEXPECTED_TOKEN);
        advance();
        return null;
    }

    private List<Term> parseArgs(int depth) {
        Token open = advance(); // '('
        List<Term> args = new ArrayList<>();
        if (match(TokenType.RPAREN)) return args;

        while (!isAtEnd()) {
            Term term = parseTerm(depth + 1);
            if (term != null) args.add(term);

            if (match(TokenType.RPAREN)) return args;

            if (!match(TokenType.COMMA)) {
                if (check(TokenType.PERIOD) || check(TokenType.EOF)) break;
                // leave the unexpected token to the enclosing construct
                return args;
            }
        }

        error(open, 1, "Unbalanced parentheses - missing ')'", Codes.UNBALANCED_PARENS);
        return args;
    }

    private Term parseList(int depth) {
        Token open = advance(); // '['
        List<Term> elements = new ArrayList<>();
        if (match(TokenType.RBRACKET)) return Term.list(elements, open.line(), open.column());

        while (!isAtEnd()) {
            Term term = parseTerm(depth + 1);
            if (term != null) elements.add(term);

            if (match(TokenType.RBRACKET)) return Term.list(elements, open.line(), open.column());

            if (match(TokenType.PIPE)) {
                // [Head|Tail]
                Term tail = parseTerm(depth + 1);
                if (tail != null) elements.add(tail);
                if (!match(TokenType.RBRACKET)) {
                    error(open, 1, "Unbalanced brackets - missing ']'", Codes.UNBALANCED_BRACKETS);
                }
                return Term.list(elements, open.line(), open.column());
            }

            if (!match(TokenType.COMMA)) break;
        }

        error(open, 1, "Unbalanced brackets - missing ']'", Codes.UNBALANCED_BRACKETS);
        return Term.list(elements, open.line(), open.column());
    }

    // ---------- helpers ----------
    private void syncToPeriod() {
        while (!isAtEnd()) {
            if (advance().type() == TokenType.PERIOD) return;
        }
    }

    private boolean match(TokenType t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType t, String msg) {
        if (check(t)) return advance();
        Token at = peek();
        error(at, at.length(), msg, Codes.EXPECTED_TOKEN);
        return null;
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private Token advance() {
        Token current = peek();
        if (!isAtEnd()) pos++;
        return current;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() { return tokens.get(pos); }

    private void error(Token at, int length, String msg, String code) {
        diagnostics.add(Diagnostic.error(at.line(), at.column(), length, msg, code));
    }
}
