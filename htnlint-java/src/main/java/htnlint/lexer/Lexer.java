package htnlint.lexer;

import htnlint.diag.Codes;
import htnlint.diag.Diagnostic;

import java.util.*;

public class Lexer {

    public record Result(List<Token> tokens, List<Diagnostic> diagnostics) {}

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("do", TokenType.DO),
            Map.entry("del", TokenType.DEL),
            Map.entry("add", TokenType.ADD),
            Map.entry("else", TokenType.ELSE),
            Map.entry("allOf", TokenType.ALLOF),
            Map.entry("anyOf", TokenType.ANYOF),
            Map.entry("hidden", TokenType.HIDDEN),
            Map.entry("try", TokenType.TRY),
            Map.entry("first", TokenType.FIRST),
            Map.entry("goals", TokenType.GOALS)
    );

    private static final String OPERATOR_CHARS = "=<>!+-*/\\";

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Scans the whole source. Never throws: malformed input produces {@link TokenType#ERROR}
     * tokens and diagnostics, and the returned list always ends with {@link TokenType#EOF}.
     */
    public Result tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int startPos = pos;
            int startLine = line;
            int startCol = col;

            char c = advance();

            switch (c) {
                case '%' -> skipLineComment();

                case '(' -> add(TokenType.LPAREN, startPos, startLine, startCol);
                case ')' -> add(TokenType.RPAREN, startPos, startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, startPos, startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, startPos, startLine, startCol);
                case ',' -> add(TokenType.COMMA, startPos, startLine, startCol);
                case '.' -> add(TokenType.PERIOD, startPos, startLine, startCol);
                case '|' -> add(TokenType.PIPE, startPos, startLine, startCol);

                case ':' -> {
                    if (match('-')) {
                        add(TokenType.RULE_OP, startPos, startLine, startCol);
                    } else {
                        error(startLine, startCol, 1, "Unexpected ':' - did you mean ':-'?", Codes.LONE_COLON);
                        add(TokenType.ERROR, startPos, startLine, startCol);
                    }
                }

                case '"' -> quoted('"', TokenType.STRING, "Unterminated string literal",
                        Codes.UNTERMINATED_STRING, startPos, startLine, startCol);
                case '\'' -> quoted('\'', TokenType.ATOM, "Unterminated quoted atom",
                        Codes.UNTERMINATED_QUOTED_ATOM, startPos, startLine, startCol);

                case '?' -> customVariable(startPos, startLine, startCol);

                default -> {
                    if (c == '/' && peek() == '*') {
                        blockComment(startLine, startCol);
                    } else if (isDigit(c) || (c == '-' && isDigit(peek()))) {
                        numberLiteral(startPos, startLine, startCol);
                    } else if (isAlpha(c)) {
                        identifier(c, startPos, startLine, startCol);
                    } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                        operatorAtom(startPos, startLine, startCol);
                    } else {
                        error(startLine, startCol, 1, "Unexpected character: '" + c + "'", Codes.UNEXPECTED_CHAR);
                        add(TokenType.ERROR, startPos, startLine, startCol);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col, 0));
        return new Result(List.copyOf(tokens), List.copyOf(diagnostics));
    }

    // ================= helpers =================

    private void numberLiteral(int startPos, int line, int col) {
        while (isDigit(peek())) advance();

        // a '.' not followed by a digit is the clause terminator
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }

        add(TokenType.NUMBER, startPos, line, col);
    }

    private void identifier(char first, int startPos, int line, int col) {
        while (isAlphaNumeric(peek()) || peek() == '-') advance();

        String text = source.substring(startPos, pos);
        TokenType type = keywords.get(text);
        if (type == null) {
            type = (Character.isUpperCase(first) || first == '_') ? TokenType.VARIABLE : TokenType.ATOM;
        }
        tokens.add(new Token(type, text, line, col));
    }

    private void customVariable(int startPos, int line, int col) {
        if (!isAlpha(peek())) {
            error(line, col, 1, "Variable name must start with letter or underscore after '?'",
                    Codes.BAD_CUSTOM_VARIABLE);
            add(TokenType.ERROR, startPos, line, col);
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        add(TokenType.VARIABLE, startPos, line, col);
    }

    private void operatorAtom(int startPos, int line, int col) {
        while (!isAtEnd() && OPERATOR_CHARS.indexOf(peek()) >= 0) {
            if (peek() == '/' && peekNext() == '*') break;
            advance();
        }
        add(TokenType.ATOM, startPos, line, col);
    }

    private void quoted(char quote, TokenType type, String unterminated, String code,
                        int startPos, int line, int col) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') break;
            if (advance() == '\\' && !isAtEnd()) advance();
        }

        if (isAtEnd() || peek() == '\n') {
            error(line, col, pos - startPos, unterminated, code);
            add(TokenType.ERROR, startPos, line, col);
            return;
        }

        advance(); // closing quote
        add(type, startPos, line, col);
    }

    private void blockComment(int line, int col) {
        advance(); // '*'
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error(line, col, 2, "Unterminated multi-line comment", Codes.UNTERMINATED_COMMENT);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (peek()) {
                case ' ', '\t', '\r', '\n' -> advance();
                default -> { return; }
            }
        }
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private void add(TokenType type, int startPos, int line, int col) {
        tokens.add(new Token(type, source.substring(startPos, pos), line, col));
    }

    private void error(int line, int col, int length, String message, String code) {
        diagnostics.add(Diagnostic.error(line, col, length, message, code));
    }
}
