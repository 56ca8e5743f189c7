package htnlint.lexer;

/**
 * A lexeme with its 1-based start position. {@code length} is the number of source characters spanned.
 */
public record Token(TokenType type, String lexeme, int line, int column, int length) {

    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, line, column, lexeme.length());
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
