package htnlint.lexer;

public enum TokenType {

    // literals
    ATOM,
    VARIABLE,
    NUMBER,
    STRING,

    // delimiters
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    COMMA, PERIOD,

    // operators
    RULE_OP,
    PIPE,

    // HTN keywords
    IF,
    DO,
    DEL,
    ADD,
    ELSE,
    ALLOF,
    ANYOF,
    HIDDEN,
    TRY,
    FIRST,
    GOALS,

    EOF,
    ERROR
}
