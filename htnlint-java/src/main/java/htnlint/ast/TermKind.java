package htnlint.ast;

public enum TermKind {
    ATOM,
    NUMBER,
    STRING,
    VARIABLE,
    COMPOUND,
    LIST
}
