package htnlint.analysis;

public record InvariantViolation(String invariant, String operator, int line, String message) {}
