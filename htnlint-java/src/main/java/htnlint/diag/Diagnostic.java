package htnlint.diag;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single finding, positioned at a 1-based line and column of the source.
 */
public record Diagnostic(
        int line,
        @JsonProperty("col") int column,
        int length,
        Severity severity,
        String message,
        String code
) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(code, "code");
    }

    public static Diagnostic error(int line, int column, int length, String message, String code) {
        return new Diagnostic(line, column, length, Severity.ERROR, message, code);
    }

    public static Diagnostic warning(int line, int column, int length, String message, String code) {
        return new Diagnostic(line, column, length, Severity.WARNING, message, code);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return line + ":" + column + " " + severity.label() + " " + code + " " + message;
    }
}
