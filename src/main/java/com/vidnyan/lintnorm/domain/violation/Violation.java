package com.vidnyan.lintnorm.domain.violation;

import java.util.Objects;

/**
 * A single issue reported by a linter for one file.
 * Immutable value object.
 * <p>
 * Formats that do not report a column use {@link #NO_COLUMN}; formats that
 * do not report a line use {@link #FIRST_LINE}.
 */
public record Violation(
    int line,
    int column,
    String code,
    String message
) {

    public static final int NO_COLUMN = 0;
    public static final int FIRST_LINE = 1;

    public Violation {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative: " + column);
        }
    }

    /**
     * Violation for a tool that reports lines only.
     */
    public static Violation atLine(int line, String code, String message) {
        return new Violation(line, NO_COLUMN, code, message);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line + ":" + column + " " + code + " " + message;
    }
}
