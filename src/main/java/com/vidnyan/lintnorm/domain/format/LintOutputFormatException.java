package com.vidnyan.lintnorm.domain.format;

/**
 * Raised when linter output does not follow the structure its format promises:
 * malformed JSON, a missing field, or a line that cannot be read as expected.
 * The whole parse is abandoned; no partial result is returned.
 */
public class LintOutputFormatException extends RuntimeException {

    private final String location;

    public LintOutputFormatException(String message, String location) {
        super(message + " at " + location);
        this.location = location;
    }

    public LintOutputFormatException(String message, String location, Throwable cause) {
        super(message + " at " + location, cause);
        this.location = location;
    }

    /**
     * The offending line of text, or the JSON path of the offending node.
     */
    public String getLocation() {
        return location;
    }
}
