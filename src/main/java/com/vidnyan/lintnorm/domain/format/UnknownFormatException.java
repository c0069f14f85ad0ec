package com.vidnyan.lintnorm.domain.format;

import java.util.List;

/**
 * The requested format key is not one of the registered formats.
 * This is a configuration problem and is raised before any output is read.
 */
public class UnknownFormatException extends RuntimeException {

    private final String formatKey;

    public UnknownFormatException(String formatKey, List<String> knownKeys) {
        super(String.format("Format not recognized: '%s'. Known formats: %s",
                formatKey, String.join(", ", knownKeys)));
        this.formatKey = formatKey;
    }

    public String getFormatKey() {
        return formatKey;
    }
}
