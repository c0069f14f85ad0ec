package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;

import java.util.List;

/**
 * Line handling shared by the plain-text extractors.
 */
final class TextLines {

    private TextLines() {
    }

    /**
     * Lines of the output with surrounding whitespace of the whole blob removed.
     * Blank or null output yields no lines.
     */
    static List<String> of(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return List.of();
        }
        return rawOutput.strip().lines().toList();
    }

    /**
     * Lines of the output exactly as printed, keeping indentation of the first line.
     */
    static List<String> raw(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return List.of();
        }
        return rawOutput.lines().toList();
    }

    static int parseNumber(String digits, String line) {
        try {
            return Integer.parseInt(digits.strip());
        } catch (NumberFormatException e) {
            throw new LintOutputFormatException("Expected a number but found '" + digits + "'",
                    "line '" + line + "'", e);
        }
    }
}
