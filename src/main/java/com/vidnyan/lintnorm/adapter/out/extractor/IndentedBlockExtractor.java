package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads formats that print a file path on its own line, followed by indented
 * violation lines for that file:
 * <pre>
 * /home/dev/project/file1.js
 *     1:1    error  '$' is not defined    no-undef
 * </pre>
 * A non-indented line starts the next file. Some tools end with a summary
 * line; when a terminator prefix is configured, reading stops there.
 */
public class IndentedBlockExtractor implements OutputExtractor {

    /**
     * ESLint stylish formatter; the summary starts with a cross.
     */
    public static final Pattern ESLINT_GRAMMAR = Pattern.compile(
            "^(?<line>\\d+):(?<column>\\d+)\\s+(error|warning)\\s+(?<message>.*)\\s+(?<code>.+)$");
    public static final String ESLINT_TERMINATOR = "✖";

    /**
     * stylelint string formatter.
     * <pre>  13:1  ✖  Expected no more than 1 empty line   max-empty-lines</pre>
     */
    public static final Pattern STYLELINT_GRAMMAR = Pattern.compile(
            "^(?<line>\\d+):(?<column>\\d+)\\s+(✖|⚠)\\s+(?<message>.*)\\s+(?<code>.+)$");

    private final Pattern violationGrammar;
    private final String terminator;
    private final LintFormat format;

    private IndentedBlockExtractor(Pattern violationGrammar, String terminator, LintFormat format) {
        this.violationGrammar = violationGrammar;
        this.terminator = terminator;
        this.format = format;
    }

    public static IndentedBlockExtractor eslint() {
        return new IndentedBlockExtractor(ESLINT_GRAMMAR, ESLINT_TERMINATOR, LintFormat.ESLINT);
    }

    public static IndentedBlockExtractor stylelint() {
        return new IndentedBlockExtractor(STYLELINT_GRAMMAR, null, LintFormat.STYLELINT);
    }

    @Override
    public ViolationsByPath extract(String rawOutput, PathNormalizer paths) {
        ViolationsByPath violations = ViolationsByPath.empty();
        String currentFile = null;

        for (String line : TextLines.raw(rawOutput)) {
            if (line.isBlank()) {
                continue;
            }

            if (Character.isWhitespace(line.charAt(0))) {
                String cleanLine = line.strip();
                Matcher match = violationGrammar.matcher(cleanLine);
                if (!match.matches()) {
                    continue;
                }
                if (currentFile == null) {
                    throw new LintOutputFormatException(
                            "Violation reported before any file header", "line '" + cleanLine + "'");
                }

                violations.add(currentFile, new Violation(
                        TextLines.parseNumber(match.group("line"), cleanLine),
                        TextLines.parseNumber(match.group("column"), cleanLine),
                        match.group("code").strip(),
                        match.group("message").strip()));
            } else if (terminator != null && line.startsWith(terminator)) {
                break;
            } else {
                currentFile = paths.normalize(line);
                violations.touch(currentFile);
            }
        }

        return violations;
    }

    @Override
    public Set<LintFormat> formats() {
        return Set.of(format);
    }
}
