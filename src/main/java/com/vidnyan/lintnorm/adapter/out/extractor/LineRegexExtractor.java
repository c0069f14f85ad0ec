package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches every output line against one grammar.
 * <p>
 * The grammar must define the named groups {@code path}, {@code line},
 * {@code column}, {@code code} and {@code message}. Lines that do not match
 * (banners, blank lines, summaries) are skipped.
 */
public class LineRegexExtractor implements OutputExtractor {

    /**
     * flake8 and most unix-style tools.
     * <pre>docs/conf.py:230:1: E265 block comment should start with '# '</pre>
     */
    public static final Pattern UNIX_GRAMMAR = Pattern.compile(
            "^(?<path>.*):(?<line>\\d+):(?<column>\\d+): (?<code>\\w\\d+) (?<message>.*)$");

    /**
     * ESLint unix formatter.
     * <pre>lintly/static/js/scripts.js:69:1: 'lintly' is not defined. [Error/no-undef]</pre>
     */
    public static final Pattern ESLINT_UNIX_GRAMMAR = Pattern.compile(
            "^(?<path>.*):(?<line>\\d+):(?<column>\\d+): (?<message>.+) \\[(Warning|Error)/(?<code>.+)\\]$");

    private final Pattern grammar;
    private final Set<LintFormat> formats;

    public LineRegexExtractor(Pattern grammar, LintFormat first, LintFormat... rest) {
        this.grammar = grammar;
        this.formats = EnumSet.of(first, rest);
    }

    @Override
    public ViolationsByPath extract(String rawOutput, PathNormalizer paths) {
        ViolationsByPath violations = ViolationsByPath.empty();

        for (String line : TextLines.of(rawOutput)) {
            String cleanLine = line.strip();
            Matcher match = grammar.matcher(cleanLine);
            if (!match.matches()) {
                continue;
            }

            String path = paths.normalize(match.group("path"));
            violations.add(path, new Violation(
                    TextLines.parseNumber(match.group("line"), cleanLine),
                    TextLines.parseNumber(match.group("column"), cleanLine),
                    match.group("code"),
                    match.group("message")));
        }

        return violations;
    }

    @Override
    public Set<LintFormat> formats() {
        return formats;
    }

    public Pattern grammar() {
        return grammar;
    }
}
