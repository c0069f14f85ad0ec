package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class LineRegexExtractorTest {

    private final PathNormalizer paths = new PathNormalizer(Path.of("/repo"));
    private final LineRegexExtractor unix =
            new LineRegexExtractor(LineRegexExtractor.UNIX_GRAMMAR, LintFormat.UNIX, LintFormat.FLAKE8);
    private final LineRegexExtractor eslintUnix =
            new LineRegexExtractor(LineRegexExtractor.ESLINT_UNIX_GRAMMAR, LintFormat.ESLINT_UNIX);

    @Test
    void singleLine_ShouldYieldOneViolationWithCapturedFields() {
        ViolationsByPath result = unix.extract("docs/conf.py:230:1: E265 block comment should start with '# '", paths);

        assertEquals(1, result.size());
        assertEquals(List.of(new Violation(230, 1, "E265", "block comment should start with '# '")),
                result.get("docs/conf.py"));
    }

    @Test
    void flake8Report_ShouldGroupByNormalizedPathAndSkipNoise() {
        ViolationsByPath result = unix.extract(Fixtures.read("flake8.txt"), paths);

        assertEquals(List.of("lintly/backends/base.py", "docs/conf.py"), List.copyOf(result.paths()));
        assertEquals(List.of(
                new Violation(54, 5, "D102", "Missing docstring in public method"),
                new Violation(60, 80, "E501", "line too long (85 > 79 characters)")
        ), result.get("lintly/backends/base.py"));
        assertEquals(3, result.violationCount());
    }

    @Test
    void nonAsciiPath_ShouldBeNormalizedLikeAnyOther() {
        ViolationsByPath result = unix.extract("/repo/src/café.py:1:1: E501 line too long", paths);

        assertEquals(List.of(new Violation(1, 1, "E501", "line too long")), result.get("src/café.py"));
    }

    @Test
    void surroundingWhitespace_ShouldBeIgnored() {
        ViolationsByPath result = unix.extract("\n\n    app.py:1:2: W291 trailing whitespace   \n", paths);

        assertEquals(List.of(new Violation(1, 2, "W291", "trailing whitespace")), result.get("app.py"));
    }

    @Test
    void emptyOrNullOutput_ShouldYieldNothing() {
        assertTrue(unix.extract("", paths).isEmpty());
        assertTrue(unix.extract("   \n  ", paths).isEmpty());
        assertTrue(unix.extract(null, paths).isEmpty());
    }

    @Test
    void eslintUnix_ShouldReadBracketedCode() {
        String output = """
                /repo/lintly/static/js/scripts.js:69:1: 'lintly' is not defined. [Error/no-undef]
                lintly/static/js/scripts.js:70:3: Unexpected console statement. [Warning/no-console]

                2 problems
                """;

        ViolationsByPath result = eslintUnix.extract(output, paths);

        assertEquals(List.of(
                new Violation(69, 1, "no-undef", "'lintly' is not defined."),
                new Violation(70, 3, "no-console", "Unexpected console statement.")
        ), result.get("lintly/static/js/scripts.js"));
    }

    @Test
    void eslintUnixLine_ShouldNotMatchUnixGrammar() {
        assertTrue(unix.extract("a.js:1:1: 'x' is not defined. [Error/no-undef]", paths).isEmpty());
    }

    @Test
    void customGrammar_ShouldBeUsedAsGiven() {
        Pattern grammar = Pattern.compile(
                "^(?<code>\\w+)\\|(?<path>[^|]+)\\|(?<line>\\d+)\\|(?<column>\\d+)\\|(?<message>.*)$");
        LineRegexExtractor extractor = new LineRegexExtractor(grammar, LintFormat.UNIX);

        ViolationsByPath result = extractor.extract("SC2086|scripts/run.sh|7|12|Double quote to prevent globbing", paths);

        assertEquals(List.of(new Violation(7, 12, "SC2086", "Double quote to prevent globbing")),
                result.get("scripts/run.sh"));
    }

    @Test
    void numberOutOfRange_ShouldFailWithOffendingLine() {
        String line = "app.py:99999999999:1: E501 line too long";

        LintOutputFormatException ex = assertThrows(LintOutputFormatException.class,
                () -> unix.extract(line, paths));
        assertTrue(ex.getLocation().contains(line));
    }

    @Test
    void formats_ShouldListAliases() {
        assertEquals(2, unix.formats().size());
        assertTrue(unix.formats().contains(LintFormat.FLAKE8));
    }
}
