package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndentedBlockExtractorTest {

    private final PathNormalizer paths = new PathNormalizer(Path.of("/repo"));
    private final IndentedBlockExtractor eslint = IndentedBlockExtractor.eslint();
    private final IndentedBlockExtractor stylelint = IndentedBlockExtractor.stylelint();

    @Test
    void eslintReport_ShouldGroupViolationsUnderHeaders() {
        ViolationsByPath result = eslint.extract(Fixtures.read("eslint-stylish.txt"), paths);

        assertEquals(List.of(
                "lintly/static/js/scripts.js",
                "lintly/static/js/clean.js",
                "lintly/static/js/other.js"
        ), List.copyOf(result.paths()));
        assertEquals(List.of(
                new Violation(1, 1, "no-undef", "'$' is not defined"),
                new Violation(12, 10, "no-console", "Unexpected console statement")
        ), result.get("lintly/static/js/scripts.js"));
        assertEquals(List.of(new Violation(3, 7, "no-unused-vars", "'unused' is assigned a value but never used")),
                result.get("lintly/static/js/other.js"));
    }

    @Test
    void headerWithoutViolations_ShouldYieldEmptyEntry() {
        ViolationsByPath result = eslint.extract("src/clean.js\n", paths);

        assertTrue(result.contains("src/clean.js"));
        assertTrue(result.get("src/clean.js").isEmpty());
    }

    @Test
    void eslintTerminator_ShouldIgnoreEverythingAfterIt() {
        String withGarbage = "file.js\n  1:1 error msg rule\n✖ 1 problem\nextra garbage";
        String withoutGarbage = "file.js\n  1:1 error msg rule\n✖ 1 problem";

        ViolationsByPath expected = eslint.extract(withoutGarbage, paths);

        assertEquals(expected, eslint.extract(withGarbage, paths));
        assertEquals(List.of(new Violation(1, 1, "rule", "msg")), expected.get("file.js"));
        assertFalse(expected.contains("extra garbage"));
    }

    @Test
    void violationBeforeAnyHeader_ShouldFail() {
        String output = "\n  1:1 error msg rule\nfile.js";

        LintOutputFormatException ex = assertThrows(LintOutputFormatException.class,
                () -> eslint.extract(output, paths));
        assertTrue(ex.getLocation().contains("1:1 error msg rule"));
    }

    @Test
    void unmatchedIndentedLine_ShouldBeSkipped() {
        ViolationsByPath result = eslint.extract("a.js\n  not a violation\n  2:4 warning  Missing semicolon  semi", paths);

        assertEquals(List.of(new Violation(2, 4, "semi", "Missing semicolon")), result.get("a.js"));
    }

    @Test
    void stylelintReport_ShouldReadErrorsAndWarnings() {
        ViolationsByPath result = stylelint.extract(Fixtures.read("stylelint.txt"), paths);

        assertEquals(List.of(
                new Violation(13, 1, "max-empty-lines", "Expected no more than 1 empty line"),
                new Violation(20, 5, "length-zero-no-unit", "Unexpected unit")
        ), result.get("lintly/static/sass/file1.scss"));
        assertEquals(List.of(new Violation(1, 3, "block-no-empty", "Unexpected empty block")),
                result.get("lintly/static/sass/file2.scss"));
    }

    @Test
    void stylelint_ShouldTreatCrossLineAsHeader() {
        ViolationsByPath result = stylelint.extract("a.css\n  1:1  ✖  Bad  rule-a\n✖ summary", paths);

        assertTrue(result.contains("✖ summary"));
        assertEquals(1, result.get("a.css").size());
    }

    @Test
    void emptyOutput_ShouldYieldNothing() {
        assertTrue(eslint.extract("", paths).isEmpty());
        assertTrue(stylelint.extract("  \n ", paths).isEmpty());
    }
}
