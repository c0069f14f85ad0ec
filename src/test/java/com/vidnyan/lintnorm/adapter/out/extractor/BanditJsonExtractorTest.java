package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BanditJsonExtractorTest {

    private final PathNormalizer paths = new PathNormalizer(Path.of("/repo"));
    private final BanditJsonExtractor extractor = new BanditJsonExtractor();

    @Test
    void report_ShouldReadResultsWithoutColumns() {
        ViolationsByPath result = extractor.extract(Fixtures.read("bandit.json"), paths);

        assertEquals(List.of(Violation.atLine(14, "B701 (jinja2_autoescape_false)",
                        "Using jinja2 templates with autoescape=False is dangerous and can lead to XSS.")),
                result.get("lintly/formatters.py"));
        assertEquals(List.of(Violation.atLine(1, "B404 (blacklist)",
                        "Consider possible security implications associated with subprocess module.")),
                result.get("lintly/git.py"));
        assertEquals(0, result.get("lintly/git.py").get(0).column());
    }

    @Test
    void noResults_ShouldYieldNothing() {
        assertTrue(extractor.extract("{\"errors\": [], \"results\": []}", paths).isEmpty());
    }

    @Test
    void missingResultsKey_ShouldFail() {
        LintOutputFormatException ex = assertThrows(LintOutputFormatException.class,
                () -> extractor.extract("{\"errors\": []}", paths));
        assertEquals("$", ex.getLocation());
    }

    @Test
    void missingFilename_ShouldFailWithJsonPath() {
        String output = "{\"results\": [{\"line_number\": 3, \"test_id\": \"B101\", "
                + "\"test_name\": \"assert_used\", \"issue_text\": \"Use of assert detected.\"}]}";

        LintOutputFormatException ex = assertThrows(LintOutputFormatException.class,
                () -> extractor.extract(output, paths));
        assertEquals("$.results[0]", ex.getLocation());
    }
}
