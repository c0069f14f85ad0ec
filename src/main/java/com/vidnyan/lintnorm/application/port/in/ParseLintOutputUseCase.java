package com.vidnyan.lintnorm.application.port.in;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.nio.file.Path;

/**
 * Primary use case: turn raw linter output into violations keyed by path.
 */
public interface ParseLintOutputUseCase {

    /**
     * Parse the output of one linter run.
     * @param request format key, raw output and optional working root
     * @return violations grouped by normalized path, with run statistics
     * @throws com.vidnyan.lintnorm.domain.format.UnknownFormatException if the format key is not registered
     * @throws com.vidnyan.lintnorm.domain.format.LintOutputFormatException if the output does not follow its format
     */
    ParseResult parse(ParseRequest request);

    /**
     * Parse request. A null working root means the configured default.
     */
    record ParseRequest(
        String formatKey,
        String rawOutput,
        Path workingRoot
    ) {
        public static ParseRequest of(String formatKey, String rawOutput) {
            return new ParseRequest(formatKey, rawOutput, null);
        }
    }

    /**
     * Parse result.
     */
    record ParseResult(
        LintFormat format,
        ViolationsByPath violations,
        ParseStats stats
    ) {
        public boolean hasViolations() {
            return stats.violationCount() > 0;
        }
    }

    record ParseStats(
        int pathCount,
        int violationCount,
        long durationMs
    ) {}
}
