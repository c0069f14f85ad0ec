package com.vidnyan.lintnorm.domain.format;

import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.Set;

/**
 * Turns the raw output of one linter format into violations keyed by path.
 * Implementations hold only their grammar and keep no state between calls.
 */
public interface OutputExtractor {

    /**
     * Parse raw tool output.
     * @param rawOutput complete output of one linter run, may be empty
     * @param paths normalizer applied to every path before it becomes a key
     * @return violations grouped by normalized path
     * @throws LintOutputFormatException if the output deviates from the format
     */
    ViolationsByPath extract(String rawOutput, PathNormalizer paths);

    /**
     * Formats this extractor is registered for.
     */
    Set<LintFormat> formats();

    /**
     * Get the extractor name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
