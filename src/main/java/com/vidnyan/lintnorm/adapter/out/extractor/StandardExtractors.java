package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.FormatRegistry;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;

import java.util.List;

/**
 * The extractors shipped with the application, one entry per supported tool.
 */
public final class StandardExtractors {

    private StandardExtractors() {
    }

    public static List<OutputExtractor> all() {
        return List.of(
                new LineRegexExtractor(LineRegexExtractor.UNIX_GRAMMAR, LintFormat.UNIX, LintFormat.FLAKE8),
                new PylintJsonExtractor(),
                IndentedBlockExtractor.eslint(),
                new LineRegexExtractor(LineRegexExtractor.ESLINT_UNIX_GRAMMAR, LintFormat.ESLINT_UNIX),
                IndentedBlockExtractor.stylelint(),
                new BlackCheckExtractor(),
                new CfnLintExtractor(),
                new BanditJsonExtractor(),
                new CfnNagExtractor(),
                new GitleaksExtractor(),
                new HadolintExtractor()
        );
    }

    public static FormatRegistry registry() {
        return new FormatRegistry(all());
    }
}
