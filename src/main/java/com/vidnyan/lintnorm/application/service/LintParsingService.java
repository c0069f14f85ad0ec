package com.vidnyan.lintnorm.application.service;

import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase;
import com.vidnyan.lintnorm.domain.format.FormatRegistry;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.format.UnknownFormatException;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Resolves the extractor for a format and runs it.
 * The format is checked before any output is looked at.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintParsingService implements ParseLintOutputUseCase {

    private final FormatRegistry formatRegistry;
    private final PathNormalizer defaultNormalizer;

    @Override
    public ParseResult parse(ParseRequest request) {
        Instant startTime = Instant.now();

        LintFormat format = LintFormat.fromKey(request.formatKey())
                .orElseThrow(() -> new UnknownFormatException(request.formatKey(), formatRegistry.knownKeys()));
        OutputExtractor extractor = formatRegistry.resolve(format);
        PathNormalizer paths = request.workingRoot() == null
                ? defaultNormalizer
                : new PathNormalizer(request.workingRoot());

        log.debug("Parsing {} output with {} relative to {}",
                format.key(), extractor.getName(), paths.workingRoot());

        ViolationsByPath violations = extractor.extract(request.rawOutput(), paths);

        Duration duration = Duration.between(startTime, Instant.now());
        ParseStats stats = new ParseStats(violations.size(), violations.violationCount(), duration.toMillis());

        log.info("Parsed {} output: {} violations in {} files ({}ms)",
                format.key(), stats.violationCount(), stats.pathCount(), stats.durationMs());

        return new ParseResult(format, violations, stats);
    }
}
