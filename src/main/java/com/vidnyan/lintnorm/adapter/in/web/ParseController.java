package com.vidnyan.lintnorm.adapter.in.web;

import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase;
import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase.ParseRequest;
import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase.ParseResult;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

/**
 * REST API for parsing linter output posted as plain text.
 */
@RestController
@RequestMapping("/api/parse")
public class ParseController {

    private static final Logger log = LoggerFactory.getLogger(ParseController.class);

    private final ParseLintOutputUseCase parseLintOutputUseCase;

    public ParseController(ParseLintOutputUseCase parseLintOutputUseCase) {
        this.parseLintOutputUseCase = parseLintOutputUseCase;
    }

    @PostMapping(path = "/{format}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ParseResponse parse(@PathVariable("format") String format,
                               @RequestBody(required = false) String rawOutput) {
        log.info("Received {} output ({} chars)", format, rawOutput == null ? 0 : rawOutput.length());

        ParseResult result = parseLintOutputUseCase.parse(ParseRequest.of(format, rawOutput));

        return new ParseResponse(
            result.format().key(),
            result.stats().pathCount(),
            result.stats().violationCount(),
            result.violations()
        );
    }

    @GetMapping("/formats")
    public List<String> formats() {
        return Arrays.stream(LintFormat.values())
            .map(LintFormat::key)
            .toList();
    }

    public record ParseResponse(
        String format,
        int pathCount,
        int violationCount,
        ViolationsByPath violations
    ) {}
}
