package com.vidnyan.lintnorm.adapter.in.cli;

import com.vidnyan.lintnorm.LintNormProperties;
import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase;
import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase.ParseRequest;
import com.vidnyan.lintnorm.application.port.in.ParseLintOutputUseCase.ParseResult;
import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.UnknownFormatException;
import com.vidnyan.lintnorm.domain.violation.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for parsing a saved linter report.
 * Runs when lintnorm.cli.input-path is set, then shuts the application down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParseCliRunner implements CommandLineRunner {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_ERROR = 2;

    private static final int MAX_LISTED = 100;

    private final ParseLintOutputUseCase parseLintOutputUseCase;
    private final LintNormProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        String inputPath = properties.getCli().getInputPath();
        if (inputPath == null || inputPath.isBlank()) {
            log.info("No input file specified. Set lintnorm.cli.input-path to parse a report.");
            return;
        }

        String format = properties.getCli().getFormat();
        if (format == null || format.isBlank()) {
            format = properties.getDefaultFormat();
        }

        int exitCode = execute(Path.of(inputPath), format);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * Parse one report file and print the outcome.
     * @return process exit code
     */
    int execute(Path inputPath, String format) {
        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║                  lint-normalizer                             ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Input:  {}", truncatePath(inputPath.toString(), 50));
        log.info("║ Format: {}", format);
        log.info("╚══════════════════════════════════════════════════════════════╝");

        String rawOutput;
        try {
            rawOutput = Files.readString(inputPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", inputPath, e.getMessage());
            return EXIT_ERROR;
        }

        ParseResult result;
        try {
            result = parseLintOutputUseCase.parse(ParseRequest.of(format, rawOutput));
        } catch (UnknownFormatException e) {
            log.error(e.getMessage());
            return EXIT_ERROR;
        } catch (LintOutputFormatException e) {
            log.error("{} output could not be parsed: {}", format, e.getMessage());
            return EXIT_ERROR;
        }

        printResults(result);
        return result.hasViolations() ? EXIT_VIOLATIONS : EXIT_CLEAN;
    }

    private void printResults(ParseResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" RESULTS ({})", result.format().key());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files:      {}", result.stats().pathCount());
        log.info(" Violations: {}", result.stats().violationCount());
        log.info(" Duration:   {}ms", result.stats().durationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (!result.hasViolations()) {
            log.info("");
            log.info("✅ No violations reported.");
            return;
        }

        int count = 0;
        for (String path : result.violations().paths()) {
            List<Violation> violations = result.violations().get(path);
            if (violations.isEmpty()) {
                continue;
            }
            log.info("");
            log.info(" {}", path);
            for (Violation v : violations) {
                count++;
                if (count > MAX_LISTED) {
                    log.info(" ... and {} more violations", result.stats().violationCount() - MAX_LISTED);
                    return;
                }
                log.info("   {}", v.format());
            }
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
