package com.vidnyan.lintnorm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * lint-normalizer - turns linter output into violations keyed by repository path.
 */
@SpringBootApplication
public class LintNormApplication {

    public static void main(String[] args) {
        SpringApplication.run(LintNormApplication.class, args);
    }
}
