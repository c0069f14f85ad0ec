package com.vidnyan.lintnorm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for output parsing.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "lintnorm")
public class LintNormProperties {

    /**
     * Directory that reported paths are made relative to.
     * Default: current directory
     */
    private String workingRoot = ".";

    /**
     * Format used when a caller does not name one.
     */
    private String defaultFormat = "unix";

    private Cli cli = new Cli();

    @Data
    public static class Cli {

        /**
         * File holding linter output to parse at startup. Empty disables the runner.
         */
        private String inputPath = "";

        /**
         * Format of the input file. Falls back to the default format.
         */
        private String format;
    }
}
