package com.vidnyan.lintnorm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.lintnorm.LintNormProperties;
import com.vidnyan.lintnorm.adapter.out.extractor.StandardExtractors;
import com.vidnyan.lintnorm.domain.format.FormatRegistry;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the parsing components.
 */
@Slf4j
@Configuration
public class LintNormConfiguration {

    /**
     * ObjectMapper for JSON responses.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public PathNormalizer pathNormalizer(LintNormProperties properties) {
        PathNormalizer normalizer = new PathNormalizer(Path.of(properties.getWorkingRoot()));
        log.info("Normalizing paths relative to {}", normalizer.workingRoot());
        return normalizer;
    }

    /**
     * Format table, logged on startup.
     */
    @Bean
    public FormatRegistry formatRegistry() {
        FormatRegistry registry = StandardExtractors.registry();
        log.info("Registered {} output formats:", registry.formats().size());
        for (LintFormat format : registry.formats()) {
            log.info("  - {} -> {}", format.key(), registry.resolve(format).getName());
        }
        return registry;
    }
}
