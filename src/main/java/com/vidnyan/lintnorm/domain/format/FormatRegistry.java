package com.vidnyan.lintnorm.domain.format;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed table from format to the extractor responsible for it.
 * <p>
 * Built once from a list of extractors. Every {@link LintFormat} must be
 * claimed by exactly one extractor; one extractor may claim several formats
 * (aliases). The table never changes after construction.
 */
public final class FormatRegistry {

    private final Map<LintFormat, OutputExtractor> extractors;

    public FormatRegistry(List<? extends OutputExtractor> candidates) {
        Map<LintFormat, OutputExtractor> table = new EnumMap<>(LintFormat.class);
        for (OutputExtractor extractor : candidates) {
            for (LintFormat format : extractor.formats()) {
                OutputExtractor previous = table.putIfAbsent(format, extractor);
                if (previous != null) {
                    throw new IllegalStateException(String.format(
                            "Format %s claimed by both %s and %s",
                            format.key(), previous.getName(), extractor.getName()));
                }
            }
        }

        Set<String> missing = Arrays.stream(LintFormat.values())
                .filter(f -> !table.containsKey(f))
                .map(LintFormat::key)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No extractor registered for formats: " + missing);
        }

        this.extractors = Collections.unmodifiableMap(table);
    }

    /**
     * Look up the extractor for a format key.
     * @throws UnknownFormatException if the key matches no format exactly
     */
    public OutputExtractor resolve(String formatKey) {
        LintFormat format = LintFormat.fromKey(formatKey)
                .orElseThrow(() -> new UnknownFormatException(formatKey, knownKeys()));
        return resolve(format);
    }

    public OutputExtractor resolve(LintFormat format) {
        return extractors.get(format);
    }

    public List<String> knownKeys() {
        return Arrays.stream(LintFormat.values())
                .map(LintFormat::key)
                .toList();
    }

    public Set<LintFormat> formats() {
        return extractors.keySet();
    }
}
