package com.vidnyan.lintnorm.adapter.out.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.Set;

/**
 * Base class for tools that report as a JSON document.
 * <p>
 * Blank output means nothing was reported. Anything else must be valid JSON
 * with every field the schema needs and nothing after the document; a missing
 * or mistyped field or a negative line or column aborts the parse with the JSON
 * path of the offending node.
 */
public abstract class JsonRecordExtractor implements OutputExtractor {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final LintFormat format;

    protected JsonRecordExtractor(LintFormat format) {
        this.format = format;
    }

    @Override
    public final ViolationsByPath extract(String rawOutput, PathNormalizer paths) {
        String json = rawOutput == null ? "" : preprocess(rawOutput).strip();
        ViolationsByPath violations = ViolationsByPath.empty();
        if (json.isEmpty()) {
            return violations;
        }

        JsonNode document;
        try {
            document = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LintOutputFormatException("Malformed " + format.key() + " output: "
                    + e.getOriginalMessage(), "$", e);
        }

        collect(document, paths, violations);
        return violations;
    }

    @Override
    public Set<LintFormat> formats() {
        return Set.of(format);
    }

    /**
     * Hook for tools that print something before the JSON starts.
     */
    protected String preprocess(String rawOutput) {
        return rawOutput;
    }

    /**
     * Walk the parsed document and add its violations.
     */
    protected abstract void collect(JsonNode document, PathNormalizer paths, ViolationsByPath violations);

    protected static JsonNode requiredArray(JsonNode node, String jsonPath) {
        if (node == null || !node.isArray()) {
            throw new LintOutputFormatException("Expected an array", jsonPath);
        }
        return node;
    }

    protected static JsonNode requiredArray(JsonNode parent, String field, String jsonPath) {
        return requiredArray(requiredField(parent, field, jsonPath), jsonPath + "." + field);
    }

    protected static int requiredInt(JsonNode parent, String field, String jsonPath) {
        JsonNode value = requiredField(parent, field, jsonPath);
        return asInt(value, jsonPath + "." + field);
    }

    protected static int asInt(JsonNode value, String jsonPath) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new LintOutputFormatException("Expected an integer but found '" + value + "'", jsonPath);
        }
        if (value.intValue() < 0) {
            throw new LintOutputFormatException("Expected a non-negative number but found " + value.intValue(), jsonPath);
        }
        return value.intValue();
    }

    protected static String requiredText(JsonNode parent, String field, String jsonPath) {
        JsonNode value = requiredField(parent, field, jsonPath);
        if (!value.isValueNode()) {
            throw new LintOutputFormatException("Expected a text value but found '" + value + "'",
                    jsonPath + "." + field);
        }
        return value.asText();
    }

    private static JsonNode requiredField(JsonNode parent, String field, String jsonPath) {
        if (parent == null || !parent.isObject()) {
            throw new LintOutputFormatException("Expected an object", jsonPath);
        }
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            throw new LintOutputFormatException("Missing required field '" + field + "'", jsonPath);
        }
        return value;
    }
}
