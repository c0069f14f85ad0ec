package com.vidnyan.lintnorm.adapter.out.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

/**
 * hadolint {@code -f json}:
 * <pre>
 * [
 *     {
 *         "line": 20,
 *         "code": "DL3020",
 *         "message": "Use COPY instead of ADD for files and folders",
 *         "column": 1,
 *         "file": "docker/Dockerfile",
 *         "level": "error"
 *     }
 * ]
 * </pre>
 */
public class HadolintExtractor extends JsonRecordExtractor {

    public HadolintExtractor() {
        super(LintFormat.HADOLINT);
    }

    @Override
    protected void collect(JsonNode document, PathNormalizer paths, ViolationsByPath violations) {
        JsonNode records = requiredArray(document, "$");
        for (int i = 0; i < records.size(); i++) {
            JsonNode record = records.get(i);
            String at = "$[" + i + "]";

            Violation violation = new Violation(
                    requiredInt(record, "line", at),
                    requiredInt(record, "column", at),
                    requiredText(record, "code", at),
                    requiredText(record, "message", at));

            violations.add(paths.normalize(requiredText(record, "file", at)), violation);
        }
    }
}
