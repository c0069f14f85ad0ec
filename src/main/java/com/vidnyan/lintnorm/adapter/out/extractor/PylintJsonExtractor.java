package com.vidnyan.lintnorm.adapter.out.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

/**
 * pylint {@code --output-format=json}:
 * <pre>
 * [
 *     {
 *         "type": "convention",
 *         "module": "lintly.backends.base",
 *         "obj": "BaseGitBackend.post_status",
 *         "line": 54,
 *         "column": 4,
 *         "path": "lintly/backends/base.py",
 *         "symbol": "missing-docstring",
 *         "message": "Missing method docstring",
 *         "message-id": "C0111"
 *     }
 * ]
 * </pre>
 * The code is reported as {@code C0111 (missing-docstring)}.
 */
public class PylintJsonExtractor extends JsonRecordExtractor {

    // pylint prints this before the JSON when it runs without an rc file
    private static final String NO_CONFIG_PREFIX = "No config";

    public PylintJsonExtractor() {
        super(LintFormat.PYLINT_JSON);
    }

    @Override
    protected String preprocess(String rawOutput) {
        if (rawOutput.startsWith(NO_CONFIG_PREFIX)) {
            int newline = rawOutput.indexOf('\n');
            return newline < 0 ? "" : rawOutput.substring(newline + 1);
        }
        return rawOutput;
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
                    String.format("%s (%s)",
                            requiredText(record, "message-id", at),
                            requiredText(record, "symbol", at)),
                    requiredText(record, "message", at));

            violations.add(paths.normalize(requiredText(record, "path", at)), violation);
        }
    }
}
