package com.vidnyan.lintnorm.adapter.out.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

/**
 * bandit {@code -f json}. Findings sit under the top-level {@code results}
 * key; {@code errors} and {@code metrics} are ignored.
 * <pre>
 * {
 *     "results": [
 *         {
 *             "filename": "./lintly/formatters.py",
 *             "issue_text": "Using jinja2 templates with autoescape=False is dangerous ...",
 *             "line_number": 14,
 *             "test_id": "B701",
 *             "test_name": "jinja2_autoescape_false"
 *         }
 *     ]
 * }
 * </pre>
 * bandit has no columns.
 */
public class BanditJsonExtractor extends JsonRecordExtractor {

    public BanditJsonExtractor() {
        super(LintFormat.BANDIT_JSON);
    }

    @Override
    protected void collect(JsonNode document, PathNormalizer paths, ViolationsByPath violations) {
        JsonNode results = requiredArray(document, "results", "$");
        for (int i = 0; i < results.size(); i++) {
            JsonNode result = results.get(i);
            String at = "$.results[" + i + "]";

            Violation violation = Violation.atLine(
                    requiredInt(result, "line_number", at),
                    String.format("%s (%s)",
                            requiredText(result, "test_id", at),
                            requiredText(result, "test_name", at)),
                    requiredText(result, "issue_text", at));

            violations.add(paths.normalize(requiredText(result, "filename", at)), violation);
        }
    }
}
