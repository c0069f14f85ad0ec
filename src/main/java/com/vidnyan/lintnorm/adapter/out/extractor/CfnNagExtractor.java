package com.vidnyan.lintnorm.adapter.out.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.ArrayList;
import java.util.List;

/**
 * cfn_nag JSON output. One record per template, each rule violation listing
 * every line it applies to:
 * <pre>
 * [
 *     {
 *         "filename": "templates/bucket.yaml",
 *         "file_results": {
 *             "failure_count": 1,
 *             "violations": [
 *                 {
 *                     "id": "W35",
 *                     "type": "WARN",
 *                     "message": "S3 Bucket should have access logging configured",
 *                     "logical_resource_ids": ["Bucket", "OtherBucket"],
 *                     "line_numbers": [4, 12]
 *                 }
 *             ]
 *         }
 *     }
 * ]
 * </pre>
 * Every line number becomes its own violation. Each template is listed in
 * the result, with an empty list if cfn_nag found nothing in it.
 */
public class CfnNagExtractor extends JsonRecordExtractor {

    public CfnNagExtractor() {
        super(LintFormat.CFN_NAG);
    }

    @Override
    protected void collect(JsonNode document, PathNormalizer paths, ViolationsByPath violations) {
        JsonNode files = requiredArray(document, "$");
        for (int i = 0; i < files.size(); i++) {
            JsonNode file = files.get(i);
            String at = "$[" + i + "]";

            JsonNode rules = requiredArray(file.get("file_results"), "violations", at + ".file_results");
            List<Violation> fileViolations = new ArrayList<>();
            for (int r = 0; r < rules.size(); r++) {
                JsonNode rule = rules.get(r);
                String ruleAt = at + ".file_results.violations[" + r + "]";

                String code = requiredText(rule, "id", ruleAt);
                String message = requiredText(rule, "message", ruleAt);
                JsonNode lineNumbers = requiredArray(rule, "line_numbers", ruleAt);
                for (int n = 0; n < lineNumbers.size(); n++) {
                    int line = asInt(lineNumbers.get(n), ruleAt + ".line_numbers[" + n + "]");
                    fileViolations.add(Violation.atLine(line, code, message));
                }
            }

            violations.replace(paths.normalize(requiredText(file, "filename", at)), fileViolations);
        }
    }
}
