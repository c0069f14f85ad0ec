package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.LintOutputFormatException;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * cfn-lint default formatter. Each finding takes two lines, the rule and
 * its message followed by the location:
 * <pre>
 * W2001 Parameter UnusedParameter not used.
 * template.yaml:2:9
 * </pre>
 */
public class CfnLintExtractor implements OutputExtractor {

    private static final Pattern RULE_LINE = Pattern.compile("^[EW]\\d{4}\\s");
    private static final Pattern LOCATION_LINE = Pattern.compile("^(?<path>[^:]+):(?<line>\\d+):(?<column>\\d+)$");

    @Override
    public ViolationsByPath extract(String rawOutput, PathNormalizer paths) {
        ViolationsByPath violations = ViolationsByPath.empty();
        String pendingRule = null;

        for (String line : TextLines.of(rawOutput)) {
            if (RULE_LINE.matcher(line).find()) {
                pendingRule = line;
            } else if (pendingRule != null) {
                Matcher location = LOCATION_LINE.matcher(line.strip());
                if (!location.matches()) {
                    throw new LintOutputFormatException(
                            "Expected path:line:column after '" + pendingRule + "'", "line '" + line + "'");
                }

                String[] rule = pendingRule.split("\\s", 2);
                violations.add(paths.normalize(location.group("path")), new Violation(
                        TextLines.parseNumber(location.group("line"), line),
                        TextLines.parseNumber(location.group("column"), line),
                        rule[0],
                        rule[1].strip()));
                pendingRule = null;
            }
        }

        return violations;
    }

    @Override
    public Set<LintFormat> formats() {
        return Set.of(LintFormat.CFN_LINT);
    }
}
