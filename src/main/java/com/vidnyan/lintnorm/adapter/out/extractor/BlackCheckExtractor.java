package com.vidnyan.lintnorm.adapter.out.extractor;

import com.vidnyan.lintnorm.domain.format.LintFormat;
import com.vidnyan.lintnorm.domain.format.OutputExtractor;
import com.vidnyan.lintnorm.domain.path.PathNormalizer;
import com.vidnyan.lintnorm.domain.violation.Violation;
import com.vidnyan.lintnorm.domain.violation.ViolationsByPath;

import java.util.List;
import java.util.Set;

/**
 * {@code black --check}. black reports no issues, only the files it would
 * rewrite:
 * <pre>
 * would reformat src/app/models.py
 * Oh no! 💥 💔 💥
 * 1 file would be reformatted, 12 files would be left unchanged.
 * </pre>
 * Each such file gets one violation on its first line.
 */
public class BlackCheckExtractor implements OutputExtractor {

    static final String REFORMAT_PREFIX = "would reformat ";
    public static final String CODE = "`black`";
    public static final String MESSAGE = "this file needs to be formatted";

    @Override
    public ViolationsByPath extract(String rawOutput, PathNormalizer paths) {
        ViolationsByPath violations = ViolationsByPath.empty();
        for (String line : TextLines.of(rawOutput)) {
            if (!line.startsWith(REFORMAT_PREFIX)) {
                continue;
            }
            String rawPath = line.substring(line.lastIndexOf(' ') + 1);
            violations.replace(paths.normalize(rawPath),
                    List.of(new Violation(Violation.FIRST_LINE, 1, CODE, MESSAGE)));
        }
        return violations;
    }

    @Override
    public Set<LintFormat> formats() {
        return Set.of(LintFormat.BLACK);
    }
}
