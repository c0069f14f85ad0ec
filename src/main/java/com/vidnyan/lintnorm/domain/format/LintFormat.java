package com.vidnyan.lintnorm.domain.format;

import java.util.Arrays;
import java.util.Optional;

/**
 * Linter output formats that can be parsed.
 * Each constant is selected by its exact, case-sensitive key.
 */
public enum LintFormat {
    UNIX("unix", "path:line:column: CODE message"),
    FLAKE8("flake8", "flake8 default formatter, same as unix"),
    PYLINT_JSON("pylint-json", "pylint --output-format=json"),
    ESLINT("eslint", "ESLint stylish formatter"),
    ESLINT_UNIX("eslint-unix", "ESLint unix formatter, path:line:column: message [Error/code]"),
    STYLELINT("stylelint", "stylelint string formatter"),
    BLACK("black", "black --check"),
    CFN_LINT("cfn-lint", "cfn-lint default formatter"),
    BANDIT_JSON("bandit-json", "bandit -f json"),
    CFN_NAG("cfn-nag", "cfn_nag_scan --output-format json"),
    GITLEAKS("gitleaks", "gitleaks JSON report"),
    HADOLINT("hadolint", "hadolint -f json");

    private final String key;
    private final String description;

    LintFormat(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public String description() {
        return description;
    }

    public static Optional<LintFormat> fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equals(key))
                .findFirst();
    }
}
