package com.specsim.domain.sim.model;

import java.util.List;

/**
 * Result of model validation.
 *
 * @param passed     true if no ERROR-level issues were found
 * @param issues     all issues in checker order
 * @param coverage   share of declared segment positions covered by fields, in [0, 1]
 * @param confidence mean field confidence, 0 for a model without fields
 */
public record ValidationReport(
        boolean passed,
        List<ValidationIssue> issues,
        double coverage,
        double confidence
) {
    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public static ValidationReport of(List<ValidationIssue> issues, double coverage, double confidence) {
        boolean passed = issues.stream().noneMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
        return new ValidationReport(passed, issues, coverage, confidence);
    }

    public boolean hasErrors() {
        return !passed;
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }

    public List<ValidationIssue> infos() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.INFO).toList();
    }

    public List<ValidationIssue> byRule(ValidationRule rule) {
        return issues.stream().filter(i -> i.rule() == rule).toList();
    }
}
