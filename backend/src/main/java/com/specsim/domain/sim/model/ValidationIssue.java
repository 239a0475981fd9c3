package com.specsim.domain.sim.model;

/**
 * Individual issue found while validating a semantic model.
 *
 * @param rule         the rule that produced the issue
 * @param severity     ERROR blocks downstream import, WARNING and INFO are advisory
 * @param targetPath   dotted path into the SIM, e.g. {@code messages[2].segments[0].fields[3]}
 * @param message      human-readable description of the issue
 * @param suggestedFix hint for a reviewer (nullable)
 */
public record ValidationIssue(
        ValidationRule rule,
        Severity severity,
        String targetPath,
        String message,
        String suggestedFix
) {
    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    public String ruleId() {
        return rule.id();
    }

    public static ValidationIssue error(ValidationRule rule, String targetPath, String message, String suggestedFix) {
        return new ValidationIssue(rule, Severity.ERROR, targetPath, message, suggestedFix);
    }

    public static ValidationIssue warning(ValidationRule rule, String targetPath, String message, String suggestedFix) {
        return new ValidationIssue(rule, Severity.WARNING, targetPath, message, suggestedFix);
    }

    public static ValidationIssue info(ValidationRule rule, String targetPath, String message) {
        return new ValidationIssue(rule, Severity.INFO, targetPath, message, null);
    }
}
