package com.specsim.infrastructure.sim.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.specsim.domain.sim.model.ValidationIssue;

import java.util.List;
import java.util.Locale;

/**
 * Wire form of one validation issue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssueDoc(
        @JsonProperty("severity") String severity,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("target_path") String targetPath,
        @JsonProperty("message") String message,
        @JsonProperty("suggested_fix") String suggestedFix
) {
    public static ValidationIssueDoc from(ValidationIssue issue) {
        return new ValidationIssueDoc(
                issue.severity().name().toLowerCase(Locale.ROOT),
                issue.ruleId(),
                issue.targetPath(),
                issue.message(),
                issue.suggestedFix());
    }

    public static List<ValidationIssueDoc> fromAll(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssueDoc::from).toList();
    }
}
