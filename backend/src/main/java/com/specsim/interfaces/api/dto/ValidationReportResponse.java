package com.specsim.interfaces.api.dto;

import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.infrastructure.sim.serialization.ValidationIssueDoc;

import java.util.List;

public record ValidationReportResponse(
        boolean passed,
        int errorCount,
        int warningCount,
        int infoCount,
        double coverage,
        double confidence,
        List<ValidationIssueDoc> issues
) {
    public static ValidationReportResponse from(ValidationReport report) {
        return new ValidationReportResponse(
                report.passed(),
                report.errors().size(),
                report.warnings().size(),
                report.infos().size(),
                report.coverage(),
                report.confidence(),
                ValidationIssueDoc.fromAll(report.issues()));
    }
}
