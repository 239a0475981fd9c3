package com.specsim.interfaces.api.dto;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.PipelineStats;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SkippedRow;
import com.specsim.infrastructure.sim.serialization.SimDocument;

import java.util.List;
import java.util.Locale;

public record BuildSimResponse(
        SimDocument model,
        ValidationReportResponse report,
        List<SectionSummary> sections,
        List<GapSummary> coverageGaps,
        List<SkippedRowSummary> skippedRows,
        PipelineStats stats
) {

    public record SectionSummary(String kind, String label, String title, int startPage, int endPage) {
        static SectionSummary from(Section section) {
            return new SectionSummary(section.kind().name().toLowerCase(Locale.ROOT), section.label(),
                    section.title(), section.startPage(), section.endPage());
        }
    }

    public record GapSummary(int page, int regionIndex, String reason, String detail) {
        static GapSummary from(CoverageGap gap) {
            return new GapSummary(gap.page(), gap.regionIndex(), gap.reason().name(), gap.detail());
        }
    }

    public record SkippedRowSummary(int page, int rowIndex, String reason, String detail) {
        static SkippedRowSummary from(SkippedRow row) {
            return new SkippedRowSummary(row.page(), row.rowIndex(), row.reason().name(), row.detail());
        }
    }

    public static BuildSimResponse from(PipelineResult result, SimDocument model) {
        return new BuildSimResponse(
                model,
                ValidationReportResponse.from(result.report()),
                result.sections().stream().map(SectionSummary::from).toList(),
                result.coverageGaps().stream().map(GapSummary::from).toList(),
                result.skippedRows().stream().map(SkippedRowSummary::from).toList(),
                result.stats());
    }
}
