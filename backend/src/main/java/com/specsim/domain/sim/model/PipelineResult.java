package com.specsim.domain.sim.model;

import java.util.List;

/**
 * Output of one document run: a complete (possibly empty) model plus everything found wrong with it.
 */
public record PipelineResult(
        SemanticModel model,
        ValidationReport report,
        List<Section> sections,
        List<CoverageGap> coverageGaps,
        List<SkippedRow> skippedRows,
        PipelineStats stats
) {}
