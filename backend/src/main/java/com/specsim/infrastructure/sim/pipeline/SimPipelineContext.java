package com.specsim.infrastructure.sim.pipeline;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.PageText;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.PipelineStats;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.SkippedRow;
import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.infrastructure.sim.arbiter.SelectedTable;
import com.specsim.infrastructure.sim.model.BuildOutcome;
import com.specsim.infrastructure.sim.model.SectionContent;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed through the stages of one document run.
 * Accumulates each stage's output for the next; only the pipeline thread writes to it.
 */
@Data
public class SimPipelineContext {

    // --- Input ---
    private Document document;
    private List<PageText> pages = new ArrayList<>();
    private SemanticModel priorModel;

    // --- Arbitration ---
    private int regionCount;
    private List<SelectedTable> selectedTables = new ArrayList<>();
    private List<CoverageGap> coverageGaps = new ArrayList<>();

    // --- Classification ---
    private List<Section> sections = new ArrayList<>();

    // --- Normalization ---
    private List<SectionContent> sectionContents = new ArrayList<>();
    private List<SkippedRow> skippedRows = new ArrayList<>();
    private List<EnumDefinition> discoveredEnums = new ArrayList<>();

    // --- Build + validate ---
    private BuildOutcome buildOutcome;
    private ValidationReport report;

    // --- Timing ---
    private long startedAt;
    private long arbitrationMs;
    private long normalizationMs;
    private long validationMs;

    public PipelineStats toStats() {
        SemanticModel model = buildOutcome.model();
        return new PipelineStats(
                pages.size(),
                regionCount,
                selectedTables.size(),
                sections.size(),
                model.messages().size(),
                model.fieldCount(),
                model.dictionary().size(),
                skippedRows.size(),
                coverageGaps.size(),
                buildOutcome.unattributedFieldCount(),
                System.currentTimeMillis() - startedAt
        );
    }

    public PipelineResult toPipelineResult() {
        return new PipelineResult(
                buildOutcome.model(),
                report,
                List.copyOf(sections),
                List.copyOf(coverageGaps),
                List.copyOf(skippedRows),
                toStats()
        );
    }
}
