package com.specsim.domain.sim.model;

public record PipelineStats(
        int pageCount,
        int regionCount,
        int selectedTableCount,
        int sectionCount,
        int messageCount,
        int fieldCount,
        int dictionaryEntryCount,
        int skippedRowCount,
        int coverageGapCount,
        int unattributedFieldCount,
        long totalLatencyMs
) {}
