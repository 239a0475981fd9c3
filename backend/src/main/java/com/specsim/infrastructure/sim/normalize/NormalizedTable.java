package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.SkippedRow;

import java.util.List;

/**
 * Output of normalizing one selected table.
 */
public record NormalizedTable(
        List<FieldRecord> fields,
        List<DictionaryRow> dictionaryRows,
        List<SkippedRow> skippedRows,
        List<EnumDefinition> enums
) {
    public NormalizedTable {
        fields = List.copyOf(fields);
        dictionaryRows = List.copyOf(dictionaryRows);
        skippedRows = List.copyOf(skippedRows);
        enums = List.copyOf(enums);
    }

    public static NormalizedTable empty() {
        return new NormalizedTable(List.of(), List.of(), List.of(), List.of());
    }
}
