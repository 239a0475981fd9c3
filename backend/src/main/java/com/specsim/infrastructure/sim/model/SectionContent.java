package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Section;

import java.util.List;

/**
 * Everything normalized for one section, in page/row order.
 */
public record SectionContent(Section section, List<FieldRecord> fields, List<DictionaryRow> dictionaryRows) {

    public SectionContent {
        fields = List.copyOf(fields);
        dictionaryRows = List.copyOf(dictionaryRows);
    }

    public static SectionContent empty(Section section) {
        return new SectionContent(section, List.of(), List.of());
    }
}
