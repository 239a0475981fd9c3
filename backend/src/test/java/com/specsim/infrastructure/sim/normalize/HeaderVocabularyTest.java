package com.specsim.infrastructure.sim.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderVocabularyTest {

    private final HeaderVocabulary vocabulary = HeaderVocabulary.standard();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Field, NAME",
            "Field Name, NAME",
            "Data Element, NAME",
            "Bits, BIT_RANGE",
            "Bit Position, BIT_RANGE",
            "Start Bit, START_BIT",
            "End Bit, END_BIT",
            "Length, LENGTH",
            "Units, UNIT",
            "Resolution, RESOLUTION",
            "Description, DESCRIPTION",
            "Remarks, DESCRIPTION",
            "DFI, CATEGORY_ID",
            "DUI No., SUB_CATEGORY_ID",
            "DI, ITEM_ID",
            "Word, SEGMENT",
            "Colour, UNRECOGNIZED"
    })
    void role_of_header_cell(String cell, ColumnRole expected) {
        assertThat(vocabulary.roleOf(cell)).isEqualTo(expected);
    }

    @Test
    @DisplayName("matching ignores case and surrounding whitespace")
    void case_insensitive() {
        assertThat(vocabulary.roleOf("  UNITS ")).isEqualTo(ColumnRole.UNIT);
        assertThat(vocabulary.isKnown(null)).isFalse();
    }

    @Test
    @DisplayName("header mapping uses the leftmost column of a role")
    void header_mapping() {
        HeaderMapping mapping = HeaderMapping.of(
                List.of("Field", "Bits", "Units", "Description", "Notes"), vocabulary, new TextCleaner());

        assertThat(mapping.roles()).doesNotContain(ColumnRole.UNRECOGNIZED);
        assertThat(mapping.indexOf(ColumnRole.DESCRIPTION)).hasValue(3);
        assertThat(mapping.hasBitPosition()).isTrue();
        assertThat(mapping.hasIdentifierColumns()).isFalse();
    }

    @Test
    @DisplayName("row view returns cleaned cells and empty strings for missing columns")
    void row_view() {
        TextCleaner cleaner = new TextCleaner();
        HeaderMapping mapping = HeaderMapping.of(List.of("Field", "Bits", "Units"), vocabulary, cleaner);
        RowView row = mapping.view(List.of("  Altitude ", "0–15"), cleaner);

        assertThat(row.name()).isEqualTo("Altitude");
        assertThat(row.bitRange()).isEqualTo("0-15");
        assertThat(row.unit()).isEmpty();
        assertThat(row.description()).isEmpty();
        assertThat(row.isBlank()).isFalse();
    }
}
