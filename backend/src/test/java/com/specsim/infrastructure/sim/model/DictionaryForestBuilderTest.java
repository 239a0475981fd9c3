package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.DictionaryLevel;
import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SectionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DictionaryForestBuilderTest {

    private DictionaryForestBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DictionaryForestBuilder();
    }

    private static SectionContent dictionary(String label, String title, DictionaryRow... rows) {
        return new SectionContent(new Section(SectionKind.DICTIONARY, label, title, 1, 1), List.of(), List.of(rows));
    }

    private static DictionaryRow row(DictionaryLevel level, Integer c, Integer s, Integer i, String name) {
        return new DictionaryRow(level, c, s, i, name, 1, 1);
    }

    @Test
    @DisplayName("rows inherit missing identifiers from the enclosing rows")
    void inherits_identifiers() {
        List<DictionaryEntry> entries = builder.build(List.of(dictionary("Appendix B", "",
                row(DictionaryLevel.CATEGORY, 281, null, null, "Track Number"),
                row(DictionaryLevel.SUB_CATEGORY, null, 1, null, "Reference"),
                row(DictionaryLevel.ITEM, null, null, 3, "Local"))));

        assertThat(entries).extracting(DictionaryEntry::key)
                .containsExactly("DFI-281", "DFI-281/DUI-1", "DFI-281/DUI-1/DI-3");
        assertThat(entries).extracting(DictionaryEntry::parentKey)
                .containsExactly(null, "DFI-281", "DFI-281/DUI-1");
    }

    @Test
    @DisplayName("a DFI section heading opens the category node")
    void section_heading_opens_category() {
        List<DictionaryEntry> entries = builder.build(List.of(dictionary("DFI-281", "Track Number",
                row(DictionaryLevel.SUB_CATEGORY, null, 1, null, "Reference"))));

        assertThat(entries.get(0).key()).isEqualTo("DFI-281");
        assertThat(entries.get(0).name()).isEqualTo("Track Number");
        assertThat(entries.get(1).parentKey()).isEqualTo("DFI-281");
    }

    @Test
    @DisplayName("a heading node is not duplicated when a row declares it")
    void heading_not_duplicated() {
        List<DictionaryEntry> entries = builder.build(List.of(dictionary("DFI-281", "Track Number",
                row(DictionaryLevel.CATEGORY, 281, null, null, "Track Number"))));
        assertThat(entries).hasSize(1);
    }

    @Test
    @DisplayName("context carries across dictionary sections")
    void context_across_sections() {
        List<DictionaryEntry> entries = builder.build(List.of(
                dictionary("DFI-281", "Track Number"),
                dictionary("DUI-1", "Reference",
                        row(DictionaryLevel.ITEM, null, null, 3, "Local"))));

        assertThat(entries).extracting(DictionaryEntry::key)
                .containsExactly("DFI-281", "DFI-281/DUI-1", "DFI-281/DUI-1/DI-3");
    }

    @Test
    @DisplayName("an item with no enclosing nodes gets a dangling parent")
    void orphan_item() {
        List<DictionaryEntry> entries = builder.build(List.of(dictionary("Appendix B", "",
                row(DictionaryLevel.ITEM, null, null, 7, "Orphan"))));

        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.key()).isEqualTo("DFI-0/DUI-0/DI-7");
            assertThat(e.parentKey()).isEqualTo("DFI-0/DUI-0");
        });
    }
}
