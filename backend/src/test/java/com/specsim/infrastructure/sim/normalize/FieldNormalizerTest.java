package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.DictionaryLevel;
import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.ExtractionMethod;
import com.specsim.domain.sim.model.FieldEncoding;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SectionKind;
import com.specsim.domain.sim.model.SkipReason;
import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.infrastructure.sim.CancellationToken;
import com.specsim.infrastructure.sim.PipelineCancelledException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FieldNormalizerTest {

    private static final Section MESSAGE = new Section(SectionKind.MESSAGE, "J3.2", "Air Track", 1, 1);
    private static final Section DICTIONARY = new Section(SectionKind.DICTIONARY, "Appendix B", "Data Dictionary", 5, 5);
    private static final List<String> HEADER = List.of("Field", "Bits", "Units", "Description");

    private FieldNormalizer normalizer;

    @BeforeEach
    void setUp() {
        TextCleaner cleaner = new TextCleaner();
        normalizer = new FieldNormalizer(cleaner, new BitRangeParser(cleaner), HeaderVocabulary.standard(),
                UnitTable.standard(), new EncodingInferrer());
    }

    private static TableCandidate table(int page, List<List<String>> rows) {
        return new TableCandidate(ExtractionMethod.PRIMARY, PageRegion.wholePage(page), rows);
    }

    private NormalizedTable normalize(Section section, List<List<String>> rows) {
        return normalizer.normalize(table(section.startPage(), rows), 1.0, section, CancellationToken.none());
    }

    @Nested
    @DisplayName("message tables")
    class MessageTables {

        @Test
        void one_row_becomes_one_field() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Altitude", "0-15", "feet", "Current altitude")));

            assertThat(result.fields()).hasSize(1);
            FieldRecord field = result.fields().get(0);
            assertThat(field.name()).isEqualTo("Altitude");
            assertThat(field.range()).isEqualTo(new BitRange(0, 15));
            assertThat(field.unit()).isEqualTo("foot");
            assertThat(field.rawUnit()).isEqualTo("feet");
            assertThat(field.unitResolved()).isTrue();
            assertThat(field.encoding()).isEqualTo(FieldEncoding.INTEGER);
            assertThat(field.description()).isEqualTo("Current altitude");
            assertThat(field.confidence()).isEqualTo(1.0);
            assertThat(field.sourcePage()).isEqualTo(1);
            assertThat(field.sourceRow()).isEqualTo(1);
            assertThat(result.skippedRows()).isEmpty();
        }

        @Test
        void unparseable_range_is_skipped_and_other_rows_survive() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Altitude", "0-15", "feet", ""),
                    List.of("Speed", "N/A", "knots", ""),
                    List.of("Heading", "16-24", "deg", "")));

            assertThat(result.fields()).extracting(FieldRecord::name).containsExactly("Altitude", "Heading");
            assertThat(result.skippedRows()).singleElement().satisfies(row -> {
                assertThat(row.reason()).isEqualTo(SkipReason.UNPARSEABLE_BIT_RANGE);
                assertThat(row.rowIndex()).isEqualTo(2);
                assertThat(row.detail()).contains("Speed").contains("N/A");
            });
        }

        @Test
        void missing_name_is_skipped_and_blank_rows_are_ignored() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("", "0-3", "", ""),
                    List.of("", "", "", ""),
                    List.of("Mode", "4-7", "", "")));

            assertThat(result.fields()).extracting(FieldRecord::name).containsExactly("Mode");
            assertThat(result.skippedRows()).singleElement()
                    .satisfies(row -> assertThat(row.reason()).isEqualTo(SkipReason.MISSING_NAME));
        }

        @Test
        void marker_rows_set_the_segment_of_following_fields() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Initial Word", "", "", ""),
                    List.of("Word Format", "0-1", "", ""),
                    List.of("Extension Word 1", "", "", ""),
                    List.of("Latitude", "0-20", "deg", "")));

            assertThat(result.fields()).extracting(FieldRecord::segmentMarker)
                    .containsExactly("Initial Word", "Extension Word 1");
            assertThat(result.skippedRows()).isEmpty();
        }

        @Test
        void segment_column_numbers_become_word_markers() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    List.of("Word", "Field", "Bits"),
                    List.of("0", "Label", "0-3"),
                    List.of("1", "Track Number", "0-18")));

            assertThat(result.fields()).extracting(FieldRecord::segmentMarker).containsExactly("Word 0", "Word 1");
        }

        @Test
        void reversed_and_single_bit_ranges_lower_confidence() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Quality", "15-6", "", ""),
                    List.of("Exercise Indicator", "16", "", "")));

            assertThat(result.fields().get(0).range()).isEqualTo(new BitRange(6, 15));
            assertThat(result.fields().get(0).confidence())
                    .isCloseTo(FieldNormalizer.RANGE_FALLBACK_PENALTY, within(1e-9));
            assertThat(result.fields().get(1).encoding()).isEqualTo(FieldEncoding.BINARY);
            assertThat(result.fields().get(1).confidence())
                    .isCloseTo(FieldNormalizer.RANGE_FALLBACK_PENALTY, within(1e-9));
        }

        @Test
        void unresolved_unit_is_kept_verbatim_with_a_penalty() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Range", "0-9", "furlongs", "")));

            FieldRecord field = result.fields().get(0);
            assertThat(field.unit()).isEqualTo("furlongs");
            assertThat(field.unitResolved()).isFalse();
            assertThat(field.confidence()).isCloseTo(FieldNormalizer.UNRESOLVED_UNIT_PENALTY, within(1e-9));
        }

        @Test
        void unit_is_read_from_the_description_when_no_unit_column() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    List.of("Field", "Bits", "Description"),
                    List.of("Altitude", "0-15", "Altitude in feet above MSL")));

            assertThat(result.fields().get(0).unit()).isEqualTo("foot");
            assertThat(result.fields().get(0).unitResolved()).isTrue();
        }

        @Test
        void coded_values_produce_an_enum_definition() {
            NormalizedTable result = normalize(MESSAGE, List.of(
                    HEADER,
                    List.of("Identity", "0-2", "", "0 = Pending; 1 = Unknown; 2 = Friend")));

            FieldRecord field = result.fields().get(0);
            assertThat(field.encoding()).isEqualTo(FieldEncoding.ENUM);
            assertThat(field.enumKey()).isEqualTo("J3.2.Identity");
            assertThat(result.enums()).singleElement().satisfies(def -> {
                assertThat(def.key()).isEqualTo("J3.2.Identity");
                assertThat(def.values()).hasSize(3);
            });
        }

        @Test
        void length_only_tables_accumulate_offsets() {
            Section connect = new Section(SectionKind.MESSAGE, "CONNECT", "", 3, 3);
            NormalizedTable result = normalize(connect, List.of(
                    List.of("Name", "Length", "Description"),
                    List.of("Fixed Header", "", ""),
                    List.of("Packet Type", "4", ""),
                    List.of("Reserved", "4", ""),
                    List.of("Remaining Length", "Variable", ""),
                    List.of("Payload", "", ""),
                    List.of("Client Identifier", "2", "UTF-8 string")));

            assertThat(result.fields()).extracting(FieldRecord::range).containsExactly(
                    new BitRange(0, 3), new BitRange(4, 7), BitRange.single(8), new BitRange(0, 1));
            FieldRecord remaining = result.fields().get(2);
            assertThat(remaining.encoding()).isEqualTo(FieldEncoding.VARIABLE_LENGTH);
            assertThat(remaining.confidence())
                    .isCloseTo(FieldNormalizer.VARIABLE_PLACEHOLDER_PENALTY, within(1e-9));
            assertThat(result.fields().get(3).segmentMarker()).isEqualTo("Payload");
            assertThat(result.fields().get(3).encoding()).isEqualTo(FieldEncoding.STRING);
        }

        @Test
        void positional_name_when_header_has_no_name_column() {
            NormalizedTable unnamed = normalize(MESSAGE, List.of(
                    List.of("Colour", "Bits"),
                    List.of("Altitude", "0-15")));
            assertThat(unnamed.fields()).singleElement().satisfies(field -> {
                assertThat(field.name()).isEqualTo("Altitude");
                assertThat(field.confidence()).isCloseTo(FieldNormalizer.POSITIONAL_NAME_PENALTY, within(1e-9));
            });
        }

        @Test
        void confidence_scales_with_table_score() {
            NormalizedTable result = normalizer.normalize(table(1, List.of(
                    HEADER,
                    List.of("Altitude", "0-15", "feet", ""))), 0.5, MESSAGE, CancellationToken.none());
            assertThat(result.fields().get(0).confidence()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void cancelled_token_stops_normalization() {
            CancellationToken token = CancellationToken.create();
            token.cancel();
            assertThatThrownBy(() -> normalizer.normalize(table(1, List.of(
                    HEADER,
                    List.of("Altitude", "0-15", "feet", ""))), 1.0, MESSAGE, token))
                    .isInstanceOf(PipelineCancelledException.class);
        }
    }

    @Nested
    @DisplayName("dictionary tables")
    class DictionaryTables {

        @Test
        void identifier_columns_set_the_level() {
            NormalizedTable result = normalize(DICTIONARY, List.of(
                    List.of("DFI", "DUI", "DI", "Name"),
                    List.of("281", "", "", "Track Number"),
                    List.of("281", "1", "", "Track Number, Reference"),
                    List.of("", "", "3", "Local"),
                    List.of("", "", "", "Orphan")));

            assertThat(result.fields()).isEmpty();
            assertThat(result.dictionaryRows()).extracting(DictionaryRow::level).containsExactly(
                    DictionaryLevel.CATEGORY, DictionaryLevel.SUB_CATEGORY, DictionaryLevel.ITEM);
            assertThat(result.dictionaryRows().get(1).subCategoryId()).isEqualTo(1);
            assertThat(result.dictionaryRows().get(2).categoryId()).isNull();
            assertThat(result.skippedRows()).singleElement()
                    .satisfies(row -> assertThat(row.reason()).isEqualTo(SkipReason.MISSING_IDENTIFIER));
        }

        @Test
        void prefixed_names_carry_their_identifier() {
            NormalizedTable result = normalize(DICTIONARY, List.of(
                    List.of("Entry"),
                    List.of("DFI 281 Track Number"),
                    List.of("DUI 1 - Reference"),
                    List.of("DI 3: Local"),
                    List.of("DI 4")));

            assertThat(result.dictionaryRows()).extracting(DictionaryRow::name)
                    .containsExactly("Track Number", "Reference", "Local");
            assertThat(result.dictionaryRows().get(0).categoryId()).isEqualTo(281);
            assertThat(result.dictionaryRows().get(2).itemId()).isEqualTo(3);
            assertThat(result.skippedRows()).singleElement()
                    .satisfies(row -> assertThat(row.reason()).isEqualTo(SkipReason.MISSING_NAME));
        }

        @Test
        void indentation_sets_the_level_of_numbered_rows() {
            NormalizedTable result = normalize(DICTIONARY, List.of(
                    List.of("Name"),
                    List.of("281 Track Number"),
                    List.of("  1 Reference"),
                    List.of("    3 Local")));

            assertThat(result.dictionaryRows()).extracting(DictionaryRow::level).containsExactly(
                    DictionaryLevel.CATEGORY, DictionaryLevel.SUB_CATEGORY, DictionaryLevel.ITEM);
        }
    }
}
