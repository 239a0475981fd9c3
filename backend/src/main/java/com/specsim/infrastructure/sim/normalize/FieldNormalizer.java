package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.DictionaryLevel;
import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SectionKind;
import com.specsim.domain.sim.model.SkipReason;
import com.specsim.domain.sim.model.SkippedRow;
import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.infrastructure.sim.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the rows of one selected table into canonical field records (message sections)
 * or dictionary rows (dictionary sections).
 * <p>
 * Rows that yield no usable name or position are reported as skipped with a reason.
 * Blank rows are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldNormalizer {

    static final double RANGE_FALLBACK_PENALTY = 0.9;
    static final double UNRESOLVED_UNIT_PENALTY = 0.9;
    static final double POSITIONAL_NAME_PENALTY = 0.8;
    static final double VARIABLE_PLACEHOLDER_PENALTY = 0.8;

    private static final Pattern PREFIXED_IDENTIFIER = Pattern.compile(
            "^(DFI|DUI|DI)\\s*[-#:]?\\s*(\\d{1,9})\\b\\s*[-:.]?\\s*(.*)$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d{1,9})\\s*[-:.)]?\\s+(.+)$");

    private static final Pattern SEGMENT_NUMBER = Pattern.compile("^\\d{1,4}$");

    private final TextCleaner textCleaner;
    private final BitRangeParser bitRangeParser;
    private final HeaderVocabulary headerVocabulary;
    private final UnitTable unitTable;
    private final EncodingInferrer encodingInferrer;

    /**
     * Normalize one table attributed to {@code section}.
     *
     * @param table      the selected candidate; row 0 is the header
     * @param tableScore arbiter score of the candidate, the base of every field's confidence
     * @param section    owning section
     * @param token      cancellation signal, polled per row
     */
    public NormalizedTable normalize(TableCandidate table, double tableScore, Section section,
                                     CancellationToken token) {
        HeaderMapping mapping = HeaderMapping.of(table.header(), headerVocabulary, textCleaner);
        NormalizedTable result = section.kind() == SectionKind.DICTIONARY
                ? normalizeDictionary(table, mapping, token)
                : normalizeFields(table, tableScore, mapping, section, token);

        log.info("[Normalizer] {} ({}): {} fields, {} dictionary rows, {} skipped rows",
                table.region().describe(), section.label(), result.fields().size(),
                result.dictionaryRows().size(), result.skippedRows().size());
        return result;
    }

    // ===== Message tables =====

    private NormalizedTable normalizeFields(TableCandidate table, double tableScore, HeaderMapping mapping,
                                            Section section, CancellationToken token) {
        int page = table.region().page();
        List<FieldRecord> fields = new ArrayList<>();
        List<SkippedRow> skipped = new ArrayList<>();
        List<EnumDefinition> enums = new ArrayList<>();

        String marker = null;
        int offset = 0;
        List<List<String>> rows = table.rows();

        for (int rowIndex = 1; rowIndex < rows.size(); rowIndex++) {
            token.throwIfCancelled();
            RowView row = mapping.view(rows.get(rowIndex), textCleaner);
            if (row.isBlank()) {
                continue;
            }

            // Marker row: a lone segment label such as "Extension Word 1"
            Optional<String> rowMarker = markerRow(rows.get(rowIndex));
            if (rowMarker.isPresent()) {
                if (!rowMarker.get().equals(marker)) {
                    offset = 0;
                }
                marker = rowMarker.get();
                continue;
            }

            String segmentCell = row.segment();
            if (!segmentCell.isEmpty()) {
                String columnMarker = segmentColumnMarker(segmentCell);
                if (!columnMarker.equals(marker)) {
                    offset = 0;
                }
                marker = columnMarker;
            }

            double penalty = 1.0;
            String name = row.name();
            if (!mapping.has(ColumnRole.NAME)) {
                name = row.firstUnrecognized();
                penalty *= POSITIONAL_NAME_PENALTY;
            }
            if (name.isEmpty()) {
                skip(skipped, page, rowIndex, SkipReason.MISSING_NAME, "no field name");
                continue;
            }

            // Position
            RangeOutcome position = resolvePosition(row, mapping, offset);
            if (position == null) {
                String detail = mapping.has(ColumnRole.BIT_RANGE) ? row.bitRange()
                        : mapping.has(ColumnRole.START_BIT) ? row.startBit()
                        : mapping.has(ColumnRole.LENGTH) ? row.length()
                        : "no bit-range column";
                skip(skipped, page, rowIndex, SkipReason.UNPARSEABLE_BIT_RANGE,
                        name + ": '" + detail + "'");
                continue;
            }
            offset = position.nextOffset();
            penalty *= position.penalty();

            // Unit
            String unit = null;
            String rawUnit = null;
            boolean unitResolved = false;
            String description = row.description();
            Optional<UnitTable.Resolution> resolution = row.unit().isEmpty()
                    ? unitTable.detectInText(description)
                    : unitTable.resolve(row.unit());
            if (resolution.isPresent()) {
                unit = resolution.get().symbol();
                rawUnit = resolution.get().raw();
                unitResolved = resolution.get().resolved();
                if (!unitResolved) {
                    penalty *= UNRESOLVED_UNIT_PENALTY;
                    log.debug("[Normalizer] page {} row {}: unresolved unit '{}'", page, rowIndex, rawUnit);
                }
            }

            // Encoding
            String enumKey = section.label() + "." + name;
            EncodingInferrer.Inference inference = encodingInferrer.infer(
                    name, description, row.length(), position.range(), position.variableLength(), enumKey);
            if (inference.hasEnum()) {
                enums.add(inference.enumDefinition());
            }

            String resolutionText = row.resolution();
            fields.add(FieldRecord.builder()
                    .name(name)
                    .range(position.range())
                    .encoding(inference.encoding())
                    .unit(unit)
                    .rawUnit(rawUnit)
                    .unitResolved(unitResolved)
                    .description(description)
                    .confidence(clamp(tableScore * penalty))
                    .segmentMarker(marker)
                    .enumKey(inference.hasEnum() ? enumKey : null)
                    .resolution(resolutionText.isEmpty() ? null : resolutionText)
                    .sourcePage(page)
                    .sourceRow(rowIndex)
                    .build());
        }

        return new NormalizedTable(fields, List.of(), skipped, enums);
    }

    /**
     * Range of one row and the offset the next length-only row starts at.
     */
    private record RangeOutcome(BitRange range, double penalty, boolean variableLength, int nextOffset) {}

    private RangeOutcome resolvePosition(RowView row, HeaderMapping mapping, int offset) {
        String lengthCell = row.length();
        boolean variable = !lengthCell.isEmpty() && bitRangeParser.isVariableLength(lengthCell);

        // 1. Combined range column
        if (mapping.has(ColumnRole.BIT_RANGE) && !row.bitRange().isEmpty()) {
            Optional<BitRangeParser.ParsedRange> parsed = bitRangeParser.parse(row.bitRange());
            if (parsed.isEmpty()) {
                return null;
            }
            BitRange range = parsed.get().range();
            boolean fallback = parsed.get().reordered() || range.length() == 1;
            return new RangeOutcome(range, fallback ? RANGE_FALLBACK_PENALTY : 1.0, variable, range.end() + 1);
        }

        // 2. Separate start/end columns
        if (mapping.has(ColumnRole.START_BIT) && !row.startBit().isEmpty()) {
            OptionalInt start = bitRangeParser.parsePosition(row.startBit());
            if (start.isEmpty()) {
                return null;
            }
            int end = start.getAsInt();
            if (mapping.has(ColumnRole.END_BIT) && !row.endBit().isEmpty()) {
                OptionalInt parsedEnd = bitRangeParser.parsePosition(row.endBit());
                if (parsedEnd.isEmpty()) {
                    return null;
                }
                end = parsedEnd.getAsInt();
            } else if (!variable && bitRangeParser.parseFixedLength(lengthCell).isPresent()) {
                end = start.getAsInt() + bitRangeParser.parseFixedLength(lengthCell).getAsInt() - 1;
            }
            BitRange range = new BitRange(Math.min(start.getAsInt(), end), Math.max(start.getAsInt(), end));
            return new RangeOutcome(range, RANGE_FALLBACK_PENALTY, variable, range.end() + 1);
        }

        // 3. Length only: accumulate offsets within the current segment
        if (mapping.has(ColumnRole.LENGTH) && !mapping.hasBitPosition() && !lengthCell.isEmpty()) {
            if (variable) {
                return new RangeOutcome(BitRange.single(offset), VARIABLE_PLACEHOLDER_PENALTY, true, offset + 1);
            }
            OptionalInt length = bitRangeParser.parseFixedLength(lengthCell);
            if (length.isEmpty()) {
                return null;
            }
            BitRange range = new BitRange(offset, offset + length.getAsInt() - 1);
            return new RangeOutcome(range, 1.0, false, range.end() + 1);
        }
        return null;
    }

    private Optional<String> markerRow(List<String> cells) {
        String only = null;
        for (String cell : cells) {
            String cleaned = textCleaner.cell(cell);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (only != null) {
                return Optional.empty();
            }
            only = cleaned;
        }
        return SegmentMarkers.parse(only);
    }

    private static String segmentColumnMarker(String cell) {
        if (SEGMENT_NUMBER.matcher(cell).matches()) {
            return "Word " + Integer.parseInt(cell);
        }
        return SegmentMarkers.parse(cell).orElse(cell);
    }

    // ===== Dictionary tables =====

    private NormalizedTable normalizeDictionary(TableCandidate table, HeaderMapping mapping, CancellationToken token) {
        int page = table.region().page();
        List<DictionaryRow> entries = new ArrayList<>();
        List<SkippedRow> skipped = new ArrayList<>();
        List<List<String>> rows = table.rows();

        for (int rowIndex = 1; rowIndex < rows.size(); rowIndex++) {
            token.throwIfCancelled();
            RowView row = mapping.view(rows.get(rowIndex), textCleaner);
            if (row.isBlank()) {
                continue;
            }
            String name = mapping.has(ColumnRole.NAME) ? row.name() : row.firstUnrecognized();

            Optional<DictionaryRow> entry = mapping.hasIdentifierColumns()
                    ? fromIdentifierColumns(row, name, page, rowIndex)
                    : fromNamePrefix(row, name, page, rowIndex);

            if (entry.isEmpty()) {
                skip(skipped, page, rowIndex, SkipReason.MISSING_IDENTIFIER, name);
            } else if (entry.get().name().isEmpty()) {
                skip(skipped, page, rowIndex, SkipReason.MISSING_NAME, entry.get().level().prefix());
            } else {
                entries.add(entry.get());
            }
        }
        return new NormalizedTable(List.of(), entries, skipped, List.of());
    }

    private Optional<DictionaryRow> fromIdentifierColumns(RowView row, String name, int page, int rowIndex) {
        Integer category = number(row.categoryId());
        Integer subCategory = number(row.subCategoryId());
        Integer item = number(row.itemId());

        DictionaryLevel level;
        if (item != null) {
            level = DictionaryLevel.ITEM;
        } else if (subCategory != null) {
            level = DictionaryLevel.SUB_CATEGORY;
        } else if (category != null) {
            level = DictionaryLevel.CATEGORY;
        } else {
            return Optional.empty();
        }
        return Optional.of(new DictionaryRow(level, category, subCategory, item, name, page, rowIndex));
    }

    private Optional<DictionaryRow> fromNamePrefix(RowView row, String name, int page, int rowIndex) {
        Matcher prefixed = PREFIXED_IDENTIFIER.matcher(name);
        if (prefixed.matches()) {
            DictionaryLevel level = levelOfPrefix(prefixed.group(1));
            int id = Integer.parseInt(prefixed.group(2));
            String rest = prefixed.group(3).strip();
            return Optional.of(withId(level, id, rest, page, rowIndex));
        }

        // Indented outline: "12 Track Number" nested by leading whitespace
        Matcher numbered = LEADING_NUMBER.matcher(name);
        if (numbered.matches()) {
            DictionaryLevel level = DictionaryLevel.ofDepth(textCleaner.indentation(row.rawName()));
            int id = Integer.parseInt(numbered.group(1));
            return Optional.of(withId(level, id, numbered.group(2).strip(), page, rowIndex));
        }
        return Optional.empty();
    }

    private static DictionaryRow withId(DictionaryLevel level, int id, String name, int page, int rowIndex) {
        return switch (level) {
            case CATEGORY -> new DictionaryRow(level, id, null, null, name, page, rowIndex);
            case SUB_CATEGORY -> new DictionaryRow(level, null, id, null, name, page, rowIndex);
            case ITEM -> new DictionaryRow(level, null, null, id, name, page, rowIndex);
        };
    }

    private static DictionaryLevel levelOfPrefix(String prefix) {
        for (DictionaryLevel level : DictionaryLevel.values()) {
            if (level.prefix().equalsIgnoreCase(prefix)) {
                return level;
            }
        }
        throw new IllegalStateException("Unmatched dictionary prefix: " + prefix);
    }

    private Integer number(String cell) {
        OptionalInt value = bitRangeParser.parsePosition(cell);
        return value.isPresent() ? value.getAsInt() : null;
    }

    // ===== Helpers =====

    private static void skip(List<SkippedRow> skipped, int page, int rowIndex, SkipReason reason, String detail) {
        log.debug("[Normalizer] page {} row {} skipped: {} ({})", page, rowIndex, reason, detail);
        skipped.add(new SkippedRow(page, rowIndex, reason, detail));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
