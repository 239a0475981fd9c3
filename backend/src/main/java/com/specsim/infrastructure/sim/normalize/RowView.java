package com.specsim.infrastructure.sim.normalize;

import java.util.List;
import java.util.OptionalInt;

/**
 * Typed accessor over one data row. Every getter returns cleaned text, empty when the column
 * is absent from the header or missing from a short row.
 */
public final class RowView {

    private final HeaderMapping mapping;
    private final List<String> cells;
    private final TextCleaner cleaner;

    RowView(HeaderMapping mapping, List<String> cells, TextCleaner cleaner) {
        this.mapping = mapping;
        this.cells = cells;
        this.cleaner = cleaner;
    }

    public String name() {
        return get(ColumnRole.NAME);
    }

    public String bitRange() {
        return get(ColumnRole.BIT_RANGE);
    }

    public String startBit() {
        return get(ColumnRole.START_BIT);
    }

    public String endBit() {
        return get(ColumnRole.END_BIT);
    }

    public String length() {
        return get(ColumnRole.LENGTH);
    }

    public String unit() {
        return get(ColumnRole.UNIT);
    }

    public String description() {
        return get(ColumnRole.DESCRIPTION);
    }

    public String segment() {
        return get(ColumnRole.SEGMENT);
    }

    public String resolution() {
        return get(ColumnRole.RESOLUTION);
    }

    public String categoryId() {
        return get(ColumnRole.CATEGORY_ID);
    }

    public String subCategoryId() {
        return get(ColumnRole.SUB_CATEGORY_ID);
    }

    public String itemId() {
        return get(ColumnRole.ITEM_ID);
    }

    /**
     * Raw (uncleaned) name cell, used to read indentation.
     */
    public String rawName() {
        OptionalInt index = mapping.indexOf(ColumnRole.NAME);
        return index.isPresent() ? raw(index.getAsInt()) : "";
    }

    /**
     * First non-empty cell among the columns whose role was not recognized. Used when the header
     * names no NAME column.
     */
    public String firstUnrecognized() {
        List<ColumnRole> roles = mapping.roles();
        for (int i = 0; i < roles.size(); i++) {
            if (roles.get(i) == ColumnRole.UNRECOGNIZED) {
                String value = cleaner.cell(raw(i));
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return "";
    }

    public boolean isBlank() {
        return cells.stream().allMatch(c -> c == null || c.isBlank());
    }

    public String get(ColumnRole role) {
        OptionalInt index = mapping.indexOf(role);
        return index.isPresent() ? cleaner.cell(raw(index.getAsInt())) : "";
    }

    private String raw(int index) {
        if (index >= cells.size()) {
            return "";
        }
        String cell = cells.get(index);
        return cell == null ? "" : cell;
    }
}
