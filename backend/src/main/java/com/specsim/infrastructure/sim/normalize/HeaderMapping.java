package com.specsim.infrastructure.sim.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Column roles of one table, resolved once from its header row.
 * When a role appears in several columns the leftmost one is used.
 */
public final class HeaderMapping {

    private final List<ColumnRole> roles;
    private final Map<ColumnRole, Integer> firstIndex;

    private HeaderMapping(List<ColumnRole> roles) {
        this.roles = Collections.unmodifiableList(roles);
        Map<ColumnRole, Integer> index = new EnumMap<>(ColumnRole.class);
        for (int i = 0; i < roles.size(); i++) {
            index.putIfAbsent(roles.get(i), i);
        }
        this.firstIndex = index;
    }

    public static HeaderMapping of(List<String> header, HeaderVocabulary vocabulary, TextCleaner cleaner) {
        List<ColumnRole> roles = new ArrayList<>(header.size());
        for (String cell : header) {
            roles.add(vocabulary.roleOf(cleaner.cell(cell)));
        }
        return new HeaderMapping(roles);
    }

    public OptionalInt indexOf(ColumnRole role) {
        Integer index = firstIndex.get(role);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean has(ColumnRole role) {
        return firstIndex.containsKey(role);
    }

    public List<ColumnRole> roles() {
        return roles;
    }

    /**
     * Whether rows carry a bit position: a range column or a start column.
     */
    public boolean hasBitPosition() {
        return has(ColumnRole.BIT_RANGE) || has(ColumnRole.START_BIT);
    }

    /**
     * Whether the table is laid out as a data dictionary (explicit DFI/DUI/DI identifier columns).
     */
    public boolean hasIdentifierColumns() {
        return has(ColumnRole.CATEGORY_ID) || has(ColumnRole.SUB_CATEGORY_ID) || has(ColumnRole.ITEM_ID);
    }

    public RowView view(List<String> row, TextCleaner cleaner) {
        return new RowView(this, row, cleaner);
    }
}
