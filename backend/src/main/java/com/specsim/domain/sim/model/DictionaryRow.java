package com.specsim.domain.sim.model;

/**
 * A dictionary-section row as read from the table, before parent linking.
 * Identifiers the row does not state are null and are inherited from the enclosing rows.
 */
public record DictionaryRow(
        DictionaryLevel level,
        Integer categoryId,
        Integer subCategoryId,
        Integer itemId,
        String name,
        int sourcePage,
        int sourceRow
) {}
