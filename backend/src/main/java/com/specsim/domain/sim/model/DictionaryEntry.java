package com.specsim.domain.sim.model;

/**
 * One node of the dictionary forest.
 *
 * @param level         nesting level
 * @param categoryId    DFI number
 * @param subCategoryId DUI number, null for categories
 * @param itemId        DI number, null above item level
 * @param name          human-readable name
 * @param parentKey     key of the parent node, null for categories
 */
public record DictionaryEntry(
        DictionaryLevel level,
        int categoryId,
        Integer subCategoryId,
        Integer itemId,
        String name,
        String parentKey
) {

    public String key() {
        return keyOf(level, categoryId, subCategoryId, itemId);
    }

    public static String keyOf(DictionaryLevel level, int categoryId, Integer subCategoryId, Integer itemId) {
        StringBuilder key = new StringBuilder("DFI-").append(categoryId);
        if (level.depth() >= DictionaryLevel.SUB_CATEGORY.depth()) {
            key.append("/DUI-").append(subCategoryId);
        }
        if (level == DictionaryLevel.ITEM) {
            key.append("/DI-").append(itemId);
        }
        return key.toString();
    }
}
