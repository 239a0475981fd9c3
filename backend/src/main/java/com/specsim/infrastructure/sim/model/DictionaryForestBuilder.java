package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.DictionaryEntry;
import com.specsim.domain.sim.model.DictionaryLevel;
import com.specsim.domain.sim.model.DictionaryRow;
import com.specsim.domain.sim.model.Section;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links dictionary rows into the DFI → DUI → DI forest.
 * <p>
 * Identifiers a row leaves out are inherited from the most recent row one level up, across
 * section boundaries in document order. A level with no enclosing node gets identifier 0, whose
 * parent key then does not resolve; the dictionary-tree check reports it.
 */
@Component
public class DictionaryForestBuilder {

    static final int MISSING_ID = 0;

    private static final Pattern SECTION_LABEL = Pattern.compile("^(DFI|DUI)-(\\d+)$");

    public List<DictionaryEntry> build(List<SectionContent> dictionarySections) {
        List<DictionaryEntry> entries = new ArrayList<>();
        Context ctx = new Context();

        for (SectionContent content : dictionarySections) {
            openSection(content, ctx, entries);
            for (DictionaryRow row : content.dictionaryRows()) {
                entries.add(link(row, ctx));
            }
        }
        return entries;
    }

    private static final class Context {
        Integer category;
        Integer subCategory;
    }

    /**
     * A "DFI-n" or "DUI-n" section heading opens that node itself unless a row declares it.
     */
    private static void openSection(SectionContent content, Context ctx, List<DictionaryEntry> entries) {
        Section section = content.section();
        Matcher m = SECTION_LABEL.matcher(section.label());
        if (!m.matches()) {
            return;
        }
        int id = Integer.parseInt(m.group(2));
        String name = section.title().isBlank() ? section.label() : section.title();

        if (m.group(1).equals("DFI")) {
            ctx.category = id;
            ctx.subCategory = null;
            if (!declares(content, DictionaryLevel.CATEGORY, id)) {
                entries.add(new DictionaryEntry(DictionaryLevel.CATEGORY, id, null, null, name, null));
            }
        } else {
            int category = ctx.category == null ? MISSING_ID : ctx.category;
            ctx.subCategory = id;
            if (!declares(content, DictionaryLevel.SUB_CATEGORY, id)) {
                entries.add(new DictionaryEntry(DictionaryLevel.SUB_CATEGORY, category, id, null, name,
                        DictionaryEntry.keyOf(DictionaryLevel.CATEGORY, category, null, null)));
            }
        }
    }

    private static boolean declares(SectionContent content, DictionaryLevel level, int id) {
        return content.dictionaryRows().stream().anyMatch(r -> r.level() == level && switch (level) {
            case CATEGORY -> r.categoryId() != null && r.categoryId() == id;
            case SUB_CATEGORY -> r.subCategoryId() != null && r.subCategoryId() == id;
            case ITEM -> false;
        });
    }

    private static DictionaryEntry link(DictionaryRow row, Context ctx) {
        return switch (row.level()) {
            case CATEGORY -> {
                int category = orMissing(row.categoryId());
                ctx.category = category;
                ctx.subCategory = null;
                yield new DictionaryEntry(DictionaryLevel.CATEGORY, category, null, null, row.name(), null);
            }
            case SUB_CATEGORY -> {
                int category = orMissing(row.categoryId() != null ? row.categoryId() : ctx.category);
                int subCategory = orMissing(row.subCategoryId());
                ctx.category = category;
                ctx.subCategory = subCategory;
                yield new DictionaryEntry(DictionaryLevel.SUB_CATEGORY, category, subCategory, null, row.name(),
                        DictionaryEntry.keyOf(DictionaryLevel.CATEGORY, category, null, null));
            }
            case ITEM -> {
                int category = orMissing(row.categoryId() != null ? row.categoryId() : ctx.category);
                int subCategory = orMissing(row.subCategoryId() != null ? row.subCategoryId() : ctx.subCategory);
                int item = orMissing(row.itemId());
                yield new DictionaryEntry(DictionaryLevel.ITEM, category, subCategory, item, row.name(),
                        DictionaryEntry.keyOf(DictionaryLevel.SUB_CATEGORY, category, subCategory, null));
            }
        };
    }

    private static int orMissing(Integer id) {
        return id == null ? MISSING_ID : id;
    }
}
