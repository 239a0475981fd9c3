package com.specsim.infrastructure.sim.normalize;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Known header keywords per column role. The first role whose pattern matches the whole
 * (cleaned, lower-cased) header cell wins, so more specific roles are registered first.
 */
public final class HeaderVocabulary {

    private final Map<ColumnRole, List<Pattern>> patterns;

    private HeaderVocabulary(Map<ColumnRole, List<Pattern>> patterns) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    public ColumnRole roleOf(String headerCell) {
        if (headerCell == null || headerCell.isBlank()) {
            return ColumnRole.UNRECOGNIZED;
        }
        String cell = headerCell.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (Map.Entry<ColumnRole, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern p : entry.getValue()) {
                if (p.matcher(cell).matches()) {
                    return entry.getKey();
                }
            }
        }
        return ColumnRole.UNRECOGNIZED;
    }

    public boolean isKnown(String headerCell) {
        return roleOf(headerCell) != ColumnRole.UNRECOGNIZED;
    }

    /**
     * Header keywords seen in J-series message tables, data dictionaries and protocol specifications.
     */
    public static HeaderVocabulary standard() {
        Map<ColumnRole, List<Pattern>> p = new LinkedHashMap<>();
        p.put(ColumnRole.START_BIT, compile("start( bit| byte| position)?", "first bit", "from"));
        p.put(ColumnRole.END_BIT, compile("(end|stop)( bit| byte| position)?", "last bit", "to"));
        p.put(ColumnRole.BIT_RANGE, compile(
                "bits?", "bit ?(range|position|positions|no\\.?|number)s?", "position", "positions",
                "byte ?(range|offset|position)s?", "offset", "range", "位置", "比特位?"));
        p.put(ColumnRole.LENGTH, compile(
                "length", "len", "size", "(bit|byte) ?(length|count|size)", "no\\.? of (bits|bytes)",
                "number of (bits|bytes)", "bytes", "长度"));
        p.put(ColumnRole.CATEGORY_ID, compile("dfi( ?(no\\.?|number|#|id))?", "category( id)?"));
        p.put(ColumnRole.SUB_CATEGORY_ID, compile("dui( ?(no\\.?|number|#|id))?", "sub-?category( id)?"));
        p.put(ColumnRole.ITEM_ID, compile("di( ?(no\\.?|number|#|id))?", "item( id| no\\.?)?"));
        p.put(ColumnRole.SEGMENT, compile("word( ?(no\\.?|number|#|type))?", "segment", "section", "part"));
        p.put(ColumnRole.NAME, compile(
                "(field|data)? ?(name|element|item name)", "field", "data (field|item|element)",
                "parameter", "variable", "element", "dfi/dui name", "字段名?", "名称"));
        p.put(ColumnRole.UNIT, compile("units?", "unit of measure", "uom", "单位"));
        p.put(ColumnRole.RESOLUTION, compile("resolution", "scale", "scaling", "lsb value", "accuracy", "精度"));
        p.put(ColumnRole.DESCRIPTION, compile(
                "description", "desc\\.?", "remarks?", "comments?", "notes?", "meaning", "values?",
                "explanation", "说明", "描述"));
        return new HeaderVocabulary(p);
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
