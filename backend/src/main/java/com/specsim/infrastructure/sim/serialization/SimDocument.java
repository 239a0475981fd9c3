package com.specsim.infrastructure.sim.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Serialized SIM: the wire contract read by export, import and mapping tools.
 * Property names are fixed; do not rename.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"standard", "edition", "page_count", "transport_unit", "container_bits",
        "messages", "dictionary", "enums", "units"})
public record SimDocument(
        @JsonProperty("standard") String standard,
        @JsonProperty("edition") String edition,
        @JsonProperty("page_count") Integer pageCount,
        @JsonProperty("transport_unit") String transportUnit,
        @JsonProperty("container_bits") Integer containerBits,
        @JsonProperty("messages") List<MessageDoc> messages,
        @JsonProperty("dictionary") List<DictionaryDoc> dictionary,
        @JsonProperty("enums") List<EnumDoc> enums,
        @JsonProperty("units") List<UnitDoc> units
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"label", "title", "start_page", "end_page", "segments"})
    public record MessageDoc(
            @JsonProperty("label") String label,
            @JsonProperty("title") String title,
            @JsonProperty("start_page") Integer startPage,
            @JsonProperty("end_page") Integer endPage,
            @JsonProperty("segments") List<SegmentDoc> segments
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"type", "index", "bit_length", "fields"})
    public record SegmentDoc(
            @JsonProperty("type") String type,
            @JsonProperty("index") Integer index,
            @JsonProperty("bit_length") Integer bitLength,
            @JsonProperty("fields") List<FieldDoc> fields
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"name", "start", "end", "encoding", "units", "raw_units", "unit_resolved", "description",
            "confidence", "segment_marker", "enum_key", "resolution", "source_page", "source_row"})
    public record FieldDoc(
            @JsonProperty("name") String name,
            @JsonProperty("start") Integer start,
            @JsonProperty("end") Integer end,
            @JsonProperty("encoding") String encoding,
            @JsonProperty("units") String units,
            @JsonProperty("raw_units") String rawUnits,
            @JsonProperty("unit_resolved") Boolean unitResolved,
            @JsonProperty("description") String description,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("segment_marker") String segmentMarker,
            @JsonProperty("enum_key") String enumKey,
            @JsonProperty("resolution") String resolution,
            @JsonProperty("source_page") Integer sourcePage,
            @JsonProperty("source_row") Integer sourceRow
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"key", "level", "category_id", "sub_category_id", "item_id", "name", "parent_key"})
    public record DictionaryDoc(
            @JsonProperty("key") String key,
            @JsonProperty("level") String level,
            @JsonProperty("category_id") Integer categoryId,
            @JsonProperty("sub_category_id") Integer subCategoryId,
            @JsonProperty("item_id") Integer itemId,
            @JsonProperty("name") String name,
            @JsonProperty("parent_key") String parentKey
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EnumDoc(
            @JsonProperty("key") String key,
            @JsonProperty("values") List<EnumValueDoc> values
    ) {}

    public record EnumValueDoc(
            @JsonProperty("code") String code,
            @JsonProperty("label") String label
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"symbol", "base_si", "factor", "offset", "description"})
    public record UnitDoc(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("base_si") String baseSi,
            @JsonProperty("factor") Double factor,
            @JsonProperty("offset") Double offset,
            @JsonProperty("description") String description
    ) {}
}
