package com.specsim.domain.sim.model;

/**
 * Stable rule identifiers reported in {@link ValidationIssue#ruleId()}.
 */
public enum ValidationRule {
    BIT_RANGE_OVERLAP("bit-range-overlap"),
    BIT_RANGE_OUT_OF_BOUNDS("bit-range-out-of-bounds"),
    BIT_RANGE_UNUSED("bit-range-unused"),
    DICTIONARY_DANGLING_PARENT("dictionary-dangling-parent"),
    DICTIONARY_CYCLE("dictionary-cycle"),
    DICTIONARY_DUPLICATE("dictionary-duplicate"),
    UNIT_UNRESOLVED("unit-unresolved"),
    UNIT_INCONSISTENT("unit-inconsistent"),
    ENUM_INCOMPLETE("enum-incomplete"),
    LOW_CONFIDENCE("low-confidence"),
    COVERAGE_GAP("coverage-gap"),
    ROW_SKIPPED("row-skipped"),
    SECTION_EMPTY("section-empty"),
    FIELDS_UNATTRIBUTED("fields-unattributed"),
    EMPTY_MODEL("empty-model"),
    VERSION_DIFF("version-diff");

    private final String id;

    ValidationRule(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
