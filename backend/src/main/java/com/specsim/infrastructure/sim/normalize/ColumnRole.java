package com.specsim.infrastructure.sim.normalize;

/**
 * Role of a table column, resolved once from its header cell.
 */
public enum ColumnRole {
    NAME,
    BIT_RANGE,
    START_BIT,
    END_BIT,
    LENGTH,
    UNIT,
    DESCRIPTION,
    SEGMENT,
    RESOLUTION,
    CATEGORY_ID,
    SUB_CATEGORY_ID,
    ITEM_ID,
    UNRECOGNIZED
}
