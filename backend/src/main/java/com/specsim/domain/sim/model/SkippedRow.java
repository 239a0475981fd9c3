package com.specsim.domain.sim.model;

/**
 * A data row that could not be normalized.
 *
 * @param page     page of the table
 * @param rowIndex row index within the table (header is row 0)
 * @param reason   why the row was skipped
 * @param detail   offending cell text or context
 */
public record SkippedRow(int page, int rowIndex, SkipReason reason, String detail) {}
