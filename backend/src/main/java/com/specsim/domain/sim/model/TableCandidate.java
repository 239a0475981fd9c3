package com.specsim.domain.sim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A raw grid of cell text produced by one extractor for one region.
 * The first row is treated as the header row.
 */
public record TableCandidate(
        ExtractionMethod method,
        PageRegion region,
        List<List<String>> rows
) {
    public TableCandidate {
        if (method == null || region == null || rows == null) {
            throw new IllegalArgumentException("Table candidate requires method, region and rows");
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row == null) {
                throw new IllegalArgumentException("Table candidate for " + region.describe() + " contains a null row");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = List.copyOf(copy);
    }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public List<List<String>> dataRows() {
        return rows.size() <= 1 ? List.of() : rows.subList(1, rows.size());
    }

    public int nonEmptyCellCount() {
        int count = 0;
        for (List<String> row : rows) {
            for (String cell : row) {
                if (cell != null && !cell.isBlank()) {
                    count++;
                }
            }
        }
        return count;
    }
}
