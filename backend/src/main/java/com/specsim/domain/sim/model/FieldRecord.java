package com.specsim.domain.sim.model;

import lombok.Builder;

/**
 * One normalized field definition, produced from a single table row.
 *
 * @param name          cleaned field name
 * @param range         inclusive bit (or byte) range
 * @param encoding      inferred data encoding
 * @param unit          canonical unit symbol, or the verbatim token when unresolved; nullable
 * @param rawUnit       unit token as it appeared in the source; nullable
 * @param unitResolved  true when {@code unit} came from the unit table
 * @param description   cleaned free text, may be empty
 * @param confidence    extraction confidence in [0, 1]
 * @param segmentMarker segment boundary label in effect for this row; nullable
 * @param enumKey       key of the enum definition for ENUM fields; nullable
 * @param resolution    scaling/resolution text; nullable
 * @param sourcePage    page the row came from
 * @param sourceRow     row index within the table (header is row 0)
 */
@Builder(toBuilder = true)
public record FieldRecord(
        String name,
        BitRange range,
        FieldEncoding encoding,
        String unit,
        String rawUnit,
        boolean unitResolved,
        String description,
        double confidence,
        String segmentMarker,
        String enumKey,
        String resolution,
        int sourcePage,
        int sourceRow
) {
    public boolean hasUnit() {
        return unit != null && !unit.isBlank();
    }
}
