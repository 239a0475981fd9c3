package com.specsim.domain.sim.model;

/**
 * Source document metadata. Fixed for the whole ingestion run.
 *
 * @param standard      standard name, e.g. "MIL-STD-6016"
 * @param edition       edition or version, e.g. "B"
 * @param pageCount     number of pages in the source
 * @param transportUnit whether field ranges are counted in bits or bytes
 * @param containerBits declared fixed container size (e.g. 70 for J-series words), nullable
 */
public record Document(
        String standard,
        String edition,
        int pageCount,
        TransportUnit transportUnit,
        Integer containerBits
) {
    public Document {
        if (transportUnit == null) {
            transportUnit = TransportUnit.BIT;
        }
    }

    public boolean hasContainerSize() {
        return containerBits != null && containerBits > 0;
    }
}
