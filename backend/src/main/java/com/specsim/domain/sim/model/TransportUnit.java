package com.specsim.domain.sim.model;

import java.util.Locale;

/**
 * Addressing unit of a document's field ranges.
 */
public enum TransportUnit {
    BIT,
    BYTE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransportUnit fromWire(String value) {
        if (value == null || value.isBlank()) {
            return BIT;
        }
        return TransportUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
