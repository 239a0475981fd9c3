package com.specsim.domain.sim.model;

import java.util.List;

/**
 * A bounded container ("word") of fields within one message.
 */
public record Segment(String type, int index, int bitLength, List<FieldRecord> fields) {

    public Segment {
        fields = List.copyOf(fields);
    }
}
