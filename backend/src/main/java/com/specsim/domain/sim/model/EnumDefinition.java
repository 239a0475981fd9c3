package com.specsim.domain.sim.model;

import java.util.List;

public record EnumDefinition(String key, List<EnumValue> values) {

    public EnumDefinition {
        values = List.copyOf(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
