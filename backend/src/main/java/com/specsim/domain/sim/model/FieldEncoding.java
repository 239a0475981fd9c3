package com.specsim.domain.sim.model;

import java.util.Arrays;

public enum FieldEncoding {
    INTEGER("integer"),
    ENUM("enum"),
    STRING("string"),
    VARIABLE_LENGTH("variable-length"),
    BINARY("binary");

    private final String wireName;

    FieldEncoding(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FieldEncoding fromWire(String value) {
        return Arrays.stream(values())
                .filter(e -> e.wireName.equalsIgnoreCase(value) || e.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field encoding: " + value));
    }
}
