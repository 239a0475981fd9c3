package com.specsim.infrastructure.sim.serialization;

import java.util.Locale;

public enum SimFormat {
    JSON("application/json"),
    YAML("application/yaml");

    private final String mediaType;

    SimFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    public static SimFormat fromParam(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("Unsupported SIM format: " + value);
        };
    }
}
