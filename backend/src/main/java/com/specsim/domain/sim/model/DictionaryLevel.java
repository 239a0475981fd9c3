package com.specsim.domain.sim.model;

/**
 * Nesting level in the dictionary forest (DFI → DUI → DI).
 */
public enum DictionaryLevel {
    CATEGORY("DFI"),
    SUB_CATEGORY("DUI"),
    ITEM("DI");

    private final String prefix;

    DictionaryLevel(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public int depth() {
        return ordinal();
    }

    public static DictionaryLevel ofDepth(int depth) {
        DictionaryLevel[] levels = values();
        return levels[Math.max(0, Math.min(depth, levels.length - 1))];
    }
}
