package com.example.teausage.model;

import java.util.Locale;

/** The {@code ice} column of the recipe override table. */
public enum IceConstraint {
    PER_ICE_LEVEL("ice (per ice level)"),
    FULL_ICE("100% ice"),
    NO_ICE("no ice");

    private final String label;

    IceConstraint(String label) { this.label = label; }

    public String label() { return label; }

    public boolean isForced() { return this != PER_ICE_LEVEL; }

    /** Ice percentage implied by a forced constraint, null for per-level entries. */
    public Integer forcedPct() {
        switch (this) {
            case FULL_ICE: return 100;
            case NO_ICE: return 0;
            default: return null;
        }
    }

    /** Returns null for blank input; throws for anything unrecognized. */
    public static IceConstraint parse(String s) {
        if (s == null || s.isBlank()) return null;
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (IceConstraint c : values()) if (c.label.equals(v)) return c;
        throw new IllegalArgumentException("Unrecognized ice value '" + s + "'");
    }
}
