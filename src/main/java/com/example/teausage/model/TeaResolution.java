package com.example.teausage.model;

/** Outcome of tea-base resolution for a canonical line. */
public enum TeaResolution {
    BLEND_DEFAULT("blend_default"),
    OVERRIDE("override"),
    MISSING_CHOICE("missing_choice"),
    CONFLICT("conflict"),
    UNKNOWN("unknown");

    private final String label;

    TeaResolution(String label) { this.label = label; }

    public String label() { return label; }

    /** Only resolved lines carry a blend and take part in volume math. */
    public boolean isResolved() { return this == BLEND_DEFAULT || this == OVERRIDE; }
}
