package com.example.teausage.model;

import java.util.*;

/**
 * A row of the recipe override table. Every numeric column is optional; a null means
 * "not supplied" and the generic formulas apply.
 */
public class RecipeOverride {
    public static final List<Integer> BUCKETS = List.of(0, 25, 50, 75, 100);

    public final String category;
    public final String itemName;
    public final Double teaBaseMl;
    public final Double milkMl;
    public final IceConstraint ice;          // nullable
    public final List<String> matchTokens;   // lowercased; empty means exact item+category match
    private final Map<Integer, Double> teaBaseMlByIce;

    public RecipeOverride(String category, String itemName, Double teaBaseMl, Double milkMl, IceConstraint ice,
                          List<String> matchTokens, Map<Integer, Double> teaBaseMlByIce) {
        this.category = category; this.itemName = itemName; this.teaBaseMl = teaBaseMl; this.milkMl = milkMl; this.ice = ice;
        this.matchTokens = matchTokens == null ? List.of() : List.copyOf(matchTokens);
        this.teaBaseMlByIce = teaBaseMlByIce == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(teaBaseMlByIce));
    }

    /** Splits a pipe-separated {@code match_tokens} cell. */
    public static List<String> splitMatchTokens(String cell) {
        if (cell == null || cell.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : cell.split("\\|")) if (!t.isBlank()) out.add(t.trim().toLowerCase(Locale.ROOT));
        return out;
    }

    public boolean hasMatchTokens() { return !matchTokens.isEmpty(); }

    public boolean forcesIce() { return ice != null && ice.isForced(); }

    /** Explicit tea-base ml for an ice bucket, or null. */
    public Double teaBaseMlAt(int bucket) { return teaBaseMlByIce.get(bucket); }

    public boolean isMilkDrink() { return milkMl != null && milkMl > 0; }

    /** Share of the drink volume that is milk; 0 when the entry gives no tea/milk pair. */
    public double milkRatio() {
        if (!isMilkDrink() || teaBaseMl == null || teaBaseMl <= 0) return 0.0;
        return milkMl / (teaBaseMl + milkMl);
    }

    @Override public String toString() {
        return (hasMatchTokens() ? "match" + matchTokens : category + " / " + itemName) + (ice != null ? " [" + ice.label() + "]" : "");
    }
}
