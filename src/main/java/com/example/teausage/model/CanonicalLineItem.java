package com.example.teausage.model;

import java.time.LocalDate;
import java.util.*;

/** One order line after modifier parsing and tea-base resolution. Immutable. */
public class CanonicalLineItem {
    public final int rowId;
    public final String orderId;
    public final LocalDate date;
    public final String time;
    public final String category;
    public final String itemName;
    public final String categoryKey;
    public final String itemKey;
    public final double quantity;
    public final String rawModifiers;
    public final Integer icePct;              // null when no ice token and no default applies
    public final IceConstraint forcedIce;     // non-null when the recipe table forces the ice level
    public final Integer sugarPct;
    public final SortedSet<String> toppings;
    public final SortedMap<String, Integer> toppingQty;
    public final String teaOverride;          // canonical override value, null unless exactly one
    public final List<String> teaOverrideChoices;
    public final boolean requiresTeaChoice;
    public final TeaResolution teaResolution;
    public final Blend resolvedBlend;         // EMPTY unless resolved
    public final int drinksPerUnit;
    public final List<String> unknownTokens;

    private CanonicalLineItem(Builder b) {
        this.rowId = b.rowId; this.orderId = b.orderId; this.date = b.date; this.time = b.time;
        this.category = b.category; this.itemName = b.itemName; this.categoryKey = b.categoryKey; this.itemKey = b.itemKey;
        this.quantity = b.quantity; this.rawModifiers = b.rawModifiers;
        this.icePct = b.icePct; this.forcedIce = b.forcedIce; this.sugarPct = b.sugarPct;
        this.toppings = Collections.unmodifiableSortedSet(new TreeSet<>(b.toppingQty.keySet()));
        this.toppingQty = Collections.unmodifiableSortedMap(new TreeMap<>(b.toppingQty));
        this.teaOverride = b.teaOverride;
        this.teaOverrideChoices = List.copyOf(b.teaOverrideChoices);
        this.requiresTeaChoice = b.requiresTeaChoice;
        this.teaResolution = b.teaResolution;
        this.resolvedBlend = b.resolvedBlend == null ? Blend.EMPTY : b.resolvedBlend;
        this.drinksPerUnit = b.drinksPerUnit;
        this.unknownTokens = List.copyOf(b.unknownTokens);
        if (teaResolution.isResolved() && Math.abs(resolvedBlend.totalWeight() - 1.0) > Blend.TOLERANCE)
            throw new IllegalStateException("Resolved line " + rowId + " has blend weights summing to " + resolvedBlend.totalWeight());
    }

    public static Builder builder() { return new Builder(); }

    public int toppingTypesCount() { return toppings.size(); }

    public int toppingUnitsTotal() { return toppingQty.values().stream().mapToInt(Integer::intValue).sum(); }

    /** {@code "boba:2|lychee_jelly:1"}. */
    public String toppingQtyString() {
        StringJoiner j = new StringJoiner("|");
        toppingQty.forEach((k, v) -> j.add(k + ":" + v));
        return j.toString();
    }

    @Override public String toString() { return rowId + " " + itemName + " " + teaResolution.label() + " " + resolvedBlend; }

    public static class Builder {
        private int rowId;
        private String orderId, time, category, itemName, categoryKey, itemKey, rawModifiers = "";
        private LocalDate date;
        private double quantity;
        private Integer icePct, sugarPct;
        private IceConstraint forcedIce;
        private final SortedMap<String, Integer> toppingQty = new TreeMap<>();
        private String teaOverride;
        private List<String> teaOverrideChoices = List.of();
        private boolean requiresTeaChoice;
        private TeaResolution teaResolution = TeaResolution.UNKNOWN;
        private Blend resolvedBlend;
        private int drinksPerUnit = 1;
        private final List<String> unknownTokens = new ArrayList<>();

        public Builder rowId(int v) { rowId = v; return this; }
        public Builder source(RawOrderLine raw) {
            orderId = raw.orderId; date = raw.date; time = raw.time; category = raw.category;
            itemName = raw.itemName; quantity = raw.quantity; rawModifiers = raw.modifiers;
            return this;
        }
        public Builder keys(String categoryKey, String itemKey) { this.categoryKey = categoryKey; this.itemKey = itemKey; return this; }
        public Builder icePct(Integer v) { icePct = v; return this; }
        public Builder forcedIce(IceConstraint v) { forcedIce = v; return this; }
        public Builder sugarPct(Integer v) { sugarPct = v; return this; }
        public Builder topping(String name, int qty) { toppingQty.merge(name, qty, Integer::sum); return this; }
        public Builder teaOverride(String v) { teaOverride = v; return this; }
        public Builder teaOverrideChoices(List<String> v) { teaOverrideChoices = v; return this; }
        public Builder requiresTeaChoice(boolean v) { requiresTeaChoice = v; return this; }
        public Builder resolution(TeaResolution r, Blend blend) { teaResolution = r; resolvedBlend = blend; return this; }
        public Builder drinksPerUnit(int v) { drinksPerUnit = v; return this; }
        public Builder unknownToken(String raw) { unknownTokens.add(raw); return this; }
        public CanonicalLineItem build() { return new CanonicalLineItem(this); }
    }
}
