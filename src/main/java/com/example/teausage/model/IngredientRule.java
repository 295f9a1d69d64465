package com.example.teausage.model;

import java.util.Locale;

/** One bill-of-materials line: how much of an ingredient a menu item uses per drink. */
public class IngredientRule {
    public enum Kind {
        TEA_BASE, MILK_BASE, BY_SUGAR_PCT, BY_ICE_PCT, FIXED, TOPPING_DEFAULT;

        public String label() { return name().toLowerCase(Locale.ROOT); }

        public static Kind parse(String v) {
            if (v == null || v.isBlank()) throw new IllegalArgumentException("BOM rule is blank");
            try { return valueOf(v.trim().toUpperCase(Locale.ROOT)); }
            catch (IllegalArgumentException ex) { throw new IllegalArgumentException("Unknown BOM rule '" + v.trim() + "'", ex); }
        }
    }

    public final String categoryKey;
    public final String itemKey;
    public final String componentKey;
    public final Kind rule;
    public final Double qty;        // ratio for tea/milk rules, amount for fixed ones
    public final String qtyUnit;    // null when blank

    public IngredientRule(String categoryKey, String itemKey, String componentKey, Kind rule, Double qty, String qtyUnit) {
        this.categoryKey = categoryKey; this.itemKey = itemKey; this.componentKey = componentKey;
        this.rule = rule; this.qty = qty; this.qtyUnit = qtyUnit;
    }

    @Override public String toString() { return categoryKey + "/" + itemKey + " " + componentKey + " " + rule.label(); }
}
