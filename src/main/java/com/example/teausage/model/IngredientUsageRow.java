package com.example.teausage.model;

import java.time.LocalDate;

/** Quantity of one ingredient used by one drink. */
public class IngredientUsageRow {
    public final String lineItemId;
    public final LocalDate date;
    public final String category;
    public final String itemName;
    public final String categoryKey;
    public final String itemKey;
    public final String componentKey;
    public final double qty;
    public final String unit;       // null when the BOM gives none
    public final IngredientRule.Kind rule;

    public IngredientUsageRow(UsageRow usage, IngredientRule rule, double qty, String unit) {
        this.lineItemId = usage.lineItemId; this.date = usage.date; this.category = usage.category; this.itemName = usage.itemName;
        this.categoryKey = usage.categoryKey; this.itemKey = usage.itemKey;
        this.componentKey = rule.componentKey; this.qty = qty; this.unit = unit; this.rule = rule.rule;
    }

    @Override public String toString() { return lineItemId + " " + componentKey + "=" + qty + (unit == null ? "" : " " + unit); }
}
