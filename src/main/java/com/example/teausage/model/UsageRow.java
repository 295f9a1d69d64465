package com.example.teausage.model;

import java.time.LocalDate;
import java.util.*;

/** Estimated liquid usage for one drink. */
public class UsageRow {
    public final String lineItemId;
    public final LocalDate date;
    public final String category;
    public final String itemName;
    public final String categoryKey;
    public final String itemKey;
    public final Integer sugarPct;
    public final TeaResolution teaResolution;
    public final Blend blend;
    public final int iceBucket;
    public final boolean iceImputed;
    public final double baseTeaMl;
    public final double toppingReductionPct;
    public final double teaBaseMlEst;
    public final Double milkMlEst;          // null for non-milk drinks
    public final Map<String, Double> componentMl;

    public UsageRow(ExplodedDrinkRow drink, int iceBucket, boolean iceImputed, double baseTeaMl,
                    double toppingReductionPct, double teaBaseMlEst, Double milkMlEst) {
        CanonicalLineItem l = drink.line;
        this.lineItemId = drink.lineItemId(); this.date = l.date; this.category = l.category; this.itemName = l.itemName;
        this.categoryKey = l.categoryKey; this.itemKey = l.itemKey; this.sugarPct = l.sugarPct;
        this.teaResolution = l.teaResolution; this.blend = l.resolvedBlend;
        this.iceBucket = iceBucket; this.iceImputed = iceImputed; this.baseTeaMl = baseTeaMl;
        this.toppingReductionPct = toppingReductionPct; this.teaBaseMlEst = teaBaseMlEst; this.milkMlEst = milkMlEst;
        this.componentMl = Collections.unmodifiableMap(l.resolvedBlend.split(teaBaseMlEst));
    }

    public double componentTotalMl() { return componentMl.values().stream().mapToDouble(Double::doubleValue).sum(); }

    @Override public String toString() { return lineItemId + " " + itemName + " tea=" + teaBaseMlEst + " " + componentMl; }
}
