package com.example.teausage.services;

import com.example.teausage.model.IngredientRule;
import com.example.teausage.model.IngredientUsageRow;
import com.example.teausage.model.UsageRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;

/**
 * Turns per-drink usage into ingredient quantities through an item bill of materials. BOM lines
 * are keyed by normalized (category, item). A line that cannot be quantified for a drink is left
 * out of the rows and counted under its status instead.
 */
public class IngredientEstimator {
    private static final Logger log = LoggerFactory.getLogger(IngredientEstimator.class);
    private static final Set<String> COUNTED_UNITS = Set.of("shot", "unit");

    /** Ingredient rows for a run plus the count of skipped BOM lines by status. */
    public static class Result {
        public final List<IngredientUsageRow> rows = new ArrayList<>();
        public final SortedMap<String, Integer> issues = new TreeMap<>();
    }

    /** One day's total of one ingredient in one unit. */
    public static class DailyIngredient {
        public final LocalDate date;
        public final String componentKey;
        public final String unit;
        public final double qtyTotal;
        public final int drinkCount;
        DailyIngredient(LocalDate date, String componentKey, String unit, double qtyTotal, int drinkCount) {
            this.date = date; this.componentKey = componentKey; this.unit = unit; this.qtyTotal = qtyTotal; this.drinkCount = drinkCount;
        }
        @Override public String toString() { return date + " " + componentKey + " " + qtyTotal + (unit == null ? "" : " " + unit) + " (" + drinkCount + ")"; }
    }

    private final Map<String, List<IngredientRule>> bom = new LinkedHashMap<>();
    private final Map<Integer, Double> sugarGramsByPct;
    private final Map<String, Double> gramsPerUnit;

    public IngredientEstimator(List<IngredientRule> rules, Map<Integer, Double> sugarGramsByPct, Map<String, Double> gramsPerUnit) {
        this.sugarGramsByPct = sugarGramsByPct == null ? Map.of() : new TreeMap<>(sugarGramsByPct);
        this.gramsPerUnit = gramsPerUnit == null ? Map.of() : new TreeMap<>(gramsPerUnit);
        if (rules == null) return;
        for (IngredientRule r : rules) {
            if (r == null || r.rule == null) throw new ConfigurationException("BOM line without a rule");
            if (r.componentKey == null || r.componentKey.isBlank())
                throw new ConfigurationException("BOM line " + r + " has no component key");
            if (r.qty != null && (Double.isNaN(r.qty) || r.qty < 0))
                throw new ConfigurationException("BOM line " + r + " has a negative qty " + r.qty);
            String key = MenuCatalog.normKey(r.categoryKey) + "/" + MenuCatalog.normKey(r.itemKey);
            bom.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
    }

    public int size() { return bom.values().stream().mapToInt(List::size).sum(); }

    public Result estimate(List<UsageRow> usage) {
        Result res = new Result();
        for (UsageRow u : usage) {
            for (IngredientRule r : bom.getOrDefault(u.categoryKey + "/" + u.itemKey, List.of())) {
                String status = quantify(u, r, res.rows);
                if (status != null) res.issues.merge(status, 1, Integer::sum);
            }
        }
        if (!res.issues.isEmpty()) log.info("Ingredient lines skipped by status: {}", res.issues);
        return res;
    }

    /** Adds the row for one BOM line, or returns why it could not be quantified. */
    private String quantify(UsageRow u, IngredientRule r, List<IngredientUsageRow> out) {
        double ratio = r.qty == null ? 1.0 : r.qty;
        switch (r.rule) {
            case TEA_BASE:
                out.add(new IngredientUsageRow(u, r, u.teaBaseMlEst * ratio, "ml"));
                return null;
            case MILK_BASE:
                if (u.milkMlEst == null) return "missing_milk";
                out.add(new IngredientUsageRow(u, r, u.milkMlEst * ratio, "ml"));
                return null;
            case BY_SUGAR_PCT: {
                if (u.sugarPct == null) return "missing_sugar_pct";
                Double grams = sugarGramsByPct.get(u.sugarPct);
                if (grams == null) return "unknown_sugar_pct:" + u.sugarPct;
                out.add(new IngredientUsageRow(u, r, grams, "g"));
                return null;
            }
            case BY_ICE_PCT:
                return "missing_ice_mapping";
            default: {
                if (r.qty == null) return "missing_qty";
                Double perUnit = gramsPerUnit.get(r.componentKey);
                if (r.qtyUnit != null && COUNTED_UNITS.contains(r.qtyUnit) && perUnit != null)
                    out.add(new IngredientUsageRow(u, r, r.qty * perUnit, "g"));
                else
                    out.add(new IngredientUsageRow(u, r, r.qty, r.qtyUnit));
                return null;
            }
        }
    }

    /** Totals per (date, ingredient, unit) with the number of distinct drinks, in that order. */
    public List<DailyIngredient> daily(List<IngredientUsageRow> rows) {
        Map<String, double[]> totals = new TreeMap<>();
        Map<String, Set<String>> drinks = new HashMap<>();
        Map<String, IngredientUsageRow> sample = new HashMap<>();
        for (IngredientUsageRow r : rows) {
            String k = r.date + "|" + r.componentKey + "|" + (r.unit == null ? "" : r.unit);
            totals.computeIfAbsent(k, x -> new double[1])[0] += r.qty;
            drinks.computeIfAbsent(k, x -> new HashSet<>()).add(r.lineItemId);
            sample.putIfAbsent(k, r);
        }
        List<DailyIngredient> out = new ArrayList<>();
        for (var e : totals.entrySet()) {
            IngredientUsageRow r = sample.get(e.getKey());
            out.add(new DailyIngredient(r.date, r.componentKey, r.unit, e.getValue()[0], drinks.get(e.getKey()).size()));
        }
        return out;
    }
}
