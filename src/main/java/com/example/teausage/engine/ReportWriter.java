package com.example.teausage.engine;

import com.example.teausage.model.*;
import com.example.teausage.services.IngredientEstimator;
import com.example.teausage.services.UsageAggregator;
import com.example.teausage.storage.CsvStorage;
import com.example.teausage.storage.ReferenceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/** Writes a finished run as CSV tables plus JSON summaries into one directory. */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final CsvStorage csv;
    private final ReferenceStorage json;

    public ReportWriter(CsvStorage csv, ReferenceStorage json) { this.csv = csv; this.json = json; }

    public void write(PipelineResult r, Path dir) throws IOException {
        Files.createDirectories(dir);

        List<Map<String, Object>> debug = new ArrayList<>(), canonical = new ArrayList<>();
        for (CanonicalLineItem l : r.lineItems) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("row_id", l.rowId); m.put("order_id", l.orderId); m.put("date", l.date); m.put("time", l.time);
            m.put("category", l.category); m.put("item_name", l.itemName);
            m.put("category_key", l.categoryKey); m.put("item_key", l.itemKey);
            m.put("qty", l.quantity); m.put("modifiers", l.rawModifiers);
            m.put("ice_pct", l.icePct); m.put("forced_ice", l.forcedIce == null ? null : l.forcedIce.label());
            m.put("sugar_pct", l.sugarPct);
            m.put("toppings", String.join("|", l.toppings)); m.put("topping_qty", l.toppingQtyString());
            m.put("topping_units", l.toppingUnitsTotal());
            m.put("tea_override", l.teaOverride); m.put("tea_override_choices", String.join("|", l.teaOverrideChoices));
            m.put("requires_tea_choice", l.requiresTeaChoice);
            m.put("tea_resolution", l.teaResolution.label()); m.put("resolved_blend", l.resolvedBlend.format());
            m.put("drinks_per_unit", l.drinksPerUnit); m.put("unknown_tokens", String.join("|", l.unknownTokens));
            debug.add(m);
            canonical.add(m);
        }
        csv.writeTable(dir.resolve("canonicalized_debug.csv"), List.of("row_id", "order_id", "date", "time", "category",
            "item_name", "category_key", "item_key", "qty", "modifiers", "ice_pct", "forced_ice", "sugar_pct", "toppings",
            "topping_qty", "topping_units", "tea_override", "tea_override_choices", "requires_tea_choice", "tea_resolution", "resolved_blend",
            "drinks_per_unit", "unknown_tokens"), debug);
        csv.writeTable(dir.resolve("canonicalized.csv"), List.of("row_id", "date", "category", "item_name", "qty", "ice_pct",
            "sugar_pct", "toppings", "tea_resolution", "resolved_blend"), canonical);

        List<Map<String, Object>> lines = new ArrayList<>(), components = new ArrayList<>();
        for (UsageRow u : r.usage) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("line_item_id", u.lineItemId); m.put("date", u.date); m.put("category", u.category); m.put("item_name", u.itemName);
            m.put("tea_resolution", u.teaResolution.label()); m.put("resolved_blend", u.blend.format());
            m.put("ice_bucket", u.iceBucket); m.put("ice_pct_imputed", u.iceImputed); m.put("base_tea_ml", u.baseTeaMl);
            m.put("topping_reduction_pct", u.toppingReductionPct); m.put("tea_base_ml_est", u.teaBaseMlEst); m.put("milk_ml_est", u.milkMlEst);
            lines.add(m);
            u.componentMl.forEach((k, v) -> components.add(Map.of("line_item_id", u.lineItemId, "date", u.date, "tea_component", k, "tea_ml", v)));
        }
        csv.writeTable(dir.resolve("usage_line_items.csv"), List.of("line_item_id", "date", "category", "item_name", "tea_resolution",
            "resolved_blend", "ice_bucket", "ice_pct_imputed", "base_tea_ml", "topping_reduction_pct", "tea_base_ml_est", "milk_ml_est"), lines);
        csv.writeTable(dir.resolve("usage_components.csv"), List.of("line_item_id", "date", "tea_component", "tea_ml"), components);

        List<Map<String, Object>> daily = new ArrayList<>();
        for (UsageAggregator.DailyUsage d : r.daily)
            daily.add(Map.of("date", d.date, "tea_component", d.component, "drink_count", d.drinkCount, "tea_ml_total", d.teaMlTotal));
        csv.writeTable(dir.resolve("usage_summary.csv"), List.of("date", "tea_component", "drink_count", "tea_ml_total"), daily);

        List<String> weekdayCols = List.of("month", "weekday", "tea_component", "days", "avg_drink_count", "avg_tea_ml");
        csv.writeTable(dir.resolve("usage_weekday_summary.csv"), weekdayCols.subList(1, weekdayCols.size()), weekdayRows(r.weekday));
        csv.writeTable(dir.resolve("usage_monthly_weekday_summary.csv"), weekdayCols, weekdayRows(r.monthWeekday));

        List<Map<String, Object>> bags = new ArrayList<>();
        for (BatchYieldRecord b : r.monthlyBatches.records) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("month", b.period); m.put("tea_component", b.teaComponent);
            m.put("days_covered", b.daysCovered); m.put("days_in_month", b.daysInPeriod);
            m.put("tea_ml_total", b.teaMlTotal); m.put("batch_yield_ml", b.batchYieldMl);
            m.put("leaf_grams_per_batch", b.leafGramsPerBatch); m.put("bag_grams", b.bagGrams);
            m.put("batches_needed", b.batchesNeeded); m.put("leaf_grams_used", b.leafGramsUsed); m.put("bags_used", b.bagsUsed);
            bags.add(m);
        }
        csv.writeTable(dir.resolve("monthly_bag_usage.csv"), List.of("month", "tea_component", "days_covered", "days_in_month",
            "tea_ml_total", "batch_yield_ml", "leaf_grams_per_batch", "bag_grams", "batches_needed", "leaf_grams_used", "bags_used"), bags);

        List<Map<String, Object>> adjusted = new ArrayList<>();
        for (UsageAggregator.DisplacedBatch d : r.displacedBatches) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("month", d.month); m.put("tea_component", d.component); m.put("tea_ml_base", d.teaMlBase);
            m.put("displaced", format(d.displaced)); m.put("displaced_total", d.displacedTotal());
            m.put("tea_ml_adjusted", d.teaMlAdjusted); m.put("batches_needed", d.adjusted.batchesNeeded);
            m.put("bags_used", d.adjusted.bagsUsed);
            adjusted.add(m);
        }
        csv.writeTable(dir.resolve("monthly_bag_usage_adjusted.csv"), List.of("month", "tea_component", "tea_ml_base", "displaced",
            "displaced_total", "tea_ml_adjusted", "batches_needed", "bags_used"), adjusted);

        List<Map<String, Object>> ingredients = new ArrayList<>();
        for (IngredientUsageRow i : r.ingredients) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("line_item_id", i.lineItemId); m.put("date", i.date); m.put("category", i.category); m.put("item_name", i.itemName);
            m.put("category_key", i.categoryKey); m.put("item_key", i.itemKey); m.put("component_key", i.componentKey);
            m.put("qty", i.qty); m.put("unit", i.unit); m.put("rule", i.rule.label());
            ingredients.add(m);
        }
        csv.writeTable(dir.resolve("usage_ingredients.csv"), List.of("line_item_id", "date", "category", "item_name", "category_key",
            "item_key", "component_key", "qty", "unit", "rule"), ingredients);

        List<Map<String, Object>> ingredientDaily = new ArrayList<>();
        for (IngredientEstimator.DailyIngredient d : r.ingredientDaily) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("date", d.date); m.put("component_key", d.componentKey); m.put("unit", d.unit);
            m.put("qty_total", d.qtyTotal); m.put("drink_count", d.drinkCount);
            ingredientDaily.add(m);
        }
        csv.writeTable(dir.resolve("usage_ingredients_summary.csv"), List.of("date", "component_key", "unit", "qty_total", "drink_count"),
            ingredientDaily);

        List<Map<String, Object>> unknown = new ArrayList<>();
        r.unknownTokens.counts().forEach((k, v) -> unknown.add(Map.of("raw_token", k, "count", v)));
        csv.writeTable(dir.resolve("unknown_tokens.csv"), List.of("raw_token", "count"), unknown);

        json.writeJson(r.validation, dir.resolve("usage_validation.json"));
        json.writeJson(r.teaJelly, dir.resolve("tea_jelly_usage.json"));
        log.info("Wrote {} usage rows and {} bag-usage rows to {}", r.usage.size(), bags.size(), dir);
    }

    private static String format(Map<String, Double> qty) {
        StringBuilder sb = new StringBuilder();
        qty.forEach((k, v) -> sb.append(sb.length() == 0 ? "" : "|").append(k).append(':').append(v));
        return sb.toString();
    }

    private static List<Map<String, Object>> weekdayRows(List<UsageAggregator.WeekdayUsage> rows) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (UsageAggregator.WeekdayUsage w : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            if (w.month != null) m.put("month", w.month.toString());
            m.put("weekday", w.weekday.toString()); m.put("tea_component", w.component); m.put("days", w.days);
            m.put("avg_drink_count", w.avgDrinkCount); m.put("avg_tea_ml", w.avgTeaMl);
            out.add(m);
        }
        return out;
    }
}
