package com.example.teausage.engine;

import com.example.teausage.model.*;
import com.example.teausage.services.IngredientEstimator;
import com.example.teausage.services.TeaJellyUsage;
import com.example.teausage.services.UnknownTokenAudit;
import com.example.teausage.services.UsageAggregator;

import java.time.LocalDate;
import java.util.*;

/** Everything one run produces. Tables are in deterministic order. */
public class PipelineResult {
    /** A drink left out of usage totals. */
    public static class ExcludedDrink {
        public final String lineItemId; public final String reason; public final String message;
        public ExcludedDrink(String lineItemId, String reason, String message) {
            this.lineItemId = lineItemId; this.reason = reason; this.message = message;
        }
        @Override public String toString() { return lineItemId + " " + reason; }
    }

    public final List<CanonicalLineItem> lineItems = new ArrayList<>();
    public final List<ExplodedDrinkRow> drinks = new ArrayList<>();
    public final List<UsageRow> usage = new ArrayList<>();
    public final List<ExcludedDrink> excluded = new ArrayList<>();
    public final SortedSet<LocalDate> sourceDays = new TreeSet<>();
    public final UnknownTokenAudit unknownTokens = new UnknownTokenAudit();
    public List<UsageAggregator.DailyUsage> daily = List.of();
    public List<UsageAggregator.WeekdayUsage> weekday = List.of();
    public List<UsageAggregator.WeekdayUsage> monthWeekday = List.of();
    public UsageAggregator.MonthlyBatchPlan monthlyBatches = new UsageAggregator.MonthlyBatchPlan();
    public TeaJellyUsage.Summary teaJelly = new TeaJellyUsage.Summary();
    public final List<IngredientUsageRow> ingredients = new ArrayList<>();
    public List<IngredientEstimator.DailyIngredient> ingredientDaily = List.of();
    public List<UsageAggregator.DisplacedBatch> displacedBatches = List.of();
    public ValidationReport validation = new ValidationReport();

    /** Tea-base ml per component over the whole run. */
    public SortedMap<String, Double> componentTotals() {
        SortedMap<String, Double> out = new TreeMap<>();
        for (UsageRow r : usage) r.componentMl.forEach((k, v) -> out.merge(k, v, Double::sum));
        return out;
    }
}
