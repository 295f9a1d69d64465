package com.example.teausage.services;

import com.example.teausage.model.BatchConstants;
import com.example.teausage.model.BatchYieldRecord;
import com.example.teausage.model.IngredientUsageRow;
import com.example.teausage.model.UsageRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.*;

/**
 * Groups per-drink usage into daily, weekday and month+weekday tables, and turns full months
 * into batch and bag counts.
 */
public class UsageAggregator {
    private static final Logger log = LoggerFactory.getLogger(UsageAggregator.class);

    public static class DailyUsage {
        public final LocalDate date; public final String component; public final int drinkCount; public final double teaMlTotal;
        public DailyUsage(LocalDate date, String component, int drinkCount, double teaMlTotal) {
            this.date = date; this.component = component; this.drinkCount = drinkCount; this.teaMlTotal = teaMlTotal;
        }
        @Override public String toString() { return date + "," + component + "," + drinkCount + "," + teaMlTotal; }
    }

    /** Average day for a weekday; {@code month} is null for the all-months table. */
    public static class WeekdayUsage {
        public final YearMonth month; public final DayOfWeek weekday; public final String component;
        public final int days; public final double avgDrinkCount; public final double avgTeaMl;
        public WeekdayUsage(YearMonth month, DayOfWeek weekday, String component, int days, double avgDrinkCount, double avgTeaMl) {
            this.month = month; this.weekday = weekday; this.component = component;
            this.days = days; this.avgDrinkCount = avgDrinkCount; this.avgTeaMl = avgTeaMl;
        }
        @Override public String toString() { return (month == null ? "" : month + ",") + weekday + "," + component + "," + days + "," + avgTeaMl; }
    }

    public static class MonthCoverage {
        public final YearMonth month; public final int daysCovered; public final int daysInMonth;
        public MonthCoverage(YearMonth month, int daysCovered) {
            this.month = month; this.daysCovered = daysCovered; this.daysInMonth = month.lengthOfMonth();
        }
        public boolean isFull() { return daysCovered == daysInMonth; }
        @Override public String toString() { return month + " " + daysCovered + "/" + daysInMonth; }
    }

    /**
     * A month's batch record after taking out the volume that other ingredients (sugar syrup,
     * creamer) displace from the tea. Grams count as ml and the adjusted volume never drops below 0.
     */
    public static class DisplacedBatch {
        public final String month; public final String component; public final double teaMlBase;
        public final SortedMap<String, Double> displaced; public final double teaMlAdjusted; public final BatchYieldRecord adjusted;
        DisplacedBatch(BatchYieldRecord base, SortedMap<String, Double> displaced, BatchYieldRecord adjusted) {
            this.month = base.period; this.component = base.teaComponent; this.teaMlBase = base.teaMlTotal;
            this.displaced = displaced; this.teaMlAdjusted = adjusted.teaMlTotal; this.adjusted = adjusted;
        }
        public double displacedTotal() { return displaced.values().stream().mapToDouble(Double::doubleValue).sum(); }
        @Override public String toString() { return month + " " + component + " " + teaMlBase + " -> " + teaMlAdjusted; }
    }

    /** Batch records for full months plus the months that were left out. */
    public static class MonthlyBatchPlan {
        public final List<BatchYieldRecord> records = new ArrayList<>();
        public final List<MonthCoverage> partialMonths = new ArrayList<>();
        public final SortedSet<String> componentsWithoutConstants = new TreeSet<>();
    }

    public List<DailyUsage> daily(List<UsageRow> rows) {
        Map<LocalDate, Map<String, Set<String>>> drinks = new TreeMap<>();
        Map<LocalDate, Map<String, Double>> ml = new HashMap<>();
        for (UsageRow r : rows) {
            for (var e : r.componentMl.entrySet()) {
                drinks.computeIfAbsent(r.date, x -> new TreeMap<>()).computeIfAbsent(e.getKey(), x -> new HashSet<>()).add(r.lineItemId);
                ml.computeIfAbsent(r.date, x -> new HashMap<>()).merge(e.getKey(), e.getValue(), Double::sum);
            }
        }
        List<DailyUsage> out = new ArrayList<>();
        for (var day : drinks.entrySet())
            for (var e : day.getValue().entrySet())
                out.add(new DailyUsage(day.getKey(), e.getKey(), e.getValue().size(), ml.get(day.getKey()).get(e.getKey())));
        return out;
    }

    /**
     * Averages over every source day falling on the weekday, so a day that sold none of a
     * component still counts toward its denominator.
     */
    public List<WeekdayUsage> byWeekday(List<DailyUsage> daily, Collection<LocalDate> sourceDays) {
        return average(daily, sourceDays, false);
    }

    public List<WeekdayUsage> byMonthWeekday(List<DailyUsage> daily, Collection<LocalDate> sourceDays) {
        return average(daily, sourceDays, true);
    }

    private List<WeekdayUsage> average(List<DailyUsage> daily, Collection<LocalDate> sourceDays, boolean perMonth) {
        Set<LocalDate> days = new TreeSet<>(sourceDays == null ? List.of() : sourceDays);
        for (DailyUsage d : daily) days.add(d.date);

        Map<String, Integer> dayCounts = new HashMap<>();
        for (LocalDate d : days) dayCounts.merge(groupKey(d, perMonth), 1, Integer::sum);

        Map<String, double[]> sums = new TreeMap<>();
        Map<String, DailyUsage> sample = new HashMap<>();
        for (DailyUsage d : daily) {
            String k = groupKey(d.date, perMonth) + "|" + d.component;
            double[] s = sums.computeIfAbsent(k, x -> new double[2]);
            s[0] += d.drinkCount; s[1] += d.teaMlTotal;
            sample.putIfAbsent(k, d);
        }

        List<WeekdayUsage> out = new ArrayList<>();
        for (var e : sums.entrySet()) {
            DailyUsage d = sample.get(e.getKey());
            int n = dayCounts.get(groupKey(d.date, perMonth));
            out.add(new WeekdayUsage(perMonth ? YearMonth.from(d.date) : null, d.date.getDayOfWeek(), d.component,
                n, e.getValue()[0] / n, e.getValue()[1] / n));
        }
        out.sort(Comparator.comparing((WeekdayUsage w) -> w.month == null ? "" : w.month.toString())
            .thenComparing(w -> w.weekday).thenComparing(w -> w.component));
        return out;
    }

    private static String groupKey(LocalDate d, boolean perMonth) {
        return (perMonth ? YearMonth.from(d) + "/" : "") + d.getDayOfWeek().getValue();
    }

    public List<MonthCoverage> coverage(Collection<LocalDate> sourceDays) {
        Map<YearMonth, Set<LocalDate>> byMonth = new TreeMap<>();
        for (LocalDate d : sourceDays) byMonth.computeIfAbsent(YearMonth.from(d), x -> new HashSet<>()).add(d);
        List<MonthCoverage> out = new ArrayList<>();
        byMonth.forEach((m, ds) -> out.add(new MonthCoverage(m, ds.size())));
        return out;
    }

    /**
     * Monthly totals per component turned into batches and bags. Only months whose every calendar
     * day appears in the source data are planned; the rest are reported as partial.
     */
    public MonthlyBatchPlan monthlyBatches(List<DailyUsage> daily, Collection<LocalDate> sourceDays,
                                           Map<String, BatchConstants> constants, BatchYieldModel model) {
        MonthlyBatchPlan plan = new MonthlyBatchPlan();
        Map<YearMonth, MonthCoverage> full = new TreeMap<>();
        for (MonthCoverage c : coverage(sourceDays)) {
            if (c.isFull()) full.put(c.month, c);
            else plan.partialMonths.add(c);
        }
        if (!plan.partialMonths.isEmpty()) log.warn("Skipping partial months for batch planning: {}", plan.partialMonths);

        Map<YearMonth, Map<String, Double>> totals = new TreeMap<>();
        for (DailyUsage d : daily) {
            YearMonth m = YearMonth.from(d.date);
            if (!full.containsKey(m)) continue;
            totals.computeIfAbsent(m, x -> new TreeMap<>()).merge(d.component, d.teaMlTotal, Double::sum);
        }
        for (var month : totals.entrySet()) {
            MonthCoverage c = full.get(month.getKey());
            for (var e : month.getValue().entrySet()) {
                BatchConstants bc = constants == null ? null : constants.get(e.getKey());
                if (bc == null) { plan.componentsWithoutConstants.add(e.getKey()); continue; }
                plan.records.add(model.compute(month.getKey().toString(), e.getKey(), c.daysCovered, c.daysInMonth, e.getValue(), bc));
            }
        }
        if (!plan.componentsWithoutConstants.isEmpty())
            log.warn("No batch constants for components {}; left out of bag usage", plan.componentsWithoutConstants);
        return plan;
    }

    /**
     * Re-plans the full-month batch records of each component in {@code displacers}, subtracting
     * the month's total of the listed ingredients from drinks that use that component.
     */
    public List<DisplacedBatch> displacedBatches(MonthlyBatchPlan plan, List<UsageRow> usage, List<IngredientUsageRow> ingredients,
                                                 Map<String, List<String>> displacers) {
        List<DisplacedBatch> out = new ArrayList<>();
        if (displacers == null || displacers.isEmpty()) return out;
        Map<String, Set<String>> teasByDrink = new HashMap<>();
        for (UsageRow u : usage) teasByDrink.put(u.lineItemId, u.componentMl.keySet());

        // month -> tea component -> ingredient -> qty
        Map<String, Map<String, Map<String, Double>>> byMonth = new TreeMap<>();
        for (IngredientUsageRow i : ingredients) {
            for (String tea : teasByDrink.getOrDefault(i.lineItemId, Set.of())) {
                List<String> keys = displacers.get(tea);
                if (keys == null || !keys.contains(i.componentKey)) continue;
                byMonth.computeIfAbsent(YearMonth.from(i.date).toString(), x -> new TreeMap<>())
                    .computeIfAbsent(tea, x -> new TreeMap<>()).merge(i.componentKey, i.qty, Double::sum);
            }
        }

        for (BatchYieldRecord r : plan.records) {
            List<String> keys = displacers.get(r.teaComponent);
            if (keys == null || keys.isEmpty()) continue;
            Map<String, Double> month = byMonth.getOrDefault(r.period, Map.of()).getOrDefault(r.teaComponent, Map.of());
            SortedMap<String, Double> displaced = new TreeMap<>();
            for (String k : keys) displaced.put(k, month.getOrDefault(k, 0.0));
            double left = Math.max(0.0, r.teaMlTotal - displaced.values().stream().mapToDouble(Double::doubleValue).sum());
            BatchYieldRecord adjusted = new BatchYieldRecord(r.period, r.teaComponent, r.daysCovered, r.daysInPeriod,
                left, r.batchYieldMl, r.leafGramsPerBatch, r.bagGrams);
            out.add(new DisplacedBatch(r, displaced, adjusted));
        }
        return out;
    }
}
