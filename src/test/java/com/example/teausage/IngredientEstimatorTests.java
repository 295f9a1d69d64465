package com.example.teausage;

import com.example.teausage.model.*;
import com.example.teausage.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.*;

public class IngredientEstimatorTests {
    private static final LocalDate DAY = LocalDate.of(2025, 3, 3);
    private static final Map<Integer, Double> SUGAR = Map.of(0, 0.0, 50, 15.0, 100, 30.0);
    private int nextRow = 1;

    private UsageRow usage(String category, String item, Integer sugar, double teaMl, Double milkMl) {
        CanonicalLineItem l = CanonicalLineItem.builder()
            .rowId(nextRow++)
            .source(RawOrderLine.of(DAY, category, item, "", 1))
            .keys(MenuCatalog.normKey(category), MenuCatalog.normKey(item))
            .sugarPct(sugar)
            .resolution(TeaResolution.BLEND_DEFAULT, Blend.single("tie_guan_yin"))
            .build();
        return new UsageRow(new ExplodedDrinkRow(l, 1), 50, false, teaMl, 0.0, teaMl, milkMl);
    }

    private static IngredientRule rule(String item, String component, IngredientRule.Kind kind, Double qty, String unit) {
        return new IngredientRule("Milk Tea", item, component, kind, qty, unit);
    }

    private final IngredientEstimator estimator = new IngredientEstimator(List.of(
        rule("TGY Milk Tea", "tgy_tea_base", IngredientRule.Kind.TEA_BASE, 0.5, null),
        rule("TGY Milk Tea", "milk", IngredientRule.Kind.MILK_BASE, null, null),
        rule("TGY Milk Tea", "sugar_syrup", IngredientRule.Kind.BY_SUGAR_PCT, null, null),
        rule("TGY Milk Tea", "non_dairy_creamer", IngredientRule.Kind.FIXED, 2.0, "shot"),
        rule("TGY Milk Tea", "cheese_foam", IngredientRule.Kind.TOPPING_DEFAULT, 40.0, "g")
    ), SUGAR, Map.of("non_dairy_creamer", 12.0));

    private static double qty(IngredientEstimator.Result r, String component) {
        return r.rows.stream().filter(i -> i.componentKey.equals(component)).findFirst().orElseThrow().qty;
    }

    @Test
    void bom_lines_scale_with_the_drink() {
        IngredientEstimator.Result r = estimator.estimate(List.of(usage("Milk Tea", "TGY Milk Tea", 50, 320, 110.0)));
        assertEquals(5, r.rows.size());
        assertTrue(r.issues.isEmpty());
        assertEquals(160.0, qty(r, "tgy_tea_base"), 1e-9);
        assertEquals(110.0, qty(r, "milk"), 1e-9);
        assertEquals(15.0, qty(r, "sugar_syrup"), 1e-9);
        assertEquals(24.0, qty(r, "non_dairy_creamer"), 1e-9);
        assertEquals(40.0, qty(r, "cheese_foam"), 1e-9);

        IngredientUsageRow creamer = r.rows.stream().filter(i -> i.componentKey.equals("non_dairy_creamer")).findFirst().orElseThrow();
        assertEquals("g", creamer.unit);
        assertEquals("milk_tea", creamer.categoryKey);
        assertEquals("tgy_milk_tea", creamer.itemKey);
        assertEquals(IngredientRule.Kind.FIXED, creamer.rule);
    }

    @Test
    void missing_inputs_are_counted_not_guessed() {
        IngredientEstimator.Result r = estimator.estimate(List.of(
            usage("Milk Tea", "TGY Milk Tea", null, 300, null),
            usage("Milk Tea", "TGY Milk Tea", 30, 300, 100.0)));
        assertEquals(Map.of("missing_milk", 1, "missing_sugar_pct", 1, "unknown_sugar_pct:30", 1), r.issues);
        assertEquals(7, r.rows.size());
    }

    @Test
    void items_without_bom_lines_add_nothing() {
        IngredientEstimator.Result r = estimator.estimate(List.of(usage("Fruit Tea", "Mango Slush", 50, 300, null)));
        assertTrue(r.rows.isEmpty());
        assertTrue(r.issues.isEmpty());
    }

    @Test
    void ice_rules_and_fixed_lines_without_qty_are_reported() {
        IngredientEstimator est = new IngredientEstimator(List.of(
            rule("Latte", "ice", IngredientRule.Kind.BY_ICE_PCT, null, null),
            rule("Latte", "syrup", IngredientRule.Kind.FIXED, null, "ml"),
            rule("Latte", "vanilla", IngredientRule.Kind.FIXED, 1.0, "shot")), SUGAR, Map.of());
        IngredientEstimator.Result r = est.estimate(List.of(usage("Milk Tea", "Latte", 50, 300, 100.0)));
        assertEquals(Map.of("missing_ice_mapping", 1, "missing_qty", 1), r.issues);
        assertEquals(1, r.rows.size());
        assertEquals("shot", r.rows.get(0).unit);     // no grams-per-unit: kept in the BOM's unit
        assertEquals(1.0, r.rows.get(0).qty, 1e-9);
    }

    @Test
    void daily_totals_group_by_date_ingredient_and_unit() {
        IngredientEstimator.Result r = estimator.estimate(List.of(
            usage("Milk Tea", "TGY Milk Tea", 50, 320, 110.0),
            usage("Milk Tea", "TGY Milk Tea", 100, 320, 110.0)));
        List<IngredientEstimator.DailyIngredient> daily = estimator.daily(r.rows);
        assertEquals(5, daily.size());
        IngredientEstimator.DailyIngredient sugar = daily.stream().filter(d -> d.componentKey.equals("sugar_syrup")).findFirst().orElseThrow();
        assertEquals(45.0, sugar.qtyTotal, 1e-9);
        assertEquals(2, sugar.drinkCount);
        assertEquals("g", sugar.unit);
        assertEquals("cheese_foam", daily.get(0).componentKey);
    }

    @Test
    void bad_bom_lines_are_configuration_errors() {
        assertThrows(ConfigurationException.class, () -> new IngredientEstimator(List.of(
            rule("X", " ", IngredientRule.Kind.FIXED, 1.0, "g")), SUGAR, Map.of()));
        assertThrows(ConfigurationException.class, () -> new IngredientEstimator(List.of(
            rule("X", "milk", IngredientRule.Kind.MILK_BASE, -1.0, null)), SUGAR, Map.of()));
        assertThrows(ConfigurationException.class, () -> new IngredientEstimator(List.of(
            rule("X", "milk", null, 1.0, null)), SUGAR, Map.of()));
    }
}
