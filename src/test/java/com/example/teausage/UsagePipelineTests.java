package com.example.teausage;

import com.example.teausage.engine.*;
import com.example.teausage.model.*;
import com.example.teausage.services.*;
import com.example.teausage.storage.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

public class UsagePipelineTests {
    @TempDir Path tmp;

    private static List<RawOrderLine> sampleOrders() throws Exception {
        try (InputStream in = UsagePipelineTests.class.getResourceAsStream("/sample-data/orders.csv")) {
            assertNotNull(in, "sample orders missing");
            return new CsvStorage().loadRawOrders(in);
        }
    }

    private static UsagePipeline pipeline(PipelineSettings settings) throws Exception {
        ReferenceStorage refs = new ReferenceStorage();
        return new UsagePipeline(settings, refs.tokenResolver(null), refs.menuCatalog(null), new CsvStorage().recipeTable(null), new CsvStorage().ingredientBom(null));
    }

    @Test
    void sample_export_produces_expected_usage() throws Exception {
        PipelineResult r = pipeline(new SettingsStorage().load(null)).run(sampleOrders());
        ValidationReport v = r.validation;

        assertEquals(12, v.rawRows);
        assertEquals(1, v.refundRows);
        assertEquals(1, v.rewardRows);
        assertEquals(10, v.lineItems);
        assertEquals(7, v.resolutionCount(TeaResolution.BLEND_DEFAULT));
        assertEquals(1, v.resolutionCount(TeaResolution.CONFLICT));
        assertEquals(1, v.resolutionCount(TeaResolution.MISSING_CHOICE));
        assertEquals(1, v.resolutionCount(TeaResolution.UNKNOWN));
        assertEquals(12, v.drinks);
        assertEquals(9, v.estimatedDrinks);
        assertEquals(3, v.excludedDrinks);
        assertEquals(3, v.imputedIceDrinks);
        assertEquals(1, v.unknownTokenOccurrences);
        assertEquals(Map.of("Extra Shot", 1), r.unknownTokens.counts());

        SortedMap<String, Double> totals = r.componentTotals();
        assertEquals(1105.0, totals.get("black"), 1e-9);
        assertEquals(705.0, totals.get("four_seasons"), 1e-9);
        assertEquals(640.0, totals.get("green"), 1e-9);
        assertEquals(220.0, totals.get("genmai"), 1e-9);
        assertEquals(432.0, totals.get("tie_guan_yin"), 1e-9);
        assertEquals(3102.0, v.teaMlTotal, 1e-9);

        UsageRow milkTea = r.usage.stream().filter(u -> u.itemName.equals("Classic Milk Tea")).findFirst().orElseThrow();
        assertEquals(385.0, milkTea.teaBaseMlEst, 1e-9);
        assertEquals(110.0, milkTea.milkMlEst, 1e-9);

        CanonicalLineItem conflict = r.lineItems.stream().filter(l -> l.teaResolution == TeaResolution.CONFLICT).findFirst().orElseThrow();
        assertEquals(List.of("four_seasons", "green"), conflict.teaOverrideChoices);

        assertEquals(2, r.teaJelly.drinksWithTeaJelly);
        assertEquals(261.0, r.teaJelly.totalTeaMl, 1e-9);

        assertTrue(r.monthlyBatches.records.isEmpty());
        assertEquals(List.of("2025-02"), v.partialMonths);
        assertTrue(r.displacedBatches.isEmpty());
    }

    @Test
    void sample_export_is_broken_down_into_ingredients() throws Exception {
        PipelineResult r = pipeline(new SettingsStorage().load(null)).run(sampleOrders());
        assertEquals(5, r.validation.ingredientRows);
        assertEquals(Map.of("missing_sugar_pct", 2), r.validation.ingredientIssues);

        Map<String, Double> byComponent = new TreeMap<>();
        for (IngredientUsageRow i : r.ingredients) byComponent.merge(i.componentKey, i.qty, Double::sum);
        assertEquals(Map.of("milk", 110.0, "non_dairy_creamer", 12.0, "passion_fruit_puree", 30.0,
            "sugar_syrup", 15.0, "tgy_tea_base", 432.0), byComponent);

        IngredientUsageRow sugar = r.ingredients.stream().filter(i -> i.componentKey.equals("sugar_syrup")).findFirst().orElseThrow();
        assertEquals("Passion Fruit Green Tea", sugar.itemName);
        assertEquals("g", sugar.unit);
        assertEquals(IngredientRule.Kind.BY_SUGAR_PCT, sugar.rule);
        assertEquals(5, r.ingredientDaily.size());
    }

    @Test
    void excluded_lines_match_unresolved_statuses_and_add_no_volume() throws Exception {
        PipelineResult r = pipeline(new SettingsStorage().load(null)).run(sampleOrders());
        long unresolved = r.lineItems.stream().filter(l -> !l.teaResolution.isResolved()).count();
        assertEquals(unresolved, r.validation.excludedLines);
        assertTrue(r.usage.stream().allMatch(u -> u.teaResolution.isResolved()));
        assertEquals(Map.of("conflict", 1, "missing_choice", 1, "unknown", 1), r.validation.excludedDrinksByReason);
        for (UsageRow u : r.usage) assertEquals(u.teaBaseMlEst, u.componentTotalMl(), 1e-9);
    }

    @Test
    void repeated_runs_are_identical() throws Exception {
        UsagePipeline p = pipeline(new SettingsStorage().load(null));
        PipelineResult a = p.run(sampleOrders()), b = p.run(sampleOrders());
        assertEquals(a.componentTotals(), b.componentTotals());
        assertEquals(a.unknownTokens.counts(), b.unknownTokens.counts());
        assertEquals(a.validation.resolutionCounts, b.validation.resolutionCounts);
        assertEquals(a.daily.toString(), b.daily.toString());
    }

    @Test
    void repeated_runs_write_byte_identical_reports() throws Exception {
        UsagePipeline p = pipeline(new SettingsStorage().load(null));
        ReportWriter writer = new ReportWriter(new CsvStorage(), new ReferenceStorage());
        Path first = tmp.resolve("first"), second = tmp.resolve("second");
        writer.write(p.run(sampleOrders()), first);
        writer.write(pipeline(new SettingsStorage().load(null)).run(sampleOrders()), second);

        List<String> names = new ArrayList<>();
        try (var files = Files.list(first)) { files.forEach(f -> names.add(f.getFileName().toString())); }
        Collections.sort(names);
        List<String> names2 = new ArrayList<>();
        try (var files = Files.list(second)) { files.forEach(f -> names2.add(f.getFileName().toString())); }
        Collections.sort(names2);
        assertEquals(names, names2);
        assertTrue(names.contains("canonicalized.csv"));
        assertTrue(names.contains("usage_line_items.csv"));
        for (String name : names)
            assertArrayEquals(Files.readAllBytes(first.resolve(name)), Files.readAllBytes(second.resolve(name)), name);
    }

    @Test
    void malformed_override_rule_blend_fails_at_construction() throws Exception {
        ReferenceStorage refs = new ReferenceStorage();
        TokenResolver tokens = new TokenResolver(List.of(
            TokenRule.contains("green tea", TokenKind.TEA_OVERRIDE, "green"),
            TokenRule.contains("half and half", TokenKind.TEA_OVERRIDE, "genmai:0.5|green:0.6")));
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> new UsagePipeline(new SettingsStorage().load(null), tokens, refs.menuCatalog(null), new CsvStorage().recipeTable(null), List.of()));
        assertTrue(ex.getMessage().contains("genmai:0.5|green:0.6"));

        TokenResolver named = new TokenResolver(List.of(
            TokenRule.contains("genmai", TokenKind.TEA_OVERRIDE, "genmai_green"),
            TokenRule.regex("(\\w+) tea", TokenKind.TEA_OVERRIDE, "$1")));
        assertDoesNotThrow(() -> new UsagePipeline(new SettingsStorage().load(null), named, refs.menuCatalog(null), new CsvStorage().recipeTable(null), List.of()));
    }

    @Test
    void settings_override_applies_date_range_and_fallback() throws Exception {
        Path override = Path.of(UsagePipelineTests.class.getResource("/sample-data/settings-override.json").toURI());
        PipelineSettings s = new SettingsStorage().load(override);
        assertEquals(IceBuckets.Fallback.LOWER, s.iceFallback);
        assertFalse(s.batchProfiles.isEmpty());

        PipelineResult r = pipeline(s).run(sampleOrders());
        assertEquals(4, r.validation.lineItems);
        assertEquals(6, r.validation.outOfRangeRows);
        assertEquals(5, r.validation.estimatedDrinks);
        assertEquals(1817.0, r.validation.teaMlTotal, 1e-9);
    }

    @Test
    void bad_settings_fail_before_any_run() {
        PipelineSettings s = new PipelineSettings();
        s.batchProfiles.put("green_tea", new BatchConstants(0.0, 160.0, 600.0));
        assertThrows(ConfigurationException.class, () -> pipeline(s));

        PipelineSettings badIce = new PipelineSettings();
        badIce.missingIcePct = 130;
        assertThrows(ConfigurationException.class, () -> pipeline(badIce));

        PipelineSettings badMap = new PipelineSettings();
        badMap.componentBatchKeys.put("green", "nowhere");
        assertThrows(ConfigurationException.class, () -> pipeline(badMap));
    }
}
