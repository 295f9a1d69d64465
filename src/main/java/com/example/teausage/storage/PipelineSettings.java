package com.example.teausage.storage;

import com.example.teausage.model.BatchConstants;
import com.example.teausage.services.ConfigurationException;
import com.example.teausage.services.IceBuckets;

import java.time.LocalDate;
import java.util.*;

/** Tunable constants for one run. Loaded from JSON; unset fields keep these defaults. */
public class PipelineSettings {
    public Map<Integer, Double> iceSampleMeansMl = new TreeMap<>(Map.of(25, 480.0, 50, 420.0, 75, 360.0, 100, 300.0));
    public Double zeroIceMl = IceBuckets.ZERO_ICE_BASE_ML;
    public IceBuckets.Fallback iceFallback = IceBuckets.Fallback.NEAREST;
    public Integer missingIcePct = 100;
    public Double toppingReductionStep = 0.10;
    public Double toppingReductionCap = 0.20;
    public List<Integer> sugarLevels = List.of(0, 25, 50, 75, 100);
    public String modifierDelimiters = ",;";
    public List<String> rewardItems = List.of("Free Drink (100☼ Reward)");
    // tea component -> batch profile name, for components brewed under another name
    public Map<String, String> componentBatchKeys = new TreeMap<>();
    public Map<String, BatchConstants> batchProfiles = new TreeMap<>();
    public List<String> teaJellyToppings = List.of("tea_jelly", "tgy_jelly", "osmanthus_tgy_jelly");
    public Double teaJellyMlPerScoop = 87.0;
    // ingredient estimation: grams of sugar syrup per sugar level, grams per counted unit
    public Map<Integer, Double> sugarGramsByPct = new TreeMap<>(Map.of(0, 0.0, 25, 7.5, 50, 15.0, 75, 22.5, 100, 30.0));
    public Map<String, Double> componentGramsPerUnit = new TreeMap<>(Map.of("non_dairy_creamer", 12.0));
    // tea component -> ingredients whose volume replaces part of its tea base
    public Map<String, List<String>> teaDisplacement = new TreeMap<>(Map.of("tie_guan_yin", List.of("sugar_syrup", "non_dairy_creamer")));
    public LocalDate startDate;
    public LocalDate endDate;
    // reference tables; null means the packaged defaults
    public String tokenRulesPath;
    public String menuPath;
    public String recipeOverridesPath;
    public String ingredientBomPath;

    /** Batch constants for a tea component, following {@link #componentBatchKeys}; null when none. */
    public BatchConstants batchConstantsFor(String component) {
        String key = componentBatchKeys.getOrDefault(component, component);
        if (key == null || key.isEmpty()) return null;
        return batchProfiles.get(key);
    }

    /** Rejects settings that would make a run meaningless. Called before any input is read. */
    public void validate() {
        if (iceSampleMeansMl == null || iceSampleMeansMl.isEmpty()) throw new ConfigurationException("iceSampleMeansMl is required");
        if (missingIcePct == null || missingIcePct < 0 || missingIcePct > 100)
            throw new ConfigurationException("missingIcePct must be within 0..100, got " + missingIcePct);
        if (toppingReductionStep == null || toppingReductionCap == null)
            throw new ConfigurationException("toppingReductionStep and toppingReductionCap are required");
        if (sugarLevels == null || sugarLevels.isEmpty()) throw new ConfigurationException("sugarLevels must not be empty");
        if (startDate != null && endDate != null && endDate.isBefore(startDate))
            throw new ConfigurationException("endDate " + endDate + " is before startDate " + startDate);
        if (sugarGramsByPct == null) sugarGramsByPct = new TreeMap<>();
        for (var e : sugarGramsByPct.entrySet())
            if (e.getValue() == null || e.getValue() < 0)
                throw new ConfigurationException("sugarGramsByPct for " + e.getKey() + "% must be non-negative, got " + e.getValue());
        if (componentGramsPerUnit == null) componentGramsPerUnit = new TreeMap<>();
        for (var e : componentGramsPerUnit.entrySet())
            if (e.getValue() == null || !(e.getValue() > 0))
                throw new ConfigurationException("componentGramsPerUnit for '" + e.getKey() + "' must be positive, got " + e.getValue());
        if (teaDisplacement == null) teaDisplacement = new TreeMap<>();
        if (batchProfiles == null) batchProfiles = new TreeMap<>();
        if (componentBatchKeys == null) componentBatchKeys = new TreeMap<>();
        for (var e : componentBatchKeys.entrySet()) {
            String target = e.getValue();
            if (target != null && !target.isEmpty() && !batchProfiles.containsKey(target))
                throw new ConfigurationException("Component '" + e.getKey() + "' maps to unknown batch profile '" + target + "'");
        }
    }
}
