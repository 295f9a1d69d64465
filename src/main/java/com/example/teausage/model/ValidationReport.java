package com.example.teausage.model;

import java.util.*;

/** Run-level counters written next to the output tables. */
public class ValidationReport {
    public int rawRows;
    public int cleanedRows;
    public int refundRows;
    public int rewardRows;
    public int undatedRows;
    public int outOfRangeRows;
    public int lineItems;
    public Map<String, Integer> resolutionCounts = new TreeMap<>();
    public int unknownTokenOccurrences;
    public int unknownTokenDistinct;
    public int drinks;
    public int estimatedDrinks;
    public int imputedIceDrinks;
    public int excludedLines;
    public int excludedDrinks;
    public Map<String, Integer> excludedDrinksByReason = new TreeMap<>();
    public List<String> partialMonths = new ArrayList<>();
    public List<String> componentsWithoutBatchConstants = new ArrayList<>();
    public double teaMlTotal;
    public int ingredientRows;
    // skipped BOM lines by status, e.g. missing_milk
    public Map<String, Integer> ingredientIssues = new TreeMap<>();

    public int resolutionCount(TeaResolution r) { return resolutionCounts.getOrDefault(r.label(), 0); }
}
