package com.example.teausage.services;

import com.example.teausage.model.BatchConstants;
import com.example.teausage.model.BatchYieldRecord;

/**
 * Converts a period's tea volume into batches, leaf grams and vendor bags. Pure and unrounded;
 * rounding is left to whoever presents the numbers.
 */
public class BatchYieldModel {

    public BatchYieldRecord compute(double teaMlTotal, double batchYieldMl, double leafGramsPerBatch, double bagGrams) {
        return compute("", "", 0, 0, teaMlTotal, new BatchConstants(batchYieldMl, leafGramsPerBatch, bagGrams));
    }

    public BatchYieldRecord compute(String period, String component, int daysCovered, int daysInPeriod,
                                    double teaMlTotal, BatchConstants c) {
        if (Double.isNaN(teaMlTotal) || teaMlTotal < 0)
            throw new IllegalArgumentException("Tea volume for " + period + " " + component + " must be non-negative, got " + teaMlTotal);
        double yieldMl = batchYieldMl(component, c);
        return new BatchYieldRecord(period, component, daysCovered, daysInPeriod, teaMlTotal,
            yieldMl, positive(component, "leafGramsPerBatch", c.leafGramsPerBatch), positive(component, "bagGrams", c.bagGrams));
    }

    /** Explicit yield when configured, otherwise the brew estimate. */
    public double batchYieldMl(String component, BatchConstants c) {
        if (c == null) throw new ConfigurationException("No batch constants for " + label(component));
        if (c.batchYieldMl != null) return positive(component, "batchYieldMl", c.batchYieldMl);
        return estimateYieldMl(component, c);
    }

    /**
     * Brewed volume of one batch when leaves are not squeezed:
     * {@code hotWater + ice - leafGrams * absorbMlPerG - processLoss}.
     */
    public double estimateYieldMl(String component, BatchConstants c) {
        double leaf = positive(component, "leafGramsPerBatch", c.leafGramsPerBatch);
        double absorb = nonNegative(component, "absorbMlPerG", c.absorbMlPerG);
        double water = nonNegative(component, "hotWaterMl", c.hotWaterMl);
        double ice = nonNegative(component, "iceGrams", c.iceGrams);
        double loss = c.processLossMl == null ? 0.0 : nonNegative(component, "processLossMl", c.processLossMl);
        double yieldMl = water + ice - leaf * absorb - loss;
        if (!(yieldMl > 0)) throw new ConfigurationException("Estimated batch yield for " + label(component) + " is not positive: " + yieldMl);
        return yieldMl;
    }

    /** Checks every constant the model will need, so bad settings stop a run before it starts. */
    public void validate(String component, BatchConstants c) {
        batchYieldMl(component, c);
        positive(component, "leafGramsPerBatch", c.leafGramsPerBatch);
        positive(component, "bagGrams", c.bagGrams);
    }

    private static double positive(String component, String name, Double v) {
        if (v == null || Double.isNaN(v) || v <= 0)
            throw new ConfigurationException(name + " for " + label(component) + " must be positive, got " + v);
        return v;
    }

    private static double nonNegative(String component, String name, Double v) {
        if (v == null || Double.isNaN(v) || v < 0)
            throw new ConfigurationException(name + " for " + label(component) + " must be non-negative, got " + v);
        return v;
    }

    private static String label(String component) { return component == null || component.isEmpty() ? "batch" : component; }
}
