package com.example.teausage.model;

/** Batches, leaf and bags needed to cover a period's tea usage. Values are not rounded. */
public class BatchYieldRecord {
    public final String period;
    public final String teaComponent;
    public final int daysCovered;
    public final int daysInPeriod;
    public final double teaMlTotal;
    public final double batchYieldMl;
    public final double leafGramsPerBatch;
    public final double bagGrams;
    public final double batchesNeeded;
    public final double leafGramsUsed;
    public final double bagsUsed;

    public BatchYieldRecord(String period, String teaComponent, int daysCovered, int daysInPeriod, double teaMlTotal,
                            double batchYieldMl, double leafGramsPerBatch, double bagGrams) {
        this.period = period; this.teaComponent = teaComponent; this.daysCovered = daysCovered; this.daysInPeriod = daysInPeriod;
        this.teaMlTotal = teaMlTotal; this.batchYieldMl = batchYieldMl; this.leafGramsPerBatch = leafGramsPerBatch; this.bagGrams = bagGrams;
        this.batchesNeeded = teaMlTotal / batchYieldMl;
        this.leafGramsUsed = batchesNeeded * leafGramsPerBatch;
        this.bagsUsed = leafGramsUsed / bagGrams;
    }

    @Override public String toString() {
        return String.format("%s %s: %.0f ml -> %.2f batches, %.2f g leaf, %.2f bags",
            period, teaComponent, teaMlTotal, batchesNeeded, leafGramsUsed, bagsUsed);
    }
}
