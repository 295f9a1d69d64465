package com.example.teausage.model;

/**
 * Per tea-component brewing constants. Either {@code batchYieldMl} is given directly, or it is
 * derived from the brew inputs (hot water + ice - leaf absorption - loss).
 */
public class BatchConstants {
    public Double batchYieldMl;
    public Double leafGramsPerBatch;
    public Double bagGrams = 600.0;
    public Double absorbMlPerG;
    public Double hotWaterMl = 4200.0;
    public Double iceGrams = 2800.0;
    public Double processLossMl = 0.0;

    public BatchConstants() {}
    public BatchConstants(Double batchYieldMl, Double leafGramsPerBatch, Double bagGrams) {
        this.batchYieldMl = batchYieldMl; this.leafGramsPerBatch = leafGramsPerBatch; this.bagGrams = bagGrams;
    }
}
