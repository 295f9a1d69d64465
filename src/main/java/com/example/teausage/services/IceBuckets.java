package com.example.teausage.services;

import java.util.*;

/**
 * Calibrated tea-base volume per ice bucket. The means come from manual pour samples; the
 * 0% bucket is a fixed default used only for an exact 0. Other ice values between buckets snap
 * to a sampled bucket according to the fallback.
 */
public class IceBuckets {
    public static final double ZERO_ICE_BASE_ML = 550.0;

    public enum Fallback { NEAREST, LOWER, ERROR }

    /** Result of snapping an ice percentage to a bucket. */
    public static class Assignment {
        public final int bucket;
        public final boolean imputed;
        Assignment(int bucket, boolean imputed) { this.bucket = bucket; this.imputed = imputed; }
    }

    private final TreeMap<Integer, Double> meansMl = new TreeMap<>();
    private final double zeroIceMl;
    private final Fallback fallback;
    private final int missingIcePct;

    public IceBuckets(Map<Integer, Double> sampleMeansMl, Double zeroIceMl, Fallback fallback, int missingIcePct) {
        if (sampleMeansMl == null || sampleMeansMl.isEmpty()) throw new ConfigurationException("Ice bucket sample means are missing");
        for (var e : sampleMeansMl.entrySet()) {
            Integer k = e.getKey(); Double v = e.getValue();
            if (k == null || k < 0 || k > 100) throw new ConfigurationException("Ice bucket key out of range: " + k);
            if (k == 0) throw new ConfigurationException("The 0% ice volume is set by zeroIceMl, not by the sample means");
            if (v == null || !(v > 0)) throw new ConfigurationException("Ice bucket " + k + "% needs a positive mean, got " + v);
            meansMl.put(k, v);
        }
        double zero = zeroIceMl == null ? ZERO_ICE_BASE_ML : zeroIceMl;
        if (!(zero > 0)) throw new ConfigurationException("0% ice base must be positive, got " + zero);
        this.zeroIceMl = zero;
        this.fallback = fallback == null ? Fallback.NEAREST : fallback;
        if (missingIcePct < 0 || missingIcePct > 100) throw new ConfigurationException("missingIcePct out of range: " + missingIcePct);
        this.missingIcePct = missingIcePct;
    }

    public static IceBuckets of(Map<Integer, Double> sampleMeansMl) {
        return new IceBuckets(sampleMeansMl, ZERO_ICE_BASE_ML, Fallback.NEAREST, 100);
    }

    public double baseMl(int bucket) {
        if (bucket == 0) return zeroIceMl;
        Double v = meansMl.get(bucket);
        if (v == null) throw new IllegalArgumentException("No calibrated volume for ice bucket " + bucket);
        return v;
    }

    /** A null ice value uses the configured default and counts as imputed. */
    public Assignment assign(Integer icePct, String lineItemId) throws UnresolvableLineException {
        if (icePct == null) return new Assignment(snap(missingIcePct, Fallback.NEAREST), true);
        if (icePct == 0 || meansMl.containsKey(icePct)) return new Assignment(icePct, false);
        if (fallback == Fallback.ERROR)
            throw new UnresolvableLineException("ice_bucket", "Line " + lineItemId + " has ice " + icePct + "% with no calibrated bucket");
        return new Assignment(snap(icePct, fallback), true);
    }

    /** Only sampled buckets are snap targets; 0 is never reached from a non-zero value. */
    private int snap(int value, Fallback how) {
        if (value == 0 || meansMl.containsKey(value)) return value;
        if (how == Fallback.LOWER) {
            Integer lower = meansMl.floorKey(value);
            return lower != null ? lower : meansMl.firstKey();
        }
        Integer lo = meansMl.floorKey(value), hi = meansMl.ceilingKey(value);
        if (lo == null) return hi;
        if (hi == null) return lo;
        return (value - lo) <= (hi - value) ? lo : hi;
    }
}
