package com.example.teausage.model;

import java.math.BigDecimal;
import java.util.*;

/**
 * Tea components mixed in fixed proportions. Weights are non-negative and sum to 1.0;
 * components are kept sorted by name so formatting is stable across runs.
 */
public class Blend {
    public static final double TOLERANCE = 1e-6;
    public static final Blend EMPTY = new Blend(new TreeMap<>());

    private final SortedMap<String, Double> weights;

    private Blend(SortedMap<String, Double> weights) { this.weights = Collections.unmodifiableSortedMap(weights); }

    public static Blend single(String component) {
        TreeMap<String, Double> m = new TreeMap<>();
        m.put(component, 1.0);
        return new Blend(m);
    }

    /** Builds a blend from explicit weights; they must already sum to 1.0. */
    public static Blend of(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) throw new IllegalArgumentException("Blend needs at least one component");
        TreeMap<String, Double> m = new TreeMap<>();
        double sum = 0;
        for (var e : weights.entrySet()) {
            String name = e.getKey() == null ? "" : e.getKey().trim();
            double w = e.getValue() == null ? Double.NaN : e.getValue();
            if (name.isEmpty()) throw new IllegalArgumentException("Blend component name is blank");
            if (!(w >= 0)) throw new IllegalArgumentException("Blend weight for " + name + " must be non-negative, got " + w);
            m.merge(name, w, Double::sum);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE)
            throw new IllegalArgumentException("Blend weights must sum to 1.0, got " + sum + " for " + m);
        return new Blend(m);
    }

    /**
     * Parses {@code "genmai:0.5|green:0.5"}. A bare name ({@code "green"}) is a single component.
     */
    public static Blend parse(String spec) {
        if (spec == null || spec.isBlank()) throw new IllegalArgumentException("Blend spec is blank");
        if (!spec.contains(":") && !spec.contains("|")) return single(spec.trim());
        Map<String, Double> m = new LinkedHashMap<>();
        for (String part : spec.split("\\|")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            int i = p.indexOf(':');
            if (i < 0) { m.merge(p, 1.0, Double::sum); continue; }
            try {
                m.merge(p.substring(0, i).trim(), Double.parseDouble(p.substring(i + 1).trim()), Double::sum);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Bad blend weight in '" + spec + "'", ex);
            }
        }
        return of(m);
    }

    public SortedMap<String, Double> weights() { return weights; }

    public boolean isEmpty() { return weights.isEmpty(); }

    public boolean isMultiComponent() { return weights.size() > 1; }

    public double totalWeight() { return weights.values().stream().mapToDouble(Double::doubleValue).sum(); }

    /** Splits a volume across components; the parts sum back to {@code ml}. */
    public Map<String, Double> split(double ml) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (var e : weights.entrySet()) out.put(e.getKey(), ml * e.getValue());
        return out;
    }

    /** {@code "a:0.25|b:0.75"} for blends, the bare name for single components, "" when empty. */
    public String format() {
        if (weights.isEmpty()) return "";
        if (weights.size() == 1) return weights.firstKey();
        StringJoiner j = new StringJoiner("|");
        for (var e : weights.entrySet())
            j.add(e.getKey() + ":" + BigDecimal.valueOf(e.getValue()).stripTrailingZeros().toPlainString());
        return j.toString();
    }

    @Override public boolean equals(Object o) { return o instanceof Blend && ((Blend) o).weights.equals(weights); }
    @Override public int hashCode() { return weights.hashCode(); }
    @Override public String toString() { return format(); }
}
