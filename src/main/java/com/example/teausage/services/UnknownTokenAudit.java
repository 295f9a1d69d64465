package com.example.teausage.services;

import java.util.*;

/**
 * Occurrence counts of modifier tokens no rule recognized. Owned by the caller of the
 * canonicalizer; sorted so two runs over the same input produce the same report.
 */
public class UnknownTokenAudit {
    private final SortedMap<String, Integer> counts = new TreeMap<>();

    public void record(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) return;
        counts.merge(rawToken.trim(), 1, Integer::sum);
    }

    public SortedMap<String, Integer> counts() { return Collections.unmodifiableSortedMap(counts); }

    public int distinct() { return counts.size(); }

    public int totalOccurrences() { return counts.values().stream().mapToInt(Integer::intValue).sum(); }

    @Override public String toString() { return counts.toString(); }
}
