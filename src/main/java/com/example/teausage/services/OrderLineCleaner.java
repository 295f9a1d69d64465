package com.example.teausage.services;

import com.example.teausage.model.RawOrderLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Keeps sell-through demand only: payment rows with a positive quantity, minus reward
 * redemptions, optionally restricted to an inclusive date range. Item and category names lose
 * CJK characters and extra whitespace.
 */
public class OrderLineCleaner {
    private static final Logger log = LoggerFactory.getLogger(OrderLineCleaner.class);
    private static final Pattern CJK = Pattern.compile("[\\u3400-\\u4DBF\\u4E00-\\u9FFF\\uF900-\\uFAFF]");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    /** Counts for one cleaning pass. */
    public static class Result {
        public final List<RawOrderLine> kept = new ArrayList<>();
        public int refunds;
        public int rewards;
        public int undated;
        public int outOfRange;
    }

    private final Set<String> rewardItems;

    public OrderLineCleaner(Collection<String> rewardItems) {
        this.rewardItems = rewardItems == null ? Set.of() : Set.copyOf(rewardItems);
    }

    public static String normalizeName(String s) {
        if (s == null) return "";
        return SPACES.matcher(CJK.matcher(s).replaceAll("")).replaceAll(" ").trim();
    }

    public Result clean(List<RawOrderLine> lines, LocalDate start, LocalDate end) {
        Result r = new Result();
        for (RawOrderLine raw : lines) {
            if (raw.date == null) { r.undated++; continue; }
            String event = raw.eventType == null ? "payment" : raw.eventType.trim().toLowerCase(Locale.ROOT);
            if (event.isEmpty()) event = "payment";
            if (!event.equals("payment") || !(raw.quantity > 0)) { r.refunds++; continue; }
            if (raw.itemName != null && rewardItems.contains(raw.itemName.trim())) { r.rewards++; continue; }
            if ((start != null && raw.date.isBefore(start)) || (end != null && raw.date.isAfter(end))) { r.outOfRange++; continue; }
            r.kept.add(raw.withNames(normalizeName(raw.category), normalizeName(raw.itemName)));
        }
        log.info("Cleaned {} rows: kept={} refunds={} rewards={} undated={} outOfRange={}",
            lines.size(), r.kept.size(), r.refunds, r.rewards, r.undated, r.outOfRange);
        return r;
    }
}
