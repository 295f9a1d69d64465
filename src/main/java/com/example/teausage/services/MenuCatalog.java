package com.example.teausage.services;

import com.example.teausage.model.Blend;
import com.example.teausage.model.MenuEntry;

import java.util.*;

/**
 * Menu items keyed by normalized (category, item), with each item's default blend and whether
 * the customer has to pick a tea. Blend specs are validated when the catalog is built.
 */
public class MenuCatalog {
    /** A menu entry whose blend has been parsed. */
    public static class Item {
        public final String categoryKey;
        public final String itemKey;
        public final Blend defaultBlend;   // null when the item has no default
        public final boolean requiresTeaChoice;
        public final int drinksPerUnit;
        Item(String categoryKey, String itemKey, Blend defaultBlend, boolean requiresTeaChoice, int drinksPerUnit) {
            this.categoryKey = categoryKey; this.itemKey = itemKey; this.defaultBlend = defaultBlend;
            this.requiresTeaChoice = requiresTeaChoice; this.drinksPerUnit = drinksPerUnit;
        }
    }

    private final Map<String, Item> items = new LinkedHashMap<>();
    private final Map<String, Blend> namedBlends = new TreeMap<>();

    public MenuCatalog(List<MenuEntry> entries, Map<String, Map<String, Double>> namedBlends) {
        if (namedBlends != null) {
            for (var e : namedBlends.entrySet()) {
                try { this.namedBlends.put(normKey(e.getKey()), Blend.of(e.getValue())); }
                catch (IllegalArgumentException ex) { throw new ConfigurationException("Named blend '" + e.getKey() + "': " + ex.getMessage(), ex); }
            }
        }
        if (entries == null) return;
        for (MenuEntry m : entries) {
            if (m == null || m.item == null || m.item.isBlank()) throw new ConfigurationException("Menu entry without an item name");
            if (m.drinksPerUnit < 1) throw new ConfigurationException("Menu entry '" + m.item + "' has drinksPerUnit " + m.drinksPerUnit);
            Blend blend = null;
            if (m.defaultBlend != null && !m.defaultBlend.isBlank()) {
                try { blend = blendFor(m.defaultBlend); }
                catch (IllegalArgumentException ex) { throw new ConfigurationException("Menu entry '" + m.item + "': " + ex.getMessage(), ex); }
            }
            String ck = normKey(m.category), ik = normKey(m.item);
            items.put(ck + "/" + ik, new Item(ck, ik, blend, m.requiresTeaChoice, m.drinksPerUnit));
        }
    }

    /** Lowercase, runs of non-alphanumerics collapsed to '_', trimmed of '_'. */
    public static String normKey(String v) {
        if (v == null) return "";
        String s = v.toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9]+", "_");
        return s.replaceAll("^_+|_+$", "");
    }

    public Optional<Item> find(String category, String item) {
        return Optional.ofNullable(items.get(normKey(category) + "/" + normKey(item)));
    }

    /**
     * Turns a canonical tea value into a blend. Named blends are looked up first; anything else
     * is parsed as {@code "a:0.5|b:0.5"} or a bare component name.
     */
    public Blend blendFor(String teaValue) {
        Blend named = namedBlends.get(normKey(teaValue));
        return named != null ? named : Blend.parse(teaValue);
    }

    public int size() { return items.size(); }
}
