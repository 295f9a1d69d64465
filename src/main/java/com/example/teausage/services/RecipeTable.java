package com.example.teausage.services;

import com.example.teausage.model.RecipeOverride;

import java.util.*;

/**
 * Ordered recipe override rules, consulted before the generic volume formulas.
 * <p>
 * An entry with match tokens applies when the item name contains any of them; an entry without
 * tokens applies on an exact item + category match. Token entries beat exact entries, and among
 * equals the first in table order wins.
 */
public class RecipeTable {
    private final List<RecipeOverride> entries;

    public RecipeTable(List<RecipeOverride> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static RecipeTable empty() { return new RecipeTable(List.of()); }

    public Optional<RecipeOverride> lookup(String itemName, String category) {
        String item = itemName == null ? "" : itemName.toLowerCase(Locale.ROOT);
        RecipeOverride exact = null;
        for (RecipeOverride r : entries) {
            if (r.hasMatchTokens()) {
                for (String t : r.matchTokens) if (item.contains(t)) return Optional.of(r);
            } else if (exact == null && sameKey(r.itemName, itemName) && sameKey(r.category, category)) {
                exact = r;
            }
        }
        return Optional.ofNullable(exact);
    }

    public int size() { return entries.size(); }

    private static boolean sameKey(String a, String b) {
        return MenuCatalog.normKey(a).equals(MenuCatalog.normKey(b));
    }
}
