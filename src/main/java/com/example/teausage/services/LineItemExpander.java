package com.example.teausage.services;

import com.example.teausage.model.CanonicalLineItem;
import com.example.teausage.model.ExplodedDrinkRow;

import java.util.*;

/** One row per physical drink: quantity times the item's drinks per unit. */
public class LineItemExpander {

    public List<ExplodedDrinkRow> expand(CanonicalLineItem line) {
        int count = drinkCount(line);
        List<ExplodedDrinkRow> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) out.add(new ExplodedDrinkRow(line, i));
        return out;
    }

    public List<ExplodedDrinkRow> expandAll(List<CanonicalLineItem> lines) {
        List<ExplodedDrinkRow> out = new ArrayList<>();
        for (CanonicalLineItem l : lines) out.addAll(expand(l));
        return out;
    }

    /** Fractional quantities keep their whole part; any positive quantity yields at least one drink. */
    public static int drinkCount(CanonicalLineItem line) {
        if (!(line.quantity > 0)) return 0;
        int units = Math.max(1, (int) Math.floor(line.quantity));
        return units * Math.max(1, line.drinksPerUnit);
    }
}
