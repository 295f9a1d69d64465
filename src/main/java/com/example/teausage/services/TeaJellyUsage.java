package com.example.teausage.services;

import com.example.teausage.model.ExplodedDrinkRow;

import java.util.*;

/** Tea poured into jelly toppings, counted in scoops per drink. */
public class TeaJellyUsage {
    public static final double ML_PER_SCOOP = 87.0;
    public static final Set<String> DEFAULT_TOPPINGS = Set.of("tea_jelly", "tgy_jelly", "osmanthus_tgy_jelly");

    public static class Summary {
        public int lineItems;
        public int drinksWithTeaJelly;
        public double totalScoops;
        public double avgScoopsPerDrink;
        public double avgScoopsPerJellyDrink;
        public double mlPerScoop;
        public double totalTeaMl;
        public double avgTeaMlPerDrink;
    }

    private final Set<String> toppings;
    private final double mlPerScoop;

    public TeaJellyUsage(Collection<String> toppings, double mlPerScoop) {
        this.toppings = toppings == null || toppings.isEmpty() ? DEFAULT_TOPPINGS : Set.copyOf(toppings);
        if (!(mlPerScoop > 0)) throw new ConfigurationException("Tea jelly ml per scoop must be positive, got " + mlPerScoop);
        this.mlPerScoop = mlPerScoop;
    }

    public int scoops(ExplodedDrinkRow drink) {
        int n = 0;
        for (var e : drink.line.toppingQty.entrySet()) if (toppings.contains(e.getKey())) n += e.getValue();
        return n;
    }

    public Summary summarize(List<ExplodedDrinkRow> drinks) {
        Summary s = new Summary();
        s.mlPerScoop = mlPerScoop;
        s.lineItems = drinks.size();
        for (ExplodedDrinkRow d : drinks) {
            int n = scoops(d);
            if (n > 0) s.drinksWithTeaJelly++;
            s.totalScoops += n;
        }
        s.totalTeaMl = s.totalScoops * mlPerScoop;
        s.avgScoopsPerDrink = s.lineItems == 0 ? 0.0 : s.totalScoops / s.lineItems;
        s.avgScoopsPerJellyDrink = s.drinksWithTeaJelly == 0 ? 0.0 : s.totalScoops / s.drinksWithTeaJelly;
        s.avgTeaMlPerDrink = s.lineItems == 0 ? 0.0 : s.totalTeaMl / s.lineItems;
        return s;
    }
}
