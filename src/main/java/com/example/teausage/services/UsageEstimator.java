package com.example.teausage.services;

import com.example.teausage.model.*;

import java.util.Optional;

/**
 * Turns one resolved drink into estimated tea-base (and milk) millilitres.
 * <ol>
 *   <li>a recipe entry forcing "100% ice" or "no ice" supplies its flat tea-base volume;</li>
 *   <li>otherwise the ice bucket picks the volume: the recipe's per-bucket column if present,
 *       else the calibrated mean (0% ice = 550 ml);</li>
 *   <li>each topping type takes off 10%, never more than 20% in total;</li>
 *   <li>milk drinks split the volume by the recipe's milk ratio;</li>
 *   <li>estimates are rounded half-up to whole ml, then spread over the blend components.</li>
 * </ol>
 */
public class UsageEstimator {
    public static final double TOPPING_STEP = 0.10;
    public static final double TOPPING_CAP = 0.20;

    private final RecipeTable recipes;
    private final IceBuckets buckets;
    private final double toppingStep;
    private final double toppingCap;

    public UsageEstimator(RecipeTable recipes, IceBuckets buckets) {
        this(recipes, buckets, TOPPING_STEP, TOPPING_CAP);
    }

    public UsageEstimator(RecipeTable recipes, IceBuckets buckets, double toppingStep, double toppingCap) {
        this.recipes = recipes == null ? RecipeTable.empty() : recipes;
        this.buckets = buckets;
        if (toppingStep < 0 || toppingCap < 0 || toppingCap >= 1)
            throw new ConfigurationException("Topping reduction must be within [0, 1): step=" + toppingStep + " cap=" + toppingCap);
        this.toppingStep = toppingStep;
        this.toppingCap = toppingCap;
    }

    /** Fraction removed for a number of topping types; non-increasing volume, saturating at the cap. */
    public double toppingReduction(int toppingTypes) {
        return Math.min(Math.max(0, toppingTypes) * toppingStep, toppingCap);
    }

    public static double roundHalfUp(double ml) { return Math.floor(ml + 0.5); }

    public UsageRow estimate(ExplodedDrinkRow drink) throws UnresolvableLineException {
        CanonicalLineItem l = drink.line;
        if (!l.teaResolution.isResolved()) throw UnresolvableLineException.forResolution(l.teaResolution, drink.lineItemId());

        Optional<RecipeOverride> recipe = recipes.lookup(l.itemName, l.category);
        RecipeOverride r = recipe.orElse(null);

        boolean flat = r != null && r.forcesIce() && r.teaBaseMl != null;
        int bucket;
        boolean imputed;
        double base;
        if (flat) {
            bucket = r.ice.forcedPct();
            imputed = false;
            base = r.teaBaseMl;
        } else {
            IceBuckets.Assignment a = buckets.assign(l.icePct, drink.lineItemId());
            bucket = a.bucket;
            imputed = a.imputed;
            Double explicit = r == null ? null : r.teaBaseMlAt(bucket);
            base = explicit != null ? explicit : buckets.baseMl(bucket);
        }

        double reduction = toppingReduction(l.toppingTypesCount());
        double factor = 1.0 - reduction;
        double volume = base * factor;

        double tea = volume;
        Double milk = null;
        if (r != null && r.isMilkDrink()) {
            if (flat) {
                milk = r.milkMl * factor;
            } else if (r.milkRatio() > 0) {
                milk = volume * r.milkRatio();
                tea = volume - milk;
            }
        }
        return new UsageRow(drink, bucket, imputed, base, reduction,
            roundHalfUp(tea), milk == null ? null : roundHalfUp(milk));
    }
}
