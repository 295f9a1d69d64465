package com.example.teausage.engine;

import com.example.teausage.model.*;
import com.example.teausage.services.*;
import com.example.teausage.storage.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One end-to-end run: clean, canonicalize, expand, estimate, aggregate, plan batches, then
 * break usage down into ingredients.
 * All configuration is checked in the constructor, so a bad setting fails before any input is
 * read. Runs hold no state between calls; the same input gives the same result.
 */
public class UsagePipeline {
    private static final Logger log = LoggerFactory.getLogger(UsagePipeline.class);

    private final PipelineSettings settings;
    private final OrderLineCleaner cleaner;
    private final Canonicalizer canonicalizer;
    private final LineItemExpander expander = new LineItemExpander();
    private final UsageEstimator estimator;
    private final UsageAggregator aggregator = new UsageAggregator();
    private final BatchYieldModel batchModel = new BatchYieldModel();
    private final TeaJellyUsage teaJelly;
    private final IngredientEstimator ingredients;

    public UsagePipeline(PipelineSettings settings, TokenResolver tokens, MenuCatalog menu, RecipeTable recipes,
                         List<IngredientRule> bom) {
        if (settings == null) throw new ConfigurationException("Pipeline settings are required");
        settings.validate();
        this.settings = settings;
        this.cleaner = new OrderLineCleaner(settings.rewardItems);
        this.canonicalizer = new Canonicalizer(tokens, menu, recipes, new HashSet<>(settings.sugarLevels), settings.modifierDelimiters);
        IceBuckets buckets = new IceBuckets(settings.iceSampleMeansMl, settings.zeroIceMl, settings.iceFallback, settings.missingIcePct);
        this.estimator = new UsageEstimator(recipes, buckets, settings.toppingReductionStep, settings.toppingReductionCap);
        for (var e : settings.batchProfiles.entrySet()) batchModel.validate(e.getKey(), e.getValue());
        this.teaJelly = new TeaJellyUsage(settings.teaJellyToppings,
            settings.teaJellyMlPerScoop == null ? TeaJellyUsage.ML_PER_SCOOP : settings.teaJellyMlPerScoop);
        this.ingredients = new IngredientEstimator(bom, settings.sugarGramsByPct, settings.componentGramsPerUnit);
        log.info("Reference tables: {} token rules, {} menu items, {} recipe overrides, {} BOM lines",
            tokens.size(), menu.size(), recipes == null ? 0 : recipes.size(), ingredients.size());
    }

    public PipelineResult run(List<RawOrderLine> raw) {
        PipelineResult res = new PipelineResult();
        ValidationReport v = res.validation;
        v.rawRows = raw.size();

        OrderLineCleaner.Result cleaned = cleaner.clean(raw, settings.startDate, settings.endDate);
        v.cleanedRows = cleaned.kept.size();
        v.refundRows = cleaned.refunds; v.rewardRows = cleaned.rewards;
        v.undatedRows = cleaned.undated; v.outOfRangeRows = cleaned.outOfRange;

        int rowId = 0;
        for (RawOrderLine line : cleaned.kept) {
            CanonicalLineItem item = canonicalizer.canonicalize(++rowId, line, res.unknownTokens);
            res.lineItems.add(item);
            res.sourceDays.add(item.date);
            v.resolutionCounts.merge(item.teaResolution.label(), 1, Integer::sum);
            if (!item.teaResolution.isResolved()) v.excludedLines++;
        }

        for (ExplodedDrinkRow d : expander.expandAll(res.lineItems)) {
            res.drinks.add(d);
            try {
                UsageRow u = estimator.estimate(d);
                res.usage.add(u);
                if (u.iceImputed) v.imputedIceDrinks++;
            } catch (UnresolvableLineException ex) {
                res.excluded.add(new PipelineResult.ExcludedDrink(d.lineItemId(), ex.reason(), ex.getMessage()));
                v.excludedDrinksByReason.merge(ex.reason(), 1, Integer::sum);
                log.debug(ex.getMessage());
            }
        }

        res.daily = aggregator.daily(res.usage);
        res.weekday = aggregator.byWeekday(res.daily, res.sourceDays);
        res.monthWeekday = aggregator.byMonthWeekday(res.daily, res.sourceDays);
        Map<String, BatchConstants> constants = new TreeMap<>();
        for (String component : res.componentTotals().keySet()) {
            BatchConstants bc = settings.batchConstantsFor(component);
            if (bc != null) constants.put(component, bc);
        }
        res.monthlyBatches = aggregator.monthlyBatches(res.daily, res.sourceDays, constants, batchModel);
        res.teaJelly = teaJelly.summarize(res.drinks);

        IngredientEstimator.Result ing = ingredients.estimate(res.usage);
        res.ingredients.addAll(ing.rows);
        res.ingredientDaily = ingredients.daily(ing.rows);
        res.displacedBatches = aggregator.displacedBatches(res.monthlyBatches, res.usage, res.ingredients, settings.teaDisplacement);
        v.ingredientRows = ing.rows.size();
        v.ingredientIssues.putAll(ing.issues);

        v.lineItems = res.lineItems.size();
        v.drinks = res.drinks.size();
        v.estimatedDrinks = res.usage.size();
        v.excludedDrinks = res.excluded.size();
        v.unknownTokenOccurrences = res.unknownTokens.totalOccurrences();
        v.unknownTokenDistinct = res.unknownTokens.distinct();
        for (var m : res.monthlyBatches.partialMonths) v.partialMonths.add(m.month.toString());
        v.componentsWithoutBatchConstants.addAll(res.monthlyBatches.componentsWithoutConstants);
        v.teaMlTotal = res.usage.stream().mapToDouble(u -> u.teaBaseMlEst).sum();

        log.info("Run complete: {} line items, {} drinks, {} estimated, {} excluded, {} unknown tokens ({} distinct)",
            v.lineItems, v.drinks, v.estimatedDrinks, v.excludedDrinks, v.unknownTokenOccurrences, v.unknownTokenDistinct);
        return res;
    }
}
