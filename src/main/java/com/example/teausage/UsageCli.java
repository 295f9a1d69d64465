package com.example.teausage;

import com.example.teausage.engine.PipelineResult;
import com.example.teausage.engine.ReportWriter;
import com.example.teausage.engine.UsagePipeline;
import com.example.teausage.model.BatchYieldRecord;
import com.example.teausage.model.RawOrderLine;
import com.example.teausage.services.ConfigurationException;
import com.example.teausage.services.UsageAggregator;
import com.example.teausage.storage.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Command line entry point: {@code UsageCli <raw-export.csv> <output-dir> [settings.json]}.
 * Prints per-component totals and the monthly bag plan after writing the output tables.
 */
public class UsageCli {
    private static final Logger log = LoggerFactory.getLogger(UsageCli.class);

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("usage: UsageCli <raw-export.csv> <output-dir> [settings.json]");
            System.exit(2);
        }
        try {
            PipelineResult r = run(Path.of(args[0]), Path.of(args[1]), args.length > 2 ? Path.of(args[2]) : null);
            print(r);
        } catch (IOException | ConfigurationException ex) {
            log.error("Run failed: {}", ex.getMessage(), ex);
            System.exit(1);
        }
    }

    public static PipelineResult run(Path rawCsv, Path outDir, Path settingsFile) throws IOException {
        PipelineSettings settings = new SettingsStorage().load(settingsFile);
        ReferenceStorage refs = new ReferenceStorage();
        CsvStorage csv = new CsvStorage();
        UsagePipeline pipeline = new UsagePipeline(settings,
            refs.tokenResolver(path(settings.tokenRulesPath)),
            refs.menuCatalog(path(settings.menuPath)),
            csv.recipeTable(path(settings.recipeOverridesPath)),
            csv.ingredientBom(path(settings.ingredientBomPath)));
        List<RawOrderLine> raw = csv.loadRawOrders(rawCsv);
        PipelineResult r = pipeline.run(raw);
        new ReportWriter(csv, refs).write(r, outDir);
        return r;
    }

    private static Path path(String s) { return s == null || s.isBlank() ? null : Path.of(s); }

    private static void print(PipelineResult r) {
        var v = r.validation;
        System.out.printf("%d line items, %d drinks (%d estimated, %d excluded), %d unknown tokens\n",
            v.lineItems, v.drinks, v.estimatedDrinks, v.excludedDrinks, v.unknownTokenOccurrences);
        System.out.println("\nTea base by component:");
        for (var e : r.componentTotals().entrySet()) System.out.printf(" - %-16s %10.0f ml\n", e.getKey(), e.getValue());
        if (!r.monthlyBatches.records.isEmpty()) {
            System.out.println("\nMonthly bag usage:");
            for (BatchYieldRecord b : r.monthlyBatches.records) System.out.println(" - " + b);
        }
        if (!r.displacedBatches.isEmpty()) System.out.println("\nAfter sugar/creamer displacement:");
        for (UsageAggregator.DisplacedBatch d : r.displacedBatches)
            System.out.printf(" - %s %s after %.0f displaced: %.2f bags\n", d.month, d.component, d.displacedTotal(), d.adjusted.bagsUsed);
        if (!v.partialMonths.isEmpty()) System.out.println("\nPartial months (no bag plan): " + v.partialMonths);
    }
}
