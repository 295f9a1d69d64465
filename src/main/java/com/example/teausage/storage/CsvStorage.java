package com.example.teausage.storage;

import com.example.teausage.model.IceConstraint;
import com.example.teausage.model.IngredientRule;
import com.example.teausage.model.RawOrderLine;
import com.example.teausage.model.RecipeOverride;
import com.example.teausage.services.ConfigurationException;
import com.example.teausage.services.RecipeTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.*;
import java.nio.file.*;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/** Tabular files: the recipe override table, raw POS exports, and output tables. */
public class CsvStorage {
    public static final String DEFAULT_RECIPES = "/defaults/recipe-overrides.csv";
    public static final List<String> RECIPE_COLUMNS = List.of("category", "item_name", "tea_base_ml", "milk_ml", "ice",
        "match_tokens", "tea_base_ml_0", "tea_base_ml_25", "tea_base_ml_50", "tea_base_ml_75", "tea_base_ml_100");
    public static final String DEFAULT_BOM = "/defaults/item-bom.csv";
    public static final List<String> BOM_COLUMNS = List.of("category_key", "item_key", "component_key", "rule", "qty", "qty_unit");
    public static final List<String> RAW_COLUMNS = List.of("Date", "Time", "Transaction ID", "Category", "Item", "Qty",
        "Modifiers Applied", "Event Type");
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    private final CsvMapper mapper = new CsvMapper();

    public RecipeTable loadRecipeOverrides(InputStream in) throws IOException {
        List<Map<String, String>> rows = readRows(in, "recipe override table");
        List<RecipeOverride> out = new ArrayList<>();
        int line = 1;
        for (Map<String, String> r : rows) {
            line++;
            String where = "recipe override table line " + line;
            IceConstraint ice;
            try { ice = IceConstraint.parse(r.get("ice")); }
            catch (IllegalArgumentException ex) { throw new ConfigurationException(ex.getMessage() + " at " + where, ex); }
            Map<Integer, Double> byIce = new TreeMap<>();
            for (int b : RecipeOverride.BUCKETS) {
                Double v = number(r.get("tea_base_ml_" + b), "tea_base_ml_" + b, where);
                if (v != null) byIce.put(b, v);
            }
            out.add(new RecipeOverride(trim(r.get("category")), trim(r.get("item_name")),
                number(r.get("tea_base_ml"), "tea_base_ml", where), number(r.get("milk_ml"), "milk_ml", where),
                ice, RecipeOverride.splitMatchTokens(r.get("match_tokens")), byIce));
        }
        return new RecipeTable(out);
    }

    public RecipeTable recipeTable(Path file) throws IOException {
        try (InputStream in = ReferenceStorage.open(file, DEFAULT_RECIPES)) {
            return loadRecipeOverrides(in);
        }
    }

    public List<IngredientRule> loadIngredientBom(InputStream in) throws IOException {
        List<Map<String, String>> rows = readRows(in, "item BOM");
        List<IngredientRule> out = new ArrayList<>();
        int line = 1;
        for (Map<String, String> r : rows) {
            line++;
            String where = "item BOM line " + line;
            IngredientRule.Kind kind;
            try { kind = IngredientRule.Kind.parse(r.get("rule")); }
            catch (IllegalArgumentException ex) { throw new ConfigurationException(ex.getMessage() + " at " + where, ex); }
            String unit = trim(r.get("qty_unit"));
            out.add(new IngredientRule(trim(r.get("category_key")), trim(r.get("item_key")), trim(r.get("component_key")),
                kind, number(r.get("qty"), "qty", where), unit == null ? null : unit.toLowerCase(Locale.ROOT)));
        }
        return out;
    }

    public List<IngredientRule> ingredientBom(Path file) throws IOException {
        try (InputStream in = ReferenceStorage.open(file, DEFAULT_BOM)) {
            return loadIngredientBom(in);
        }
    }

    /** Raw export rows in file order. Blank dates are kept as null for the cleaner to count. */
    public List<RawOrderLine> loadRawOrders(InputStream in) throws IOException {
        List<Map<String, String>> rows = readRows(in, "raw order export");
        List<RawOrderLine> out = new ArrayList<>(rows.size());
        int line = 1;
        for (Map<String, String> r : rows) {
            line++;
            LocalDate date = date(r.get("Date"), line);
            double qty;
            String q = trim(r.get("Qty"));
            try { qty = q == null ? 0.0 : Double.parseDouble(q); }
            catch (NumberFormatException ex) { throw new IOException("Bad Qty '" + q + "' at raw order export line " + line, ex); }
            out.add(new RawOrderLine(trim(r.get("Transaction ID")), date, trim(r.get("Time")), trim(r.get("Category")),
                trim(r.get("Item")), r.get("Modifiers Applied"), qty, trim(r.get("Event Type"))));
        }
        return out;
    }

    public List<RawOrderLine> loadRawOrders(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return loadRawOrders(in);
        }
    }

    /** Writes rows under a header of {@code columns}; values are written as text, nulls as empty cells. */
    public void writeTable(Path file, List<String> columns, List<? extends Map<String, ?>> rows) throws IOException {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String c : columns) b.addColumn(c);
        CsvSchema schema = b.build().withHeader();
        try (SequenceWriter w = mapper.writer(schema).writeValues(file.toFile())) {
            for (Map<String, ?> row : rows) {
                Map<String, String> cells = new LinkedHashMap<>();
                for (String c : columns) cells.put(c, row.get(c) == null ? "" : String.valueOf(row.get(c)));
                w.write(cells);
            }
        } catch (IOException ex) {
            throw new IOException("Failed to write " + file, ex);
        }
    }

    private List<Map<String, String>> readRows(InputStream in, String what) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class).with(schema).readValues(in)) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (it.hasNextValue()) {
                Map<String, String> raw = it.nextValue();
                Map<String, String> row = new HashMap<>();
                raw.forEach((k, v) -> row.put(k.trim(), v));
                rows.add(row);
            }
            return rows;
        } catch (RuntimeException | IOException ex) {
            throw new IOException("Failed to parse " + what + " CSV. Expect a header row followed by data rows.", ex);
        }
    }

    private static LocalDate date(String v, int line) throws IOException {
        String s = trim(v);
        if (s == null) return null;
        try {
            return s.contains("/") ? LocalDate.parse(s, US_DATE) : LocalDate.parse(s);
        } catch (DateTimeParseException ex) {
            throw new IOException("Bad Date '" + s + "' at raw order export line " + line, ex);
        }
    }

    private static Double number(String v, String column, String where) {
        String s = trim(v);
        if (s == null) return null;
        try { return Double.parseDouble(s); }
        catch (NumberFormatException ex) { throw new ConfigurationException("Column " + column + " is not a number ('" + s + "') at " + where, ex); }
    }

    private static String trim(String v) {
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
