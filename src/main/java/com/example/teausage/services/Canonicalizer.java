package com.example.teausage.services;

import com.example.teausage.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Parses one order line's modifier text into structured fields and resolves its tea base.
 * <p>
 * Resolution order: unknown menu item, then conflict (two or more overrides), then
 * override, then missing choice, then the item's default blend. Ice and sugar take the last
 * token seen; two or more tea override tokens are a conflict, even when they agree.
 */
public class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);
    private static final Pattern HOT = Pattern.compile("(?i)\\bhot\\b");
    public static final Set<Integer> DEFAULT_SUGAR_LEVELS = Set.of(0, 25, 50, 75, 100);

    private final TokenResolver tokens;
    private final MenuCatalog menu;
    private final RecipeTable recipes;
    private final Set<Integer> sugarLevels;
    private final Pattern delimiters;

    public Canonicalizer(TokenResolver tokens, MenuCatalog menu, RecipeTable recipes) {
        this(tokens, menu, recipes, DEFAULT_SUGAR_LEVELS, ",;");
    }

    public Canonicalizer(TokenResolver tokens, MenuCatalog menu, RecipeTable recipes, Set<Integer> sugarLevels, String delimiterChars) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.menu = Objects.requireNonNull(menu, "menu");
        this.recipes = recipes == null ? RecipeTable.empty() : recipes;
        this.sugarLevels = sugarLevels == null || sugarLevels.isEmpty() ? DEFAULT_SUGAR_LEVELS : Set.copyOf(sugarLevels);
        String d = delimiterChars == null || delimiterChars.isEmpty() ? "," : delimiterChars;
        StringBuilder cls = new StringBuilder("[");
        for (char c : d.toCharArray()) cls.append(Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c);
        this.delimiters = Pattern.compile(cls.append(']').toString());
        for (String value : tokens.fixedValues(TokenKind.TEA_OVERRIDE)) {
            try { menu.blendFor(value); }
            catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Tea override rule value '" + value + "' is not a valid blend: " + ex.getMessage(), ex);
            }
        }
    }

    /** Splits raw modifier text on the delimiter set, dropping blanks. */
    public List<String> split(String modifiers) {
        List<String> out = new ArrayList<>();
        if (modifiers == null) return out;
        for (String t : delimiters.split(modifiers)) if (!t.isBlank()) out.add(t.trim());
        return out;
    }

    public CanonicalLineItem canonicalize(int rowId, RawOrderLine raw, UnknownTokenAudit audit) {
        var b = CanonicalLineItem.builder()
            .rowId(rowId)
            .source(raw)
            .keys(MenuCatalog.normKey(raw.category), MenuCatalog.normKey(raw.itemName));

        Integer ice = null, sugar = null;
        List<String> overrides = new ArrayList<>();
        for (String rawToken : split(raw.modifiers)) {
            ModifierToken t = tokens.resolve(rawToken);
            boolean unknown = false;
            switch (t.kind) {
                case ICE: {
                    Integer v = pct(t.value);
                    if (v == null || v < 0 || v > 100) unknown = true; else ice = v;
                    break;
                }
                case SUGAR: {
                    Integer v = pct(t.value);
                    if (v == null || !sugarLevels.contains(v)) unknown = true; else sugar = v;
                    break;
                }
                case TOPPING: b.topping(t.value, t.quantity); break;
                case TEA_OVERRIDE: overrides.add(t.value); break;
                default: unknown = true;
            }
            if (unknown) {
                b.unknownToken(t.raw);
                if (audit != null) audit.record(t.raw);
            }
        }

        Optional<RecipeOverride> recipe = recipes.lookup(raw.itemName, raw.category);
        if (recipe.isPresent() && recipe.get().forcesIce()) {
            b.forcedIce(recipe.get().ice);
            if (ice == null) ice = recipe.get().ice.forcedPct();
        }
        if (ice == null && raw.category != null && HOT.matcher(raw.category).find()) ice = 0;
        b.icePct(ice).sugarPct(sugar);

        resolveTea(b, raw, overrides);
        return b.build();
    }

    private void resolveTea(CanonicalLineItem.Builder b, RawOrderLine raw, List<String> overrides) {
        if (overrides.size() == 1) b.teaOverride(overrides.get(0));
        if (overrides.size() > 1) b.teaOverrideChoices(new ArrayList<>(new TreeSet<>(overrides)));

        Optional<MenuCatalog.Item> found = menu.find(raw.category, raw.itemName);
        if (found.isEmpty()) {
            log.debug("No menu entry for {} / {}", raw.category, raw.itemName);
            b.resolution(TeaResolution.UNKNOWN, Blend.EMPTY);
            return;
        }
        MenuCatalog.Item item = found.get();
        b.requiresTeaChoice(item.requiresTeaChoice).drinksPerUnit(item.drinksPerUnit);

        if (overrides.size() > 1) {
            b.resolution(TeaResolution.CONFLICT, Blend.EMPTY);
        } else if (overrides.size() == 1) {
            Blend blend;
            try { blend = menu.blendFor(overrides.get(0)); }
            catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Tea override value '" + overrides.get(0) + "' is not a valid blend", ex);
            }
            b.resolution(TeaResolution.OVERRIDE, blend);
        } else if (item.requiresTeaChoice) {
            b.resolution(TeaResolution.MISSING_CHOICE, Blend.EMPTY);
        } else if (item.defaultBlend != null) {
            b.resolution(TeaResolution.BLEND_DEFAULT, item.defaultBlend);
        } else {
            b.resolution(TeaResolution.UNKNOWN, Blend.EMPTY);
        }
    }

    private static Integer pct(String v) {
        if (v == null) return null;
        try { return Integer.parseInt(v.trim().replace("%", "")); }
        catch (NumberFormatException ex) { return null; }
    }
}
