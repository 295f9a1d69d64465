package com.example.teausage;

import com.example.teausage.model.*;
import com.example.teausage.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.*;

public class CanonicalizerTests {
    private static final LocalDate DAY = LocalDate.of(2025, 3, 3);

    private final TokenResolver tokens = new TokenResolver(List.of(
        TokenRule.regex("(\\d{1,3})\\s*%\\s*ice", TokenKind.ICE, "$1"),
        TokenRule.regex("(\\d{1,3})\\s*%\\s*sugar", TokenKind.SUGAR, "$1"),
        TokenRule.exact("boba", TokenKind.TOPPING, "boba"),
        TokenRule.exact("pudding", TokenKind.TOPPING, "pudding"),
        TokenRule.contains("genmai", TokenKind.TEA_OVERRIDE, "genmai_green"),
        TokenRule.contains("green tea", TokenKind.TEA_OVERRIDE, "green"),
        TokenRule.contains("four seasons", TokenKind.TEA_OVERRIDE, "four_seasons")
    ));
    private final MenuCatalog menu = new MenuCatalog(List.of(
        new MenuEntry("Fruit Tea", "Passion Fruit Green Tea", "green", false),
        new MenuEntry("Pure Tea", "Build Your Own Tea", null, true),
        new MenuEntry("Specials", "Brown Sugar Milk", null, false),
        new MenuEntry("Hot Drinks", "Hot Four Seasons", "four_seasons", false),
        new MenuEntry("Fruit Tea", "Mango Slush", "four_seasons", false)
    ), Map.of("genmai_green", Map.of("genmai", 0.5, "green", 0.5)));
    private final RecipeTable recipes = new RecipeTable(List.of(
        new RecipeOverride(null, null, 250.0, null, IceConstraint.FULL_ICE, List.of("slush"), null)
    ));
    private final Canonicalizer canon = new Canonicalizer(tokens, menu, recipes);

    private CanonicalLineItem run(String category, String item, String modifiers, UnknownTokenAudit audit) {
        return canon.canonicalize(1, RawOrderLine.of(DAY, category, item, modifiers, 1), audit);
    }

    @Test
    void ice_and_sugar_take_the_last_value_and_toppings_collapse() {
        CanonicalLineItem l = run("Fruit Tea", "Passion Fruit Green Tea", "25% Ice, 50% Sugar; 75% Ice, Boba, Pudding, Boba", null);
        assertEquals(75, l.icePct);
        assertEquals(50, l.sugarPct);
        assertEquals(List.of("boba", "pudding"), new ArrayList<>(l.toppings));
        assertEquals("boba:2|pudding:1", l.toppingQtyString());
        assertEquals(2, l.toppingTypesCount());
        assertEquals(TeaResolution.BLEND_DEFAULT, l.teaResolution);
        assertEquals(Blend.single("green"), l.resolvedBlend);
    }

    @Test
    void unmapped_and_out_of_range_tokens_are_audited() {
        UnknownTokenAudit audit = new UnknownTokenAudit();
        CanonicalLineItem l = run("Fruit Tea", "Passion Fruit Green Tea", "Extra Shot, 30% Sugar, 150% Ice, Extra Shot", audit);
        assertEquals(List.of("Extra Shot", "30% Sugar", "150% Ice", "Extra Shot"), l.unknownTokens);
        assertNull(l.sugarPct);
        assertEquals(Map.of("150% Ice", 1, "30% Sugar", 1, "Extra Shot", 2), audit.counts());
        assertEquals(3, audit.distinct());
        assertEquals(4, audit.totalOccurrences());
        // still resolvable: unknown tokens do not block tea resolution
        assertEquals(TeaResolution.BLEND_DEFAULT, l.teaResolution);
    }

    @Test
    void huge_topping_count_does_not_stop_the_line() {
        UnknownTokenAudit audit = new UnknownTokenAudit();
        CanonicalLineItem l = run("Fruit Tea", "Passion Fruit Green Tea", "Boba x99999999999, 50% Ice", audit);
        assertEquals(List.of("Boba x99999999999"), l.unknownTokens);
        assertEquals(50, l.icePct);
        assertTrue(l.toppings.isEmpty());
        assertEquals(TeaResolution.BLEND_DEFAULT, l.teaResolution);
        assertEquals(1, audit.totalOccurrences());
    }

    @Test
    void two_distinct_overrides_are_a_conflict_with_sorted_choices() {
        CanonicalLineItem l = run("Pure Tea", "Build Your Own Tea", "Green Tea, Four Seasons", null);
        assertEquals(TeaResolution.CONFLICT, l.teaResolution);
        assertEquals(List.of("four_seasons", "green"), l.teaOverrideChoices);
        assertTrue(l.resolvedBlend.isEmpty());
        assertNull(l.teaOverride);
    }

    @Test
    void repeated_override_token_is_still_a_conflict() {
        CanonicalLineItem l = run("Pure Tea", "Build Your Own Tea", "Green Tea, green tea, 50% Ice", null);
        assertEquals(TeaResolution.CONFLICT, l.teaResolution);
        assertEquals(List.of("green"), l.teaOverrideChoices);

        CanonicalLineItem one = run("Pure Tea", "Build Your Own Tea", "Green Tea", null);
        assertEquals(TeaResolution.OVERRIDE, one.teaResolution);
        assertEquals("green", one.teaOverride);
    }

    @Test
    void override_to_named_blend_resolves_weights() {
        CanonicalLineItem l = run("Pure Tea", "Build Your Own Tea", "Genmai Green Tea", null);
        assertEquals(TeaResolution.OVERRIDE, l.teaResolution);
        assertEquals("genmai:0.5|green:0.5", l.resolvedBlend.format());
        assertEquals(1.0, l.resolvedBlend.totalWeight(), 1e-9);
        assertTrue(l.requiresTeaChoice);
    }

    @Test
    void required_choice_without_override_is_missing_choice() {
        assertEquals(TeaResolution.MISSING_CHOICE, run("Pure Tea", "Build Your Own Tea", "50% Ice", null).teaResolution);
    }

    @Test
    void unknown_menu_item_and_item_without_tea_are_unknown() {
        CanonicalLineItem off = run("Specials", "Mystery Drink", "Green Tea", null);
        assertEquals(TeaResolution.UNKNOWN, off.teaResolution);
        assertEquals("green", off.teaOverride);
        assertEquals(TeaResolution.UNKNOWN, run("Specials", "Brown Sugar Milk", "", null).teaResolution);
    }

    @Test
    void forced_recipe_ice_and_hot_category_fill_missing_ice() {
        CanonicalLineItem slush = run("Fruit Tea", "Mango Slush", "Boba", null);
        assertEquals(IceConstraint.FULL_ICE, slush.forcedIce);
        assertEquals(100, slush.icePct);

        CanonicalLineItem hot = run("Hot Drinks", "Hot Four Seasons", "", null);
        assertEquals(0, hot.icePct);
        assertNull(hot.forcedIce);

        assertNull(run("Fruit Tea", "Passion Fruit Green Tea", "", null).icePct);
    }

    @Test
    void menu_keys_are_normalized() {
        CanonicalLineItem l = run("  fruit tea ", "Passion-Fruit  Green Tea!", "", null);
        assertEquals("fruit_tea", l.categoryKey);
        assertEquals("passion_fruit_green_tea", l.itemKey);
        assertEquals(TeaResolution.BLEND_DEFAULT, l.teaResolution);
    }

    @Test
    void same_input_gives_same_audit() {
        UnknownTokenAudit a = new UnknownTokenAudit(), b = new UnknownTokenAudit();
        for (UnknownTokenAudit audit : List.of(a, b)) {
            run("Fruit Tea", "Passion Fruit Green Tea", "Zeta, Alpha", audit);
            run("Fruit Tea", "Passion Fruit Green Tea", "Alpha", audit);
        }
        assertEquals(a.counts(), b.counts());
        assertEquals(List.of("Alpha", "Zeta"), new ArrayList<>(a.counts().keySet()));
    }
}
