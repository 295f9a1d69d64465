package com.example.teausage.model;

/** One menu item as listed in the menu reference file. */
public class MenuEntry {
    public String category;
    public String item;
    public String defaultBlend;        // "tie_guan_yin", "genmai:0.5|green:0.5" or a named blend; nullable
    public boolean requiresTeaChoice;
    public int drinksPerUnit = 1;      // combos sell more than one drink per unit

    public MenuEntry() {}
    public MenuEntry(String category, String item, String defaultBlend, boolean requiresTeaChoice) {
        this.category = category; this.item = item; this.defaultBlend = defaultBlend; this.requiresTeaChoice = requiresTeaChoice;
    }
}
