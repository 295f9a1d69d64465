package com.example.teausage.model;

/** Exactly one physical drink cut from a canonical line. */
public class ExplodedDrinkRow {
    public final CanonicalLineItem line;
    public final int index; // 1-based within the line

    public ExplodedDrinkRow(CanonicalLineItem line, int index) { this.line = line; this.index = index; }

    public String lineItemId() { return line.rowId + "-" + index; }

    @Override public String toString() { return lineItemId() + " " + line.itemName; }
}
