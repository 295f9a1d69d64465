package com.example.teausage.model;

import java.time.LocalDate;

/** One row of a point-of-sale export. Never mutated after load. */
public class RawOrderLine {
    public final String orderId;
    public final LocalDate date;
    public final String time;       // nullable, kept as exported
    public final String category;
    public final String itemName;
    public final String modifiers;  // free-form, may be empty
    public final double quantity;
    public final String eventType;  // nullable; "Payment" / "Refund"

    public RawOrderLine(String orderId, LocalDate date, String time, String category, String itemName,
                        String modifiers, double quantity, String eventType) {
        this.orderId = orderId; this.date = date; this.time = time; this.category = category;
        this.itemName = itemName; this.modifiers = modifiers == null ? "" : modifiers;
        this.quantity = quantity; this.eventType = eventType;
    }

    /** Convenience for fixtures: a payment row with no order id or time. */
    public static RawOrderLine of(LocalDate date, String category, String itemName, String modifiers, double quantity) {
        return new RawOrderLine(null, date, null, category, itemName, modifiers, quantity, "Payment");
    }

    public RawOrderLine withNames(String category, String itemName) {
        return new RawOrderLine(orderId, date, time, category, itemName, modifiers, quantity, eventType);
    }

    @Override public String toString() { return date + " " + category + " / " + itemName + " x" + quantity + " [" + modifiers + "]"; }
}
