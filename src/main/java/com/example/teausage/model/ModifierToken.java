package com.example.teausage.model;

/** A classified modifier token. {@code value} is the canonical value, or the raw token for UNKNOWN. */
public class ModifierToken {
    public final TokenKind kind;
    public final String value;
    public final String raw;
    public final int quantity; // from an "xN" suffix, 1 when absent

    public ModifierToken(TokenKind kind, String value, String raw, int quantity) {
        this.kind = kind; this.value = value; this.raw = raw; this.quantity = quantity;
    }

    public static ModifierToken unknown(String raw) { return new ModifierToken(TokenKind.UNKNOWN, raw, raw, 1); }

    public boolean isUnknown() { return kind == TokenKind.UNKNOWN; }

    @Override public String toString() { return kind + ":" + value + (quantity > 1 ? " x" + quantity : ""); }
}
