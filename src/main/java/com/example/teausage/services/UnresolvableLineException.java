package com.example.teausage.services;

import com.example.teausage.model.TeaResolution;

/** A drink cannot be turned into a volume estimate and must be left out of totals. */
public class UnresolvableLineException extends Exception {
    private final String reason;

    public UnresolvableLineException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static UnresolvableLineException forResolution(TeaResolution r, String lineItemId) {
        return new UnresolvableLineException(r.label(), "Line " + lineItemId + " has tea resolution " + r.label());
    }

    /** Short machine-readable reason: a resolution label or "ice_bucket". */
    public String reason() { return reason; }
}
