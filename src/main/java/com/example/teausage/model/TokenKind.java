package com.example.teausage.model;

public enum TokenKind {
    ICE, SUGAR, TOPPING, TEA_OVERRIDE, UNKNOWN
}
