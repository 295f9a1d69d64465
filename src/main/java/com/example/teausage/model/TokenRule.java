package com.example.teausage.model;

/** One row of the modifier token rule table. */
public class TokenRule {
    public enum Match { EXACT, CONTAINS, REGEX }

    public String pattern;
    public Match match = Match.EXACT;
    public TokenKind kind;
    public String value;  // canonical value; REGEX rules may reference groups as $1

    public TokenRule() {}
    public TokenRule(String pattern, Match match, TokenKind kind, String value) {
        this.pattern = pattern; this.match = match; this.kind = kind; this.value = value;
    }

    public static TokenRule exact(String pattern, TokenKind kind, String value) { return new TokenRule(pattern, Match.EXACT, kind, value); }
    public static TokenRule contains(String pattern, TokenKind kind, String value) { return new TokenRule(pattern, Match.CONTAINS, kind, value); }
    public static TokenRule regex(String pattern, TokenKind kind, String value) { return new TokenRule(pattern, Match.REGEX, kind, value); }
}
