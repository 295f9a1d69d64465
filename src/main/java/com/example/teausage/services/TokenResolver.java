package com.example.teausage.services;

import com.example.teausage.model.ModifierToken;
import com.example.teausage.model.TokenKind;
import com.example.teausage.model.TokenRule;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-text modifier tokens to canonical (kind, value) pairs. Rules are tried in table
 * order and the first match wins, so specific patterns have to be listed before general ones.
 * Read-only once built.
 */
public class TokenResolver {
    private static final Pattern QTY_SUFFIX = Pattern.compile("(?i)^(.*?)\\s*x\\s*(\\d{1,3})$");

    private final List<CompiledRule> rules = new ArrayList<>();

    public TokenResolver(List<TokenRule> table) {
        if (table == null) return;
        int i = 0;
        for (TokenRule r : table) {
            i++;
            if (r == null || r.pattern == null || r.pattern.isBlank() || r.kind == null)
                throw new ConfigurationException("Token rule #" + i + " needs a pattern and a kind");
            if (r.kind == TokenKind.UNKNOWN)
                throw new ConfigurationException("Token rule #" + i + " ('" + r.pattern + "') cannot map to UNKNOWN");
            rules.add(new CompiledRule(r));
        }
    }

    public int size() { return rules.size(); }

    /** Fixed canonical values of one kind, in table order. Values built from regex groups are left out. */
    public List<String> fixedValues(TokenKind kind) {
        List<String> out = new ArrayList<>();
        for (CompiledRule r : rules) {
            String v = r.rule.value;
            if (r.rule.kind == kind && v != null && !(r.rule.match == TokenRule.Match.REGEX && v.contains("$"))) out.add(v);
        }
        return out;
    }

    /** Never fails: tokens that match nothing come back as UNKNOWN carrying the raw text. */
    public ModifierToken resolve(String rawToken) {
        if (rawToken == null) return ModifierToken.unknown("");
        String raw = rawToken.trim();
        String body = raw;
        int qty = 1;
        Matcher qm = QTY_SUFFIX.matcher(raw);
        if (qm.matches() && !qm.group(1).isBlank()) {
            body = qm.group(1).trim();
            qty = Integer.parseInt(qm.group(2));
        }
        String norm = body.toLowerCase(Locale.ROOT);
        for (CompiledRule r : rules) {
            String value = r.apply(norm);
            if (value != null) return new ModifierToken(r.rule.kind, value, raw, qty);
        }
        return ModifierToken.unknown(raw);
    }

    private static final class CompiledRule {
        final TokenRule rule;
        final String needle;
        final Pattern regex;

        CompiledRule(TokenRule rule) {
            this.rule = rule;
            this.needle = rule.pattern.trim().toLowerCase(Locale.ROOT);
            Pattern p = null;
            if (rule.match == TokenRule.Match.REGEX) {
                try { p = Pattern.compile(rule.pattern, Pattern.CASE_INSENSITIVE); }
                catch (RuntimeException ex) { throw new ConfigurationException("Bad token regex '" + rule.pattern + "'", ex); }
            }
            this.regex = p;
        }

        /** Canonical value when the rule matches, else null. */
        String apply(String norm) {
            switch (rule.match == null ? TokenRule.Match.EXACT : rule.match) {
                case CONTAINS: return norm.contains(needle) ? rule.value : null;
                case REGEX: {
                    Matcher m = regex.matcher(norm);
                    if (!m.matches()) return null;
                    String v = rule.value == null ? m.group() : rule.value;
                    for (int g = m.groupCount(); g >= 1; g--) v = v.replace("$" + g, m.group(g) == null ? "" : m.group(g));
                    return v;
                }
                default: return norm.equals(needle) ? rule.value : null;
            }
        }
    }
}
