package com.raditha.correlator.normalization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds alternate spellings of an identifier from its tokens.
 *
 * <p>Variants are the original form, snake_case, lowerCamel and UpperCamel
 * joins, plus the same three joins over the reversed token order when the
 * identifier has between {@value #MIN_REVERSIBLE_TOKENS} and
 * {@value #MAX_REVERSED_VARIANT_TOKENS} tokens. Spellings that differ only in
 * case are collapsed, keeping the first one produced.
 */
public class NameVariants {

    static final int MIN_REVERSIBLE_TOKENS = 2;
    static final int MAX_REVERSED_VARIANT_TOKENS = 4;
    static final int MAX_REORDERED_TOKENS = 6;

    private final IdentifierTokenizer tokenizer;

    public NameVariants() {
        this(new IdentifierTokenizer());
    }

    public NameVariants(IdentifierTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Generate all variant spellings of an identifier.
     */
    public Set<String> variantsOf(String identifier) {
        return variantsOf(identifier, tokenizer.tokenize(identifier));
    }

    /**
     * Generate variant spellings from an already tokenized identifier.
     *
     * @param original The identifier as written by the caller
     * @param tokens   Tokens of {@code original}
     * @return Ordered, case-insensitively unique spellings; never empty
     */
    public Set<String> variantsOf(String original, List<String> tokens) {
        Map<String, String> unique = new LinkedHashMap<>();
        add(unique, original);
        add(unique, snakeCase(tokens));
        add(unique, lowerCamelCase(tokens));
        add(unique, upperCamelCase(tokens));

        if (tokens.size() >= MIN_REVERSIBLE_TOKENS && tokens.size() <= MAX_REVERSED_VARIANT_TOKENS) {
            List<String> reversed = reversed(tokens);
            add(unique, snakeCase(reversed));
            add(unique, lowerCamelCase(reversed));
            add(unique, upperCamelCase(reversed));
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(unique.values()));
    }

    /**
     * Token orders worth searching for when the tokens may appear reordered:
     * the original order, then the reversed order for 2 to 6 tokens.
     */
    public List<List<String>> tokenOrders(List<String> tokens) {
        List<List<String>> orders = new ArrayList<>();
        orders.add(List.copyOf(tokens));
        if (tokens.size() >= MIN_REVERSIBLE_TOKENS && tokens.size() <= MAX_REORDERED_TOKENS) {
            orders.add(reversed(tokens));
        }
        return orders;
    }

    public static String snakeCase(List<String> tokens) {
        return String.join(String.valueOf(IdentifierTokenizer.SEPARATOR), tokens);
    }

    public static String lowerCamelCase(List<String> tokens) {
        if (tokens.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(tokens.get(0));
        for (int i = 1; i < tokens.size(); i++) {
            appendCapitalized(sb, tokens.get(i));
        }
        return sb.toString();
    }

    public static String upperCamelCase(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            appendCapitalized(sb, token);
        }
        return sb.toString();
    }

    private static void appendCapitalized(StringBuilder sb, String token) {
        if (token.isEmpty()) {
            return;
        }
        sb.append(IdentifierTokenizer.toUpperCase(token.charAt(0)));
        sb.append(token, 1, token.length());
    }

    private static List<String> reversed(List<String> tokens) {
        List<String> copy = new ArrayList<>(tokens);
        Collections.reverse(copy);
        return List.copyOf(copy);
    }

    private static void add(Map<String, String> unique, String variant) {
        unique.putIfAbsent(IdentifierTokenizer.toLowerCase(variant), variant);
    }
}
