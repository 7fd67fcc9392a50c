package com.raditha.correlator.normalization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits identifiers into lower-case tokens along underscore or camelCase
 * boundaries.
 *
 * <p>An identifier containing {@code _} is split strictly on the separator and
 * empty tokens produced by doubled, leading or trailing separators are kept.
 * Any other identifier is split before every uppercase letter except the first
 * character. Only ASCII letters are treated as cased.
 */
public class IdentifierTokenizer {

    public static final char SEPARATOR = '_';

    /**
     * Tokenize an identifier.
     *
     * @param identifier Identifier to split
     * @return Lower-case tokens; a single token holding the whole lower-cased
     *         identifier when no boundary was found
     */
    public List<String> tokenize(String identifier) {
        List<String> tokens;
        if (identifier.indexOf(SEPARATOR) >= 0) {
            tokens = new ArrayList<>(Arrays.asList(toLowerCase(identifier).split(String.valueOf(SEPARATOR), -1)));
        } else {
            tokens = splitCamelCase(identifier);
        }

        if (tokens.size() <= 1) {
            return List.of(toLowerCase(identifier));
        }
        return List.copyOf(tokens);
    }

    private List<String> splitCamelCase(String identifier) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (i > 0 && isUpperCase(c)) {
                tokens.add(current.toString());
                current.setLength(0);
            }
            current.append(toLowerCase(c));
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Lower-case ASCII letters only, so that indexes in the result line up with
     * the source string.
     */
    public static String toLowerCase(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    static char toLowerCase(char c) {
        return isUpperCase(c) ? (char) (c + ('a' - 'A')) : c;
    }

    static char toUpperCase(char c) {
        return c >= 'a' && c <= 'z' ? (char) (c - ('a' - 'A')) : c;
    }

    static boolean isUpperCase(char c) {
        return c >= 'A' && c <= 'Z';
    }
}
