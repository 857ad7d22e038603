package com.nomen.iupac.naming.substituent;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A substituent prefix such as {@code methyl}, {@code propan-2-yl} or
 * {@code 2-hydroxyethyl}.
 *
 * @param text     the prefix as cited, without enclosing marks
 * @param compound true when the prefix is itself substituted; such prefixes
 *                 are multiplied with {@code bis}, {@code tris}, ...
 */
public record SubstituentName(String text, boolean compound) {

    private static final Pattern VON_BAEYER_DESCRIPTOR = Pattern.compile("\\[[0-9.^{},]+]");
    private static final Pattern INDICATED_HYDROGEN = Pattern.compile("\\d+H");
    private static final Pattern ITALIC_PREFIX = Pattern.compile("^(tert|sec)-");

    public SubstituentName {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Substituent name must not be empty");
        }
    }

    public static SubstituentName simple(String text) {
        return new SubstituentName(text, false);
    }

    public static SubstituentName compound(String text) {
        return new SubstituentName(text, true);
    }

    /**
     * True when the prefix must be enclosed wherever it is cited: compound
     * prefixes and prefixes carrying locants ({@code (propan-2-yl)}).
     */
    public boolean needsEnclosure() {
        if (compound) {
            return true;
        }
        String plain = ITALIC_PREFIX.matcher(text).replaceFirst("");
        for (int i = 0; i < plain.length(); i++) {
            if (Character.isDigit(plain.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * The prefix inside parentheses, or square brackets / braces when it
     * already contains parentheses / square brackets (P-16.5.1.2).
     */
    public String enclosed() {
        String structural = VON_BAEYER_DESCRIPTOR.matcher(text).replaceAll("");
        if (structural.indexOf('[') >= 0) {
            return "{" + text + "}";
        }
        if (structural.indexOf('(') >= 0) {
            return "[" + text + "]";
        }
        return "(" + text + ")";
    }

    /**
     * Text compared for alphanumerical order: letters only, ignoring
     * {@code tert-}/{@code sec-}, locants and indicated hydrogen.
     */
    public String alphaKey() {
        String key = ITALIC_PREFIX.matcher(text).replaceFirst("");
        key = VON_BAEYER_DESCRIPTOR.matcher(key).replaceAll("");
        key = INDICATED_HYDROGEN.matcher(key).replaceAll("");
        StringBuilder letters = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isLetter(c)) {
                letters.append(c);
            }
        }
        return letters.toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return text;
    }
}
