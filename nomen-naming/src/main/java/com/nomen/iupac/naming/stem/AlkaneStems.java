/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.stem;

/**
 * Numerical terms of substitutive nomenclature (P-14.2).
 *
 * <p>Stems are generated for any positive count: units, tens and hundreds are
 * combined right to left ({@code hentriacont}, {@code dohectapent}...), with the
 * special cases {@code undec}, {@code icos}, {@code henicos} and {@code docos}.
 */
public final class AlkaneStems {

    private static final String[] RETAINED = {"", "meth", "eth", "prop", "but"};
    private static final String[] UNITS = {"", "hen", "do", "tri", "tetra", "penta", "hexa", "hepta", "octa", "nona"};
    private static final String[] TENS = {"", "deca", "icosa", "triaconta", "tetraconta", "pentaconta",
        "hexaconta", "heptaconta", "octaconta", "nonaconta"};
    private static final String[] HUNDREDS = {"", "hecta", "dicta", "tricta", "tetracta", "pentacta",
        "hexacta", "heptacta", "octacta", "nonacta"};
    private static final String[] SIMPLE_MULTIPLIERS = {"", "", "di", "tri", "tetra", "penta", "hexa", "hepta",
        "octa", "nona", "deca"};
    private static final String[] COMPOUND_MULTIPLIERS = {"", "", "bis", "tris", "tetrakis", "pentakis", "hexakis",
        "heptakis", "octakis", "nonakis", "decakis"};

    private AlkaneStems() {
    }

    /**
     * Stem without ending: {@code meth}, {@code pent}, {@code undec}, {@code henicos}.
     *
     * @throws IllegalArgumentException if {@code carbons < 1}
     */
    public static String stem(int carbons) {
        if (carbons < 1) {
            throw new IllegalArgumentException("Carbon count must be >= 1, was " + carbons);
        }
        if (carbons < RETAINED.length) {
            return RETAINED[carbons];
        }
        return dropFinalA(numeral(carbons));
    }

    /**
     * Saturated parent name: {@code hexane}.
     */
    public static String alkane(int carbons) {
        return stem(carbons) + "ane";
    }

    /**
     * Substituent name of the unbranched chain attached at C1: {@code hexyl}.
     */
    public static String alkyl(int carbons) {
        return stem(carbons) + "yl";
    }

    /**
     * Multiplying prefix for simple groups: {@code di}, {@code tri}; empty for one.
     */
    public static String multiplier(int count) {
        if (count < SIMPLE_MULTIPLIERS.length) {
            return SIMPLE_MULTIPLIERS[count];
        }
        return numeral(count);
    }

    /**
     * Multiplying prefix for compound groups: {@code bis}, {@code tris}, {@code tetrakis}.
     */
    public static String compoundMultiplier(int count) {
        if (count < COMPOUND_MULTIPLIERS.length) {
            return COMPOUND_MULTIPLIERS[count];
        }
        return numeral(count) + "kis";
    }

    /**
     * Cyclic prefix of von Baeyer names by ring count: {@code bicyclo}, {@code tricyclo}.
     */
    public static String cyclicPrefix(int rings) {
        if (rings < 2) {
            throw new IllegalArgumentException("Von Baeyer systems have at least two rings, got " + rings);
        }
        return (rings == 2 ? "bi" : multiplier(rings)) + "cyclo";
    }

    /**
     * Multiplying term with its final vowel, {@code undeca}, {@code icosa}.
     */
    static String numeral(int n) {
        if (n >= 1000) {
            throw new IllegalArgumentException("Numerical term not supported for " + n);
        }
        if (n == 11) {
            return "undeca";
        }
        if (n == 20) {
            return "icosa";
        }
        if (n == 21) {
            return "henicosa";
        }
        if (n == 22) {
            return "docosa";
        }
        int units = n % 10;
        int tens = (n / 10) % 10;
        int hundreds = (n / 100) % 10;
        StringBuilder sb = new StringBuilder();
        if (units == 1 && n > 1) {
            sb.append(n < 10 ? "mono" : "hen");
        } else {
            sb.append(n < 10 ? SIMPLE_MULTIPLIERS[units] : UNITS[units]);
        }
        if (tens == 2 && units > 0) {
            sb.append("cosa");
        } else {
            sb.append(TENS[tens]);
        }
        sb.append(HUNDREDS[hundreds]);
        return sb.toString();
    }

    private static String dropFinalA(String term) {
        return term.endsWith("a") ? term.substring(0, term.length() - 1) : term;
    }
}
