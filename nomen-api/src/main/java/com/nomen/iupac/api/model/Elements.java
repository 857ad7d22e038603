package com.nomen.iupac.api.model;

import java.util.Map;

/**
 * Element data needed by the naming pipeline.
 */
public final class Elements {

    private static final Map<String, Integer> ATOMIC_NUMBERS = Map.ofEntries(
            Map.entry("H", 1), Map.entry("B", 5), Map.entry("C", 6), Map.entry("N", 7),
            Map.entry("O", 8), Map.entry("F", 9), Map.entry("Si", 14), Map.entry("P", 15),
            Map.entry("S", 16), Map.entry("Cl", 17), Map.entry("Ge", 32), Map.entry("As", 33),
            Map.entry("Se", 34), Map.entry("Br", 35), Map.entry("Sn", 50), Map.entry("Sb", 51),
            Map.entry("Te", 52), Map.entry("I", 53), Map.entry("Pb", 82), Map.entry("Bi", 83),
            Map.entry("Na", 11), Map.entry("Mg", 12), Map.entry("Al", 13), Map.entry("K", 19),
            Map.entry("Li", 3), Map.entry("Ca", 20), Map.entry("Fe", 26), Map.entry("Zn", 30),
            Map.entry("Cu", 29), Map.entry("Hg", 80)
    );

    private Elements() {
        throw new AssertionError("No instances");
    }

    /**
     * Returns the atomic number for a symbol, or 0 for unknown symbols.
     */
    public static int atomicNumber(String symbol) {
        return ATOMIC_NUMBERS.getOrDefault(normalize(symbol), 0);
    }

    /**
     * Normalizes aromatic lower-case symbols ("c", "se") to their element symbol.
     */
    public static String normalize(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return symbol;
        }
        return Character.toUpperCase(symbol.charAt(0)) + symbol.substring(1);
    }

    public static boolean isHalogen(String symbol) {
        return switch (symbol) {
            case "F", "Cl", "Br", "I" -> true;
            default -> false;
        };
    }
}
