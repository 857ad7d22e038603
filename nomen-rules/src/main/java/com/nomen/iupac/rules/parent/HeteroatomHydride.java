package com.nomen.iupac.rules.parent;

import java.util.Arrays;
import java.util.Optional;

/**
 * Mononuclear parent hydrides that outrank rings and chains.
 */
public enum HeteroatomHydride {
    SILICON("Si", 4, "silane", "silyl"),
    GERMANIUM("Ge", 4, "germane", "germyl"),
    TIN("Sn", 4, "stannane", "stannyl"),
    LEAD("Pb", 4, "plumbane", "plumbyl"),
    PHOSPHORUS("P", 3, "phosphane", "phosphanyl"),
    ARSENIC("As", 3, "arsane", "arsanyl"),
    ANTIMONY("Sb", 3, "stibane", "stibanyl"),
    BISMUTH("Bi", 3, "bismuthane", "bismuthanyl");

    private final String symbol;
    private final int valence;
    private final String parentName;
    private final String prefixName;

    HeteroatomHydride(String symbol, int valence, String parentName, String prefixName) {
        this.symbol = symbol;
        this.valence = valence;
        this.parentName = parentName;
        this.prefixName = prefixName;
    }

    public static Optional<HeteroatomHydride> forSymbol(String symbol) {
        return Arrays.stream(values()).filter(h -> h.symbol.equals(symbol)).findFirst();
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Standard bonding number: bond-order sum plus hydrogens must equal this.
     */
    public int valence() {
        return valence;
    }

    public String parentName() {
        return parentName;
    }

    /**
     * Substituent prefix form, e.g. {@code silyl}.
     */
    public String prefixName() {
        return prefixName;
    }
}
