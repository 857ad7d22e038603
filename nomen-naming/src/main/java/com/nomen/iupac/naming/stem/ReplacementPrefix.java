package com.nomen.iupac.naming.stem;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * Skeletal replacement ("a") prefixes, most senior first.
 */
public enum ReplacementPrefix {
    OXYGEN("O", "oxa"),
    SULFUR("S", "thia"),
    SELENIUM("Se", "selena"),
    TELLURIUM("Te", "tellura"),
    NITROGEN("N", "aza"),
    PHOSPHORUS("P", "phospha"),
    ARSENIC("As", "arsa"),
    ANTIMONY("Sb", "stiba"),
    BISMUTH("Bi", "bisma"),
    SILICON("Si", "sila"),
    GERMANIUM("Ge", "germa"),
    TIN("Sn", "stanna"),
    LEAD("Pb", "plumba"),
    BORON("B", "bora");

    /**
     * Orders element symbols by seniority; unknown symbols sort last.
     */
    public static final Comparator<String> SENIORITY = Comparator.comparingInt(ReplacementPrefix::rank);

    private final String symbol;
    private final String prefix;

    ReplacementPrefix(String symbol, String prefix) {
        this.symbol = symbol;
        this.prefix = prefix;
    }

    public static Optional<ReplacementPrefix> forSymbol(String symbol) {
        return Arrays.stream(values()).filter(p -> p.symbol.equals(symbol)).findFirst();
    }

    public static int rank(String symbol) {
        return forSymbol(symbol).map(Enum::ordinal).orElse(values().length);
    }

    public String symbol() {
        return symbol;
    }

    public String prefix() {
        return prefix;
    }
}
