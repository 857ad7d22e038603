package com.nomen.iupac.rules.group;

/**
 * Suffix-eligible characteristic groups, most senior first.
 */
public enum FunctionalGroupType {
    ACID("oic acid", "carboxylic acid", "carboxy", true),
    ESTER("oate", "carboxylate", "alkoxycarbonyl", true),
    AMIDE("amide", "carboxamide", "carbamoyl", true),
    NITRILE("nitrile", "carbonitrile", "cyano", true),
    ALDEHYDE("al", "carbaldehyde", "formyl", true),
    KETONE("one", "one", "oxo", false),
    ALCOHOL("ol", "ol", "hydroxy", false),
    THIOL("thiol", "thiol", "sulfanyl", false),
    AMINE("amine", "amine", "amino", false);

    private final String suffix;
    private final String attachedSuffix;
    private final String prefix;
    private final boolean carbonInGroup;

    FunctionalGroupType(String suffix, String attachedSuffix, String prefix, boolean carbonInGroup) {
        this.suffix = suffix;
        this.attachedSuffix = attachedSuffix;
        this.prefix = prefix;
        this.carbonInGroup = carbonInGroup;
    }

    /**
     * Suffix when the group carbon is a parent atom, e.g. {@code oic acid}.
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Suffix when the group carbon sits outside the parent, e.g. {@code carboxylic acid}.
     */
    public String attachedSuffix() {
        return attachedSuffix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * True for acids, esters, amides, nitriles and aldehydes, whose carbon atom
     * belongs to the group and may lie outside a ring parent.
     */
    public boolean carbonInGroup() {
        return carbonInGroup;
    }

    public boolean isSeniorTo(FunctionalGroupType other) {
        return ordinal() < other.ordinal();
    }
}
