package com.nomen.iupac.api.model;

/**
 * Bond multiplicity as produced by the line-notation parser.
 */
public enum BondOrder {
    SINGLE(1.0),
    DOUBLE(2.0),
    TRIPLE(3.0),
    /**
     * Delocalized bond between two aromatic atoms. Counts 1.5 towards valence.
     */
    AROMATIC(1.5);

    private final double valence;

    BondOrder(double valence) {
        this.valence = valence;
    }

    /**
     * Returns the contribution of this bond to each endpoint's bond-order sum.
     */
    public double valence() {
        return valence;
    }

    public boolean isMultiple() {
        return this == DOUBLE || this == TRIPLE;
    }
}
