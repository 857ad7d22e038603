package com.nomen.iupac.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Undirected bond between two atom indices.
 */
public record Bond(
    @JsonProperty("atom1") int atom1,
    @JsonProperty("atom2") int atom2,
    @JsonProperty("order") BondOrder order,
    @JsonProperty("stereo") BondStereo stereo
) implements Serializable {

    public Bond {
        if (atom1 < 0 || atom2 < 0) {
            throw new IllegalArgumentException("Atom indices must be >= 0: " + atom1 + ", " + atom2);
        }
        if (atom1 == atom2) {
            throw new IllegalArgumentException("Self-bond on atom " + atom1);
        }
        Objects.requireNonNull(order, "order must not be null");
        stereo = stereo == null ? BondStereo.NONE : stereo;
    }

    public Bond(int atom1, int atom2, BondOrder order) {
        this(atom1, atom2, order, BondStereo.NONE);
    }

    public boolean connects(int a, int b) {
        return (atom1 == a && atom2 == b) || (atom1 == b && atom2 == a);
    }

    public boolean involves(int atom) {
        return atom1 == atom || atom2 == atom;
    }

    /**
     * Returns the endpoint opposite to {@code atom}.
     *
     * @throws IllegalArgumentException if the bond does not touch {@code atom}
     */
    public int other(int atom) {
        if (atom == atom1) {
            return atom2;
        }
        if (atom == atom2) {
            return atom1;
        }
        throw new IllegalArgumentException("Atom " + atom + " is not part of bond " + this);
    }
}
