/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A heavy atom of the input graph.
 *
 * <p>Hydrogens are normally carried as {@link #implicitHydrogens()} rather than
 * as explicit atoms. Aromaticity and ring membership are set upstream by the
 * parser and are taken at face value.
 */
public record Atom(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("atomic_number") int atomicNumber,
    @JsonProperty("charge") int charge,
    @JsonProperty("implicit_hydrogens") int implicitHydrogens,
    @JsonProperty("isotope") Integer isotope,
    @JsonProperty("chirality") String chirality,
    @JsonProperty("aromatic") boolean aromatic,
    @JsonProperty("in_ring") boolean inRing,
    @JsonProperty("atom_class") int atomClass
) implements Serializable {

    public Atom {
        Objects.requireNonNull(symbol, "symbol must not be null");
        symbol = Elements.normalize(symbol);
        if (implicitHydrogens < 0) {
            throw new IllegalArgumentException("implicitHydrogens must be >= 0, was " + implicitHydrogens);
        }
        if (atomicNumber == 0) {
            atomicNumber = Elements.atomicNumber(symbol);
        }
    }

    /**
     * Creates a neutral, non-aromatic atom.
     */
    public static Atom of(String symbol, int implicitHydrogens) {
        return new Atom(symbol, 0, 0, implicitHydrogens, null, null, false, false, 0);
    }

    /**
     * Creates a neutral aromatic atom.
     */
    public static Atom aromatic(String symbol, int implicitHydrogens) {
        return new Atom(symbol, 0, 0, implicitHydrogens, null, null, true, true, 0);
    }

    public Atom withImplicitHydrogens(int hydrogens) {
        return new Atom(symbol, atomicNumber, charge, hydrogens, isotope, chirality, aromatic, inRing, atomClass);
    }

    public Atom withInRing(boolean ring) {
        return new Atom(symbol, atomicNumber, charge, implicitHydrogens, isotope, chirality, aromatic, ring, atomClass);
    }

    public Atom withCharge(int newCharge) {
        return new Atom(symbol, atomicNumber, newCharge, implicitHydrogens, isotope, chirality, aromatic, inRing, atomClass);
    }

    public boolean isCarbon() {
        return atomicNumber == 6;
    }

    public boolean isHydrogen() {
        return atomicNumber == 1;
    }

    public boolean isHalogen() {
        return Elements.isHalogen(symbol);
    }

    /**
     * Returns true for anything other than carbon and hydrogen.
     */
    public boolean isHeteroatom() {
        return !isCarbon() && !isHydrogen();
    }
}
