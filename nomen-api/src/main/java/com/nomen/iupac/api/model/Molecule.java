/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable molecular graph handed to the naming engine.
 *
 * <p>Atoms are addressed by their index in {@link #atoms()}. Adjacency is
 * precomputed at construction, so all queries are read-only and the instance
 * can be shared between threads.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Molecule ethanol = Molecule.builder()
 *     .addAtom(Atom.of("C", 3))
 *     .addAtom(Atom.of("C", 2))
 *     .addAtom(Atom.of("O", 1))
 *     .addBond(0, 1, BondOrder.SINGLE)
 *     .addBond(1, 2, BondOrder.SINGLE)
 *     .build();
 * }</pre>
 */
public final class Molecule implements Serializable {

    private final List<Atom> atoms;
    private final List<Bond> bonds;
    private final List<List<Integer>> rings;
    private final List<String> errors;

    private final int[][] adjacency;
    private final Map<Long, Bond> bondIndex;

    private Molecule(List<Atom> atoms, List<Bond> bonds, List<List<Integer>> rings, List<String> errors) {
        this.atoms = List.copyOf(atoms);
        this.bonds = List.copyOf(bonds);
        List<List<Integer>> ringCopies = new ArrayList<>(rings.size());
        for (List<Integer> ring : rings) {
            ringCopies.add(List.copyOf(ring));
        }
        this.rings = Collections.unmodifiableList(ringCopies);
        this.errors = List.copyOf(errors);

        int n = atoms.size();
        int[] degree = new int[n];
        for (Bond bond : this.bonds) {
            degree[bond.atom1()]++;
            degree[bond.atom2()]++;
        }
        this.adjacency = new int[n][];
        for (int i = 0; i < n; i++) {
            adjacency[i] = new int[degree[i]];
        }
        int[] fill = new int[n];
        this.bondIndex = new HashMap<>();
        for (Bond bond : this.bonds) {
            adjacency[bond.atom1()][fill[bond.atom1()]++] = bond.atom2();
            adjacency[bond.atom2()][fill[bond.atom2()]++] = bond.atom1();
            bondIndex.put(key(bond.atom1(), bond.atom2()), bond);
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    @JsonProperty("atoms")
    public List<Atom> atoms() {
        return atoms;
    }

    @JsonProperty("bonds")
    public List<Bond> bonds() {
        return bonds;
    }

    /**
     * Ring index arrays supplied by the parser, possibly empty.
     */
    @JsonProperty("rings")
    public List<List<Integer>> rings() {
        return rings;
    }

    /**
     * Upstream parse diagnostics, surfaced verbatim in the naming result.
     */
    @JsonProperty("errors")
    public List<String> errors() {
        return errors;
    }

    public int atomCount() {
        return atoms.size();
    }

    public int bondCount() {
        return bonds.size();
    }

    public Atom atom(int index) {
        return atoms.get(index);
    }

    /**
     * Returns a copy of the neighbor indices of {@code atom}, in bond order.
     */
    public int[] neighbors(int atom) {
        return adjacency[atom].clone();
    }

    public int degree(int atom) {
        return adjacency[atom].length;
    }

    /**
     * Number of non-hydrogen neighbors of {@code atom}.
     */
    public int heavyDegree(int atom) {
        int count = 0;
        for (int neighbor : adjacency[atom]) {
            if (!atoms.get(neighbor).isHydrogen()) {
                count++;
            }
        }
        return count;
    }

    public Optional<Bond> bondBetween(int a, int b) {
        return Optional.ofNullable(bondIndex.get(key(a, b)));
    }

    public BondOrder orderBetween(int a, int b) {
        Bond bond = bondIndex.get(key(a, b));
        return bond == null ? null : bond.order();
    }

    public boolean bonded(int a, int b) {
        return bondIndex.containsKey(key(a, b));
    }

    /**
     * Sum of bond orders around {@code atom}, aromatic bonds counting 1.5.
     */
    public double bondOrderSum(int atom) {
        double sum = 0;
        for (int neighbor : adjacency[atom]) {
            sum += bondIndex.get(key(atom, neighbor)).order().valence();
        }
        return sum;
    }

    /**
     * Implicit plus explicit hydrogen count.
     */
    public int hydrogenCount(int atom) {
        int count = atoms.get(atom).implicitHydrogens();
        for (int neighbor : adjacency[atom]) {
            if (atoms.get(neighbor).isHydrogen()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of neighbors of {@code atom} that are carbon.
     */
    public int carbonDegree(int atom) {
        int count = 0;
        for (int neighbor : adjacency[atom]) {
            if (atoms.get(neighbor).isCarbon()) {
                count++;
            }
        }
        return count;
    }

    public int carbonCount() {
        int count = 0;
        for (Atom atom : atoms) {
            if (atom.isCarbon()) {
                count++;
            }
        }
        return count;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // DERIVED MOLECULES
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Copies the induced sub-molecule over {@code atomIndices}.
     *
     * <p>Atom {@code k} of the result corresponds to {@code atomIndices[k]} of this
     * molecule. Every bond cut at the boundary is replaced by hydrogens on the
     * retained endpoint (one per unit of bond order), so the fragment keeps its
     * valence. Parser rings fully inside the fragment are carried over.
     */
    public Molecule subMolecule(int[] atomIndices) {
        Objects.requireNonNull(atomIndices, "atomIndices must not be null");
        Map<Integer, Integer> remap = new HashMap<>();
        for (int i = 0; i < atomIndices.length; i++) {
            remap.put(atomIndices[i], i);
        }
        Builder builder = builder();
        for (int original : atomIndices) {
            Atom atom = atoms.get(original);
            int added = 0;
            for (int neighbor : adjacency[original]) {
                if (!remap.containsKey(neighbor)) {
                    BondOrder order = bondIndex.get(key(original, neighbor)).order();
                    added += order == BondOrder.AROMATIC ? 1 : (int) order.valence();
                }
            }
            builder.addAtom(added == 0 ? atom : atom.withImplicitHydrogens(atom.implicitHydrogens() + added));
        }
        for (Bond bond : bonds) {
            Integer a = remap.get(bond.atom1());
            Integer b = remap.get(bond.atom2());
            if (a != null && b != null) {
                builder.addBond(new Bond(a, b, bond.order(), bond.stereo()));
            }
        }
        for (List<Integer> ring : rings) {
            if (ring.stream().allMatch(remap::containsKey)) {
                builder.addRing(ring.stream().mapToInt(remap::get).toArray());
            }
        }
        return builder.build();
    }

    private static long key(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    @Override
    public String toString() {
        return "Molecule{atoms=" + atoms.size() + ", bonds=" + bonds.size() + ", rings=" + rings.size() + "}";
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════════════

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Atom> atoms = new ArrayList<>();
        private final List<Bond> bonds = new ArrayList<>();
        private final List<List<Integer>> rings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        private Builder() {
        }

        public Builder addAtom(Atom atom) {
            atoms.add(Objects.requireNonNull(atom, "atom must not be null"));
            return this;
        }

        public Builder addBond(int a, int b, BondOrder order) {
            return addBond(new Bond(a, b, order));
        }

        public Builder addBond(Bond bond) {
            Objects.requireNonNull(bond, "bond must not be null");
            boolean duplicate = bonds.stream().anyMatch(b -> b.connects(bond.atom1(), bond.atom2()));
            if (!duplicate) {
                bonds.add(bond);
            }
            return this;
        }

        public Builder addRing(int... ringAtoms) {
            List<Integer> ring = new ArrayList<>(ringAtoms.length);
            for (int atom : ringAtoms) {
                ring.add(atom);
            }
            rings.add(ring);
            return this;
        }

        public Builder addError(String error) {
            errors.add(Objects.requireNonNull(error, "error must not be null"));
            return this;
        }

        public int atomCount() {
            return atoms.size();
        }

        public Atom atom(int index) {
            return atoms.get(index);
        }

        public Builder replaceAtom(int index, Atom atom) {
            atoms.set(index, Objects.requireNonNull(atom, "atom must not be null"));
            return this;
        }

        /**
         * Builds the molecule.
         *
         * @throws IllegalArgumentException if a bond references an unknown atom
         */
        public Molecule build() {
            for (Bond bond : bonds) {
                if (bond.atom1() >= atoms.size() || bond.atom2() >= atoms.size()) {
                    throw new IllegalArgumentException(
                            "Bond " + bond + " references an atom outside 0.." + (atoms.size() - 1));
                }
            }
            return new Molecule(atoms, bonds, rings, errors);
        }

        @Override
        public String toString() {
            return "Molecule.Builder{atoms=" + atoms.size() + ", bonds=" + bonds.size() + "}";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Molecule other)) {
            return false;
        }
        return atoms.equals(other.atoms) && bonds.equals(other.bonds)
                && rings.equals(other.rings) && errors.equals(other.errors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(atoms, bonds, rings, errors);
    }
}
