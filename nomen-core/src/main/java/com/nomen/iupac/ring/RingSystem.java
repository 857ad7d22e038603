package com.nomen.iupac.ring;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.graph.Edge;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.List;
import java.util.Set;

/**
 * Rings connected through shared atoms, with their aggregate atoms and bonds.
 *
 * @param id          position of this system in {@link RingAnalysis#systems()}
 * @param rings       constituent SSSR rings
 * @param atoms       every atom of every ring
 * @param bonds       every ring bond
 * @param heteroatoms ring atoms that are not carbon, ascending
 * @param fused       two rings share exactly one bond
 * @param bridged     two rings share three or more atoms, or bridgeheads exist without a fusion bond
 * @param spiro       two rings share exactly one atom and no bond
 * @param type        aromatic / heterocyclic / aliphatic
 */
public record RingSystem(
    int id,
    List<Ring> rings,
    IntSortedSet atoms,
    Set<Edge> bonds,
    IntList heteroatoms,
    boolean fused,
    boolean bridged,
    boolean spiro,
    RingSystemType type
) {

    public int ringCount() {
        return rings.size();
    }

    /**
     * Number of atoms in the system.
     */
    public int size() {
        return atoms.size();
    }

    public boolean isIsolated() {
        return rings.size() == 1;
    }

    public boolean contains(int atom) {
        return atoms.contains(atom);
    }

    public boolean isAromatic() {
        return type == RingSystemType.AROMATIC;
    }

    /**
     * Number of constituent rings containing {@code atom}.
     */
    public int ringMembership(int atom) {
        int count = 0;
        for (Ring ring : rings) {
            if (ring.contains(atom)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Atoms in two or more rings with graph degree of at least three, ascending.
     */
    public IntList bridgeheads(Molecule molecule) {
        IntList bridgeheads = new IntArrayList();
        for (int atom : atoms) {
            if (ringMembership(atom) >= 2 && molecule.degree(atom) >= 3) {
                bridgeheads.add(atom);
            }
        }
        return bridgeheads;
    }

    /**
     * Smallest ring size in the system.
     */
    public int smallestRingSize() {
        return rings.stream().mapToInt(Ring::size).min().orElse(0);
    }

    public String describe() {
        String kind = isIsolated() ? "isolated" : fused ? "fused" : bridged ? "bridged" : spiro ? "spiro" : "polycyclic";
        return String.format("system %d: %d ring(s), %d atoms, %s %s", id, rings.size(), atoms.size(),
                kind, type.name().toLowerCase());
    }
}
