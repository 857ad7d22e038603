/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules.standard;

import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.rules.NamingState;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.group.FunctionalGroup;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Principal chain criteria, in order:
 * <ol>
 *   <li>more principal characteristic groups</li>
 *   <li>more skeletal atoms</li>
 *   <li>more multiple bonds</li>
 *   <li>more double bonds</li>
 *   <li>more substituents</li>
 *   <li>lower locants for principal groups, then multiple bonds, then substituents,
 *       taking the better direction of each chain</li>
 *   <li>lower atom indices, so the choice is deterministic</li>
 * </ol>
 */
final class ChainSeniority implements Comparator<Chain> {

    private final NamingState state;
    private final Molecule molecule;
    private final IntSet principalAtoms;

    ChainSeniority(NamingState state) {
        this.state = state;
        this.molecule = state.molecule();
        this.principalAtoms = new IntOpenHashSet();
        for (FunctionalGroup group : state.principalGroups()) {
            principalAtoms.addAll(group.atoms());
        }
    }

    /**
     * Negative when {@code a} is the more senior chain.
     */
    @Override
    public int compare(Chain a, Chain b) {
        int result = Integer.compare(CandidateGroups.count(state, b), CandidateGroups.count(state, a));
        if (result == 0) {
            result = Integer.compare(b.length(), a.length());
        }
        if (result == 0) {
            result = Integer.compare(multipleBonds(b, false), multipleBonds(a, false));
        }
        if (result == 0) {
            result = Integer.compare(multipleBonds(b, true), multipleBonds(a, true));
        }
        if (result == 0) {
            result = Integer.compare(substituentAtoms(b).size(), substituentAtoms(a).size());
        }
        if (result == 0) {
            result = compareLocants(bestLocants(a), bestLocants(b));
        }
        if (result == 0) {
            result = compareLocants(a.atoms().toIntArray(), b.atoms().toIntArray());
        }
        return result;
    }

    private int multipleBonds(Chain chain, boolean doubleOnly) {
        int count = 0;
        IntList atoms = chain.atoms();
        for (int i = 0; i + 1 < atoms.size(); i++) {
            BondOrder order = molecule.orderBetween(atoms.getInt(i), atoms.getInt(i + 1));
            if (order == BondOrder.DOUBLE || (!doubleOnly && order == BondOrder.TRIPLE)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Chain atom of each non-chain heavy neighbor that is not part of a principal group,
     * one entry per neighbor.
     */
    private IntList substituentAtoms(Chain chain) {
        IntList attached = new IntArrayList();
        for (int atom : chain.atoms()) {
            for (int neighbor : molecule.neighbors(atom)) {
                if (!chain.contains(neighbor) && !molecule.atom(neighbor).isHydrogen()
                        && !principalAtoms.contains(neighbor)) {
                    attached.add(atom);
                }
            }
        }
        return attached;
    }

    /**
     * Concatenated principal-group, multiple-bond and substituent locants for the
     * better of the two directions.
     */
    private int[] bestLocants(Chain chain) {
        int[] forward = locants(chain);
        int[] backward = locants(chain.reversed());
        return compareLocants(forward, backward) <= 0 ? forward : backward;
    }

    private int[] locants(Chain chain) {
        IntList atoms = chain.atoms();
        IntArrayList principal = new IntArrayList();
        for (FunctionalGroup group : state.principalGroups()) {
            int at = group.expressedAt(molecule, chain::contains, false);
            if (at >= 0) {
                principal.add(atoms.indexOf(at) + 1);
            }
        }
        IntArrayList multiple = new IntArrayList();
        for (int i = 0; i + 1 < atoms.size(); i++) {
            BondOrder order = molecule.orderBetween(atoms.getInt(i), atoms.getInt(i + 1));
            if (order == BondOrder.DOUBLE || order == BondOrder.TRIPLE) {
                multiple.add(i + 1);
            }
        }
        IntArrayList substituents = new IntArrayList();
        for (int atom : substituentAtoms(chain)) {
            substituents.add(atoms.indexOf(atom) + 1);
        }
        int[] p = principal.toIntArray();
        int[] m = multiple.toIntArray();
        int[] s = substituents.toIntArray();
        Arrays.sort(p);
        Arrays.sort(m);
        Arrays.sort(s);
        int[] all = new int[p.length + m.length + s.length];
        System.arraycopy(p, 0, all, 0, p.length);
        System.arraycopy(m, 0, all, p.length, m.length);
        System.arraycopy(s, 0, all, p.length + m.length, s.length);
        return all;
    }

    private static int compareLocants(int[] a, int[] b) {
        return Arrays.compare(a, b);
    }
}
