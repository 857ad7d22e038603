/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.ring;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.graph.CycleFinder;
import com.nomen.iupac.graph.Edge;
import com.nomen.iupac.graph.Graph;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Groups the rings of a molecule into ring systems and labels each system.
 *
 * <h2>Ring source</h2>
 * <p>Parser-supplied ring index arrays are used when present and valid (every
 * consecutive pair bonded). Otherwise rings are the minimum cycle basis of the
 * heavy-atom graph.
 *
 * <h2>Classification</h2>
 * <ul>
 *   <li><b>fused</b>: two rings share exactly two atoms, which form a common bond</li>
 *   <li><b>bridged</b>: two rings share three or more atoms, or the system has at
 *       least two bridgeheads (ring membership &ge; 2, degree &ge; 3) without a fusion bond</li>
 *   <li><b>spiro</b>: two rings share exactly one atom and no bond</li>
 * </ul>
 * <p>The type is aromatic if any member atom carries the aromatic flag, else
 * heterocyclic if any member is not carbon, else aliphatic.
 *
 * <p>Stateless; one instance can serve concurrent callers.
 */
public final class RingClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RingClassifier.class);

    private final int maxCycleLength;

    public RingClassifier() {
        this(CycleFinder.DEFAULT_MAX_LENGTH);
    }

    /**
     * @param maxCycleLength upper bound on enumerated cycle length, further
     *                       reduced for dense graphs
     */
    public RingClassifier(int maxCycleLength) {
        if (maxCycleLength < 3) {
            throw new IllegalArgumentException("maxCycleLength must be >= 3, was " + maxCycleLength);
        }
        this.maxCycleLength = maxCycleLength;
    }

    public RingAnalysis analyze(Molecule molecule) {
        List<Ring> rings = findRings(molecule);
        if (rings.isEmpty()) {
            return RingAnalysis.empty();
        }
        List<RingSystem> systems = groupIntoSystems(molecule, rings);
        if (logger.isDebugEnabled()) {
            systems.forEach(system -> logger.debug("Ring {}", system.describe()));
        }
        return new RingAnalysis(rings, systems);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RING DISCOVERY
    // ════════════════════════════════════════════════════════════════════════════════

    List<Ring> findRings(Molecule molecule) {
        Graph graph = Graph.fromMolecule(molecule);
        int expected = CycleFinder.cycleRank(graph);
        if (expected <= 0) {
            return List.of();
        }
        List<Ring> supplied = validParserRings(molecule);
        if (supplied.size() == expected) {
            return supplied;
        }
        if (!supplied.isEmpty()) {
            logger.debug("Parser supplied {} valid rings, cycle rank is {}; recomputing", supplied.size(), expected);
        }
        int bound = CycleFinder.adaptiveMaxLength(graph.nodeCount(), graph.edgeCount(), maxCycleLength);
        List<IntList> basis = CycleFinder.minimumCycleBasis(graph, CycleFinder.allSimpleCycles(graph, bound));
        List<Ring> rings = new ArrayList<>(basis.size());
        for (IntList cycle : basis) {
            rings.add(new Ring(cycle));
        }
        return rings;
    }

    private List<Ring> validParserRings(Molecule molecule) {
        List<Ring> rings = new ArrayList<>();
        for (List<Integer> indices : molecule.rings()) {
            if (indices.size() < 3 || !consecutiveBonded(molecule, indices)) {
                logger.warn("Dropping invalid parser ring {}", indices);
                continue;
            }
            IntArrayList atoms = new IntArrayList();
            indices.forEach(atoms::add);
            rings.add(new Ring(CycleFinder.canonicalize(atoms)));
        }
        return rings;
    }

    private static boolean consecutiveBonded(Molecule molecule, List<Integer> ring) {
        int n = ring.size();
        for (int i = 0; i < n; i++) {
            int a = ring.get(i);
            int b = ring.get((i + 1) % n);
            if (a < 0 || b < 0 || a >= molecule.atomCount() || b >= molecule.atomCount() || !molecule.bonded(a, b)) {
                return false;
            }
        }
        return true;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // GROUPING AND CLASSIFICATION
    // ════════════════════════════════════════════════════════════════════════════════

    private List<RingSystem> groupIntoSystems(Molecule molecule, List<Ring> rings) {
        UnionFind unionFind = new UnionFind(rings.size());
        for (int i = 0; i < rings.size(); i++) {
            for (int j = i + 1; j < rings.size(); j++) {
                if (!rings.get(i).sharedAtoms(rings.get(j)).isEmpty()) {
                    unionFind.union(i, j);
                }
            }
        }
        Map<Integer, List<Ring>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rings.size(); i++) {
            groups.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(rings.get(i));
        }
        List<RingSystem> systems = new ArrayList<>(groups.size());
        for (List<Ring> group : groups.values()) {
            systems.add(classify(molecule, systems.size(), group));
        }
        return systems;
    }

    private RingSystem classify(Molecule molecule, int id, List<Ring> rings) {
        IntSortedSet atoms = new IntRBTreeSet();
        Set<Edge> bonds = new TreeSet<>();
        for (Ring ring : rings) {
            atoms.addAll(ring.atoms());
            bonds.addAll(ring.edges());
        }

        boolean fusedPair = false;
        boolean bridgedPair = false;
        boolean spiroPair = false;
        for (int i = 0; i < rings.size(); i++) {
            for (int j = i + 1; j < rings.size(); j++) {
                Ring a = rings.get(i);
                Ring b = rings.get(j);
                int shared = a.sharedAtoms(b).size();
                int sharedBonds = a.sharedEdges(b).size();
                if (shared == 2 && sharedBonds == 1) {
                    fusedPair = true;
                } else if (shared >= 3) {
                    bridgedPair = true;
                } else if (shared == 1 && sharedBonds == 0) {
                    spiroPair = true;
                }
            }
        }

        IntList heteroatoms = new IntArrayList();
        boolean anyAromatic = false;
        for (int atom : atoms) {
            Atom a = molecule.atom(atom);
            if (a.isHeteroatom()) {
                heteroatoms.add(atom);
            }
            anyAromatic |= a.aromatic();
        }
        RingSystemType type = anyAromatic ? RingSystemType.AROMATIC
                : heteroatoms.isEmpty() ? RingSystemType.ALIPHATIC : RingSystemType.HETEROCYCLIC;

        RingSystem provisional = new RingSystem(id, List.copyOf(rings), atoms, bonds, heteroatoms,
                fusedPair, bridgedPair, spiroPair, type);
        boolean bridged = bridgedPair || (!fusedPair && !spiroPair && provisional.bridgeheads(molecule).size() >= 2);
        if (bridged == bridgedPair) {
            return provisional;
        }
        return new RingSystem(id, List.copyOf(rings), atoms, bonds, heteroatoms, fusedPair, true, spiroPair, type);
    }
}
