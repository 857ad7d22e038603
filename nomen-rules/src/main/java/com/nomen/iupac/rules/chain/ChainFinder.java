/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules.chain;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.graph.Graph;
import com.nomen.iupac.graph.Traversal;
import com.nomen.iupac.ring.RingAnalysis;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates candidate parent chains.
 *
 * <p>The acyclic carbon atoms of a molecule form a forest. Every maximal
 * chain runs between two leaves of one tree and is unique for that pair, so
 * the candidates are all leaf-to-leaf paths plus the isolated carbons.
 * Each path is reported once, starting at its smaller end atom.
 */
public final class ChainFinder {

    private static final Logger logger = LoggerFactory.getLogger(ChainFinder.class);

    public List<Chain> find(Molecule molecule, RingAnalysis rings) {
        return find(molecule, rings, IntSets.EMPTY_SET);
    }

    /**
     * Same as {@link #find(Molecule, RingAnalysis)} with {@code excluded} atoms
     * removed from the skeleton, e.g. carboxy carbons of a substituent.
     */
    public List<Chain> find(Molecule molecule, RingAnalysis rings, IntSet excluded) {
        Graph skeleton = new Graph();
        for (int i = 0; i < molecule.atomCount(); i++) {
            if (isChainCarbon(molecule, rings, i) && !excluded.contains(i)) {
                skeleton.addNode(i);
            }
        }
        for (int node : skeleton.nodes()) {
            for (int neighbor : molecule.neighbors(node)) {
                if (skeleton.hasNode(neighbor)) {
                    skeleton.addEdge(node, neighbor);
                }
            }
        }

        List<Chain> chains = new ArrayList<>();
        for (IntList tree : Traversal.connectedComponents(skeleton)) {
            if (tree.size() == 1) {
                chains.add(Chain.of(tree.getInt(0)));
                continue;
            }
            IntList leaves = new IntArrayList();
            for (int node : tree) {
                if (skeleton.degree(node) == 1) {
                    leaves.add(node);
                }
            }
            for (int i = 0; i < leaves.size(); i++) {
                for (int j = i + 1; j < leaves.size(); j++) {
                    chains.add(new Chain(Traversal.shortestPath(skeleton, leaves.getInt(i), leaves.getInt(j))));
                }
            }
        }
        logger.debug("Found {} candidate chains", chains.size());
        return chains;
    }

    private static boolean isChainCarbon(Molecule molecule, RingAnalysis rings, int atom) {
        return molecule.atom(atom).isCarbon() && !rings.inRing(atom);
    }
}
