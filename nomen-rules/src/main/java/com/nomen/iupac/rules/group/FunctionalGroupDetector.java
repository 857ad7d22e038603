/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules.group;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingAnalysis;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the suffix-eligible characteristic groups of a molecule.
 *
 * <h2>Recognized groups</h2>
 * <ul>
 *   <li><b>acid</b>: carbon with =O and -OH and at most one other heavy neighbor</li>
 *   <li><b>ester</b>: acyclic carbon with =O and -O-C, at most one other neighbor, a carbon.
 *       Anhydride oxygens (bonded to a second carbonyl carbon) do not count</li>
 *   <li><b>amide</b>: acyclic carbon with =O and a terminal -NH2, at most one other neighbor, a carbon</li>
 *   <li><b>nitrile</b>: carbon triple-bonded to a terminal nitrogen, at most one other neighbor, a carbon</li>
 *   <li><b>aldehyde</b>: carbon with =O, at least one hydrogen, at most one carbon neighbor</li>
 *   <li><b>ketone</b>: carbon with =O and two other heavy neighbors, both carbon
 *       unless the carbon is a ring atom (lactams and lactones name as ring ketones)</li>
 *   <li><b>alcohol / thiol</b>: terminal O / S with hydrogen on a non-carbonyl carbon</li>
 *   <li><b>amine</b>: terminal NH2 on a non-carbonyl carbon</li>
 * </ul>
 * Ethers, sulfides, nitro groups and N-substituted amides are not
 * suffix-eligible and are left to the substituent classifier.
 *
 * <p>Results are ordered by seniority, then by carbon atom index.
 */
public final class FunctionalGroupDetector {

    private static final Logger logger = LoggerFactory.getLogger(FunctionalGroupDetector.class);

    public List<FunctionalGroup> detect(Molecule molecule, RingAnalysis rings) {
        List<FunctionalGroup> groups = new ArrayList<>();
        for (int i = 0; i < molecule.atomCount(); i++) {
            Atom atom = molecule.atom(i);
            if (atom.isCarbon() && !atom.aromatic()) {
                detectCarbonyl(molecule, rings, i, groups);
                detectNitrile(molecule, i, groups);
            } else if (atom.charge() == 0 && !atom.aromatic()) {
                detectTerminalHeteroatom(molecule, i, groups);
            }
        }
        groups.sort(Comparator.comparing(FunctionalGroup::type).thenComparingInt(FunctionalGroup::carbon));
        if (logger.isDebugEnabled() && !groups.isEmpty()) {
            logger.debug("Detected functional groups: {}", groups.stream().map(g -> g.type() + "@" + g.carbon()).toList());
        }
        return groups;
    }

    private static void detectCarbonyl(Molecule molecule, RingAnalysis rings, int carbon, List<FunctionalGroup> out) {
        boolean acyclic = !rings.inRing(carbon);
        int carbonylOxygen = -1;
        int hydroxylOxygen = -1;
        int esterOxygen = -1;
        int amideNitrogen = -1;
        IntList others = new IntArrayList();
        for (int neighbor : molecule.neighbors(carbon)) {
            Atom n = molecule.atom(neighbor);
            if (n.isHydrogen()) {
                continue;
            }
            BondOrder order = molecule.orderBetween(carbon, neighbor);
            if (carbonylOxygen < 0 && isTerminal(molecule, neighbor, "O") && order == BondOrder.DOUBLE) {
                carbonylOxygen = neighbor;
            } else if (hydroxylOxygen < 0 && isTerminal(molecule, neighbor, "O") && order == BondOrder.SINGLE
                    && molecule.hydrogenCount(neighbor) > 0) {
                hydroxylOxygen = neighbor;
            } else if (acyclic && esterOxygen < 0 && order == BondOrder.SINGLE && isEsterOxygen(molecule, neighbor, carbon)) {
                esterOxygen = neighbor;
            } else if (acyclic && amideNitrogen < 0 && order == BondOrder.SINGLE && isTerminal(molecule, neighbor, "N")
                    && n.charge() == 0 && molecule.hydrogenCount(neighbor) >= 2) {
                amideNitrogen = neighbor;
            } else {
                others.add(neighbor);
            }
        }
        if (carbonylOxygen < 0) {
            return;
        }
        boolean allCarbon = others.intStream().allMatch(n -> molecule.atom(n).isCarbon());
        if (hydroxylOxygen >= 0) {
            if (esterOxygen < 0 && amideNitrogen < 0 && others.size() <= 1) {
                out.add(new FunctionalGroup(FunctionalGroupType.ACID, carbon,
                    IntArrayList.wrap(new int[]{carbonylOxygen, hydroxylOxygen}), false));
            }
            return;
        }
        if (esterOxygen >= 0 || amideNitrogen >= 0) {
            // carbamates and similar carbonic acid derivatives are not named here
            if ((esterOxygen < 0) == (amideNitrogen < 0) || others.size() > 1 || !allCarbon) {
                return;
            }
            if (esterOxygen >= 0) {
                out.add(new FunctionalGroup(FunctionalGroupType.ESTER, carbon,
                    IntArrayList.wrap(new int[]{carbonylOxygen, esterOxygen}), false));
            } else {
                out.add(new FunctionalGroup(FunctionalGroupType.AMIDE, carbon,
                    IntArrayList.wrap(new int[]{carbonylOxygen, amideNitrogen}), false));
            }
            return;
        }
        if (others.size() <= 1 && allCarbon && molecule.hydrogenCount(carbon) > 0) {
            out.add(new FunctionalGroup(FunctionalGroupType.ALDEHYDE, carbon, IntArrayList.wrap(new int[]{carbonylOxygen}), false));
        } else if (others.size() == 2 && (allCarbon || rings.inRing(carbon))) {
            out.add(new FunctionalGroup(FunctionalGroupType.KETONE, carbon, IntArrayList.wrap(new int[]{carbonylOxygen}), false));
        }
    }

    private static void detectNitrile(Molecule molecule, int carbon, List<FunctionalGroup> out) {
        int nitrogen = -1;
        int others = 0;
        for (int neighbor : molecule.neighbors(carbon)) {
            Atom n = molecule.atom(neighbor);
            if (n.isHydrogen()) {
                continue;
            }
            if (nitrogen < 0 && isTerminal(molecule, neighbor, "N") && n.charge() == 0
                    && molecule.orderBetween(carbon, neighbor) == BondOrder.TRIPLE) {
                nitrogen = neighbor;
            } else if (n.isCarbon()) {
                others++;
            } else {
                return;
            }
        }
        if (nitrogen >= 0 && others <= 1) {
            out.add(new FunctionalGroup(FunctionalGroupType.NITRILE, carbon, IntArrayList.wrap(new int[]{nitrogen}), false));
        }
    }

    private static void detectTerminalHeteroatom(Molecule molecule, int atom, List<FunctionalGroup> out) {
        FunctionalGroupType type = switch (molecule.atom(atom).symbol()) {
            case "O" -> FunctionalGroupType.ALCOHOL;
            case "S" -> FunctionalGroupType.THIOL;
            case "N" -> FunctionalGroupType.AMINE;
            default -> null;
        };
        if (type == null || molecule.heavyDegree(atom) != 1) {
            return;
        }
        int minHydrogens = type == FunctionalGroupType.AMINE ? 2 : 1;
        if (molecule.hydrogenCount(atom) < minHydrogens) {
            return;
        }
        for (int neighbor : molecule.neighbors(atom)) {
            if (molecule.atom(neighbor).isCarbon()
                    && molecule.orderBetween(atom, neighbor) == BondOrder.SINGLE
                    && !isCarbonylCarbon(molecule, neighbor)) {
                out.add(new FunctionalGroup(type, neighbor, IntArrayList.wrap(new int[]{atom}), false));
                return;
            }
        }
    }

    private static boolean isTerminal(Molecule molecule, int atom, String symbol) {
        return molecule.atom(atom).symbol().equals(symbol) && molecule.heavyDegree(atom) == 1;
    }

    /**
     * Oxygen linking an acyl carbon to a carbon that is not itself a carbonyl carbon.
     */
    private static boolean isEsterOxygen(Molecule molecule, int oxygen, int acylCarbon) {
        if (!molecule.atom(oxygen).symbol().equals("O") || molecule.atom(oxygen).charge() != 0
                || molecule.heavyDegree(oxygen) != 2) {
            return false;
        }
        for (int neighbor : molecule.neighbors(oxygen)) {
            if (neighbor == acylCarbon || molecule.atom(neighbor).isHydrogen()) {
                continue;
            }
            return molecule.atom(neighbor).isCarbon()
                && molecule.orderBetween(oxygen, neighbor) == BondOrder.SINGLE
                && !isCarbonylCarbon(molecule, neighbor);
        }
        return false;
    }

    private static boolean isCarbonylCarbon(Molecule molecule, int carbon) {
        for (int neighbor : molecule.neighbors(carbon)) {
            if (isTerminal(molecule, neighbor, "O") && molecule.orderBetween(carbon, neighbor) == BondOrder.DOUBLE) {
                return true;
            }
        }
        return false;
    }
}
