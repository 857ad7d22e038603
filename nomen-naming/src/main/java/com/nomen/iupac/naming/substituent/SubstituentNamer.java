/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.substituent;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.rules.parent.HeteroatomHydride;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies the fragment hanging off a parent atom and names it as a prefix.
 *
 * <h2>Recognized directly</h2>
 * <ul>
 *   <li>single atoms: halo, hydroxy, oxo, sulfanyl, amino, imino, methyl,
 *       methylidene, silyl and the other mononuclear hydride prefixes</li>
 *   <li>nitro, cyano, carboxy, carbamoyl, formyl, acetyl and alkoxycarbonyl groups</li>
 *   <li>unbranched saturated alkyl chains of any length, tert-butyl, and the
 *       other retained alkyl names when {@code retainedAlkylNames} is set</li>
 *   <li>ether, sulfide and amine links: {@code methoxy}, {@code (phenylsulfanyl)},
 *       {@code (dimethylamino)}, with the group beyond the link named recursively</li>
 * </ul>
 * Everything else is copied into an independent sub-molecule and named by the
 * {@link FragmentNamer} with the free valence on the attachment atom.
 *
 * <p>Stateless apart from configuration; safe for concurrent use.
 */
public final class SubstituentNamer {

    private static final Logger logger = LoggerFactory.getLogger(SubstituentNamer.class);

    /**
     * Nesting limit for recursive naming. Each level names a strictly smaller
     * fragment, so the limit is only reached by pathological inputs.
     */
    static final int MAX_DEPTH = 24;

    private static final Map<String, String> HALO = Map.of(
        "F", "fluoro", "Cl", "chloro", "Br", "bromo", "I", "iodo");

    private static final String TERT_BUTYL = "C(C,C,C)";

    // Skeleton signatures rooted at the attachment atom
    private static final Map<String, String> RETAINED_ALKYL = Map.of(
        "C(C,C)", "isopropyl",
        "C(C(C,C))", "isobutyl",
        "C(C,C(C))", "sec-butyl",
        "C(C(C(C,C)))", "isopentyl",
        "C(C(C,C,C))", "neopentyl",
        "C(C,C,C(C))", "tert-pentyl");

    // Alkyl and aryl names whose "yl" contracts to "oxy" (P-63.2.2.2)
    private static final List<String> CONTRACTED_OXY = List.of("methyl", "ethyl", "propyl", "butyl", "phenyl");

    private final boolean retainedAlkylNames;
    private final FragmentNamer fragmentNamer;

    public SubstituentNamer(boolean retainedAlkylNames, FragmentNamer fragmentNamer) {
        this.retainedAlkylNames = retainedAlkylNames;
        this.fragmentNamer = Objects.requireNonNull(fragmentNamer, "fragmentNamer must not be null");
    }

    /**
     * Names {@code fragment} of {@code molecule} as a prefix.
     *
     * @param fragment   heavy atoms of the substituent
     * @param attachment fragment atom bonded to the parent
     * @param order      order of the bond to the parent
     * @param depth      nesting level, 1 for prefixes on the parent itself
     * @throws IllegalStateException when nesting exceeds {@link #MAX_DEPTH}
     */
    public SubstituentName name(Molecule molecule, IntList fragment, int attachment, BondOrder order, int depth) {
        Objects.requireNonNull(molecule, "molecule must not be null");
        Objects.requireNonNull(fragment, "fragment must not be null");
        Objects.requireNonNull(order, "order must not be null");
        if (depth > MAX_DEPTH) {
            throw new IllegalStateException("Substituent nesting deeper than " + MAX_DEPTH);
        }
        IntSet members = new IntOpenHashSet(fragment);
        if (!members.contains(attachment)) {
            throw new IllegalArgumentException("Attachment atom " + attachment + " is not part of the fragment");
        }
        SubstituentName name = classify(molecule, members, attachment, order, depth);
        if (name == null) {
            name = recurse(molecule, members, attachment, order, depth);
        }
        logger.debug("Fragment of {} atom(s) at atom {} named {}", members.size(), attachment, name.text());
        return name;
    }

    private SubstituentName classify(Molecule molecule, IntSet members, int attachment, BondOrder order, int depth) {
        Atom atom = molecule.atom(attachment);
        if (members.size() == 1) {
            return singleAtom(atom, order);
        }
        if (order != BondOrder.SINGLE || atom.aromatic()) {
            return null;
        }
        switch (atom.symbol()) {
            case "C": {
                if (isCyano(molecule, members, attachment)) {
                    return SubstituentName.simple("cyano");
                }
                SubstituentName acyl = acyl(molecule, members, attachment, depth);
                return acyl != null ? acyl : alkyl(molecule, members, attachment);
            }
            case "N":
                return isNitro(molecule, members, attachment) ? SubstituentName.simple("nitro")
                    : amino(molecule, members, attachment, depth);
            case "O":
                return ether(molecule, members, attachment, depth);
            case "S":
                return sulfide(molecule, members, attachment, depth);
            default:
                return null;
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SIMPLE PREFIXES
    // ════════════════════════════════════════════════════════════════════════════════

    private static SubstituentName singleAtom(Atom atom, BondOrder order) {
        String symbol = atom.symbol();
        if (atom.charge() == -1 && symbol.equals("O") && order == BondOrder.SINGLE) {
            return SubstituentName.simple("oxido");
        }
        if (atom.charge() != 0) {
            return null;
        }
        if (order == BondOrder.SINGLE && HALO.containsKey(symbol)) {
            return SubstituentName.simple(HALO.get(symbol));
        }
        String text = switch (symbol) {
            case "C" -> byOrder(order, "methyl", "methylidene", "methylidyne");
            case "O" -> byOrder(order, "hydroxy", "oxo", null);
            case "S" -> byOrder(order, "sulfanyl", "sulfanylidene", null);
            case "N" -> byOrder(order, "amino", "imino", "nitrilo");
            default -> order == BondOrder.SINGLE
                ? HeteroatomHydride.forSymbol(symbol).map(HeteroatomHydride::prefixName).orElse(null)
                : null;
        };
        return text == null ? null : SubstituentName.simple(text);
    }

    private static String byOrder(BondOrder order, String single, String doubled, String triple) {
        return switch (order) {
            case SINGLE -> single;
            case DOUBLE -> doubled;
            case TRIPLE -> triple;
            case AROMATIC -> null;
        };
    }

    private static boolean isNitro(Molecule molecule, IntSet members, int nitrogen) {
        if (members.size() != 3) {
            return false;
        }
        for (int neighbor : inside(molecule, members, nitrogen)) {
            if (!isTerminal(molecule, neighbor, "O")) {
                return false;
            }
        }
        return inside(molecule, members, nitrogen).size() == 2;
    }

    private static boolean isCyano(Molecule molecule, IntSet members, int carbon) {
        if (members.size() != 2) {
            return false;
        }
        IntList neighbors = inside(molecule, members, carbon);
        return neighbors.size() == 1
            && isTerminal(molecule, neighbors.getInt(0), "N")
            && molecule.orderBetween(carbon, neighbors.getInt(0)) == BondOrder.TRIPLE;
    }

    /**
     * Carbonyl-bearing attachment: carboxy, carbamoyl, formyl, acetyl, alkoxycarbonyl.
     */
    private SubstituentName acyl(Molecule molecule, IntSet members, int carbon, int depth) {
        int oxo = -1;
        int hydroxyl = -1;
        int ether = -1;
        int amide = -1;
        IntList others = new IntArrayList();
        for (int neighbor : inside(molecule, members, carbon)) {
            BondOrder order = molecule.orderBetween(carbon, neighbor);
            if (oxo < 0 && order == BondOrder.DOUBLE && isTerminal(molecule, neighbor, "O")) {
                oxo = neighbor;
            } else if (hydroxyl < 0 && order == BondOrder.SINGLE && isTerminal(molecule, neighbor, "O")
                    && molecule.hydrogenCount(neighbor) > 0) {
                hydroxyl = neighbor;
            } else if (ether < 0 && order == BondOrder.SINGLE && molecule.atom(neighbor).symbol().equals("O")
                    && molecule.heavyDegree(neighbor) == 2) {
                ether = neighbor;
            } else if (amide < 0 && order == BondOrder.SINGLE && isTerminal(molecule, neighbor, "N")
                    && molecule.hydrogenCount(neighbor) >= 2) {
                amide = neighbor;
            } else {
                others.add(neighbor);
            }
        }
        if (oxo < 0) {
            return null;
        }
        if (hydroxyl >= 0) {
            return members.size() == 3 && ether < 0 && amide < 0 && others.isEmpty() ? SubstituentName.simple("carboxy") : null;
        }
        if (amide >= 0) {
            return members.size() == 3 && ether < 0 ? SubstituentName.simple("carbamoyl") : null;
        }
        if (ether < 0) {
            if (members.size() == 2 && others.isEmpty()) {
                return SubstituentName.simple("formyl");
            }
            if (members.size() == 3 && others.size() == 1 && isTerminal(molecule, others.getInt(0), "C")) {
                return SubstituentName.simple("acetyl");
            }
            return null;
        }
        if (!others.isEmpty()) {
            return null;
        }
        int alkylAtom = otherNeighbor(molecule, members, ether, carbon);
        IntSet rest = new IntOpenHashSet(members);
        rest.remove(carbon);
        rest.remove(oxo);
        rest.remove(ether);
        SubstituentName alkyl = name(molecule, sorted(rest), alkylAtom, BondOrder.SINGLE, depth);
        return SubstituentName.compound(oxyForm(alkyl) + "carbonyl");
    }

    /**
     * Saturated acyclic carbon skeletons: unbranched alkyl, tert-butyl and,
     * when enabled, the other retained names.
     */
    private SubstituentName alkyl(Molecule molecule, IntSet members, int attachment) {
        int bonds = 0;
        boolean unbranched = inside(molecule, members, attachment).size() <= 1;
        for (int atom : members) {
            Atom a = molecule.atom(atom);
            if (!a.isCarbon() || a.aromatic()) {
                return null;
            }
            IntList neighbors = inside(molecule, members, atom);
            for (int neighbor : neighbors) {
                if (molecule.orderBetween(atom, neighbor) != BondOrder.SINGLE) {
                    return null;
                }
            }
            bonds += neighbors.size();
            unbranched &= neighbors.size() <= 2;
        }
        if (bonds / 2 != members.size() - 1) {
            return null;
        }
        if (unbranched) {
            return SubstituentName.simple(AlkaneStems.alkyl(members.size()));
        }
        String signature = signature(molecule, members, attachment, -1);
        if (signature.equals(TERT_BUTYL)) {
            return SubstituentName.simple("tert-butyl");
        }
        if (retainedAlkylNames && RETAINED_ALKYL.containsKey(signature)) {
            return SubstituentName.simple(RETAINED_ALKYL.get(signature));
        }
        return null;
    }

    private static String signature(Molecule molecule, IntSet members, int atom, int from) {
        List<String> children = new ArrayList<>();
        for (int neighbor : inside(molecule, members, atom)) {
            if (neighbor != from) {
                children.add(signature(molecule, members, neighbor, atom));
            }
        }
        if (children.isEmpty()) {
            return "C";
        }
        children.sort(Comparator.naturalOrder());
        return "C(" + String.join(",", children) + ")";
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // HETEROATOM LINKS
    // ════════════════════════════════════════════════════════════════════════════════

    private SubstituentName ether(Molecule molecule, IntSet members, int oxygen, int depth) {
        SubstituentName beyond = beyondLink(molecule, members, oxygen, depth);
        if (beyond == null) {
            return null;
        }
        String text = oxyForm(beyond);
        boolean compound = beyond.compound() || (!contractsToOxy(beyond) && beyond.needsEnclosure());
        return new SubstituentName(text, compound);
    }

    private SubstituentName sulfide(Molecule molecule, IntSet members, int sulfur, int depth) {
        SubstituentName beyond = beyondLink(molecule, members, sulfur, depth);
        if (beyond == null) {
            return null;
        }
        return SubstituentName.compound(cited(beyond) + "sulfanyl");
    }

    /**
     * Secondary and tertiary amino groups: {@code methylamino},
     * {@code dimethylamino}, {@code ethyl(methyl)amino}.
     */
    private SubstituentName amino(Molecule molecule, IntSet members, int nitrogen, int depth) {
        if (molecule.atom(nitrogen).charge() != 0) {
            return null;
        }
        IntList neighbors = inside(molecule, members, nitrogen);
        if (neighbors.isEmpty() || neighbors.size() > 2) {
            return null;
        }
        List<SubstituentName> groups = new ArrayList<>();
        IntSet covered = new IntOpenHashSet();
        for (int neighbor : neighbors) {
            if (molecule.orderBetween(nitrogen, neighbor) != BondOrder.SINGLE || covered.contains(neighbor)) {
                return null;
            }
            IntList branch = Fragments.collect(molecule, neighbor, atom -> atom == nitrogen || !members.contains(atom));
            covered.addAll(branch);
            groups.add(name(molecule, branch, neighbor, BondOrder.SINGLE, depth));
        }
        groups.sort(Comparator.comparing(SubstituentName::alphaKey).thenComparing(SubstituentName::text));
        String text;
        if (groups.size() == 1) {
            text = cited(groups.get(0)) + "amino";
        } else if (groups.get(0).text().equals(groups.get(1).text())) {
            SubstituentName group = groups.get(0);
            text = group.needsEnclosure()
                ? AlkaneStems.compoundMultiplier(2) + group.enclosed() + "amino"
                : AlkaneStems.multiplier(2) + group.text() + "amino";
        } else {
            text = cited(groups.get(0)) + groups.get(1).enclosed() + "amino";
        }
        return SubstituentName.compound(text);
    }

    /**
     * Name of the group on the far side of a divalent link atom, or null when
     * the link atom is not a simple two-connected bridge.
     */
    private SubstituentName beyondLink(Molecule molecule, IntSet members, int link, int depth) {
        if (molecule.atom(link).charge() != 0) {
            return null;
        }
        IntList neighbors = inside(molecule, members, link);
        if (neighbors.size() != 1 || molecule.orderBetween(link, neighbors.getInt(0)) != BondOrder.SINGLE) {
            return null;
        }
        IntSet rest = new IntOpenHashSet(members);
        rest.remove(link);
        return name(molecule, sorted(rest), neighbors.getInt(0), BondOrder.SINGLE, depth);
    }

    private static boolean contractsToOxy(SubstituentName group) {
        return CONTRACTED_OXY.stream().anyMatch(group.text()::endsWith);
    }

    private static String oxyForm(SubstituentName group) {
        if (contractsToOxy(group)) {
            return group.text().substring(0, group.text().length() - 2) + "oxy";
        }
        return cited(group) + "oxy";
    }

    private static String cited(SubstituentName group) {
        return group.needsEnclosure() ? group.enclosed() : group.text();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RECURSION
    // ════════════════════════════════════════════════════════════════════════════════

    private SubstituentName recurse(Molecule molecule, IntSet members, int attachment, BondOrder order, int depth) {
        int[] atoms = new int[members.size()];
        atoms[0] = attachment;
        int next = 1;
        for (int atom : sorted(members)) {
            if (atom != attachment) {
                atoms[next++] = atom;
            }
        }
        Molecule fragment = molecule.subMolecule(atoms);
        return fragmentNamer.name(fragment, 0, order, depth + 1);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // HELPERS
    // ════════════════════════════════════════════════════════════════════════════════

    private static IntList inside(Molecule molecule, IntSet members, int atom) {
        IntList result = new IntArrayList();
        for (int neighbor : molecule.neighbors(atom)) {
            if (members.contains(neighbor) && !molecule.atom(neighbor).isHydrogen()) {
                result.add(neighbor);
            }
        }
        return result;
    }

    private static int otherNeighbor(Molecule molecule, IntSet members, int link, int exclude) {
        for (int neighbor : inside(molecule, members, link)) {
            if (neighbor != exclude) {
                return neighbor;
            }
        }
        throw new IllegalStateException("Atom " + link + " has no neighbor besides " + exclude);
    }

    private static boolean isTerminal(Molecule molecule, int atom, String symbol) {
        return molecule.atom(atom).symbol().equals(symbol) && molecule.heavyDegree(atom) == 1;
    }

    private static IntList sorted(IntSet atoms) {
        IntArrayList list = new IntArrayList(atoms);
        list.sort(null);
        return list;
    }
}
