/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.stem.HantzschWidman;
import com.nomen.iupac.ring.Ring;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingParentNamer;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Names isolated rings (P-22).
 *
 * <h2>Carbocycles</h2>
 * <p>Aromatic or Kekulé six-membered rings are {@code benzene}; everything else
 * is a cycloalkane with ene/yne endings.
 *
 * <h2>Heterocycles</h2>
 * <p>Saturated rings use the retained names azirane, pyrrolidine,
 * piperidine, piperazine and morpholine, otherwise the saturated
 * Hantzsch-Widman name ({@code oxolane}, {@code 1,3-dioxolane}). Rings with
 * any unsaturation are described relative to the mancude ring: retained
 * names ({@code pyridine}, {@code furan}, {@code imidazole}) or the
 * unsaturated Hantzsch-Widman name, plus indicated hydrogen and hydro
 * prefixes ({@code 1H-pyrrole}, {@code 3,4-dihydro-2H-pyran}).
 */
public final class MonocycleNamer implements RingParentNamer {

    private static final Logger logger = LoggerFactory.getLogger(MonocycleNamer.class);

    /**
     * Retained names of mancude heteromonocycles, keyed by ring size and
     * element locants under the lowest heteroatom numbering.
     */
    private static final Map<String, String> MANCUDE = Map.ofEntries(
        Map.entry("6:N1", "pyridine"),
        Map.entry("6:N1,N2", "pyridazine"),
        Map.entry("6:N1,N3", "pyrimidine"),
        Map.entry("6:N1,N4", "pyrazine"),
        Map.entry("6:N1,N2,N3", "1,2,3-triazine"),
        Map.entry("6:N1,N2,N4", "1,2,4-triazine"),
        Map.entry("6:N1,N3,N5", "1,3,5-triazine"),
        Map.entry("6:N1,N2,N4,N5", "1,2,4,5-tetrazine"),
        Map.entry("6:O1", "pyran"),
        Map.entry("6:S1", "thiopyran"),
        Map.entry("5:O1", "furan"),
        Map.entry("5:S1", "thiophene"),
        Map.entry("5:N1", "pyrrole"),
        Map.entry("5:N1,N3", "imidazole"),
        Map.entry("5:N1,N2", "pyrazole"),
        Map.entry("5:O1,N3", "oxazole"),
        Map.entry("5:O1,N2", "isoxazole"),
        Map.entry("5:S1,N3", "thiazole"),
        Map.entry("5:S1,N2", "isothiazole"),
        Map.entry("5:N1,N2,N3", "1,2,3-triazole"),
        Map.entry("5:N1,N2,N4", "1,2,4-triazole"),
        Map.entry("5:N1,N2,N3,N4", "tetrazole"));

    private static final Map<String, String> SATURATED = Map.of(
        "3:N1", "azirane",
        "5:N1", "pyrrolidine",
        "6:N1", "piperidine",
        "6:N1,N4", "piperazine",
        "6:O1,N4", "morpholine");

    @Override
    public Optional<NamedParent> name(Molecule molecule, RingSystem system) {
        if (!system.isIsolated()) {
            return Optional.empty();
        }
        Ring ring = system.rings().get(0);
        IntList cycle = ring.atoms();
        List<Numbering> numberings = RingNumberings.around(cycle);
        RingSaturation saturation = RingSaturation.of(molecule, cycle);
        if (system.heteroatoms().isEmpty()) {
            return Optional.of(carbocycle(molecule, cycle, numberings, saturation));
        }
        return heterocycle(molecule, cycle, system.heteroatoms(), numberings, saturation);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CARBOCYCLES
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamedParent carbocycle(Molecule molecule, IntList cycle, List<Numbering> numberings,
                                          RingSaturation saturation) {
        boolean mancude = saturation.unsaturated() && saturation.saturated().isEmpty() && !saturation.triple();
        boolean aromatic = cycle.intStream().anyMatch(a -> molecule.atom(a).aromatic());
        if (cycle.size() == 6 && (mancude || aromatic)) {
            return FixedParentName.plain(ParentKind.MONOCYCLE, cycle, numberings, "benzene", true);
        }
        return new AlicyclicParentName(ParentKind.MONOCYCLE, cycle, numberings, "cyclo",
            Unsaturation.find(molecule, cycle), Int2ObjectMaps.emptyMap(), null);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // HETEROCYCLES
    // ════════════════════════════════════════════════════════════════════════════════

    private static Optional<NamedParent> heterocycle(Molecule molecule, IntList cycle, IntList heteroatoms,
                                                     List<Numbering> all, RingSaturation saturation) {
        List<String> symbols = heteroatoms.intStream().mapToObj(a -> molecule.atom(a).symbol()).toList();
        if (!HantzschWidman.supports(cycle.size(), symbols) || saturation.triple()) {
            logger.debug("No monocycle name for ring of {} with heteroatoms {}", cycle.size(), symbols);
            return Optional.empty();
        }
        List<Numbering> numberings = HeteroLocants.lowest(molecule, all, heteroatoms);
        String key = cycle.size() + ":" + HeteroLocants.signature(molecule, numberings.get(0), heteroatoms);
        boolean cite = heteroatoms.size() > 1 && cycle.size() > 3;

        if (!saturation.unsaturated()) {
            String retained = SATURATED.get(key);
            if (retained != null) {
                return Optional.of(FixedParentName.plain(ParentKind.MONOCYCLE, cycle, numberings, retained, false));
            }
            return Optional.of(new FixedParentName(ParentKind.MONOCYCLE, cycle, numberings,
                HantzschWidman.name(cycle.size(), symbols, false), cite ? heteroatoms : IntLists.EMPTY_LIST,
                IntLists.EMPTY_LIST, 0, false));
        }

        int indicated = cycle.size() - 2 * maxDoubleBonds(cycle, saturation.divalent()) - saturation.divalent().size();
        int hydro = saturation.saturated().size() - indicated;
        if (indicated < 0 || hydro < 0 || hydro % 2 != 0) {
            logger.debug("Inconsistent hydrogenation for ring {}: indicated={}, hydro={}", cycle, indicated, hydro);
            return Optional.empty();
        }
        String retained = MANCUDE.get(key);
        String name;
        IntList cited;
        if (retained != null) {
            name = retained;
            cited = IntLists.EMPTY_LIST;
        } else {
            name = HantzschWidman.name(cycle.size(), symbols, true);
            cited = cite ? heteroatoms : IntLists.EMPTY_LIST;
        }
        return Optional.of(new FixedParentName(ParentKind.MONOCYCLE, cycle, numberings, name, cited,
            saturation.saturated(), indicated, false));
    }

    /**
     * Maximum number of non-cumulative ring double bonds when divalent
     * chalcogens cannot take part in one.
     */
    static int maxDoubleBonds(IntList cycle, IntList divalent) {
        int n = cycle.size();
        if (divalent.isEmpty()) {
            return n / 2;
        }
        int start = cycle.indexOf(divalent.getInt(0));
        int total = 0;
        int run = 0;
        for (int i = 1; i <= n; i++) {
            int atom = cycle.getInt((start + i) % n);
            if (divalent.contains(atom)) {
                total += run / 2;
                run = 0;
            } else {
                run++;
            }
        }
        return total;
    }
}
