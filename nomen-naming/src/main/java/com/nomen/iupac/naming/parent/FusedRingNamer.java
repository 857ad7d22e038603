/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.graph.Edge;
import com.nomen.iupac.ring.FusedSystem;
import com.nomen.iupac.ring.Ring;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingParentNamer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Names ortho-fused ring systems with retained names (P-25.1, P-25.2).
 *
 * <p>The perimeter of the system is aligned against each template in every
 * rotation and reflection; all matching alignments become candidate
 * numberings. Hydro prefixes and indicated hydrogen are derived from the
 * ring atoms that carry no ring double bond ({@code 2,3-dihydro-1H-indene}).
 * Fully saturated systems are left to von Baeyer nomenclature.
 *
 * <p>All-carbon six-membered systems of two or three rings that no template
 * aligns with are named geometrically: naphthalene, or anthracene versus
 * phenanthrene by whether the middle ring is fused at opposite bonds.
 */
public final class FusedRingNamer implements RingParentNamer {

    private static final Logger logger = LoggerFactory.getLogger(FusedRingNamer.class);

    static final List<FusedTemplate> TEMPLATES = List.of(
        FusedTemplate.of("naphthalene", 0, "C1 C2 C3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("azulene", 0, "C1 C2 C3 C3a* C4 C5 C6 C7 C8 C8a*", "3a-8a"),
        FusedTemplate.of("indene", 1, "C1 C2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("anthracene", 0, "C1 C2 C3 C4 C4a* C10 C10a* C5 C6 C7 C8 C8a* C9 C9a*", "4a-9a", "8a-10a"),
        FusedTemplate.of("phenanthrene", 0, "C1 C2 C3 C4 C4a* C4b* C5 C6 C7 C8 C8a* C9 C10 C10a*", "4a-10a", "4b-8a"),
        FusedTemplate.of("fluorene", 1, "C1 C2 C3 C4 C4a* C4b* C5 C6 C7 C8 C8a* C9 C9a*", "4a-9a", "4b-8a"),
        FusedTemplate.of("carbazole", 1, "C1 C2 C3 C4 C4a* C4b* C5 C6 C7 C8 C8a* N9 C9a*", "4a-9a", "4b-8a"),
        FusedTemplate.of("dibenzofuran", 0, "C1 C2 C3 C4 C4a* O5 C5a* C6 C7 C8 C9 C9a* C9b*", "4a-9b", "5a-9a"),
        FusedTemplate.of("dibenzothiophene", 0, "C1 C2 C3 C4 C4a* S5 C5a* C6 C7 C8 C9 C9a* C9b*", "4a-9b", "5a-9a"),
        FusedTemplate.of("acridine", 0, "C1 C2 C3 C4 C4a* N10 C10a* C5 C6 C7 C8 C8a* C9 C9a*", "4a-9a", "8a-10a"),
        FusedTemplate.of("quinoline", 0, "N1 C2 C3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("isoquinoline", 0, "C1 N2 C3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("quinoxaline", 0, "N1 C2 C3 N4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("quinazoline", 0, "N1 C2 N3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("cinnoline", 0, "N1 N2 C3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("phthalazine", 0, "C1 N2 N3 C4 C4a* C5 C6 C7 C8 C8a*", "4a-8a"),
        FusedTemplate.of("indole", 1, "N1 C2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("isoindole", 1, "C1 N2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("1-benzofuran", 0, "O1 C2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("2-benzofuran", 0, "C1 O2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("1-benzothiophene", 0, "S1 C2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("benzimidazole", 1, "N1 C2 N3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("1,3-benzoxazole", 0, "O1 C2 N3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("1,3-benzothiazole", 0, "S1 C2 N3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("indazole", 1, "N1 N2 C3 C3a* C4 C5 C6 C7 C7a*", "3a-7a"),
        FusedTemplate.of("purine", 1, "N1 C2 N3 C4* N9 C8 N7 C5* C6", "4-5"));

    @Override
    public Optional<NamedParent> name(Molecule molecule, RingSystem system) {
        if (!system.fused() || system.bridged()) {
            return Optional.empty();
        }
        IntList atoms = new IntArrayList(system.atoms());
        RingSaturation saturation = RingSaturation.of(molecule, atoms);
        if (!saturation.unsaturated() || saturation.triple()) {
            logger.debug("Fused system {} is not partly mancude", system.describe());
            return Optional.empty();
        }
        Optional<FusedSystem> fused = FusedSystem.of(system);
        if (fused.isPresent()) {
            for (FusedTemplate template : TEMPLATES) {
                List<Numbering> numberings = template.align(molecule, fused.get());
                if (numberings.isEmpty()) {
                    continue;
                }
                int hydro = saturation.saturated().size() - template.indicatedHydrogen();
                if (hydro < 0 || hydro % 2 != 0) {
                    logger.debug("Hydrogenation of {} does not fit {}", system.describe(), template.name());
                    return Optional.empty();
                }
                return Optional.of(new FixedParentName(ParentKind.FUSED, atoms, numberings, template.name(),
                    IntLists.EMPTY_LIST, saturation.saturated(), template.indicatedHydrogen(), false));
            }
        }
        return geometric(molecule, system, atoms, saturation);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // GEOMETRIC FALLBACK
    // ════════════════════════════════════════════════════════════════════════════════

    private static Optional<NamedParent> geometric(Molecule molecule, RingSystem system, IntList atoms,
                                                   RingSaturation saturation) {
        boolean benzenoid = system.rings().stream().allMatch(r -> r.size() == 6)
            && system.heteroatoms().isEmpty()
            && saturation.saturated().isEmpty();
        if (!benzenoid || system.ringCount() < 2 || system.ringCount() > 3) {
            logger.debug("No fused template for {}", system.describe());
            return Optional.empty();
        }
        List<Ring> rings = system.rings();
        int[] degree = new int[rings.size()];
        for (int i = 0; i < rings.size(); i++) {
            for (int j = i + 1; j < rings.size(); j++) {
                if (!rings.get(i).sharedEdges(rings.get(j)).isEmpty()) {
                    degree[i]++;
                    degree[j]++;
                }
            }
        }
        String name;
        List<Ring> walk = new ArrayList<>();
        if (rings.size() == 2) {
            name = "naphthalene";
            walk.addAll(rings);
        } else {
            int middle = -1;
            for (int i = 0; i < degree.length; i++) {
                if (degree[i] == 2) {
                    middle = i;
                }
            }
            if (middle < 0) {
                return Optional.empty();
            }
            List<Ring> outer = new ArrayList<>(rings);
            Ring center = outer.remove(middle);
            name = opposite(center, outer.get(0), outer.get(1)) ? "anthracene" : "phenanthrene";
            walk.add(outer.get(0));
            walk.add(center);
            walk.add(outer.get(1));
        }
        IntArrayList order = new IntArrayList();
        for (Ring ring : walk) {
            for (int atom : ring.atoms()) {
                if (!order.contains(atom)) {
                    order.add(atom);
                }
            }
        }
        logger.debug("Geometric fallback named {} as {}", system.describe(), name);
        return Optional.of(FixedParentName.plain(ParentKind.FUSED, atoms, List.of(Numbering.sequential(order)), name,
            false));
    }

    /**
     * True when the two fusion bonds of {@code center} are on opposite sides of the ring.
     */
    static boolean opposite(Ring center, Ring first, Ring second) {
        Edge a = center.sharedEdges(first).get(0);
        Edge b = center.sharedEdges(second).get(0);
        int minDistance = Integer.MAX_VALUE;
        for (int x : new int[]{a.u(), a.v()}) {
            for (int y : new int[]{b.u(), b.v()}) {
                int d = Math.abs(center.atoms().indexOf(x) - center.atoms().indexOf(y));
                minDistance = Math.min(minDistance, Math.min(d, center.size() - d));
            }
        }
        return minDistance == 2;
    }
}
