/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.numbering;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.parent.HeteroLocants;
import com.nomen.iupac.naming.parent.Locants;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Chooses among the numberings a parent allows by the rule of lowest locants (P-31.1.4).
 *
 * <p>Criteria, each applied only to the numberings that tie on all earlier ones:
 * <ol>
 *   <li>skeletal heteroatoms, together and then by element seniority</li>
 *   <li>indicated hydrogen</li>
 *   <li>free valence</li>
 *   <li>principal characteristic groups</li>
 *   <li>hydro prefixes and ene/yne endings together</li>
 *   <li>all detachable prefixes together</li>
 *   <li>the prefix cited first in alphanumerical order</li>
 * </ol>
 * The first numbering still tied after the last criterion wins.
 */
public final class LocantOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(LocantOptimizer.class);

    private record Criterion(String name, Comparator<Numbering> order) {
    }

    /**
     * @param suffixAtoms  parent atoms expressing the principal group, one entry per group
     * @param freeValence  attachment atom when naming a substituent, or -1
     * @param prefixes     detachable prefixes on parent atoms
     */
    public Numbering choose(Molecule molecule, NamedParent parent, IntList suffixAtoms, int freeValence,
                            List<PrefixSite> prefixes) {
        List<Numbering> candidates = parent.numberings();
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        for (Criterion criterion : criteria(molecule, parent, suffixAtoms, freeValence, prefixes)) {
            Numbering best = candidates.stream().min(criterion.order()).orElseThrow();
            List<Numbering> kept = candidates.stream().filter(n -> criterion.order().compare(n, best) == 0).toList();
            if (kept.size() < candidates.size() && logger.isTraceEnabled()) {
                logger.trace("Locant criterion '{}' kept {} of {} numberings", criterion.name(), kept.size(), candidates.size());
            }
            candidates = kept;
            if (candidates.size() == 1) {
                break;
            }
        }
        return candidates.get(0);
    }

    private static List<Criterion> criteria(Molecule molecule, NamedParent parent, IntList suffixAtoms,
                                            int freeValence, List<PrefixSite> prefixes) {
        IntList heteroatoms = new IntArrayList();
        for (int atom : parent.atoms()) {
            if (!molecule.atom(atom).isCarbon()) {
                heteroatoms.add(atom);
            }
        }
        IntList prefixAtoms = new IntArrayList();
        Map<String, IntList> byName = new TreeMap<>();
        for (PrefixSite site : prefixes) {
            prefixAtoms.add(site.atom());
            byName.computeIfAbsent(site.alphaName(), k -> new IntArrayList()).add(site.atom());
        }
        List<Criterion> criteria = new ArrayList<>();
        criteria.add(new Criterion("heteroatoms", HeteroLocants.comparator(molecule, heteroatoms)));
        criteria.add(locants("indicated hydrogen", parent::indicatedHydrogen));
        if (freeValence >= 0) {
            criteria.add(locants("free valence", n -> List.of(locantOf(n, freeValence))));
        }
        criteria.add(locants("principal groups", n -> n.locantsOf(suffixAtoms)));
        criteria.add(locants("hydro/ene/yne", parent::unsaturation));
        criteria.add(locants("prefixes", n -> n.locantsOf(prefixAtoms)));
        for (Map.Entry<String, IntList> entry : byName.entrySet()) {
            IntList atoms = entry.getValue();
            criteria.add(locants("prefix " + entry.getKey(), n -> n.locantsOf(atoms)));
        }
        return criteria;
    }

    private static Locant locantOf(Numbering numbering, int atom) {
        Locant locant = numbering.locantOf(atom);
        if (locant == null) {
            throw new IllegalStateException("Atom " + atom + " is not part of the parent numbering " + numbering);
        }
        return locant;
    }

    private static Criterion locants(String name, Function<Numbering, List<Locant>> extractor) {
        return new Criterion(name, (a, b) -> Locants.compare(extractor.apply(a), extractor.apply(b)));
    }
}
