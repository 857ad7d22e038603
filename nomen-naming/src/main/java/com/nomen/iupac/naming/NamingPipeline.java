/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming;

import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.infra.config.NamingConfig;
import com.nomen.iupac.naming.assembly.NameAssembler;
import com.nomen.iupac.naming.assembly.Prefix;
import com.nomen.iupac.naming.assembly.Suffix;
import com.nomen.iupac.naming.numbering.LocantOptimizer;
import com.nomen.iupac.naming.numbering.PrefixSite;
import com.nomen.iupac.naming.substituent.FragmentNamer;
import com.nomen.iupac.naming.substituent.Fragments;
import com.nomen.iupac.naming.substituent.SubstituentName;
import com.nomen.iupac.naming.substituent.SubstituentNamer;
import com.nomen.iupac.ring.RingAnalysis;
import com.nomen.iupac.ring.RingClassifier;
import com.nomen.iupac.rules.NamingState;
import com.nomen.iupac.rules.RuleScheduler;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.chain.ChainFinder;
import com.nomen.iupac.rules.group.FunctionalGroup;
import com.nomen.iupac.rules.group.FunctionalGroupDetector;
import com.nomen.iupac.rules.group.FunctionalGroupType;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentStructure;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One pass from molecule to name.
 *
 * <ol>
 *   <li>ring perception, functional-group detection, chain candidates</li>
 *   <li>parent selection by the rule scheduler</li>
 *   <li>substituent fragments collected by flood fill from the parent and named</li>
 *   <li>lowest-locant numbering</li>
 *   <li>name assembly</li>
 * </ol>
 * Substituent fragments that need a parent of their own come back through
 * {@link #name(Molecule, int, BondOrder, int)} with the attachment atom as
 * free valence.
 */
final class NamingPipeline implements FragmentNamer {

    private static final Logger logger = LoggerFactory.getLogger(NamingPipeline.class);

    /**
     * Result of naming a whole molecule.
     *
     * @param parentName parent hydride as rendered with nothing attached, or null
     * @param numbering  chosen numbering, or null for a fallback name
     */
    record Outcome(String name, NamingState state, String parentName, Numbering numbering, boolean fallback) {
    }

    /**
     * @param esterAlkyls groups on the ester oxygens when the suffix is an ester, else empty
     */
    private record Layout(Numbering numbering, List<Prefix> prefixes, Optional<Suffix> suffix,
                          List<SubstituentName> esterAlkyls) {
    }

    private record Attached(int parentAtom, SubstituentName name) {
    }

    private final RingClassifier ringClassifier;
    private final FunctionalGroupDetector groupDetector = new FunctionalGroupDetector();
    private final ChainFinder chainFinder = new ChainFinder();
    private final RuleScheduler scheduler;
    private final SubstituentNamer substituentNamer;
    private final LocantOptimizer optimizer = new LocantOptimizer();
    private final NameAssembler assembler = new NameAssembler();

    NamingPipeline(NamingConfig config, RuleScheduler scheduler) {
        Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.ringClassifier = new RingClassifier(config.maxCycleLength());
        this.substituentNamer = new SubstituentNamer(config.retainedAlkylNames(), this);
    }

    Outcome name(Molecule molecule) {
        RingAnalysis rings = ringClassifier.analyze(molecule);
        List<FunctionalGroup> groups = groupDetector.detect(molecule, rings);
        List<Chain> chains = chainFinder.find(molecule, rings, cyanoCarbons(groups));
        NamingState state = scheduler.run(NamingState.initial(molecule, rings, chains, groups));
        if (state.parentStructure().isEmpty()) {
            String fallback = fallbackName(state);
            logger.debug("No parent structure, using {}", fallback);
            return new Outcome(fallback, state, null, null, true);
        }
        NamedParent parent = state.parentStructure().get().parentName();
        Layout layout = layout(state, 1);
        String name = layout.esterAlkyls().isEmpty()
            ? assembler.assemble(parent, layout.numbering(), layout.prefixes(), layout.suffix())
            : assembler.assembleEster(parent, layout.numbering(), layout.prefixes(), layout.suffix().orElseThrow(),
                layout.esterAlkyls());
        logger.debug("Named {} as {}", molecule, name);
        return new Outcome(name, state, parent.render(layout.numbering(), 0), layout.numbering(), false);
    }

    /**
     * Names an isolated fragment as a substituent. Carboxy and nitrile carbons
     * stay out of the chain skeleton so they are cited as {@code carboxy} and
     * {@code cyano} prefixes.
     *
     * @throws NamingException when no parent structure contains the attachment atom
     */
    @Override
    public SubstituentName name(Molecule fragment, int attachment, BondOrder order, int depth) {
        RingAnalysis rings = ringClassifier.analyze(fragment);
        List<FunctionalGroup> groups = groupDetector.detect(fragment, rings);
        IntSet acidCarbons = new IntOpenHashSet();
        for (FunctionalGroup group : groups) {
            boolean prefixOnly = group.type() == FunctionalGroupType.ACID || group.type() == FunctionalGroupType.NITRILE;
            if (prefixOnly && group.carbon() != attachment) {
                acidCarbons.add(group.carbon());
            }
        }
        List<Chain> chains = chainFinder.find(fragment, rings, acidCarbons);
        NamingState state = scheduler.run(NamingState.initial(fragment, rings, chains, groups).forSubstituent(attachment));
        if (state.parentStructure().isEmpty()) {
            throw new NamingException("No parent structure for a substituent fragment of "
                + fragment.atomCount() + " atoms: " + state.conflicts());
        }
        NamedParent parent = state.parentStructure().get().parentName();
        Layout layout = layout(state, depth);
        return assembler.assembleSubstituent(parent, layout.numbering(), layout.prefixes(), attachment, order);
    }

    private Layout layout(NamingState state, int depth) {
        Molecule molecule = state.molecule();
        ParentStructure parent = state.parentStructure().orElseThrow();
        NamedParent named = parent.parentName();
        IntSet inParent = new IntOpenHashSet(named.atoms());
        boolean cyclic = !(parent instanceof ParentStructure.ChainParent)
            && !(parent instanceof ParentStructure.HeteroatomParent);

        IntList suffixAtoms = new IntArrayList();
        IntSet consumed = new IntOpenHashSet();
        IntList esterOxygens = new IntArrayList();
        FunctionalGroupType suffixType = null;
        boolean attachedForm = false;
        for (FunctionalGroup group : state.principalGroups()) {
            int at = group.expressedAt(molecule, inParent::contains, cyclic);
            if (at < 0) {
                continue;
            }
            suffixAtoms.add(at);
            suffixType = group.type();
            consumed.addAll(group.atoms());
            if (group.attachedForm(inParent::contains)) {
                consumed.add(group.carbon());
                attachedForm = true;
            }
            if (group.type() == FunctionalGroupType.ESTER) {
                esterOxygens.add(group.esterOxygen());
            }
        }

        List<SubstituentName> esterAlkyls = new ArrayList<>();
        for (int oxygen : esterOxygens) {
            for (int neighbor : molecule.neighbors(oxygen)) {
                if (consumed.contains(neighbor) || inParent.contains(neighbor) || molecule.atom(neighbor).isHydrogen()) {
                    continue;
                }
                IntList fragment = Fragments.collect(molecule, neighbor,
                    other -> inParent.contains(other) || consumed.contains(other));
                esterAlkyls.add(substituentNamer.name(molecule, fragment, neighbor, BondOrder.SINGLE, depth));
                consumed.addAll(fragment);
            }
        }

        List<Attached> attached = new ArrayList<>();
        for (int atom : named.atoms()) {
            for (int neighbor : molecule.neighbors(atom)) {
                if (inParent.contains(neighbor) || consumed.contains(neighbor) || molecule.atom(neighbor).isHydrogen()) {
                    continue;
                }
                IntList fragment = Fragments.collect(molecule, neighbor,
                    other -> inParent.contains(other) || consumed.contains(other));
                BondOrder order = molecule.orderBetween(atom, neighbor);
                SubstituentName name = substituentNamer.name(molecule, fragment, neighbor,
                    order == BondOrder.AROMATIC ? BondOrder.SINGLE : order, depth);
                attached.add(new Attached(atom, name));
            }
        }

        List<PrefixSite> sites = attached.stream().map(a -> new PrefixSite(a.parentAtom(), a.name().alphaKey())).toList();
        int freeValence = state.attachment().orElse(-1);
        Numbering numbering = optimizer.choose(molecule, named, suffixAtoms, freeValence, sites);

        List<Prefix> prefixes = attached.stream()
            .map(a -> new Prefix(numbering.locantOf(a.parentAtom()), a.name()))
            .toList();
        Optional<Suffix> suffix = suffixType == null
            ? Optional.empty()
            : Optional.of(new Suffix(suffixType, numbering.locantsOf(suffixAtoms), attachedForm));
        return new Layout(numbering, prefixes, suffix, esterAlkyls);
    }

    /**
     * Nitrile carbons to keep out of chains when a senior group takes the
     * suffix, so the nitrile is cited as {@code cyano}.
     */
    private static IntSet cyanoCarbons(List<FunctionalGroup> groups) {
        IntSet carbons = new IntOpenHashSet();
        boolean seniorPresent = groups.stream().anyMatch(g -> g.type().isSeniorTo(FunctionalGroupType.NITRILE));
        if (seniorPresent) {
            for (FunctionalGroup group : groups) {
                if (group.type() == FunctionalGroupType.NITRILE) {
                    carbons.add(group.carbon());
                }
            }
        }
        return carbons;
    }

    /**
     * {@code polycyclic_C<n>}: n is the size of the first remaining ring system,
     * or the heavy-atom count when no ring system is left.
     */
    static String fallbackName(NamingState state) {
        int size = state.candidateRings().isEmpty()
            ? heavyAtoms(state.molecule())
            : state.candidateRings().get(0).size();
        return "polycyclic_C" + size;
    }

    static int heavyAtoms(Molecule molecule) {
        int count = 0;
        for (int i = 0; i < molecule.atomCount(); i++) {
            if (!molecule.atom(i).isHydrogen()) {
                count++;
            }
        }
        return count;
    }
}
