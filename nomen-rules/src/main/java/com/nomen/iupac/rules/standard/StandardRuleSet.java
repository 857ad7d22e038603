/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules.standard;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.Conflict;
import com.nomen.iupac.rules.ExecutionPhase;
import com.nomen.iupac.rules.NamingRule;
import com.nomen.iupac.rules.NamingState;
import com.nomen.iupac.rules.Transition;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.group.FunctionalGroup;
import com.nomen.iupac.rules.group.FunctionalGroupType;
import com.nomen.iupac.rules.parent.HeteroatomHydride;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.ParentNamers;
import com.nomen.iupac.rules.parent.ParentStructure;
import com.nomen.iupac.rules.parent.RingParentNamer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * The standard parent-selection rules.
 *
 * <table>
 *   <caption>Rules by priority</caption>
 *   <tr><th>Priority</th><th>Rule</th></tr>
 *   <tr><td>900</td><td>P-68 mononuclear heteroatom parent hydride</td></tr>
 *   <tr><td>800</td><td>P-41 principal characteristic group</td></tr>
 *   <tr><td>750</td><td>P-29 parent must carry the free valence (substituent mode)</td></tr>
 *   <tr><td>700</td><td>P-44.1.1 maximum number of principal groups</td></tr>
 *   <tr><td>600</td><td>P-44.2.2 ring heteroatom seniority</td></tr>
 *   <tr><td>560</td><td>P-28 biphenyl ring assembly</td></tr>
 *   <tr><td>550</td><td>P-44.2.3 smallest ring system</td></tr>
 *   <tr><td>540</td><td>P-44.2.4 most rings</td></tr>
 *   <tr><td>530</td><td>ring tie-break by lowest atom index</td></tr>
 *   <tr><td>500</td><td>P-44.1.2 ring versus chain</td></tr>
 *   <tr><td>450</td><td>P-44.3 principal chain</td></tr>
 *   <tr><td>380..300</td><td>parent naming: monocycle, von Baeyer, spiro, fused, chain</td></tr>
 * </table>
 */
public final class StandardRuleSet {

    private StandardRuleSet() {
    }

    public static List<NamingRule> create(ParentNamers namers) {
        Objects.requireNonNull(namers, "namers must not be null");
        List<NamingRule> rules = new ArrayList<>();
        rules.add(heteroatomParent(namers));
        rules.add(principalGroup());
        rules.add(freeValence());
        rules.add(maximumPrincipalGroups());
        rules.add(heteroatomSeniority());
        rules.add(biphenyl(namers));
        rules.add(ringFilter("P-44.2.3", 550, "smallest ring system",
            Comparator.comparingInt(RingSystem::size)));
        rules.add(ringFilter("P-44.2.4", 540, "most rings",
            Comparator.comparingInt(RingSystem::ringCount).reversed()));
        rules.add(ringFilter("ring-tie-break", 530, "lowest atom index",
            Comparator.comparingInt(system -> system.atoms().firstInt())));
        rules.add(ringVersusChain());
        rules.add(principalChain());
        rules.add(ringNaming("P-22.1-monocycle", "P-22.1", 380, namers.monocycle(),
            state -> firstRing(state).isIsolated()));
        rules.add(ringNaming("P-23.2-von-baeyer", "P-23.2", 370, namers.vonBaeyer(),
            state -> firstRing(state).bridged()));
        rules.add(ringNaming("P-24.2-spiro", "P-24.2", 360, namers.spiro(),
            state -> firstRing(state).spiro() && !firstRing(state).bridged()));
        rules.add(ringNaming("P-25.3-fused", "P-25.3", 350, namers.fused(),
            state -> firstRing(state).fused() && !firstRing(state).bridged()));
        rules.add(ringNaming("P-23.2-polycyclic", "P-23.2", 340, namers.vonBaeyer(),
            state -> !firstRing(state).isIsolated() && !firstRing(state).bridged() && !firstRing(state).isAromatic()));
        rules.add(chainNaming(namers));
        return List.copyOf(rules);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // HETEROATOM PARENT
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamingRule heteroatomParent(ParentNamers namers) {
        return new NamingRule("P-68-heteroatom-parent", "P-68", 900, ExecutionPhase.HETEROATOM_PARENT,
            state -> heteroatomCenter(state).isPresent(),
            state -> {
                int center = heteroatomCenter(state).getAsInt();
                String symbol = state.molecule().atom(center).symbol();
                Optional<NamedParent> named = namers.heteroatom().name(state.molecule(), center);
                if (named.isEmpty()) {
                    return Transition.of(state.withConflict(new Conflict("P-68-heteroatom-parent",
                        "no hydride name for " + symbol + " atom " + center)), "heteroatom parent not nameable");
                }
                return Transition.of(state.withParentStructure(new ParentStructure.HeteroatomParent(center, named.get())),
                    "%s atom %d has standard valence; parent hydride %s", symbol, center,
                    named.get().render(named.get().numberings().get(0), 0));
            });
    }

    /**
     * The single acyclic Si/Ge/Sn/Pb/P/As/Sb/Bi atom with standard valence, if exactly one such
     * element is present. In substituent mode it must also be the attachment atom.
     */
    static OptionalInt heteroatomCenter(NamingState state) {
        Molecule molecule = state.molecule();
        int found = -1;
        for (int i = 0; i < molecule.atomCount(); i++) {
            Atom atom = molecule.atom(i);
            Optional<HeteroatomHydride> hydride = HeteroatomHydride.forSymbol(atom.symbol());
            if (hydride.isEmpty()) {
                continue;
            }
            if (found >= 0) {
                return OptionalInt.empty();
            }
            double valence = molecule.bondOrderSum(i) + atom.implicitHydrogens();
            if (state.ringAnalysis().inRing(i) || valence != hydride.get().valence() || atom.charge() != 0) {
                return OptionalInt.empty();
            }
            found = i;
        }
        if (found < 0) {
            return OptionalInt.empty();
        }
        OptionalInt attachment = state.attachment();
        if (attachment.isPresent() && attachment.getAsInt() != found) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(found);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // FUNCTIONAL GROUPS AND FREE VALENCE
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamingRule principalGroup() {
        return new NamingRule("P-41-principal-group", "P-41", 800, ExecutionPhase.FUNCTIONAL_GROUPS,
            state -> !state.substituentMode() && !state.functionalGroups().isEmpty() && !state.hasPrincipalGroups(),
            state -> {
                FunctionalGroupType senior = state.functionalGroups().stream()
                    .map(FunctionalGroup::type)
                    .min(Comparator.naturalOrder())
                    .orElseThrow();
                List<FunctionalGroup> marked = state.functionalGroups().stream()
                    .map(group -> group.withPrincipal(group.type() == senior))
                    .toList();
                long count = marked.stream().filter(FunctionalGroup::principal).count();
                return Transition.of(state.withFunctionalGroups(marked),
                    "principal characteristic group %s (%d)", senior.name().toLowerCase(), count);
            });
    }

    private static NamingRule freeValence() {
        return new NamingRule("P-29-free-valence", "P-29", 750, ExecutionPhase.FUNCTIONAL_GROUPS,
            NamingState::substituentMode,
            state -> {
                int atom = state.attachment().getAsInt();
                List<RingSystem> rings = state.candidateRings().stream().filter(r -> r.contains(atom)).toList();
                List<Chain> chains = state.candidateChains().stream().filter(c -> c.contains(atom)).toList();
                return Transition.of(state.withCandidateRings(rings).withCandidateChains(chains),
                    "parent must contain attachment atom %d: %d ring(s), %d chain(s)", atom, rings.size(), chains.size());
            });
    }

    private static NamingRule maximumPrincipalGroups() {
        return new NamingRule("P-44.1.1", "P-44.1.1", 700, ExecutionPhase.FUNCTIONAL_GROUPS,
            state -> state.hasPrincipalGroups()
                && state.candidateRings().size() + state.candidateChains().size() > 1,
            state -> {
                int best = 0;
                for (RingSystem ring : state.candidateRings()) {
                    best = Math.max(best, CandidateGroups.count(state, ring));
                }
                for (Chain chain : state.candidateChains()) {
                    best = Math.max(best, CandidateGroups.count(state, chain));
                }
                int max = best;
                List<RingSystem> rings = state.candidateRings().stream()
                    .filter(r -> CandidateGroups.count(state, r) == max).toList();
                List<Chain> chains = state.candidateChains().stream()
                    .filter(c -> CandidateGroups.count(state, c) == max).toList();
                return Transition.of(state.withCandidateRings(rings).withCandidateChains(chains),
                    "kept %d ring(s) and %d chain(s) carrying %d principal group(s)", rings.size(), chains.size(), max);
            });
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RING SENIORITY
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamingRule heteroatomSeniority() {
        return new NamingRule("P-44.2.2", "P-44.2.2", 600, ExecutionPhase.RING_SELECTION,
            state -> state.candidateRings().size() > 1,
            state -> {
                Molecule molecule = state.molecule();
                int[] best = null;
                for (RingSystem ring : state.candidateRings()) {
                    int[] profile = RingSeniority.heteroatomProfile(molecule, ring);
                    if (best == null || RingSeniority.compareProfiles(profile, best) > 0) {
                        best = profile;
                    }
                }
                int[] senior = best;
                List<RingSystem> kept = state.candidateRings().stream()
                    .filter(r -> RingSeniority.compareProfiles(RingSeniority.heteroatomProfile(molecule, r), senior) == 0)
                    .toList();
                return Transition.of(state.withCandidateRings(kept),
                    "kept %d of %d ring system(s) by heteroatom seniority", kept.size(), state.candidateRings().size());
            });
    }

    private static NamingRule biphenyl(ParentNamers namers) {
        return new NamingRule("P-28-biphenyl", "P-28.2", 560, ExecutionPhase.RING_SELECTION,
            StandardRuleSet::isUnsubstitutedBiphenyl,
            state -> {
                List<RingSystem> systems = state.ringAnalysis().systems();
                Optional<NamedParent> named = namers.ringAssembly().name(state.molecule(), systems);
                if (named.isEmpty()) {
                    return Transition.of(state.withConflict(new Conflict("P-28-biphenyl",
                        "ring assembly not nameable")), "ring assembly not nameable");
                }
                return Transition.of(state.withParentStructure(
                    new ParentStructure.RingAssemblyParent(systems, named.get())), "two benzene rings joined by a single bond");
            });
    }

    private static boolean isUnsubstitutedBiphenyl(NamingState state) {
        if (state.substituentMode() || !state.functionalGroups().isEmpty()) {
            return false;
        }
        Molecule molecule = state.molecule();
        List<RingSystem> systems = state.ringAnalysis().systems();
        if (systems.size() != 2 || heavyAtoms(molecule) != 12) {
            return false;
        }
        for (RingSystem system : systems) {
            if (!system.isIsolated() || system.size() != 6 || !system.isAromatic() || !system.heteroatoms().isEmpty()) {
                return false;
            }
        }
        for (int atom : systems.get(0).atoms()) {
            for (int neighbor : molecule.neighbors(atom)) {
                if (systems.get(1).contains(neighbor)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static int heavyAtoms(Molecule molecule) {
        int count = 0;
        for (Atom atom : molecule.atoms()) {
            if (!atom.isHydrogen()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Keeps the ring systems that rank first under {@code order}.
     */
    private static NamingRule ringFilter(String id, int priority, String criterion, Comparator<RingSystem> order) {
        String reference = id.startsWith("P-") ? id : "P-44.2";
        return new NamingRule(id, reference, priority, ExecutionPhase.RING_SELECTION,
            state -> state.candidateRings().size() > 1,
            state -> {
                RingSystem best = state.candidateRings().stream().min(order).orElseThrow();
                List<RingSystem> kept = state.candidateRings().stream()
                    .filter(r -> order.compare(r, best) == 0)
                    .toList();
                return Transition.of(state.withCandidateRings(kept),
                    "kept %d ring system(s) by %s", kept.size(), criterion);
            });
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RING VERSUS CHAIN, PRINCIPAL CHAIN
    // ════════════════════════════════════════════════════════════════════════════════

    private static NamingRule ringVersusChain() {
        return new NamingRule("P-44.1.2", "P-44.1.2", 500, ExecutionPhase.RING_VS_CHAIN,
            state -> !state.candidateRings().isEmpty() && !state.candidateChains().isEmpty(),
            state -> {
                RingSystem ring = state.candidateRings().get(0);
                int ringGroups = CandidateGroups.count(state, ring);
                Chain longest = state.candidateChains().stream()
                    .max(Comparator.comparingInt(Chain::length))
                    .orElseThrow();
                int chainGroups = CandidateGroups.count(state, longest);
                boolean chainWins = chainGroups > ringGroups
                    || (chainGroups == ringGroups && longest.length() > ring.size());
                if (chainWins) {
                    return Transition.of(state.withCandidateRings(List.of()),
                        "chain of %d atoms outranks ring system of %d atoms", longest.length(), ring.size());
                }
                return Transition.of(state.withCandidateChains(List.of()),
                    "ring system of %d atoms outranks chains (longest %d)", ring.size(), longest.length());
            });
    }

    private static NamingRule principalChain() {
        return new NamingRule("P-44.3", "P-44.3", 450, ExecutionPhase.CHAIN_SELECTION,
            state -> state.candidateChains().size() > 1,
            state -> {
                Chain best = state.candidateChains().stream()
                    .min(new ChainSeniority(state))
                    .orElseThrow();
                return Transition.of(state.withCandidateChains(List.of(best)),
                    "principal chain of %d atoms chosen from %d", best.length(), state.candidateChains().size());
            });
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PARENT NAMING
    // ════════════════════════════════════════════════════════════════════════════════

    private static RingSystem firstRing(NamingState state) {
        return state.candidateRings().get(0);
    }

    private static NamingRule ringNaming(String id, String reference, int priority, RingParentNamer namer,
                                         Predicate<NamingState> applies) {
        return new NamingRule(id, reference, priority, ExecutionPhase.PARENT_NAMING,
            state -> !state.candidateRings().isEmpty() && applies.test(state),
            state -> {
                RingSystem system = firstRing(state);
                Optional<NamedParent> named = namer.name(state.molecule(), system);
                if (named.isEmpty()) {
                    return Transition.of(state.withConflict(new Conflict(id,
                        "no name for " + system.describe())), "ring system not matched");
                }
                return Transition.of(state.withParentStructure(new ParentStructure.RingParent(system, named.get())),
                    "%s named %s", system.describe(), preview(named.get()));
            });
    }

    private static NamingRule chainNaming(ParentNamers namers) {
        return new NamingRule("P-21.2-chain", "P-21.2", 300, ExecutionPhase.PARENT_NAMING,
            state -> state.candidateRings().isEmpty() && !state.candidateChains().isEmpty(),
            state -> {
                Chain chain = state.candidateChains().stream()
                    .min(chainOrder(state))
                    .orElseThrow();
                Optional<NamedParent> named = namers.chain().name(state.molecule(), chain);
                if (named.isEmpty()) {
                    return Transition.of(state.withConflict(new Conflict("P-21.2-chain",
                        "no name for chain " + chain.atoms())), "chain not nameable");
                }
                return Transition.of(state.withParentStructure(new ParentStructure.ChainParent(chain, named.get())),
                    "chain of %d atoms named %s", chain.length(), preview(named.get()));
            });
    }

    private static Comparator<Chain> chainOrder(NamingState state) {
        return state.candidateChains().size() > 1
            ? new ChainSeniority(state)
            : Comparator.comparingInt((ToIntFunction<Chain>) Chain::first);
    }

    private static String preview(NamedParent named) {
        return named.render(named.numberings().get(0), 0);
    }
}
