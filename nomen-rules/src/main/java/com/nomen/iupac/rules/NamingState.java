/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingAnalysis;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.group.FunctionalGroup;
import com.nomen.iupac.rules.parent.ParentStructure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable state of parent selection for one molecule.
 *
 * <p>Every {@code with*} method returns a new instance and leaves the receiver
 * untouched, so a rule can never corrupt the state seen by an earlier rule.
 *
 * <h2>Substituent mode</h2>
 * <p>When naming a fragment as a substituent the state carries the
 * attachment atom (the free valence). No group becomes principal and the
 * parent must contain the attachment atom.
 */
public final class NamingState {

    private final Molecule molecule;
    private final RingAnalysis ringAnalysis;
    private final List<RingSystem> candidateRings;
    private final List<Chain> candidateChains;
    private final List<FunctionalGroup> functionalGroups;
    private final int attachment;
    private final ParentStructure parentStructure;
    private final List<Conflict> conflicts;
    private final List<AuditEntry> auditTrail;

    private NamingState(Molecule molecule,
                        RingAnalysis ringAnalysis,
                        List<RingSystem> candidateRings,
                        List<Chain> candidateChains,
                        List<FunctionalGroup> functionalGroups,
                        int attachment,
                        ParentStructure parentStructure,
                        List<Conflict> conflicts,
                        List<AuditEntry> auditTrail) {
        this.molecule = molecule;
        this.ringAnalysis = ringAnalysis;
        this.candidateRings = List.copyOf(candidateRings);
        this.candidateChains = List.copyOf(candidateChains);
        this.functionalGroups = List.copyOf(functionalGroups);
        this.attachment = attachment;
        this.parentStructure = parentStructure;
        this.conflicts = List.copyOf(conflicts);
        this.auditTrail = List.copyOf(auditTrail);
    }

    /**
     * Starting state: every ring system and chain is a candidate.
     */
    public static NamingState initial(Molecule molecule, RingAnalysis ringAnalysis,
                                      List<Chain> chains, List<FunctionalGroup> functionalGroups) {
        Objects.requireNonNull(molecule, "molecule must not be null");
        Objects.requireNonNull(ringAnalysis, "ringAnalysis must not be null");
        return new NamingState(molecule, ringAnalysis, ringAnalysis.systems(), chains, functionalGroups,
            -1, null, List.of(), List.of());
    }

    /**
     * Same candidates, naming the molecule as a substituent attached through {@code atom}.
     */
    public NamingState forSubstituent(int atom) {
        if (atom < 0 || atom >= molecule.atomCount()) {
            throw new IllegalArgumentException("Attachment atom " + atom + " outside molecule");
        }
        return new NamingState(molecule, ringAnalysis, candidateRings, candidateChains, functionalGroups,
            atom, parentStructure, conflicts, auditTrail);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TRANSITIONS
    // ════════════════════════════════════════════════════════════════════════════════

    public NamingState withCandidateRings(List<RingSystem> rings) {
        return new NamingState(molecule, ringAnalysis, rings, candidateChains, functionalGroups,
            attachment, parentStructure, conflicts, auditTrail);
    }

    public NamingState withCandidateChains(List<Chain> chains) {
        return new NamingState(molecule, ringAnalysis, candidateRings, chains, functionalGroups,
            attachment, parentStructure, conflicts, auditTrail);
    }

    public NamingState withFunctionalGroups(List<FunctionalGroup> groups) {
        return new NamingState(molecule, ringAnalysis, candidateRings, candidateChains, groups,
            attachment, parentStructure, conflicts, auditTrail);
    }

    public NamingState withParentStructure(ParentStructure parent) {
        Objects.requireNonNull(parent, "parent must not be null");
        return new NamingState(molecule, ringAnalysis, candidateRings, candidateChains, functionalGroups,
            attachment, parent, conflicts, auditTrail);
    }

    public NamingState withConflict(Conflict conflict) {
        List<Conflict> next = new ArrayList<>(conflicts);
        next.add(Objects.requireNonNull(conflict, "conflict must not be null"));
        return new NamingState(molecule, ringAnalysis, candidateRings, candidateChains, functionalGroups,
            attachment, parentStructure, next, auditTrail);
    }

    /**
     * Appends an audit entry.
     */
    public NamingState record(AuditEntry entry) {
        List<AuditEntry> next = new ArrayList<>(auditTrail);
        next.add(Objects.requireNonNull(entry, "entry must not be null"));
        return new NamingState(molecule, ringAnalysis, candidateRings, candidateChains, functionalGroups,
            attachment, parentStructure, conflicts, next);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public Molecule molecule() {
        return molecule;
    }

    public RingAnalysis ringAnalysis() {
        return ringAnalysis;
    }

    public List<RingSystem> candidateRings() {
        return candidateRings;
    }

    public List<Chain> candidateChains() {
        return candidateChains;
    }

    public List<FunctionalGroup> functionalGroups() {
        return functionalGroups;
    }

    public List<FunctionalGroup> principalGroups() {
        return functionalGroups.stream().filter(FunctionalGroup::principal).toList();
    }

    public boolean hasPrincipalGroups() {
        return functionalGroups.stream().anyMatch(FunctionalGroup::principal);
    }

    public OptionalInt attachment() {
        return attachment < 0 ? OptionalInt.empty() : OptionalInt.of(attachment);
    }

    public boolean substituentMode() {
        return attachment >= 0;
    }

    public Optional<ParentStructure> parentStructure() {
        return Optional.ofNullable(parentStructure);
    }

    public List<Conflict> conflicts() {
        return conflicts;
    }

    public List<AuditEntry> auditTrail() {
        return auditTrail;
    }

    /**
     * One line per remaining candidate, for full traces.
     */
    public List<String> candidateSummaries() {
        List<String> summaries = new ArrayList<>();
        candidateRings.forEach(system -> summaries.add("ring " + system.describe()));
        candidateChains.forEach(chain -> summaries.add("chain of " + chain.length() + ": " + chain.atoms()));
        functionalGroups.forEach(group -> summaries.add("group " + group.type().name().toLowerCase()
            + " at carbon " + group.carbon() + (group.principal() ? " (principal)" : "")));
        return summaries;
    }

    @Override
    public String toString() {
        return "NamingState{rings=" + candidateRings.size()
            + ", chains=" + candidateChains.size()
            + ", groups=" + functionalGroups.size()
            + ", parent=" + (parentStructure == null ? "none" : parentStructure.kind())
            + ", audit=" + auditTrail.size() + '}';
    }
}
