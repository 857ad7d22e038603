/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.parent;

import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.List;

/**
 * Parent whose name is a fixed word, decorated per numbering with cited
 * heteroatom locants, indicated hydrogen and hydro prefixes.
 *
 * <p>Covers retained and Hantzsch-Widman heterocycles, benzene, fused
 * templates, biphenyl and mononuclear hydrides. Examples: {@code pyridine},
 * {@code 1,2,4-triazine}, {@code 1H-pyrrole}, {@code 3,4-dihydro-2H-pyran},
 * {@code 2,3-dihydro-1H-indene}.
 *
 * <p>{@code saturatedPositions} are the ring atoms without a double bond,
 * divalent chalcogens excluded. Under each numbering the lowest
 * {@code indicatedCount} of them carry indicated hydrogen; the rest are
 * expressed by hydro prefixes.
 */
record FixedParentName(
    ParentKind kind,
    IntList atoms,
    List<Numbering> numberings,
    String name,
    IntList citedHeteroatoms,
    IntList saturatedPositions,
    int indicatedCount,
    boolean homogeneous
) implements NamedParent {

    FixedParentName {
        IntArrayList sorted = new IntArrayList(atoms);
        sorted.sort(null);
        atoms = IntLists.unmodifiable(sorted);
        numberings = List.copyOf(numberings);
        citedHeteroatoms = IntLists.unmodifiable(new IntArrayList(citedHeteroatoms));
        saturatedPositions = IntLists.unmodifiable(new IntArrayList(saturatedPositions));
        if (indicatedCount < 0 || indicatedCount > saturatedPositions.size()) {
            throw new IllegalArgumentException("indicatedCount " + indicatedCount
                + " outside 0.." + saturatedPositions.size());
        }
    }

    /**
     * A name with no locant-dependent parts.
     */
    static FixedParentName plain(ParentKind kind, IntList atoms, List<Numbering> numberings, String name,
                                 boolean homogeneous) {
        return new FixedParentName(kind, atoms, numberings, name, IntLists.EMPTY_LIST, IntLists.EMPTY_LIST, 0,
            homogeneous);
    }

    @Override
    public String render(Numbering numbering, int attachments) {
        List<Locant> indicated = indicatedHydrogen(numbering);
        List<Locant> hydro = unsaturation(numbering);
        StringBuilder core = new StringBuilder();
        for (int i = 0; i < indicated.size(); i++) {
            core.append(i > 0 ? "," : "").append(indicated.get(i)).append('H');
        }
        if (!indicated.isEmpty()) {
            core.append('-');
        }
        if (!citedHeteroatoms.isEmpty()) {
            core.append(Locants.join(numbering.locantsOf(citedHeteroatoms))).append('-');
        }
        core.append(name);
        if (hydro.isEmpty()) {
            return core.toString();
        }
        String prefix = Locants.join(hydro) + "-" + AlkaneStems.multiplier(hydro.size()) + "hydro";
        return Character.isDigit(core.charAt(0)) ? prefix + "-" + core : prefix + core;
    }

    @Override
    public List<Locant> indicatedHydrogen(Numbering numbering) {
        return sortedSaturated(numbering).subList(0, indicatedCount);
    }

    /**
     * Hydro prefix locants.
     */
    @Override
    public List<Locant> unsaturation(Numbering numbering) {
        List<Locant> sorted = sortedSaturated(numbering);
        return sorted.subList(indicatedCount, sorted.size());
    }

    private List<Locant> sortedSaturated(Numbering numbering) {
        return new ArrayList<>(numbering.locantsOf(saturatedPositions));
    }
}
