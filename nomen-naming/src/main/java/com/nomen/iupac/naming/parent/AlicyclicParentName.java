/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.parent;

import com.nomen.iupac.naming.parent.Unsaturation.MultipleBond;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.naming.stem.ReplacementPrefix;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ring parent named from the alkane of the same atom count: cycloalkanes,
 * von Baeyer and spiro hydrocarbons, with skeletal replacement prefixes for
 * heteroatoms.
 *
 * <p>Examples: {@code cyclohexene}, {@code bicyclo[2.2.1]hept-2-ene},
 * {@code 7-oxabicyclo[2.2.1]heptane}, {@code 2-oxa-6-azaspiro[3.3]heptane}.
 *
 * @param descriptor      text between the replacement prefixes and the alkane stem,
 *                        e.g. {@code cyclo} or {@code bicyclo[2.2.1]}
 * @param heteroatoms     replaced skeletal atoms mapped to their element symbol
 * @param retainedName    name used instead of the systematic one, or null
 */
record AlicyclicParentName(
    ParentKind kind,
    IntList atoms,
    List<Numbering> numberings,
    String descriptor,
    List<MultipleBond> bonds,
    Int2ObjectMap<String> heteroatoms,
    String retainedName
) implements NamedParent {

    AlicyclicParentName {
        IntArrayList sorted = new IntArrayList(atoms);
        sorted.sort(null);
        atoms = IntLists.unmodifiable(sorted);
        numberings = List.copyOf(numberings);
        bonds = List.copyOf(bonds);
        heteroatoms = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(heteroatoms));
    }

    @Override
    public String render(Numbering numbering, int attachments) {
        String base;
        if (retainedName != null) {
            base = retainedName;
        } else {
            boolean omitLocant = kind == ParentKind.MONOCYCLE && attachments == 0 && bonds.size() == 1;
            base = Unsaturation.ending(descriptor + AlkaneStems.stem(atoms.size()), bonds, numbering, omitLocant);
        }
        return replacementPrefixes(numbering) + base;
    }

    private String replacementPrefixes(Numbering numbering) {
        if (heteroatoms.isEmpty()) {
            return "";
        }
        Map<String, List<Locant>> byElement = new TreeMap<>(ReplacementPrefix.SENIORITY);
        for (Int2ObjectMap.Entry<String> entry : heteroatoms.int2ObjectEntrySet()) {
            byElement.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(numbering.locantOf(entry.getIntKey()));
        }
        StringBuilder text = new StringBuilder();
        for (Map.Entry<String, List<Locant>> entry : byElement.entrySet()) {
            List<Locant> locants = new ArrayList<>(entry.getValue());
            locants.sort(null);
            if (text.length() > 0) {
                text.append('-');
            }
            text.append(Locants.join(locants)).append('-')
                .append(AlkaneStems.multiplier(locants.size()))
                .append(ReplacementPrefix.forSymbol(entry.getKey()).orElseThrow().prefix());
        }
        return text.toString();
    }

    @Override
    public List<Locant> unsaturation(Numbering numbering) {
        return Unsaturation.locants(bonds, numbering);
    }

    @Override
    public boolean homogeneous() {
        return kind == ParentKind.MONOCYCLE && heteroatoms.isEmpty() && bonds.isEmpty();
    }
}
