/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules.parent;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * A named parent hydride together with every numbering its nomenclature allows.
 *
 * <p>Produced by the parent-name generators. The numbering that is finally
 * used depends on the attached groups, so the name is rendered per numbering:
 * ene/yne and replacement-prefix locants change with it.
 */
public interface NamedParent {

    ParentKind kind();

    /**
     * Skeletal atoms of the parent, ascending.
     */
    IntList atoms();

    /**
     * Valid numberings, never empty. All of them already satisfy the
     * heteroatom-locant rules of the parent's nomenclature system.
     */
    List<Numbering> numberings();

    /**
     * Parent hydride name under {@code numbering}, e.g. {@code cyclohexa-1,3-diene}.
     *
     * @param attachments number of substituents and suffix groups on the parent;
     *                    some names drop locants when nothing is attached
     */
    String render(Numbering numbering, int attachments);

    /**
     * Locants that carry indicated hydrogen under {@code numbering}
     * ({@code 1H-pyrrole}, {@code 2H-pyran}). Compared right after heteroatom locants.
     */
    default List<Locant> indicatedHydrogen(Numbering numbering) {
        return List.of();
    }

    /**
     * Locants of ene/yne endings and hydro prefixes under {@code numbering}, sorted.
     * A multiple bond counts once, at its lower locant.
     */
    default List<Locant> unsaturation(Numbering numbering) {
        return List.of();
    }

    /**
     * True when the parent is all carbon, so a single attached group needs no locant
     * (cyclohexanol, chlorobenzene).
     */
    default boolean homogeneous() {
        return false;
    }
}
