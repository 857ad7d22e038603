package com.nomen.iupac.rules.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingSystem;

import java.util.Optional;

/**
 * Names one ring system as a parent hydride. Returns empty when the system is
 * outside the namer's nomenclature.
 */
@FunctionalInterface
public interface RingParentNamer {

    Optional<NamedParent> name(Molecule molecule, RingSystem system);
}
