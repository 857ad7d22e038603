package com.nomen.iupac.rules.parent;

import com.nomen.iupac.api.model.Molecule;

import java.util.Optional;

@FunctionalInterface
public interface HeteroatomParentNamer {

    Optional<NamedParent> name(Molecule molecule, int centralAtom);
}
