package com.nomen.iupac.rules.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.rules.chain.Chain;

import java.util.Optional;

@FunctionalInterface
public interface ChainParentNamer {

    Optional<NamedParent> name(Molecule molecule, Chain chain);
}
