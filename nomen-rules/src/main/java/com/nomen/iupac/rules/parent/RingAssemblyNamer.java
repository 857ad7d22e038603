package com.nomen.iupac.rules.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingSystem;

import java.util.List;
import java.util.Optional;

/**
 * Names ring systems joined directly by single bonds (biphenyl).
 */
@FunctionalInterface
public interface RingAssemblyNamer {

    Optional<NamedParent> name(Molecule molecule, List<RingSystem> systems);
}
