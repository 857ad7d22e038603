package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.parent.ChainParentNamer;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;

import java.util.List;
import java.util.Optional;

/**
 * Names an unbranched carbon chain; the two numbering directions are left to the locant optimizer.
 */
public final class ChainNamer implements ChainParentNamer {

    @Override
    public Optional<NamedParent> name(Molecule molecule, Chain chain) {
        List<Numbering> numberings = chain.length() == 1
            ? List.of(Numbering.sequential(chain.atoms()))
            : List.of(Numbering.sequential(chain.atoms()), Numbering.sequential(chain.reversed().atoms()));
        return Optional.of(new ChainParentName(chain.atoms(), numberings, Unsaturation.find(molecule, chain.atoms())));
    }
}
