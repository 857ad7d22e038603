package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.rules.parent.HeteroatomHydride;
import com.nomen.iupac.rules.parent.HeteroatomParentNamer;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.List;
import java.util.Optional;

/**
 * Mononuclear parent hydrides: {@code silane}, {@code phosphane}, {@code bismuthane}.
 */
public final class HeteroatomHydrideNamer implements HeteroatomParentNamer {

    @Override
    public Optional<NamedParent> name(Molecule molecule, int centralAtom) {
        return HeteroatomHydride.forSymbol(molecule.atom(centralAtom).symbol())
            .map(hydride -> {
                IntList atoms = IntLists.singleton(centralAtom);
                return FixedParentName.plain(ParentKind.HETEROATOM_HYDRIDE, atoms,
                    List.of(Numbering.sequential(atoms)), hydride.parentName(), false);
            });
    }
}
