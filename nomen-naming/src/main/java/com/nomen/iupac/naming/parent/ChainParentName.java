package com.nomen.iupac.naming.parent;

import com.nomen.iupac.naming.parent.Unsaturation.MultipleBond;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.List;

/**
 * Acyclic hydrocarbon parent: {@code pentane}, {@code but-2-ene}, {@code ethyne}.
 * Ethene and ethyne never need locants.
 */
record ChainParentName(IntList atoms, List<Numbering> numberings, List<MultipleBond> bonds) implements NamedParent {

    ChainParentName {
        IntArrayList sorted = new IntArrayList(atoms);
        sorted.sort(null);
        atoms = IntLists.unmodifiable(sorted);
        numberings = List.copyOf(numberings);
        bonds = List.copyOf(bonds);
    }

    @Override
    public ParentKind kind() {
        return ParentKind.CHAIN;
    }

    @Override
    public String render(Numbering numbering, int attachments) {
        return Unsaturation.ending(AlkaneStems.stem(atoms.size()), bonds, numbering, atoms.size() <= 2);
    }

    @Override
    public List<Locant> unsaturation(Numbering numbering) {
        return Unsaturation.locants(bonds, numbering);
    }
}
