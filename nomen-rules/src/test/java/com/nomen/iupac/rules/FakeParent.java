package com.nomen.iupac.rules;

import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Fixed-name parent for rule tests.
 */
public record FakeParent(ParentKind kind, IntList atoms, String name) implements NamedParent {

    public static FakeParent of(ParentKind kind, String name, int... atoms) {
        return new FakeParent(kind, IntArrayList.wrap(atoms), name);
    }

    @Override
    public List<Numbering> numberings() {
        return List.of(Numbering.sequential(atoms));
    }

    @Override
    public String render(Numbering numbering, int attachments) {
        return name;
    }
}
