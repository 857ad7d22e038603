package com.nomen.iupac.rules.group;

import com.nomen.iupac.api.model.Molecule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.function.IntPredicate;

/**
 * A detected characteristic group.
 *
 * @param type      group class
 * @param carbon    carbon atom bearing the group (for acyl groups and nitriles, the group carbon)
 * @param atoms     the group's heteroatoms; for esters the carbonyl oxygen, then the ester oxygen
 * @param principal true when expressed as the suffix
 */
public record FunctionalGroup(FunctionalGroupType type, int carbon, IntList atoms, boolean principal) {

    public FunctionalGroup {
        atoms = IntLists.unmodifiable(new IntArrayList(atoms));
    }

    public FunctionalGroup withPrincipal(boolean value) {
        return value == principal ? this : new FunctionalGroup(type, carbon, atoms, value);
    }

    /**
     * Parent atom at which the group is expressed as a suffix, or -1.
     *
     * <p>The group carbon itself when it is a parent atom. For acyl groups and
     * nitriles on a cyclic parent, the ring atom the group carbon is bonded to.
     */
    public int expressedAt(Molecule molecule, IntPredicate inParent, boolean cyclicParent) {
        if (inParent.test(carbon)) {
            return carbon;
        }
        if (cyclicParent && type.carbonInGroup()) {
            for (int neighbor : molecule.neighbors(carbon)) {
                if (inParent.test(neighbor)) {
                    return neighbor;
                }
            }
        }
        return -1;
    }

    /**
     * True when the group carbon is outside the parent, so the suffix is the
     * attached form ({@code -carboxylic acid}).
     */
    public boolean attachedForm(IntPredicate inParent) {
        return type.carbonInGroup() && !inParent.test(carbon);
    }

    /**
     * Single-bonded oxygen of an ester, linking the acyl carbon to the alkyl group.
     *
     * @throws IllegalStateException when this is not an ester
     */
    public int esterOxygen() {
        if (type != FunctionalGroupType.ESTER) {
            throw new IllegalStateException("Not an ester: " + type);
        }
        return atoms.getInt(1);
    }
}
