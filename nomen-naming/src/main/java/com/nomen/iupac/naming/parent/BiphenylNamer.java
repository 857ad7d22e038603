package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.Ring;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingAssemblyNamer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Two benzene rings joined by a single bond (P-28.2.1): {@code 1,1'-biphenyl}.
 * The ring atoms of the bond are 1 and 1'; the second ring's locants are primed.
 */
public final class BiphenylNamer implements RingAssemblyNamer {

    @Override
    public Optional<NamedParent> name(Molecule molecule, List<RingSystem> systems) {
        if (systems.size() != 2 || !systems.get(0).isIsolated() || !systems.get(1).isIsolated()) {
            return Optional.empty();
        }
        Ring first = systems.get(0).rings().get(0);
        Ring second = systems.get(1).rings().get(0);
        if (first.size() != 6 || second.size() != 6) {
            return Optional.empty();
        }
        for (int a : first.atoms()) {
            for (int b : second.atoms()) {
                if (molecule.bonded(a, b)) {
                    return Optional.of(assembly(first, a, second, b));
                }
            }
        }
        return Optional.empty();
    }

    private static NamedParent assembly(Ring first, int firstLink, Ring second, int secondLink) {
        List<Numbering> numberings = new ArrayList<>(8);
        numberings.addAll(numberings(first, firstLink, second, secondLink));
        numberings.addAll(numberings(second, secondLink, first, firstLink));
        IntList atoms = new IntArrayList(first.atoms());
        atoms.addAll(second.atoms());
        return FixedParentName.plain(ParentKind.RING_ASSEMBLY, atoms, numberings, "1,1'-biphenyl", false);
    }

    private static List<Numbering> numberings(Ring unprimed, int unprimedLink, Ring primed, int primedLink) {
        List<Numbering> result = new ArrayList<>(4);
        for (int d1 : new int[]{1, -1}) {
            for (int d2 : new int[]{1, -1}) {
                IntArrayList order = new IntArrayList();
                List<Locant> labels = new ArrayList<>();
                IntList walk1 = RingNumberings.walk(unprimed.atoms(), unprimed.atoms().indexOf(unprimedLink), d1);
                IntList walk2 = RingNumberings.walk(primed.atoms(), primed.atoms().indexOf(primedLink), d2);
                for (int i = 0; i < 6; i++) {
                    order.add(walk1.getInt(i));
                    labels.add(Locant.of(i + 1));
                }
                for (int i = 0; i < 6; i++) {
                    order.add(walk2.getInt(i));
                    labels.add(new Locant(i + 1, "'"));
                }
                result.add(Numbering.of(order, labels));
            }
        }
        return result;
    }
}
