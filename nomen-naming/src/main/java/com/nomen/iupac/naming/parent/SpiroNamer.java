package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.Ring;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingParentNamer;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Monospiro alicyclic systems (P-24.2): {@code spiro[4.5]decane}.
 *
 * <p>Numbering starts in the smaller ring at an atom next to the spiro atom,
 * goes around that ring, gives the spiro atom the next locant and continues
 * around the larger ring. Polyspiro systems and spiro unions with mancude
 * rings are declined.
 */
public final class SpiroNamer implements RingParentNamer {

    private static final Logger logger = LoggerFactory.getLogger(SpiroNamer.class);

    @Override
    public Optional<NamedParent> name(Molecule molecule, RingSystem system) {
        if (system.ringCount() != 2 || system.bridged() || system.fused()) {
            logger.debug("Not a monospiro system: {}", system.describe());
            return Optional.empty();
        }
        Ring a = system.rings().get(0);
        Ring b = system.rings().get(1);
        IntSet shared = a.sharedAtoms(b);
        if (shared.size() != 1 || system.atoms().intStream().anyMatch(x -> molecule.atom(x).aromatic())) {
            return Optional.empty();
        }
        int spiroAtom = shared.iterator().nextInt();
        Ring small = a.size() <= b.size() ? a : b;
        Ring large = small == a ? b : a;

        List<Numbering> numberings = new ArrayList<>(numberings(small, large, spiroAtom));
        if (small.size() == large.size()) {
            numberings.addAll(numberings(large, small, spiroAtom));
        }
        Int2ObjectOpenHashMap<String> heteroatoms = new Int2ObjectOpenHashMap<>();
        for (int atom : system.heteroatoms()) {
            heteroatoms.put(atom, molecule.atom(atom).symbol());
        }
        IntList atoms = new IntArrayList(system.atoms());
        String descriptor = "spiro[" + (small.size() - 1) + "." + (large.size() - 1) + "]";
        return Optional.of(new AlicyclicParentName(ParentKind.SPIRO, atoms, numberings, descriptor,
            Unsaturation.find(molecule, atoms), heteroatoms, null));
    }

    private static List<Numbering> numberings(Ring first, Ring second, int spiroAtom) {
        List<Numbering> result = new ArrayList<>(4);
        for (int firstDirection : new int[]{1, -1}) {
            for (int secondDirection : new int[]{1, -1}) {
                IntArrayList order = new IntArrayList();
                IntList firstWalk = RingNumberings.walk(first.atoms(), first.atoms().indexOf(spiroAtom), firstDirection);
                IntList secondWalk = RingNumberings.walk(second.atoms(), second.atoms().indexOf(spiroAtom), secondDirection);
                order.addAll(firstWalk.subList(1, firstWalk.size()));
                order.add(spiroAtom);
                order.addAll(secondWalk.subList(1, secondWalk.size()));
                result.add(Numbering.sequential(order));
            }
        }
        return result;
    }
}
