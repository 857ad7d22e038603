package com.nomen.iupac.rules.standard;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingSystem;

import java.util.List;

/**
 * Heteroatom seniority of ring systems.
 */
final class RingSeniority {

    /**
     * Ring heteroatoms, most senior first.
     */
    static final List<String> HETEROATOM_ORDER =
        List.of("O", "S", "Se", "Te", "N", "P", "As", "Sb", "B", "Si", "Ge");

    private RingSeniority() {
    }

    /**
     * Counts of each heteroatom in {@link #HETEROATOM_ORDER}; other elements in a last slot.
     */
    static int[] heteroatomProfile(Molecule molecule, RingSystem system) {
        int[] profile = new int[HETEROATOM_ORDER.size() + 1];
        for (int atom : system.heteroatoms()) {
            int index = HETEROATOM_ORDER.indexOf(molecule.atom(atom).symbol());
            profile[index < 0 ? HETEROATOM_ORDER.size() : index]++;
        }
        return profile;
    }

    /**
     * Positive when {@code a} is senior: more of the first heteroatom in which the profiles differ.
     */
    static int compareProfiles(int[] a, int[] b) {
        for (int i = 0; i < a.length; i++) {
            if (a[i] != b[i]) {
                return Integer.compare(a[i], b[i]);
            }
        }
        return 0;
    }
}
