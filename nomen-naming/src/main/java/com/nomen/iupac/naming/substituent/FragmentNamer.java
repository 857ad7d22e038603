package com.nomen.iupac.naming.substituent;

import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;

/**
 * Names an isolated fragment as a substituent through the full naming pipeline.
 */
@FunctionalInterface
public interface FragmentNamer {

    /**
     * @param fragment   independent copy of the fragment, cut bonds replaced by hydrogen
     * @param attachment fragment atom that carried the bond to the parent
     * @param order      order of that bond: {@code yl}, {@code ylidene} or {@code ylidyne}
     * @param depth      nesting level of the substituent, 1 for prefixes on the parent
     */
    SubstituentName name(Molecule fragment, int attachment, BondOrder order, int depth);
}
