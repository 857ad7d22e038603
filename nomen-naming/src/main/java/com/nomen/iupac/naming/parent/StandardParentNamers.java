package com.nomen.iupac.naming.parent;

import com.nomen.iupac.rules.parent.ParentNamers;

/**
 * The parent-name generators of this module, wired for the standard rule set.
 */
public final class StandardParentNamers {

    private StandardParentNamers() {
    }

    public static ParentNamers create() {
        return new ParentNamers(
            new HeteroatomHydrideNamer(),
            new MonocycleNamer(),
            new VonBaeyerNamer(),
            new SpiroNamer(),
            new FusedRingNamer(),
            new BiphenylNamer(),
            new ChainNamer());
    }
}
