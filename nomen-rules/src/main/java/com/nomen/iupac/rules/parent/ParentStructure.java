package com.nomen.iupac.rules.parent;

import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.chain.Chain;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * The parent structure fixed by the rule engine.
 */
public sealed interface ParentStructure {

    NamedParent parentName();

    default ParentKind kind() {
        return parentName().kind();
    }

    default IntList atoms() {
        return parentName().atoms();
    }

    /**
     * A single ring system: monocycle, von Baeyer, spiro or fused.
     */
    record RingParent(RingSystem system, NamedParent parentName) implements ParentStructure {
    }

    /**
     * Identical ring systems joined by single bonds, e.g. biphenyl.
     */
    record RingAssemblyParent(List<RingSystem> systems, NamedParent parentName) implements ParentStructure {

        public RingAssemblyParent {
            systems = List.copyOf(systems);
        }
    }

    record ChainParent(Chain chain, NamedParent parentName) implements ParentStructure {
    }

    /**
     * Mononuclear parent hydride such as silane or phosphane.
     */
    record HeteroatomParent(int atom, NamedParent parentName) implements ParentStructure {
    }
}
