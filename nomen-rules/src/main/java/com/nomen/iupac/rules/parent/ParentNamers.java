package com.nomen.iupac.rules.parent;

import java.util.Objects;

/**
 * The generators the standard rule set delegates parent naming to.
 */
public record ParentNamers(
    HeteroatomParentNamer heteroatom,
    RingParentNamer monocycle,
    RingParentNamer vonBaeyer,
    RingParentNamer spiro,
    RingParentNamer fused,
    RingAssemblyNamer ringAssembly,
    ChainParentNamer chain
) {

    public ParentNamers {
        Objects.requireNonNull(heteroatom, "heteroatom must not be null");
        Objects.requireNonNull(monocycle, "monocycle must not be null");
        Objects.requireNonNull(vonBaeyer, "vonBaeyer must not be null");
        Objects.requireNonNull(spiro, "spiro must not be null");
        Objects.requireNonNull(fused, "fused must not be null");
        Objects.requireNonNull(ringAssembly, "ringAssembly must not be null");
        Objects.requireNonNull(chain, "chain must not be null");
    }
}
