package com.nomen.iupac.rules.parent;

/**
 * How a parent hydride is named.
 */
public enum ParentKind {
    HETEROATOM_HYDRIDE,
    CHAIN,
    MONOCYCLE,
    VON_BAEYER,
    SPIRO,
    FUSED,
    RING_ASSEMBLY
}
