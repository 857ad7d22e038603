package com.nomen.iupac.rules;

/**
 * Stage of parent selection a rule belongs to. Recorded with every audit entry.
 */
public enum ExecutionPhase {
    HETEROATOM_PARENT,
    FUNCTIONAL_GROUPS,
    RING_SELECTION,
    RING_VS_CHAIN,
    CHAIN_SELECTION,
    PARENT_NAMING
}
