package com.nomen.iupac.ring;

/**
 * Chemical character of a ring system.
 */
public enum RingSystemType {
    /** All-carbon, no aromatic atom. */
    ALIPHATIC,
    /** At least one aromatic atom. */
    AROMATIC,
    /** No aromatic atom, at least one ring heteroatom. */
    HETEROCYCLIC
}
