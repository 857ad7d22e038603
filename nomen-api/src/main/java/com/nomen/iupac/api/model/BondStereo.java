package com.nomen.iupac.api.model;

/**
 * Stereo annotation carried by a bond. Passed through untouched.
 */
public enum BondStereo {
    NONE,
    UP,
    DOWN,
    EITHER
}
