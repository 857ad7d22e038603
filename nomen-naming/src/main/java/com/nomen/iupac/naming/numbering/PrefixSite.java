package com.nomen.iupac.naming.numbering;

/**
 * A detachable prefix on a parent atom.
 *
 * @param atom      parent atom carrying the prefix
 * @param alphaName name used for alphanumerical ordering, without multiplying prefixes
 */
public record PrefixSite(int atom, String alphaName) {
}
