package com.nomen.iupac.rules.standard;

import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.NamingState;
import com.nomen.iupac.rules.chain.Chain;
import com.nomen.iupac.rules.group.FunctionalGroup;

/**
 * Counts principal characteristic groups a candidate parent could carry as suffixes.
 */
final class CandidateGroups {

    private CandidateGroups() {
    }

    static int count(NamingState state, RingSystem ring) {
        int count = 0;
        for (FunctionalGroup group : state.principalGroups()) {
            if (group.expressedAt(state.molecule(), ring::contains, true) >= 0) {
                count++;
            }
        }
        return count;
    }

    static int count(NamingState state, Chain chain) {
        int count = 0;
        for (FunctionalGroup group : state.principalGroups()) {
            if (group.expressedAt(state.molecule(), chain::contains, false) >= 0) {
                count++;
            }
        }
        return count;
    }
}
