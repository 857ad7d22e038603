package com.nomen.iupac.api.model;

/**
 * Defines the detail level of the audit trail surfaced with a name.
 */
public enum TraceLevel {
    /**
     * No trace. {@link NamingResult#trace()} is {@code null}.
     */
    NONE,

    /**
     * Ids of the rules that fired, in order.
     */
    BASIC,

    /**
     * Rule ids with phase and rationale, plus the conflict log.
     */
    STANDARD,

    /**
     * Everything in STANDARD plus candidate summaries (ring systems, chains,
     * functional groups) and the chosen numbering.
     */
    FULL
}
