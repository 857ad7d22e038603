package com.nomen.iupac.rules;

import java.util.Objects;

/**
 * Result of a rule action: the replacement state and why it was produced.
 */
public record Transition(NamingState state, String rationale) {

    public Transition {
        Objects.requireNonNull(state, "state must not be null");
    }

    public static Transition of(NamingState state, String rationale) {
        return new Transition(state, rationale);
    }

    public static Transition of(NamingState state, String format, Object... args) {
        return new Transition(state, String.format(format, args));
    }
}
