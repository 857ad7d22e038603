/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A naming rule as data.
 *
 * <p>The scheduler evaluates {@code condition} against the current state and,
 * when it holds, replaces the state with the one returned by {@code action}.
 * Higher {@code priority} runs earlier; equal priorities run in id order.
 *
 * @param id                stable identifier, also used in the audit trail
 * @param blueBookReference IUPAC recommendation section the rule implements
 * @param priority          higher runs first
 * @param phase             stage of parent selection
 * @param condition         eligibility test, must not mutate anything
 * @param action            state transition
 */
public record NamingRule(
    String id,
    String blueBookReference,
    int priority,
    ExecutionPhase phase,
    Predicate<NamingState> condition,
    Function<NamingState, Transition> action
) {

    /**
     * Scheduler order: priority descending, then id.
     */
    public static final Comparator<NamingRule> EXECUTION_ORDER =
        Comparator.comparingInt(NamingRule::priority).reversed().thenComparing(NamingRule::id);

    public NamingRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        blueBookReference = blueBookReference == null ? "" : blueBookReference;
    }

    @Override
    public String toString() {
        return id + " (" + blueBookReference + ", priority " + priority + ")";
    }
}
