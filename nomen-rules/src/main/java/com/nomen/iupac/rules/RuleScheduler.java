/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.rules;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs naming rules over a {@link NamingState} in priority order.
 *
 * <h2>Execution</h2>
 * <p>Each rule is considered once. An eligible rule's action replaces the
 * state and one {@link AuditEntry} is appended. The pass stops as soon as a
 * parent structure is fixed. If none is fixed after the last rule a conflict
 * is logged; the caller then falls back to a generic name.
 *
 * <h2>Tracing</h2>
 * <p>One span {@code iupac.rules} per run. Applied rules become
 * {@code rule.applied} events, new conflicts {@code rule.conflict} events.
 *
 * <p>Thread-safe: the scheduler holds no per-run state.
 */
public final class RuleScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RuleScheduler.class);

    static final AttributeKey<String> RULE_ID = AttributeKey.stringKey("rule.id");
    static final AttributeKey<String> RULE_PHASE = AttributeKey.stringKey("rule.phase");
    static final AttributeKey<String> RULE_RATIONALE = AttributeKey.stringKey("rule.rationale");
    static final AttributeKey<String> CONFLICT_DESCRIPTION = AttributeKey.stringKey("conflict.description");

    private final List<NamingRule> rules;
    private final Tracer tracer;

    public RuleScheduler(List<NamingRule> rules, Tracer tracer) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        List<NamingRule> ordered = new ArrayList<>(rules);
        ordered.sort(NamingRule.EXECUTION_ORDER);
        this.rules = List.copyOf(ordered);
        logger.info("RuleScheduler initialized with {} rules", this.rules.size());
    }

    public RuleScheduler(List<NamingRule> rules) {
        this(rules, OpenTelemetry.noop().getTracer("nomen-rules"));
    }

    /**
     * Rules in execution order.
     */
    public List<NamingRule> rules() {
        return rules;
    }

    public NamingState run(NamingState initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        Span span = tracer.spanBuilder("iupac.rules").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            NamingState state = initial;
            for (NamingRule rule : rules) {
                if (state.parentStructure().isPresent()) {
                    break;
                }
                if (!rule.condition().test(state)) {
                    continue;
                }
                int conflictsBefore = state.conflicts().size();
                Transition transition = rule.action().apply(state);
                AuditEntry entry = new AuditEntry(rule.id(), rule.blueBookReference(), rule.phase(),
                    transition.rationale());
                state = transition.state().record(entry);
                span.addEvent("rule.applied", Attributes.of(
                    RULE_ID, entry.ruleId(),
                    RULE_PHASE, entry.phase().name(),
                    RULE_RATIONALE, entry.rationale()));
                logger.debug("Applied {} [{}]: {}", entry.ruleId(), entry.phase(), entry.rationale());
                emitConflicts(span, state.conflicts().subList(conflictsBefore, state.conflicts().size()));
            }
            if (state.parentStructure().isEmpty()) {
                Conflict conflict = new Conflict("scheduler", "no rule could fix a parent structure");
                state = state.withConflict(conflict);
                emitConflicts(span, List.of(conflict));
            }
            span.setAttribute("rules.applied", state.auditTrail().size() - initial.auditTrail().size());
            return state;
        } finally {
            span.end();
        }
    }

    private static void emitConflicts(Span span, List<Conflict> conflicts) {
        for (Conflict conflict : conflicts) {
            span.addEvent("rule.conflict", Attributes.of(
                RULE_ID, conflict.ruleId(),
                CONFLICT_DESCRIPTION, conflict.description()));
            logger.debug("Conflict in {}: {}", conflict.ruleId(), conflict.description());
        }
    }
}
