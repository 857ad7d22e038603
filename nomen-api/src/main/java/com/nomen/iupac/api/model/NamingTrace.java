/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Audit trail of one naming run.
 *
 * <p>Every state transition of the rule engine appends one {@link AppliedRule};
 * the trace surfaces them according to the requested {@link TraceLevel}.
 * Conflicts are structural problems the engine worked around (for example no
 * candidate parent at all) and are listed in the order they were detected.
 */
public record NamingTrace(
    @JsonProperty("level") TraceLevel level,
    @JsonProperty("total_duration_nanos") long totalDurationNanos,
    @JsonProperty("applied_rules") List<AppliedRule> appliedRules,
    @JsonProperty("conflicts") List<String> conflicts,
    @JsonProperty("parent_kind") String parentKind,
    @JsonProperty("parent_name") String parentName,
    @JsonProperty("candidate_summaries") List<String> candidateSummaries
) implements Serializable {

    public NamingTrace {
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        candidateSummaries = candidateSummaries == null ? List.of() : List.copyOf(candidateSummaries);
    }

    /**
     * One rule application.
     */
    public record AppliedRule(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("blue_book_reference") String blueBookReference,
        @JsonProperty("phase") String phase,
        @JsonProperty("rationale") String rationale
    ) implements Serializable {

        /**
         * Returns a human-readable description of this entry.
         */
        public String describe() {
            if (rationale == null || rationale.isEmpty()) {
                return String.format("%s [%s]", ruleId, phase);
            }
            return String.format("%s [%s] %s", ruleId, phase, rationale);
        }
    }

    /**
     * Rule ids in application order.
     */
    public List<String> ruleIds() {
        return appliedRules.stream().map(AppliedRule::ruleId).toList();
    }

    public double totalDurationMicros() {
        return totalDurationNanos / 1000.0;
    }
}
