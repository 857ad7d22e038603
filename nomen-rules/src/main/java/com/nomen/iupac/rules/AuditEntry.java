package com.nomen.iupac.rules;

import java.util.Objects;

/**
 * One applied rule in the audit trail of a {@link NamingState}.
 */
public record AuditEntry(String ruleId, String blueBookReference, ExecutionPhase phase, String rationale) {

    public AuditEntry {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        blueBookReference = blueBookReference == null ? "" : blueBookReference;
        rationale = rationale == null ? "" : rationale;
    }
}
