package com.nomen.iupac.rules;

/**
 * A structurally required candidate that could not be produced, e.g. a ring
 * system no generator can name. Conflicts never abort naming.
 *
 * @param ruleId      rule that observed the conflict
 * @param description human-readable detail
 */
public record Conflict(String ruleId, String description) {
}
