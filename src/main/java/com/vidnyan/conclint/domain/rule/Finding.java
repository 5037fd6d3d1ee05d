package com.vidnyan.conclint.domain.rule;

import com.vidnyan.conclint.domain.model.Location;

import java.util.Comparator;

/**
 * A reported rule violation.
 * Immutable value object; the message always starts with {@code [ruleId]}.
 */
public record Finding(
    String ruleId,
    String ruleName,
    RuleDefinition.Severity severity,
    String message,
    Location location,
    String docAnchor
) {

    public static final String RULE_FAILED_ID = "ENGINE_001";

    /**
     * Source position first, rule id as tie-break.
     */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::location, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Finding::ruleId)
            .thenComparing(Finding::message);

    public Finding {
        message = withCode(ruleId, message);
    }

    static String withCode(String ruleId, String message) {
        String prefix = "[" + ruleId + "]";
        if (message == null || message.isBlank()) {
            return prefix;
        }
        return message.startsWith(prefix) ? message : prefix + " " + message;
    }

    /**
     * Informational finding recording that a rule crashed on one file.
     */
    public static Finding ruleFailed(RuleDefinition rule, String filePath, Throwable error) {
        return new Finding(
                RULE_FAILED_ID,
                "RuleFailed",
                RuleDefinition.Severity.INFO,
                String.format("Rule %s (%s) failed on this file: %s",
                        rule.id(), rule.name(), error.getClass().getSimpleName()
                                + (error.getMessage() != null ? ": " + error.getMessage() : "")),
                Location.at(filePath, 1, 1),
                null);
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String ruleName;
        private RuleDefinition.Severity severity = RuleDefinition.Severity.WARNING;
        private String message;
        private Location location;
        private String docAnchor;

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder severity(RuleDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder docAnchor(String anchor) { this.docAnchor = anchor; return this; }

        public Finding build() {
            return new Finding(ruleId, ruleName, severity, message, location, docAnchor);
        }
    }
}
