package com.vidnyan.conclint.domain.rule;

import java.util.Map;

/**
 * Rule definition - describes what a rule reports and how.
 * Immutable value object loaded from the JSON rule catalog.
 */
public record RuleDefinition(
    String id,
    String name,
    String description,
    Severity severity,
    Category category,
    String messageTemplate,
    String docAnchor,
    boolean isEnabled
) {

    public enum Severity {
        ERROR,      // Breaks structured concurrency, should fail the build
        WARNING,    // Likely bug or performance problem
        INFO;       // Engine notices, e.g. a rule that failed on a file

        /**
         * Lower-case label used in rendered findings.
         */
        public String label() {
            return name().toLowerCase();
        }
    }

    public enum Category {
        SCOPE,
        RUN_BLOCKING,
        DISPATCHER,
        CANCELLATION,
        EXCEPTION,
        CHANNEL,
        FLOW,
        TEST,
        ARCHITECTURE,
        ENGINE
    }

    /**
     * Render the message template with {@code {placeholder}} values.
     * The result always starts with {@code [id]}.
     */
    public String formatMessage(Map<String, ?> values) {
        String message = messageTemplate != null && !messageTemplate.isBlank() ? messageTemplate : description;
        if (message == null) {
            message = name;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            message = message.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return Finding.withCode(id, message);
    }

    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity = Severity.WARNING;
        private Category category = Category.SCOPE;
        private String messageTemplate;
        private String docAnchor;
        private boolean isEnabled = true;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder messageTemplate(String template) { this.messageTemplate = template; return this; }
        public Builder docAnchor(String anchor) { this.docAnchor = anchor; return this; }
        public Builder isEnabled(boolean enabled) { this.isEnabled = enabled; return this; }

        public RuleDefinition build() {
            return new RuleDefinition(id, name, description, severity, category,
                    messageTemplate, docAnchor, isEnabled);
        }
    }
}
