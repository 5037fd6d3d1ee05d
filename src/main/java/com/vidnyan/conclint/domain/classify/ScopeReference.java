package com.vidnyan.conclint.domain.classify;

/**
 * Classification of the receiver of a task-launch call.
 * Exactly one kind is assigned per analyzed receiver.
 *
 * @param kind which class of scope the receiver denotes
 * @param name the name that decided the classification, or the receiver text when unclassified
 */
public record ScopeReference(Kind kind, String name) {

    public enum Kind {
        UNSCOPED_GLOBAL,
        FRAMEWORK_SCOPE,
        ANNOTATED_SCOPE,
        INLINE_SCOPE_CONSTRUCTION,
        UNCLASSIFIED
    }

    public static ScopeReference unclassified(String text) {
        return new ScopeReference(Kind.UNCLASSIFIED, text);
    }

    public boolean is(Kind other) {
        return kind == other;
    }
}
