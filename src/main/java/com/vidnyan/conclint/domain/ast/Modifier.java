package com.vidnyan.conclint.domain.ast;

/**
 * Declaration modifiers relevant to the rules.
 */
public enum Modifier {
    SUSPEND,
    PRIVATE,
    OVERRIDE,
    INLINE
}
