package com.vidnyan.conclint.domain.ast;

/**
 * Slot a node occupies inside its parent.
 */
public enum Role {
    ROOT,
    DECLARATION,
    MEMBER,
    PARAMETER,
    BODY,
    INITIALIZER,
    STATEMENT,
    RECEIVER,
    ARGUMENT,
    TRAILING_LAMBDA,
    TRY_BLOCK,
    CATCH,
    FINALLY,
    CONDITION,
    THEN,
    ELSE,
    TARGET,
    VALUE,
    OPERAND,
    OTHER
}
