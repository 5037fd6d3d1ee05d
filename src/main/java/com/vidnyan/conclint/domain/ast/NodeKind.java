package com.vidnyan.conclint.domain.ast;

/**
 * Kinds of syntax nodes the engine understands.
 * Host adapters map their concrete trees onto these; anything else becomes {@link #OTHER}.
 */
public enum NodeKind {
    FILE(false),
    CLASS_DECLARATION(true),
    FUNCTION_DECLARATION(true),
    PARAMETER(true),
    PROPERTY_DECLARATION(true),
    BLOCK(false),
    CALL_EXPRESSION(true),
    LAMBDA_EXPRESSION(false),
    NAME_REFERENCE(true),
    TRY_EXPRESSION(false),
    CATCH_CLAUSE(false),
    LOOP_EXPRESSION(false),
    IF_EXPRESSION(false),
    THROW_EXPRESSION(false),
    ASSIGNMENT(false),
    BINARY_EXPRESSION(false),
    RETURN_EXPRESSION(false),
    LITERAL(false),
    OTHER(false);

    private final boolean nameRequired;

    NodeKind(boolean nameRequired) {
        this.nameRequired = nameRequired;
    }

    /**
     * Whether a node of this kind is malformed without a name.
     */
    public boolean isNameRequired() {
        return nameRequired;
    }
}
