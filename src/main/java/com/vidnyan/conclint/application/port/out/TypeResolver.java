package com.vidnyan.conclint.application.port.out;

import com.vidnyan.conclint.domain.ast.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Port for the optional name-resolution shim a host may provide.
 * Implemented by adapters that have access to type information; the name-based
 * fallback accepts missed detections on shadowed or aliased names.
 */
public interface TypeResolver {

    /**
     * Function declaration a node belongs to.
     */
    Optional<SyntaxNode> enclosingFunction(SyntaxNode node);

    /**
     * Supertypes of a class declaration, as simple or qualified names without type arguments.
     */
    List<String> supertypes(SyntaxNode classDeclaration);
}
