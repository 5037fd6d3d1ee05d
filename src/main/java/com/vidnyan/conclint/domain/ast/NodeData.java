package com.vidnyan.conclint.domain.ast;

import java.util.List;
import java.util.Set;

/**
 * Attributes carried by a syntax node besides its kind and position.
 * <p>
 * {@code name} is the callee for calls, the identifier for references and declarations,
 * the bound parameter for catch clauses and the keyword for loops.
 * {@code typeName} is the declared or caught type, when the host knows it.
 */
public record NodeData(
    String name,
    String typeName,
    String text,
    Set<Modifier> modifiers,
    List<String> annotations,
    List<String> supertypes
) {

    public static final NodeData EMPTY = new NodeData(null, null, null, Set.of(), List.of(), List.of());

    public NodeData {
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        supertypes = supertypes == null ? List.of() : List.copyOf(supertypes);
    }

    public static NodeData named(String name) {
        return new NodeData(name, null, null, Set.of(), List.of(), List.of());
    }
}
