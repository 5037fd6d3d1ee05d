package com.vidnyan.conclint.domain.classify;

import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;

import java.util.Optional;

/**
 * Lexical lookup of the parameter or property a simple name refers to.
 * Purely syntactic: the innermost visible declaration with the same name wins.
 */
public final class Declarations {

    private Declarations() {
    }

    public static Optional<SyntaxNode> resolve(SyntaxNode use, String name) {
        if (name == null) {
            return Optional.empty();
        }
        SyntaxNode previous = use;
        for (SyntaxNode scope : use.ancestors()) {
            Optional<SyntaxNode> found = switch (scope.kind()) {
                case BLOCK -> localProperty(scope, name, previous);
                case FUNCTION_DECLARATION, LAMBDA_EXPRESSION -> named(scope, Role.PARAMETER, NodeKind.PARAMETER, name);
                case CLASS_DECLARATION -> named(scope, Role.PARAMETER, NodeKind.PARAMETER, name)
                        .or(() -> named(scope, Role.MEMBER, NodeKind.PROPERTY_DECLARATION, name));
                case FILE -> named(scope, Role.DECLARATION, NodeKind.PROPERTY_DECLARATION, name);
                default -> Optional.empty();
            };
            if (found.isPresent()) {
                return found;
            }
            previous = scope;
        }
        return Optional.empty();
    }

    /**
     * The class member or constructor parameter with the given name, if the node sits inside a class.
     */
    public static Optional<SyntaxNode> classMember(SyntaxNode use, String name) {
        for (SyntaxNode scope : use.ancestors()) {
            if (scope.is(NodeKind.CLASS_DECLARATION)) {
                return named(scope, Role.PARAMETER, NodeKind.PARAMETER, name)
                        .or(() -> named(scope, Role.MEMBER, NodeKind.PROPERTY_DECLARATION, name));
            }
        }
        return Optional.empty();
    }

    private static Optional<SyntaxNode> localProperty(SyntaxNode block, String name, SyntaxNode before) {
        SyntaxNode match = null;
        for (SyntaxNode statement : block.children()) {
            if (statement.equals(before) || before.precedes(statement)) {
                break;
            }
            if (statement.is(NodeKind.PROPERTY_DECLARATION) && name.equals(statement.name())) {
                match = statement;
            }
        }
        return Optional.ofNullable(match);
    }

    private static Optional<SyntaxNode> named(SyntaxNode owner, Role role, NodeKind kind, String name) {
        return owner.children(role).stream()
                .filter(n -> n.is(kind) && name.equals(n.name()))
                .findFirst();
    }
}
