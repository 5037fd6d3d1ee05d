package com.vidnyan.conclint.domain.classify;

import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.ScopeReference.Kind;

import java.util.Optional;

/**
 * Classifies the receiver of a launch call.
 * <p>
 * Checks run in a fixed order and the first match wins: the unscoped global,
 * framework scope names and factories, a declaration annotated as structured scope,
 * then an inline scope construction. Anything else is {@link Kind#UNCLASSIFIED}.
 */
public class ScopeClassifier {

    private final AnalysisConfig config;

    public ScopeClassifier(AnalysisConfig config) {
        this.config = config;
    }

    public ScopeReference classify(SyntaxNode receiver) {
        if (receiver == null) {
            return ScopeReference.unclassified("");
        }
        if (receiver.isReference(CoroutineNames.GLOBAL_SCOPE)) {
            return new ScopeReference(Kind.UNSCOPED_GLOBAL, CoroutineNames.GLOBAL_SCOPE);
        }

        Optional<ScopeReference> framework = frameworkScope(receiver);
        if (framework.isPresent()) {
            return framework.get();
        }

        Optional<SyntaxNode> declaration = declarationOf(receiver);
        if (declaration.isPresent()) {
            SyntaxNode decl = declaration.get();
            Optional<SyntaxNode> initializer = decl.child(Role.INITIALIZER);
            if (initializer.isPresent() && initializer.get().is(NodeKind.CALL_EXPRESSION)
                    && config.frameworkScopeFactories().contains(initializer.get().calleeName())) {
                return new ScopeReference(Kind.FRAMEWORK_SCOPE, initializer.get().calleeName());
            }
            if (decl.hasAnnotation(CoroutineNames.SCOPE_ANNOTATION)) {
                return new ScopeReference(Kind.ANNOTATED_SCOPE, decl.name());
            }
        }

        if (receiver.isCall(CoroutineNames.SCOPE_CONSTRUCTOR)) {
            return new ScopeReference(Kind.INLINE_SCOPE_CONSTRUCTION, CoroutineNames.SCOPE_CONSTRUCTOR);
        }
        return ScopeReference.unclassified(receiver.referenceText());
    }

    private Optional<ScopeReference> frameworkScope(SyntaxNode receiver) {
        if (receiver.is(NodeKind.NAME_REFERENCE) && config.frameworkScopes().contains(receiver.name())) {
            return Optional.of(new ScopeReference(Kind.FRAMEWORK_SCOPE, receiver.name()));
        }
        if (receiver.is(NodeKind.CALL_EXPRESSION) && config.frameworkScopeFactories().contains(receiver.calleeName())) {
            return Optional.of(new ScopeReference(Kind.FRAMEWORK_SCOPE, receiver.calleeName()));
        }
        return Optional.empty();
    }

    /**
     * Declaration behind a plain or {@code this.}-qualified name.
     */
    private Optional<SyntaxNode> declarationOf(SyntaxNode receiver) {
        if (!receiver.is(NodeKind.NAME_REFERENCE)) {
            return Optional.empty();
        }
        Optional<SyntaxNode> qualifier = receiver.receiver();
        if (qualifier.isEmpty()) {
            return Declarations.resolve(receiver, receiver.name());
        }
        if (qualifier.get().isReference(CoroutineNames.THIS)) {
            return Declarations.classMember(receiver, receiver.name());
        }
        return Optional.empty();
    }
}
