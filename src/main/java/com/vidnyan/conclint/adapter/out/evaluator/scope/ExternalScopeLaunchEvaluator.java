package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.Declarations;
import com.vidnyan.conclint.domain.classify.ScopeReference;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects suspend functions that launch into a scope owned by their class
 * instead of the caller's scope, escaping the caller's structured concurrency.
 */
@Component
public class ExternalScopeLaunchEvaluator extends CoroutineRuleEvaluator {

    public ExternalScopeLaunchEvaluator() {
        super("SCOPE_005");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.TASK_LAUNCHERS);
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> function = context.enclosingFunction(call);
        if (function.isEmpty() || !context.patterns().isSuspendable(function.get())) {
            return;
        }
        Optional<String> receiverName = call.receiver().flatMap(this::memberName);
        if (receiverName.isEmpty()) {
            return;
        }
        ScopeReference scope = context.scopes().classify(call.receiver().get());
        if (scope.is(ScopeReference.Kind.FRAMEWORK_SCOPE)) {
            return;
        }
        // a local or parameter of the same name shadows the class member
        Optional<SyntaxNode> declaration = call.receiver().get().receiver().isPresent()
                ? Declarations.classMember(call, receiverName.get())
                : Declarations.resolve(call.receiver().get(), receiverName.get());
        boolean isClassMember = declaration
                .flatMap(SyntaxNode::parent)
                .map(owner -> owner.is(NodeKind.CLASS_DECLARATION))
                .orElse(false);
        if (isClassMember) {
            findings.add(finding(rule, call, Map.of(
                    "builder", call.calleeName(),
                    "scope", receiverName.get(),
                    "function", function.get().name())));
        }
    }

    private Optional<String> memberName(SyntaxNode receiver) {
        if (!receiver.is(NodeKind.NAME_REFERENCE)) {
            return Optional.empty();
        }
        Optional<SyntaxNode> qualifier = receiver.receiver();
        if (qualifier.isEmpty() || qualifier.get().isReference(CoroutineNames.THIS)) {
            return Optional.of(receiver.name());
        }
        return Optional.empty();
    }
}
