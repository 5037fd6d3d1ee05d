package com.vidnyan.conclint.adapter.out.evaluator.dispatch;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects {@code Dispatchers.Unconfined} passed as context to launch, async or withContext.
 */
@Component
public class UnconfinedDispatcherEvaluator extends CoroutineRuleEvaluator {

    public UnconfinedDispatcherEvaluator() {
        super("DISPATCH_003");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.nodesOfKind(NodeKind.NAME_REFERENCE).stream()
                .filter(ref -> CoroutineNames.UNCONFINED.equals(ref.name()))
                .toList();
    }

    @Override
    protected void check(SyntaxNode ref, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        if (!context.patterns().denotesDispatcher(ref, CoroutineNames.UNCONFINED)) {
            return;
        }
        builderTakingAsContext(ref)
                .ifPresent(builder -> findings.add(finding(rule, ref, Map.of("builder", builder.calleeName()))));
    }

    // climbs through "+" combinations to the argument slot of the call
    private Optional<SyntaxNode> builderTakingAsContext(SyntaxNode ref) {
        SyntaxNode current = ref;
        while (current.role() == Role.OPERAND
                && current.parent().map(p -> p.is(NodeKind.BINARY_EXPRESSION)).orElse(false)) {
            current = current.parent().get();
        }
        if (current.role() != Role.ARGUMENT) {
            return Optional.empty();
        }
        return current.parent().filter(p -> p.isCallTo(CoroutineNames.CONTEXT_TAKING_BUILDERS));
    }
}
