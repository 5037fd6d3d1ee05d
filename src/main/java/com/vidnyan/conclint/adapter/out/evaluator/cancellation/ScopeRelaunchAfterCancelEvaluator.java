package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
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
 * Detects {@code scope.cancel()} followed in the same function by {@code scope.launch}/{@code scope.async}.
 * A cancelled scope silently refuses new children.
 * <p>
 * Receivers are compared by source text, without alias or branch analysis.
 */
@Component
public class ScopeRelaunchAfterCancelEvaluator extends CoroutineRuleEvaluator {

    public ScopeRelaunchAfterCancelEvaluator() {
        super("CANCEL_005");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.CANCEL);
    }

    @Override
    protected void check(SyntaxNode cancel, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> receiver = cancel.receiver();
        Optional<SyntaxNode> function = context.enclosingFunction(cancel);
        if (receiver.isEmpty() || function.isEmpty()) {
            return;
        }
        String scope = receiver.get().referenceText();
        for (SyntaxNode call : function.get().descendantsOfKind(NodeKind.CALL_EXPRESSION)) {
            if (context.patterns().isTaskLaunch(call)
                    && cancel.precedes(call)
                    && call.receiver().map(r -> r.referenceText().equals(scope)).orElse(false)) {
                findings.add(finding(rule, cancel, Map.of(
                        "scope", scope,
                        "builder", call.calleeName())));
                return;
            }
        }
    }
}
