package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.ScopeReference;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Detects {@code GlobalScope.launch} / {@code GlobalScope.async}.
 * Work started on the global scope has no owner to cancel it.
 */
@Component
public class UnscopedLaunchEvaluator extends CoroutineRuleEvaluator {

    public UnscopedLaunchEvaluator() {
        super("SCOPE_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.TASK_LAUNCHERS);
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        call.receiver()
                .map(receiver -> context.scopes().classify(receiver))
                .filter(scope -> scope.is(ScopeReference.Kind.UNSCOPED_GLOBAL))
                .ifPresent(scope -> findings.add(finding(rule, call, Map.of("builder", call.calleeName()))));
    }
}
