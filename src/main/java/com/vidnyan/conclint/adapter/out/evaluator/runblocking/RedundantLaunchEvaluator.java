package com.vidnyan.conclint.adapter.out.evaluator.runblocking;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
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
 * Detects {@code coroutineScope { launch { ... } }} where the single launch is the whole body.
 * The scope already waits for its block, so the extra coroutine adds nothing.
 */
@Component
public class RedundantLaunchEvaluator extends CoroutineRuleEvaluator {

    public RedundantLaunchEvaluator() {
        super("RUNBLOCK_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.STRUCTURED_BUILDERS);
    }

    @Override
    protected void check(SyntaxNode builder, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> lambda = builder.lambdaArgument();
        if (lambda.isEmpty()) {
            return;
        }
        List<SyntaxNode> statements = lambda.get().statements();
        if (statements.size() != 1) {
            return;
        }
        SyntaxNode only = statements.get(0);
        boolean ownScope = only.receiver().map(r -> r.isReference(CoroutineNames.THIS)).orElse(true);
        if (only.isCall(CoroutineNames.LAUNCH) && ownScope) {
            findings.add(finding(rule, only, Map.of("builder", builder.calleeName())));
        }
    }
}
