package com.vidnyan.conclint.adapter.out.evaluator.lifecycle;

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
 * Detects flows collected in {@code lifecycleScope.launch { }} without
 * {@code repeatOnLifecycle} or {@code flowWithLifecycle}; collection keeps running in the background.
 */
@Component
public class LifecycleAwareFlowCollectionEvaluator extends CoroutineRuleEvaluator {

    public LifecycleAwareFlowCollectionEvaluator() {
        super("ARCH_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.LIFECYCLE_LAUNCHERS);
    }

    @Override
    protected void check(SyntaxNode launch, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        boolean onLifecycleScope = launch.receiver()
                .map(r -> r.isReference(CoroutineNames.LIFECYCLE_SCOPE))
                .orElse(false);
        Optional<SyntaxNode> lambda = launch.lambdaArgument();
        if (!onLifecycleScope || lambda.isEmpty()) {
            return;
        }
        List<SyntaxNode> calls = lambda.get().descendantsOfKind(NodeKind.CALL_EXPRESSION);
        boolean collects = calls.stream().anyMatch(c -> c.isCallTo(CoroutineNames.FLOW_COLLECTORS));
        boolean lifecycleSafe = calls.stream().anyMatch(c -> c.isCallTo(CoroutineNames.LIFECYCLE_SAFE_COLLECTION));
        if (collects && !lifecycleSafe) {
            findings.add(finding(rule, launch, Map.of("builder", launch.calleeName())));
        }
    }
}
