package com.vidnyan.conclint.adapter.out.evaluator.flow;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.CoroutineNames.BlockingCategory;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects blocking calls inside a {@code flow { }} builder, which runs on the collector's dispatcher.
 */
@Component
public class FlowBlockingCallEvaluator extends CoroutineRuleEvaluator {

    public FlowBlockingCallEvaluator() {
        super("FLOW_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.calls();
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<BlockingCategory> category = context.patterns().blockingCategory(call);
        if (category.isEmpty()) {
            return;
        }
        if (context.patterns().enclosingLambdaOf(call, CoroutineNames.FLOW_BUILDERS).isPresent()) {
            findings.add(finding(rule, call, Map.of(
                    "call", context.patterns().qualifiedName(call),
                    "hint", category.get().hint())));
        }
    }
}
