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

/**
 * Detects domain errors extending CancellationException; they are silently
 * treated as cancellation instead of failing the parent.
 */
@Component
public class CancellationSubclassEvaluator extends CoroutineRuleEvaluator {

    public CancellationSubclassEvaluator() {
        super("EXCEPT_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.nodesOfKind(NodeKind.CLASS_DECLARATION);
    }

    @Override
    protected void check(SyntaxNode declaration, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        boolean extendsCancellation = context.supertypes(declaration).stream()
                .anyMatch(type -> type.equals(CoroutineNames.CANCELLATION_EXCEPTION)
                        || type.endsWith("." + CoroutineNames.CANCELLATION_EXCEPTION));
        if (extendsCancellation) {
            findings.add(finding(rule, declaration, Map.of("class", declaration.name())));
        }
    }
}
