package com.vidnyan.conclint.adapter.out.evaluator.dispatch;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames.BlockingCategory;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects calls from the blocking registry (Thread.sleep, JDBC, blocking I/O, ...)
 * made from a coroutine body or a suspend function.
 */
@Component
public class BlockingCallInCoroutineEvaluator extends CoroutineRuleEvaluator {

    public BlockingCallInCoroutineEvaluator() {
        super("DISPATCH_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.calls();
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<BlockingCategory> category = context.patterns().blockingCategory(call);
        if (category.isEmpty() || !context.patterns().isInSuspendContext(call)) {
            return;
        }
        findings.add(finding(rule, call, Map.of(
                "call", context.patterns().qualifiedName(call),
                "hint", category.get().hint())));
    }
}
