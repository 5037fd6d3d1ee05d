package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.CoroutinePatterns;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects loops in suspend context that never reach a cooperation point
 * (yield, ensureActive, delay, or another suspending call) and so cannot be cancelled.
 * <p>
 * Calls inside nested functions and launched coroutines do not count, they run elsewhere.
 */
@Component
public class LoopWithoutCooperationEvaluator extends CoroutineRuleEvaluator {

    public LoopWithoutCooperationEvaluator() {
        super("CANCEL_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.nodesOfKind(NodeKind.LOOP_EXPRESSION);
    }

    @Override
    protected void check(SyntaxNode loop, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        CoroutinePatterns patterns = context.patterns();
        if (!patterns.isInSuspendContext(loop)) {
            return;
        }
        Optional<SyntaxNode> body = loop.body();
        if (body.isEmpty()) {
            return;
        }
        for (SyntaxNode call : body.get().descendantsOfKind(NodeKind.CALL_EXPRESSION)) {
            if (runsElsewhere(call, loop, patterns)) {
                continue;
            }
            if (patterns.isCooperationPoint(call) || patterns.looksSuspending(call)
                    || context.isLocalSuspendFunction(call.calleeName())) {
                return;
            }
        }
        String keyword = loop.name() != null ? loop.name() : "loop";
        findings.add(finding(rule, loop, Map.of("loop", keyword)));
    }

    private boolean runsElsewhere(SyntaxNode call, SyntaxNode loop, CoroutinePatterns patterns) {
        for (SyntaxNode ancestor : call.ancestors()) {
            if (ancestor.equals(loop)) {
                return false;
            }
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION)) {
                return true;
            }
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION)
                    && patterns.isLambdaOf(ancestor, CoroutineNames.TASK_LAUNCHERS)) {
                return true;
            }
        }
        return false;
    }
}
