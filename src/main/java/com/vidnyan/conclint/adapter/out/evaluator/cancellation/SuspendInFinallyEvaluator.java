package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.CoroutinePatterns;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Detects suspending calls in a finally block of a coroutine that are not wrapped in
 * {@code withContext(NonCancellable)}. Once cancelled they throw immediately and the cleanup is skipped.
 */
@Component
public class SuspendInFinallyEvaluator extends CoroutineRuleEvaluator {

    public SuspendInFinallyEvaluator() {
        super("CANCEL_004");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.calls();
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        CoroutinePatterns patterns = context.patterns();
        if (!isSuspending(call, context)) {
            return;
        }
        if (!patterns.isWithinFinally(call) || !patterns.isInSuspendContext(call)) {
            return;
        }
        if (patterns.isWrappedInNonCancellableContext(call)) {
            return;
        }
        findings.add(finding(rule, call, Map.of("call", call.calleeName())));
    }

    private boolean isSuspending(SyntaxNode call, RuleContext context) {
        String name = call.calleeName();
        return CoroutineNames.KNOWN_SUSPEND_CALLS.contains(name)
                || context.patterns().isCooperationPoint(call)
                || context.isLocalSuspendFunction(name);
    }
}
