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
 * Detects {@code runBlocking} called from suspend context, where it blocks the
 * thread the calling coroutine runs on.
 * Program entry points ({@code main}) and test functions are exempt.
 */
@Component
public class RunBlockingInSuspendEvaluator extends CoroutineRuleEvaluator {

    private static final String ENTRY_POINT = "main";
    private static final String TEST_ANNOTATION = "Test";

    public RunBlockingInSuspendEvaluator() {
        super("RUNBLOCK_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.RUN_BLOCKING);
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> enclosing = context.patterns().enclosingFunctionLike(call);
        if (enclosing.isEmpty() || !context.patterns().isSuspendable(enclosing.get())) {
            return;
        }
        Optional<SyntaxNode> named = context.enclosingFunction(call);
        if (named.isPresent() && isEntryPoint(named.get())) {
            return;
        }
        String where = named.filter(f -> context.patterns().isSuspendable(f))
                .map(f -> "suspend function '" + f.name() + "'")
                .orElse("a coroutine");
        findings.add(finding(rule, call, Map.of("function", where)));
    }

    private boolean isEntryPoint(SyntaxNode function) {
        return ENTRY_POINT.equals(function.name()) || function.hasAnnotation(TEST_ANNOTATION);
    }
}
