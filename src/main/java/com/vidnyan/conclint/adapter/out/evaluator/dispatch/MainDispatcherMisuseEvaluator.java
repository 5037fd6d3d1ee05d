package com.vidnyan.conclint.adapter.out.evaluator.dispatch;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.CoroutineNames.BlockingCategory;
import com.vidnyan.conclint.domain.classify.CoroutinePatterns;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects blocking calls running on {@code Dispatchers.Main}.
 * A nested builder that switches to another context takes the call off the main thread.
 */
@Component
public class MainDispatcherMisuseEvaluator extends CoroutineRuleEvaluator {

    public MainDispatcherMisuseEvaluator() {
        super("DISPATCH_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.CONTEXT_TAKING_BUILDERS);
    }

    @Override
    protected void check(SyntaxNode builder, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        CoroutinePatterns patterns = context.patterns();
        if (builder.arguments().stream().noneMatch(arg -> patterns.denotesDispatcher(arg, CoroutineNames.MAIN))) {
            return;
        }
        Optional<SyntaxNode> lambda = builder.lambdaArgument();
        if (lambda.isEmpty()) {
            return;
        }
        for (SyntaxNode call : lambda.get().descendantsOfKind(NodeKind.CALL_EXPRESSION)) {
            Optional<BlockingCategory> category = patterns.blockingCategory(call);
            if (category.isPresent() && !leavesMain(call, lambda.get(), patterns)) {
                findings.add(finding(rule, call, Map.of(
                        "call", patterns.qualifiedName(call),
                        "builder", builder.calleeName(),
                        "hint", category.get().hint())));
            }
        }
    }

    // a builder between the call and the Main block that names any other context
    private boolean leavesMain(SyntaxNode call, SyntaxNode mainLambda, CoroutinePatterns patterns) {
        for (SyntaxNode ancestor : call.ancestors()) {
            if (ancestor.equals(mainLambda)) {
                return false;
            }
            if (ancestor.isCallTo(CoroutineNames.CONTEXT_TAKING_BUILDERS)
                    && ancestor.lambdaArgument().map(l -> l.contains(call)).orElse(false)
                    && ancestor.arguments().stream()
                            .anyMatch(arg -> !arg.is(NodeKind.LAMBDA_EXPRESSION)
                                    && !patterns.denotesDispatcher(arg, CoroutineNames.MAIN))) {
                return true;
            }
        }
        return false;
    }
}
