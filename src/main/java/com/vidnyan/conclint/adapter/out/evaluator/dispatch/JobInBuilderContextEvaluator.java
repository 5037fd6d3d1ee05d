package com.vidnyan.conclint.adapter.out.evaluator.dispatch;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
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
 * Detects a fresh {@code Job()} or {@code SupervisorJob()} passed as builder context,
 * which detaches the new coroutine from its parent.
 */
@Component
public class JobInBuilderContextEvaluator extends CoroutineRuleEvaluator {

    public JobInBuilderContextEvaluator() {
        super("DISPATCH_004");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.CONTEXT_TAKING_BUILDERS);
    }

    @Override
    protected void check(SyntaxNode builder, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        for (SyntaxNode argument : builder.arguments()) {
            Optional<SyntaxNode> job = freshJob(argument);
            if (job.isPresent()) {
                findings.add(finding(rule, builder, Map.of(
                        "builder", builder.calleeName(),
                        "job", job.get().calleeName() + "()")));
                return;
            }
        }
    }

    private Optional<SyntaxNode> freshJob(SyntaxNode expression) {
        if (expression.is(NodeKind.CALL_EXPRESSION) && expression.receiver().isEmpty()
                && CoroutineNames.JOB_CONSTRUCTORS.contains(expression.calleeName())) {
            return Optional.of(expression);
        }
        if (expression.is(NodeKind.BINARY_EXPRESSION)) {
            for (SyntaxNode operand : expression.children(Role.OPERAND)) {
                Optional<SyntaxNode> job = freshJob(operand);
                if (job.isPresent()) {
                    return job;
                }
            }
        }
        return Optional.empty();
    }
}
