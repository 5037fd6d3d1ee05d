package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

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
 * Detects {@code catch (e: Exception)} / {@code catch (e: Throwable)} in suspend context
 * that also catches CancellationException and thereby stops cancellation.
 * <p>
 * Not reported when an earlier catch handles CancellationException and rethrows it,
 * or when the broad catch itself rethrows or checks {@code ensureActive()}.
 */
@Component
public class CancellationSwallowedEvaluator extends CoroutineRuleEvaluator {

    public CancellationSwallowedEvaluator() {
        super("CANCEL_003");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.nodesOfKind(NodeKind.CATCH_CLAUSE);
    }

    @Override
    protected void check(SyntaxNode clause, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        String caught = clause.typeName();
        if (caught == null || !CoroutineNames.BROAD_CATCH_TYPES.contains(caught.trim())) {
            return;
        }
        if (!context.patterns().isInSuspendContext(clause)) {
            return;
        }
        Optional<SyntaxNode> tryExpression = clause.parent().filter(p -> p.is(NodeKind.TRY_EXPRESSION));
        if (tryExpression.isPresent() && hasEarlierCancellationRethrow(tryExpression.get(), clause)) {
            return;
        }
        if (rethrows(clause)) {
            return;
        }
        findings.add(finding(rule, clause, Map.of("type", caught.trim())));
    }

    private boolean hasEarlierCancellationRethrow(SyntaxNode tryExpression, SyntaxNode clause) {
        for (SyntaxNode sibling : tryExpression.children(Role.CATCH)) {
            if (sibling.equals(clause)) {
                return false;
            }
            String type = sibling.typeName();
            if (type != null && type.contains(CoroutineNames.CANCELLATION_EXCEPTION)
                    && !sibling.descendantsOfKind(NodeKind.THROW_EXPRESSION).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private boolean rethrows(SyntaxNode clause) {
        String parameter = clause.name();
        List<SyntaxNode> inside = clause.descendants();
        boolean mentionsCancellation = false;
        boolean throwsAnything = false;
        for (SyntaxNode node : inside) {
            if (node.isCall(CoroutineNames.ENSURE_ACTIVE)) {
                return true;
            }
            if (node.is(NodeKind.THROW_EXPRESSION)) {
                throwsAnything = true;
                Optional<SyntaxNode> thrown = node.child(Role.VALUE);
                if (parameter != null && thrown.isPresent() && thrown.get().isReference(parameter)
                        && thrown.get().receiver().isEmpty()) {
                    return true;
                }
            }
            if (node.isReference(CoroutineNames.CANCELLATION_EXCEPTION)
                    || CoroutineNames.CANCELLATION_EXCEPTION.equals(node.typeName())) {
                mentionsCancellation = true;
            }
        }
        return mentionsCancellation && throwsAnything;
    }
}
