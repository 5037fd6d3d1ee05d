package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects coroutine scopes that escape the ViewModel lifecycle: a ViewModel holding its own
 * {@code CoroutineScope(...)}, or a bare {@code viewModelScope} launched from outside a ViewModel.
 */
@Component
public class ViewModelScopeLeakEvaluator extends CoroutineRuleEvaluator {

    public ViewModelScopeLeakEvaluator() {
        super("SCOPE_006");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        List<SyntaxNode> candidates = new ArrayList<>(context.nodesOfKind(NodeKind.PROPERTY_DECLARATION));
        candidates.addAll(context.callsNamed(CoroutineNames.TASK_LAUNCHERS));
        return candidates;
    }

    @Override
    protected void check(SyntaxNode node, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        if (node.is(NodeKind.PROPERTY_DECLARATION)) {
            boolean constructsScope = node.child(Role.INITIALIZER)
                    .filter(init -> init.isCall(CoroutineNames.SCOPE_CONSTRUCTOR))
                    .isPresent();
            if (constructsScope) {
                context.enclosingClassExtending(node, CoroutineNames.VIEW_MODEL_TYPES)
                        .ifPresent(viewModel -> findings.add(finding(rule, node, Map.of("detail",
                                "ViewModel '" + viewModel.name() + "' creates its own CoroutineScope in property '"
                                        + node.name() + "'"))));
            }
            return;
        }

        Optional<SyntaxNode> receiver = node.receiver();
        if (receiver.isEmpty() || !receiver.get().isReference(CoroutineNames.VIEW_MODEL_SCOPE)
                || receiver.get().receiver().isPresent()) {
            return;
        }
        if (context.enclosingClassExtending(node, CoroutineNames.VIEW_MODEL_TYPES).isEmpty()) {
            findings.add(finding(rule, node, Map.of("detail",
                    "viewModelScope." + node.calleeName() + " is called outside a ViewModel")));
        }
    }
}
