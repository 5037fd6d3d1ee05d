package com.vidnyan.conclint.adapter.out.evaluator.lifecycle;

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
 * Detects UI components that bypass their lifecycle scope. A LifecycleOwner (activity,
 * fragment) holding a {@code CoroutineScope(...)} property keeps working after it is destroyed,
 * and a bare {@code lifecycleScope} launched outside a LifecycleOwner has no lifecycle to follow.
 * {@code owner.lifecycleScope} is accepted anywhere.
 */
@Component
public class LifecycleAwareScopeEvaluator extends CoroutineRuleEvaluator {

    public LifecycleAwareScopeEvaluator() {
        super("ARCH_001");
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
            if (!constructsScope) {
                return;
            }
            context.enclosingClassExtending(node, CoroutineNames.LIFECYCLE_OWNER_TYPES)
                    .ifPresent(owner -> findings.add(finding(rule, node, Map.of("detail",
                            "'" + owner.name() + "' creates its own CoroutineScope in property '"
                                    + node.name() + "'"))));
            return;
        }

        Optional<SyntaxNode> receiver = node.receiver();
        if (receiver.isPresent() && receiver.get().isReference(CoroutineNames.LIFECYCLE_SCOPE)
                && receiver.get().receiver().isEmpty()
                && context.enclosingClassExtending(node, CoroutineNames.LIFECYCLE_OWNER_TYPES).isEmpty()) {
            findings.add(finding(rule, node, Map.of("detail",
                    "lifecycleScope." + node.calleeName() + " is called outside a LifecycleOwner")));
        }
    }
}
