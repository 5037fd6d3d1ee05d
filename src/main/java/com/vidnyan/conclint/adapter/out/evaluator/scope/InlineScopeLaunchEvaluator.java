package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.ScopeReference;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects scopes created on the fly: {@code CoroutineScope(Dispatchers.IO).launch { }}
 * and properties initialized with {@code CoroutineScope(...)}.
 */
@Component
public class InlineScopeLaunchEvaluator extends CoroutineRuleEvaluator {

    public InlineScopeLaunchEvaluator() {
        super("SCOPE_004");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        List<SyntaxNode> candidates = new ArrayList<>(context.callsNamed(CoroutineNames.TASK_LAUNCHERS));
        candidates.addAll(context.nodesOfKind(NodeKind.PROPERTY_DECLARATION));
        return candidates;
    }

    @Override
    protected void check(SyntaxNode node, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        if (node.is(NodeKind.PROPERTY_DECLARATION)) {
            node.child(Role.INITIALIZER)
                    .filter(init -> init.isCall(CoroutineNames.SCOPE_CONSTRUCTOR))
                    .ifPresent(init -> findings.add(finding(rule, node,
                            Map.of("target", "Property '" + node.name() + "'"))));
            return;
        }
        node.receiver()
                .map(receiver -> context.scopes().classify(receiver))
                .filter(scope -> scope.is(ScopeReference.Kind.INLINE_SCOPE_CONSTRUCTION))
                .ifPresent(scope -> findings.add(finding(rule, node, Map.of("target", "CoroutineScope(...)." + node.calleeName() + " { }"))));
    }
}
