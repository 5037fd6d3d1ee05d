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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects {@code async} results that are never awaited.
 * <p>
 * A discarded result is always reported. A result bound to a local property is consumed
 * when the same block calls {@code name.await*()} or passes {@code name} to {@code awaitAll}.
 */
@Component
public class DeferredNotConsumedEvaluator extends CoroutineRuleEvaluator {

    public DeferredNotConsumedEvaluator() {
        super("SCOPE_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.ASYNC);
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        if (call.role() == Role.STATEMENT) {
            findings.add(finding(rule, call, Map.of("name", "result")));
            return;
        }
        Optional<SyntaxNode> parent = call.parent();
        if (call.role() != Role.INITIALIZER || parent.isEmpty() || !parent.get().is(NodeKind.PROPERTY_DECLARATION)) {
            return;
        }
        SyntaxNode property = parent.get();
        Optional<SyntaxNode> block = property.parent().filter(p -> p.is(NodeKind.BLOCK));
        if (block.isEmpty()) {
            return;
        }
        if (!isConsumed(block.get(), property.name())) {
            findings.add(finding(rule, call, Map.of("name", "'" + property.name() + "'")));
        }
    }

    private boolean isConsumed(SyntaxNode block, String name) {
        for (SyntaxNode node : block.descendantsOfKind(NodeKind.CALL_EXPRESSION)) {
            String callee = node.calleeName();
            if (callee.equals(CoroutineNames.AWAIT_ALL)) {
                if (passes(node, name) || node.receiver().map(r -> passes(r, name)).orElse(false)) {
                    return true;
                }
            } else if (callee.startsWith(CoroutineNames.AWAIT_PREFIX)
                    && node.receiver().map(r -> r.isReference(name) && r.receiver().isEmpty()).orElse(false)) {
                return true;
            }
        }
        return false;
    }

    private boolean passes(SyntaxNode call, String name) {
        if (!call.is(NodeKind.CALL_EXPRESSION)) {
            return false;
        }
        for (SyntaxNode argument : call.arguments()) {
            String text = argument.referenceText();
            if (text.equals(name) || text.endsWith("." + name)) {
                return true;
            }
        }
        return false;
    }
}
