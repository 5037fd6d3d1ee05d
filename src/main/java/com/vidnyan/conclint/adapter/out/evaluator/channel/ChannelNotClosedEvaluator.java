package com.vidnyan.conclint.adapter.out.evaluator.channel;

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
import java.util.Set;

/**
 * Detects manually created channels that are never closed in the function creating them.
 * Channels built by {@code produce { }} close themselves and are ignored.
 */
@Component
public class ChannelNotClosedEvaluator extends CoroutineRuleEvaluator {

    public ChannelNotClosedEvaluator() {
        super("CHANNEL_001");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.CHANNEL_CONSTRUCTOR);
    }

    @Override
    protected void check(SyntaxNode constructor, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        if (context.patterns().enclosingLambdaOf(constructor, Set.of(CoroutineNames.PRODUCE)).isPresent()) {
            return;
        }
        Optional<String> binding = bindingName(constructor);
        Optional<SyntaxNode> function = context.enclosingFunction(constructor);
        if (binding.isEmpty() || function.isEmpty()) {
            return;
        }
        if (!isClosed(function.get(), binding.get())) {
            findings.add(finding(rule, constructor, Map.of(
                    "channel", binding.get(),
                    "function", function.get().name())));
        }
    }

    private Optional<String> bindingName(SyntaxNode constructor) {
        Optional<SyntaxNode> parent = constructor.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        if (constructor.role() == Role.INITIALIZER && parent.get().is(NodeKind.PROPERTY_DECLARATION)) {
            return Optional.ofNullable(parent.get().name());
        }
        if (constructor.role() == Role.VALUE && parent.get().is(NodeKind.ASSIGNMENT)) {
            return parent.get().child(Role.TARGET)
                    .filter(target -> target.is(NodeKind.NAME_REFERENCE))
                    .map(SyntaxNode::referenceText);
        }
        return Optional.empty();
    }

    private boolean isClosed(SyntaxNode function, String channel) {
        return function.descendantsOfKind(NodeKind.CALL_EXPRESSION).stream()
                .filter(call -> call.calleeName().startsWith(CoroutineNames.CLOSE))
                .anyMatch(call -> call.receiver().map(r -> r.referenceText().equals(channel)).orElse(false));
    }
}
