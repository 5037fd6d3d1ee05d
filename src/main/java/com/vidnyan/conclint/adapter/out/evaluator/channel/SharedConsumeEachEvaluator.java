package com.vidnyan.conclint.adapter.out.evaluator.channel;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects one channel consumed with {@code consumeEach} from two or more launched coroutines
 * of the same function. {@code consumeEach} cancels the channel when the first consumer finishes.
 * <p>
 * Each consumer belongs to its innermost launch; channels are matched by receiver text.
 */
@Component
public class SharedConsumeEachEvaluator extends CoroutineRuleEvaluator {

    public SharedConsumeEachEvaluator() {
        super("CHANNEL_002");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        List<SyntaxNode> consumers = new ArrayList<>();
        context.exclusiveConsumers().values().forEach(consumers::addAll);
        return consumers;
    }

    @Override
    protected void check(SyntaxNode consumer, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> site = context.patterns().enclosingLambdaOf(consumer, CoroutineNames.TASK_LAUNCHERS);
        Optional<SyntaxNode> function = context.enclosingFunction(consumer);
        if (site.isEmpty() || function.isEmpty()) {
            return;
        }
        String channel = consumer.receiver().map(SyntaxNode::referenceText).orElse("");
        Set<SyntaxNode> sites = launchSites(context, channel, function.get());
        if (sites.size() >= 2) {
            findings.add(finding(rule, consumer, Map.of(
                    "channel", channel,
                    "sites", sites.size())));
        }
    }

    // distinct innermost launch sites consuming the channel inside the function
    private Set<SyntaxNode> launchSites(RuleContext context, String channel, SyntaxNode function) {
        Map<SyntaxNode, SyntaxNode> siteByConsumer = new LinkedHashMap<>();
        for (SyntaxNode other : context.exclusiveConsumers().getOrDefault(channel, List.of())) {
            if (!function.contains(other)
                    || !context.enclosingFunction(other).map(function::equals).orElse(false)) {
                continue;
            }
            context.patterns().enclosingLambdaOf(other, CoroutineNames.TASK_LAUNCHERS)
                    .ifPresent(site -> siteByConsumer.put(other, site));
        }
        return new LinkedHashSet<>(siteByConsumer.values());
    }
}
