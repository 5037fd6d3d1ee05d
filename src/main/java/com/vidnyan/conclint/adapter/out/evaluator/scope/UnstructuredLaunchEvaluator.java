package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.adapter.out.evaluator.CoroutineRuleEvaluator;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.ScopeReference;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects launch/async on a receiver that is not a known structured scope.
 * <p>
 * GlobalScope and inline {@code CoroutineScope(...)} receivers have their own rules.
 * A receiver listed in the allowed scopes, or a declaration carrying
 * {@code @Suppress("UnstructuredLaunch")}, opts out.
 */
@Component
public class UnstructuredLaunchEvaluator extends CoroutineRuleEvaluator {

    // string arguments of @Suppress("...", "...")
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");

    public UnstructuredLaunchEvaluator() {
        super("SCOPE_003");
    }

    @Override
    protected List<SyntaxNode> candidates(RuleContext context) {
        return context.callsNamed(CoroutineNames.TASK_LAUNCHERS);
    }

    @Override
    protected void check(SyntaxNode call, RuleDefinition rule, RuleContext context, List<Finding> findings) {
        Optional<SyntaxNode> receiver = call.receiver();
        if (receiver.isEmpty()) {
            return;
        }
        SyntaxNode scopeNode = receiver.get();
        // this.launch inside a builder block targets the builder's own scope
        if (scopeNode.isReference(CoroutineNames.THIS) && context.patterns().isInsideTaskLauncherLambda(call)) {
            return;
        }
        ScopeReference scope = context.scopes().classify(scopeNode);
        if (!scope.is(ScopeReference.Kind.UNCLASSIFIED)) {
            return;
        }
        if (context.config().allowedScopes().contains(scope.name())
                || (scopeNode.name() != null && context.config().allowedScopes().contains(scopeNode.name()))) {
            return;
        }
        if (isSuppressed(call, rule)) {
            return;
        }
        findings.add(finding(rule, call, Map.of(
                "builder", call.calleeName(),
                "scope", scope.name())));
    }

    private boolean isSuppressed(SyntaxNode call, RuleDefinition rule) {
        for (SyntaxNode ancestor : call.ancestors()) {
            if (!ancestor.is(NodeKind.FUNCTION_DECLARATION) && !ancestor.is(NodeKind.CLASS_DECLARATION)) {
                continue;
            }
            for (String annotation : ancestor.annotations()) {
                if (!annotation.contains("Suppress")) {
                    continue;
                }
                Matcher quoted = QUOTED.matcher(annotation);
                while (quoted.find()) {
                    String token = quoted.group(1).trim();
                    if (token.equals(rule.id()) || token.equals(rule.name())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
