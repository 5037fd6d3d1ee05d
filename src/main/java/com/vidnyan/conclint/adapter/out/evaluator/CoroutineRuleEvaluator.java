package com.vidnyan.conclint.adapter.out.evaluator;

import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.rule.EvaluationResult;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import com.vidnyan.conclint.domain.rule.RuleEvaluator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class for evaluators that visit a set of candidate nodes of one file
 * and report findings on some of them.
 */
@Slf4j
public abstract class CoroutineRuleEvaluator implements RuleEvaluator {

    private final String ruleId;

    protected CoroutineRuleEvaluator(String ruleId) {
        this.ruleId = ruleId;
    }

    public String ruleId() {
        return ruleId;
    }

    @Override
    public boolean supports(RuleDefinition rule) {
        return ruleId.equals(rule.id());
    }

    @Override
    public EvaluationResult evaluate(RuleDefinition rule, RuleContext context) {
        Instant start = Instant.now();
        List<SyntaxNode> candidates = candidates(context);
        List<Finding> findings = new ArrayList<>();

        for (SyntaxNode candidate : candidates) {
            check(candidate, rule, context, findings);
        }

        Duration duration = Duration.between(start, Instant.now());
        if (!findings.isEmpty()) {
            log.debug("{}: {} finding(s) in {} ({} candidates)",
                    rule.id(), findings.size(), context.filePath(), candidates.size());
        }
        return EvaluationResult.success(rule.id(), context.filePath(), findings, duration, candidates.size());
    }

    /**
     * Nodes this rule looks at, in document order.
     */
    protected abstract List<SyntaxNode> candidates(RuleContext context);

    protected abstract void check(SyntaxNode node, RuleDefinition rule, RuleContext context, List<Finding> findings);

    protected Finding finding(RuleDefinition rule, SyntaxNode at, Map<String, ?> values) {
        return Finding.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .severity(rule.severity())
                .message(rule.formatMessage(values))
                .location(at.location())
                .docAnchor(rule.docAnchor())
                .build();
    }
}
