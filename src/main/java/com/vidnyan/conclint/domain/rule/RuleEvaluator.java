package com.vidnyan.conclint.domain.rule;

/**
 * Interface for rule evaluators.
 * Each evaluator handles one catalog rule and must not depend on other rules' output.
 */
public interface RuleEvaluator {

    /**
     * Check if this evaluator can handle the given rule.
     */
    boolean supports(RuleDefinition rule);

    /**
     * Evaluate the rule against one compilation unit.
     */
    EvaluationResult evaluate(RuleDefinition rule, RuleContext context);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
