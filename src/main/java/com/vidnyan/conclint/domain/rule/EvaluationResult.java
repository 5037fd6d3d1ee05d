package com.vidnyan.conclint.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of evaluating one rule against one compilation unit.
 */
public record EvaluationResult(
    String ruleId,
    String filePath,
    List<Finding> findings,
    Duration executionTime,
    int nodesAnalyzed,
    EvaluationStatus status,
    String errorMessage
) {

    public enum EvaluationStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    /**
     * Create a successful result.
     */
    public static EvaluationResult success(String ruleId, String filePath, List<Finding> findings,
                                           Duration duration, int nodes) {
        return new EvaluationResult(ruleId, filePath, List.copyOf(findings), duration, nodes,
                EvaluationStatus.SUCCESS, null);
    }

    /**
     * Create an error result.
     */
    public static EvaluationResult error(String ruleId, String filePath, String message) {
        return new EvaluationResult(ruleId, filePath, List.of(), Duration.ZERO, 0,
                EvaluationStatus.ERROR, message);
    }

    /**
     * Create a skipped result.
     */
    public static EvaluationResult skipped(String ruleId, String filePath, String reason) {
        return new EvaluationResult(ruleId, filePath, List.of(), Duration.ZERO, 0,
                EvaluationStatus.SKIPPED, reason);
    }
}
