package com.vidnyan.conclint.application.port.in;

import com.vidnyan.conclint.domain.ast.SyntaxTree;
import com.vidnyan.conclint.domain.rule.EvaluationResult;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: analyze coroutine syntax trees for structured-concurrency violations.
 * This is the main entry point to the application.
 */
public interface AnalyzeCodeUseCase {

    /**
     * Analyze the given compilation units and return all findings.
     * @param request Analysis request parameters
     * @return Analysis result with findings and metadata
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analyze every serialized tree found under a directory.
     */
    AnalysisResult analyzeDirectory(Path root);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        List<Path> files,           // serialized trees to read
        List<SyntaxTree> trees,     // trees already built by the host
        List<String> ruleIds        // Empty = all enabled rules
    ) {
        public AnalysisRequest {
            files = files == null ? List.of() : List.copyOf(files);
            trees = trees == null ? List.of() : List.copyOf(trees);
            ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        }

        public static AnalysisRequest forFiles(List<Path> files) {
            return new AnalysisRequest(files, List.of(), List.of());
        }

        public static AnalysisRequest forTrees(List<SyntaxTree> trees) {
            return new AnalysisRequest(List.of(), trees, List.of());
        }

        public AnalysisRequest withRules(List<String> ids) {
            return new AnalysisRequest(files, trees, ids);
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        List<Finding> findings,
        List<EvaluationResult> ruleResults,
        List<UnitFailure> failures,
        AnalysisStats stats
    ) {
        public Verdict verdict() {
            return findingCount(RuleDefinition.Severity.ERROR) > 0 ? Verdict.FAIL : Verdict.PASS;
        }

        public int findingCount(RuleDefinition.Severity severity) {
            return (int) findings.stream()
                    .filter(f -> f.severity() == severity)
                    .count();
        }
    }

    enum Verdict {
        PASS,
        FAIL
    }

    /**
     * A compilation unit that could not be analyzed at all.
     */
    record UnitFailure(
        String filePath,
        String message
    ) {}

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesAnalyzed,
        int filesFailed,
        int nodesAnalyzed,
        int rulesEvaluated,
        long totalDurationMs
    ) {}
}
