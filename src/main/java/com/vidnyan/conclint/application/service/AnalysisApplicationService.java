package com.vidnyan.conclint.application.service;

import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.conclint.application.port.out.RuleRepository;
import com.vidnyan.conclint.application.port.out.SyntaxTreeReader;
import com.vidnyan.conclint.application.port.out.TypeResolver;
import com.vidnyan.conclint.config.AnalysisProperties;
import com.vidnyan.conclint.domain.ast.MalformedTreeException;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.*;
import com.vidnyan.conclint.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 * <p>
 * Every file gets its own {@link RuleContext} and its own finding buffer, so files may be
 * analyzed on a worker pool; buffers are only merged after all files are done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeCodeUseCase {

    private final SyntaxTreeReader syntaxTreeReader;
    private final RuleRepository ruleRepository;
    private final List<RuleEvaluator> ruleEvaluators;
    private final TypeResolver typeResolver;
    private final RepositoryScanner repositoryScanner;
    private final AnalysisConfig analysisConfig;
    private final AnalysisProperties analysisProperties;

    @Override
    public AnalysisResult analyzeDirectory(Path root) {
        try {
            List<Path> files = repositoryScanner.scanSourceFiles(root);
            log.info("Found {} syntax tree file(s) under {}", files.size(), root);
            return analyze(AnalysisRequest.forFiles(files));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();

        // Step 1: Read compilation units
        log.info("Step 1: Reading {} file(s) and {} provided tree(s)...",
                request.files().size(), request.trees().size());
        List<SyntaxTree> trees = new ArrayList<>(request.trees());
        List<UnitFailure> failures = new ArrayList<>();
        for (Path file : request.files()) {
            try {
                trees.add(syntaxTreeReader.read(file));
            } catch (MalformedTreeException e) {
                log.warn("Skipping malformed tree {}: {}", file, e.getMessage());
                failures.add(new UnitFailure(file.toString(), e.getMessage()));
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
                failures.add(new UnitFailure(file.toString(), "I/O error: " + e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable tree {}", file, e);
                failures.add(new UnitFailure(file.toString(), e.toString()));
            }
        }

        // Step 2: Load rules and bind evaluators
        log.info("Step 2: Loading rules...");
        List<RuleDefinition> rules = selectRules(request);
        List<EvaluationResult> ruleResults = new ArrayList<>();
        List<BoundRule> boundRules = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            Optional<RuleEvaluator> evaluator = findEvaluator(rule);
            if (evaluator.isPresent()) {
                boundRules.add(new BoundRule(rule, evaluator.get()));
            } else {
                log.warn("No evaluator found for rule: {}", rule.id());
                ruleResults.add(EvaluationResult.skipped(rule.id(), null, "No evaluator available"));
            }
        }
        log.info("Loaded {} rules ({} with evaluators)", rules.size(), boundRules.size());

        // Step 3: Evaluate rules per file
        log.info("Step 3: Evaluating rules on {} file(s)...", trees.size());
        List<FileOutcome> outcomes = evaluateAll(trees, boundRules, failures);

        // Step 4: Merge
        List<List<Finding>> buffers = new ArrayList<>();
        int nodesAnalyzed = 0;
        for (FileOutcome outcome : outcomes) {
            buffers.add(outcome.findings());
            ruleResults.addAll(outcome.results());
            nodesAnalyzed += outcome.nodes();
        }
        List<Finding> findings = FindingAggregator.aggregate(buffers);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                outcomes.size(),
                failures.size(),
                nodesAnalyzed,
                boundRules.size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} findings in {} file(s), {} failed, {}ms",
                findings.size(), stats.filesAnalyzed(), stats.filesFailed(), stats.totalDurationMs());

        return new AnalysisResult(findings, List.copyOf(ruleResults), List.copyOf(failures), stats);
    }

    private List<FileOutcome> evaluateAll(List<SyntaxTree> trees, List<BoundRule> rules,
                                          List<UnitFailure> failures) {
        int parallelism = Math.max(1, analysisProperties.getParallelism());
        if (parallelism == 1 || trees.size() <= 1) {
            List<FileOutcome> outcomes = new ArrayList<>();
            for (SyntaxTree tree : trees) {
                try {
                    outcomes.add(evaluateFile(tree, rules));
                } catch (RuntimeException e) {
                    log.error("Analysis of {} failed", tree.filePath(), e);
                    failures.add(new UnitFailure(tree.filePath(), e.toString()));
                }
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, trees.size()));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (SyntaxTree tree : trees) {
                futures.add(executor.submit(() -> evaluateFile(tree, rules)));
            }
            List<FileOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    String path = trees.get(i).filePath();
                    log.error("Analysis of {} failed", path, e.getCause());
                    failures.add(new UnitFailure(path, String.valueOf(e.getCause())));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome evaluateFile(SyntaxTree tree, List<BoundRule> rules) {
        log.debug("Analyzing {} ({} nodes)", tree.filePath(), tree.size());
        RuleContext context = RuleContext.build(tree, analysisConfig, typeResolver);
        List<Finding> findings = new ArrayList<>();
        List<EvaluationResult> results = new ArrayList<>();

        for (BoundRule bound : rules) {
            RuleDefinition rule = bound.rule();
            try {
                EvaluationResult result = bound.evaluator().evaluate(rule, context);
                results.add(result);
                findings.addAll(result.findings());
            } catch (Exception | StackOverflowError e) {
                log.error("Error evaluating rule {} on {}", rule.id(), tree.filePath(), e);
                findings.add(Finding.ruleFailed(rule, tree.filePath(), e));
                results.add(EvaluationResult.error(rule.id(), tree.filePath(), e.toString()));
            }
        }
        return new FileOutcome(findings, results, tree.size());
    }

    private List<RuleDefinition> selectRules(AnalysisRequest request) {
        List<RuleDefinition> candidates = request.ruleIds().isEmpty()
                ? ruleRepository.findEnabled()
                : request.ruleIds().stream()
                        .map(ruleRepository::findById)
                        .flatMap(Optional::stream)
                        .toList();
        return candidates.stream()
                .filter(rule -> analysisConfig.isRuleEnabled(rule.id(), rule.name()))
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    private Optional<RuleEvaluator> findEvaluator(RuleDefinition rule) {
        return ruleEvaluators.stream()
                .filter(e -> e.supports(rule))
                .findFirst();
    }

    private record BoundRule(RuleDefinition rule, RuleEvaluator evaluator) {}

    private record FileOutcome(List<Finding> findings, List<EvaluationResult> results, int nodes) {}
}
