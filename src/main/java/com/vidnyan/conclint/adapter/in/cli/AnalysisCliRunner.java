package com.vidnyan.conclint.adapter.in.cli;

import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase.AnalysisResult;
import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase.UnitFailure;
import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase.Verdict;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI Runner for standalone analysis.
 * Runs analysis when conclint.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_DETAILS = 100;

    private final AnalyzeCodeUseCase analyzeCodeUseCase;
    private final AnalysisConfig analysisConfig;
    private final ConfigurableApplicationContext context;

    @Value("${conclint.analyze.path:}")
    private String sourcePath;

    @Override
    public void run(String... args) {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set conclint.analyze.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║        conclint - Structured Concurrency Linter               ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisResult result = analyzeCodeUseCase.analyzeDirectory(Path.of(sourcePath));
            printResults(result);

            exitCode = result.verdict() == Verdict.FAIL ? 1 : 0;
            log.info("");
            log.info("Analysis complete: {}", result.verdict());
        } catch (RuntimeException e) {
            log.error("Analysis failed", e);
            exitCode = 2;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files analyzed:   {}", result.stats().filesAnalyzed());
        log.info(" Files failed:     {}", result.stats().filesFailed());
        log.info(" Nodes analyzed:   {}", result.stats().nodesAnalyzed());
        log.info(" Rules evaluated:  {}", result.stats().rulesEvaluated());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" FINDINGS:");
        log.info("   🟠 Errors:   {}", result.findingCount(RuleDefinition.Severity.ERROR));
        log.info("   🟡 Warnings: {}", result.findingCount(RuleDefinition.Severity.WARNING));
        log.info("   🔵 Info:     {}", result.findingCount(RuleDefinition.Severity.INFO));
        log.info("═══════════════════════════════════════════════════════════════");

        for (UnitFailure failure : result.failures()) {
            log.warn(" Could not analyze {}: {}", failure.filePath(), failure.message());
        }

        if (result.findings().isEmpty()) {
            log.info("");
            log.info("✅ No findings. Structured concurrency looks intact.");
            return;
        }

        log.info("");
        log.info(" FINDING DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (Finding f : result.findings()) {
            count++;
            if (count > MAX_DETAILS) {
                log.info(" ... and {} more findings", result.findings().size() - MAX_DETAILS);
                break;
            }

            String severity = switch (f.severity()) {
                case ERROR -> "🟠 ERROR";
                case WARNING -> "🟡 WARN";
                case INFO -> "🔵 INFO";
            };

            log.info("");
            log.info(" {} [{}] {}", severity, f.ruleId(), f.ruleName());
            log.info(" Location: {}", f.location() != null ? f.location().format() : "unknown");
            log.info(" Message:  {}", f.message());
            if (f.docAnchor() != null) {
                log.info(" Docs:     {}", analysisConfig.documentationUrl(f.docAnchor()));
            }
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
