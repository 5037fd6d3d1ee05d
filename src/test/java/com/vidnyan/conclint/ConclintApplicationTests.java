package com.vidnyan.conclint;

import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase.AnalysisRequest;
import com.vidnyan.conclint.application.port.in.AnalyzeCodeUseCase.AnalysisResult;
import com.vidnyan.conclint.application.port.out.RuleRepository;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import com.vidnyan.conclint.domain.rule.RuleEvaluator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "conclint.analysis.disabled-rules=TEST_001",
        "conclint.analysis.framework-scopes=presenterScope"
})
class ConclintApplicationTests {

    @Autowired
    private AnalyzeCodeUseCase analyzeCodeUseCase;

    @Autowired
    private RuleRepository ruleRepository;

    @Autowired
    private List<RuleEvaluator> evaluators;

    @Autowired
    private AnalysisConfig analysisConfig;

    @Test
    void contextLoads_ShouldBindEveryCatalogRule() {
        List<RuleDefinition> rules = ruleRepository.findAll();

        assertEquals(23, rules.size());
        assertEquals(23, evaluators.size());
        for (RuleDefinition rule : rules) {
            assertTrue(evaluators.stream().anyMatch(e -> e.supports(rule)), rule.id());
        }
    }

    @Test
    void analysisProperties_ShouldExtendDefaults() {
        assertTrue(analysisConfig.frameworkScopes().contains("presenterScope"));
        assertTrue(analysisConfig.frameworkScopes().contains("viewModelScope"));
        assertFalse(analysisConfig.isRuleEnabled("TEST_001", "RunBlockingWithDelayInTest"));
    }

    @Test
    void analyze_ShouldRunThroughWiredService() {
        AnalysisResult result = analyzeCodeUseCase.analyze(AnalysisRequest.forTrees(List.of(
                file(TestTrees.fun("start",
                        TestTrees.launchOn("GlobalScope", "launch", call("work")),
                        TestTrees.launchOn("presenterScope", "launch", call("work"))))
                        .toTree(TestTrees.SOURCE_FILE))));

        assertEquals(22, result.stats().rulesEvaluated());
        assertEquals(1, result.findings().stream().filter(f -> f.ruleId().equals("SCOPE_001")).count());
        assertTrue(result.findings().stream().noneMatch(f -> f.ruleId().equals("SCOPE_003")));
    }
}
