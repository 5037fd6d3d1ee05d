package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class UnstructuredLaunchEvaluatorTest {

    private final UnstructuredLaunchEvaluator evaluator = new UnstructuredLaunchEvaluator();

    @Test
    void unclassifiedReceiver_ShouldReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(fun("start",
                launchOn("someScope", "launch", call("work")))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("someScope"));
    }

    @Test
    void classifiedReceivers_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(fun("start",
                launchOn("viewModelScope", "launch"),
                launchOn("GlobalScope", "launch"),
                call("launch").receiver(call("CoroutineScope").arguments(ref("Dispatchers.IO"))).withLambda(),
                call("launch").withLambda())));

        assertTrue(findings.isEmpty());
    }

    @Test
    void annotatedScopeParameter_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(function("start")
                .parameters(parameter("scope", "CoroutineScope").annotation("@StructuredScope"))
                .body(launchOn("scope", "launch"))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void thisInsideBuilderBlock_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(suspendFun("load",
                call("coroutineScope").withLambda(launchOn("this", "launch", call("work"))))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void allowListedScope_ShouldNotReport() {
        AnalysisConfig config = AnalysisConfig.builder().allowedScopes(List.of("appScope")).build();

        List<Finding> findings = run(evaluator, "SCOPE_003", tree(fun("start",
                launchOn("appScope", "launch"))), config);

        assertTrue(findings.isEmpty());
    }

    @Test
    void suppressedFunction_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(
                function("start").annotation("@Suppress(\"UnstructuredLaunch\")")
                        .body(launchOn("someScope", "launch")),
                function("stop").annotation("@Suppress(\"SCOPE_003\")")
                        .body(launchOn("someScope", "launch"))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void suppressionOfSimilarRuleIds_ShouldStillReport() {
        List<Finding> findings = run(evaluator, "SCOPE_003", tree(
                function("start").annotation("@Suppress(\"SCOPE_0031\")")
                        .body(launchOn("someScope", "launch")),
                function("stop").annotation("@Suppress(\"UnstructuredLaunchCheck\", \"unused\")")
                        .body(launchOn("otherScope", "launch")),
                function("pause").annotation("@Suppress(\"unused\", \"SCOPE_003\")")
                        .body(launchOn("thirdScope", "launch"))));

        assertEquals(2, findings.size());
    }
}
