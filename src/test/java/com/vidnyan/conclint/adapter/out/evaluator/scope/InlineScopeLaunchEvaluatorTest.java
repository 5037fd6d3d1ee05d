package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class InlineScopeLaunchEvaluatorTest {

    private final InlineScopeLaunchEvaluator evaluator = new InlineScopeLaunchEvaluator();

    @Test
    void launchOnFreshScope_ShouldReport() {
        List<Finding> findings = run(evaluator, "SCOPE_004", tree(fun("start",
                call("launch")
                        .receiver(call("CoroutineScope").arguments(ref("Dispatchers.IO")))
                        .withLambda(call("work")))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().startsWith("[SCOPE_004]"));
    }

    @Test
    void propertyHoldingFreshScope_ShouldReportOnTheProperty() {
        List<Finding> findings = run(evaluator, "SCOPE_004", tree(classDecl("Repository")
                .members(
                        property("scope").initializer(call("CoroutineScope").arguments(ref("Dispatchers.Default"))),
                        fun("refresh", launchOn("scope", "launch")))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("'scope'"));
    }

    @Test
    void ordinaryScopes_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_004", tree(fun("start",
                launchOn("viewModelScope", "launch"),
                property("job").initializer(call("Job")))));

        assertTrue(findings.isEmpty());
    }
}
