package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class ScopeRelaunchAfterCancelEvaluatorTest {

    private final ScopeRelaunchAfterCancelEvaluator evaluator = new ScopeRelaunchAfterCancelEvaluator();

    @Test
    void launchAfterCancel_ShouldReportOnce() {
        List<Finding> findings = run(evaluator, "CANCEL_005", tree(fun("restart",
                call("cancel").receiver(ref("scope")).at(2, 5),
                call("log").arguments(literal("\"restarting\"")).at(3, 5),
                launchOn("scope", "launch", call("work")).at(4, 5),
                launchOn("scope", "async", call("work")).at(5, 5))));

        assertEquals(1, findings.size());
        assertEquals(2, findings.get(0).location().line());
        assertTrue(findings.get(0).message().contains("'scope'"));
    }

    @Test
    void launchBeforeCancel_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_005", tree(fun("restart",
                launchOn("scope", "launch", call("work")),
                call("log"),
                call("cancel").receiver(ref("scope")))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void relaunchOnDifferentScope_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_005", tree(fun("restart",
                call("cancel").receiver(ref("scope")),
                launchOn("otherScope", "launch", call("work")))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void cancelAndRelaunchInDifferentFunctions_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_005", tree(classDecl("Controller")
                .members(
                        fun("stop", call("cancel").receiver(ref("scope"))),
                        fun("start", launchOn("scope", "launch")))));

        assertTrue(findings.isEmpty());
    }
}
