package com.vidnyan.conclint.adapter.out.evaluator.testing;

import com.vidnyan.conclint.domain.ast.NodeSpec;
import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class RunBlockingWithDelayInTestEvaluatorTest {

    private final RunBlockingWithDelayInTestEvaluator evaluator = new RunBlockingWithDelayInTestEvaluator();

    private static NodeSpec waitingTest() {
        return function("retriesAfterTimeout").annotation("@Test").body(
                call("runBlocking").withLambda(
                        call("start").receiver(ref("service")),
                        call("delay").arguments(literal("5000")),
                        call("assertTrue").arguments(ref("service.done"))));
    }

    @Test
    void delayInsideRunBlockingInTestFile_ShouldReport() {
        List<Finding> findings = run(evaluator, "TEST_001", testTree(waitingTest()));

        assertEquals(1, findings.size());
        assertEquals(TEST_FILE, findings.get(0).location().filePath());
    }

    @Test
    void sameCodeInProductionSource_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "TEST_001", tree(waitingTest()));

        assertTrue(findings.isEmpty());
    }

    @Test
    void runBlockingWithoutDelay_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "TEST_001", testTree(fun("loads",
                call("runBlocking").withLambda(call("load").receiver(ref("repository"))))));

        assertTrue(findings.isEmpty());
    }
}
