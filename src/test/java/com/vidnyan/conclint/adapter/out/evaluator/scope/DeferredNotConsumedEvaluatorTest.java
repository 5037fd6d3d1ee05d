package com.vidnyan.conclint.adapter.out.evaluator.scope;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class DeferredNotConsumedEvaluatorTest {

    private final DeferredNotConsumedEvaluator evaluator = new DeferredNotConsumedEvaluator();

    @Test
    void boundResultNeverAwaited_ShouldReportOnce() {
        List<Finding> findings = run(evaluator, "SCOPE_002", tree(suspendFun("load",
                property("result").initializer(launchOn("scope", "async", literal("1"))),
                call("println").arguments(literal("\"done\"")))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("'result'"));
    }

    @Test
    void awaitOnNextStatement_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_002", tree(suspendFun("load",
                property("result").initializer(launchOn("scope", "async", literal("1"))),
                call("await").receiver(ref("result")))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void awaitAllOverBindings_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "SCOPE_002", tree(suspendFun("load",
                property("a").initializer(launchOn("scope", "async", call("one"))),
                property("b").initializer(launchOn("scope", "async", call("two"))),
                call("awaitAll").receiver(call("listOf").arguments(ref("a"), ref("b"))))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void awaitOnOtherBinding_ShouldStillReport() {
        List<Finding> findings = run(evaluator, "SCOPE_002", tree(suspendFun("load",
                property("a").initializer(launchOn("scope", "async", call("one"))),
                property("b").initializer(launchOn("scope", "async", call("two"))),
                call("await").receiver(ref("b")))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("'a'"));
    }

    @Test
    void discardedResult_ShouldReportOnce() {
        List<Finding> findings = run(evaluator, "SCOPE_002", tree(suspendFun("load",
                launchOn("scope", "async", call("compute")))));

        assertEquals(1, findings.size());
    }
}
