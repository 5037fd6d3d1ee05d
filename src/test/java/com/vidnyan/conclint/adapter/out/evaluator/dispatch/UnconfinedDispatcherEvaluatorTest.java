package com.vidnyan.conclint.adapter.out.evaluator.dispatch;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class UnconfinedDispatcherEvaluatorTest {

    private final UnconfinedDispatcherEvaluator evaluator = new UnconfinedDispatcherEvaluator();

    @Test
    void unconfinedAsBuilderContext_ShouldReport() {
        List<Finding> findings = run(evaluator, "DISPATCH_003", tree(suspendFun("load",
                call("launch").receiver(ref("scope")).arguments(ref("Dispatchers.Unconfined")).withLambda(),
                call("withContext").arguments(binary("+", ref("Dispatchers.Unconfined"), call("CoroutineName")))
                        .withLambda())));

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("launch"));
        assertTrue(findings.get(1).message().contains("withContext"));
    }

    @Test
    void unconfinedOutsideBuilderArguments_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "DISPATCH_003", tree(suspendFun("load",
                property("dispatcher").initializer(ref("Dispatchers.Unconfined")),
                call("launch").arguments(ref("Dispatchers.Default")).withLambda(),
                call("println").arguments(ref("Unconfined")))));

        assertTrue(findings.isEmpty());
    }
}
