package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class CancellationSubclassEvaluatorTest {

    private final CancellationSubclassEvaluator evaluator = new CancellationSubclassEvaluator();

    @Test
    void classExtendingCancellationException_ShouldReport() {
        List<Finding> findings = run(evaluator, "EXCEPT_002", tree(
                classDecl("TimeoutSignal").supertypes("CancellationException(\"timeout\")"),
                classDecl("StopSignal").supertypes("kotlinx.coroutines.CancellationException()")));

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("'TimeoutSignal'"));
    }

    @Test
    void otherSupertypes_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "EXCEPT_002", tree(
                classDecl("DomainError").supertypes("IllegalStateException()"),
                classDecl("Plain"),
                classDecl("Wrapper").supertypes("Box<CancellationException>")));

        assertTrue(findings.isEmpty());
    }
}
