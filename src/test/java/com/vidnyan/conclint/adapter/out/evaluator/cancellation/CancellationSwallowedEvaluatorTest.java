package com.vidnyan.conclint.adapter.out.evaluator.cancellation;

import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class CancellationSwallowedEvaluatorTest {

    private final CancellationSwallowedEvaluator evaluator = new CancellationSwallowedEvaluator();

    @Test
    void broadCatchInSuspendFunction_ShouldReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(suspendFun("load",
                tryExpr(call("fetch"))
                        .catching(catchClause("e", "Exception", call("log").arguments(ref("e")))))));

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("catch (Exception)"));
    }

    @Test
    void earlierCancellationCatchThatRethrows_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(suspendFun("load",
                tryExpr(call("fetch"))
                        .catching(
                                catchClause("c", "CancellationException", throwExpr(ref("c"))),
                                catchClause("e", "Throwable", call("log").arguments(ref("e")))))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void earlierCancellationCatchThatSwallows_ShouldReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(suspendFun("load",
                tryExpr(call("fetch"))
                        .catching(
                                catchClause("c", "CancellationException", call("log").arguments(ref("c"))),
                                catchClause("e", "Exception", call("log").arguments(ref("e")))))));

        assertEquals(1, findings.size());
    }

    @Test
    void rethrowInsideBroadCatch_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(suspendFun("load",
                tryExpr(call("fetch"))
                        .catching(catchClause("e", "Exception",
                                ifExpr(binary("is", ref("e"), ref("CancellationException")), throwExpr(ref("e"))),
                                call("log").arguments(ref("e")))))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void ensureActiveInsideBroadCatch_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(suspendFun("load",
                tryExpr(call("fetch"))
                        .catching(catchClause("e", "Exception",
                                call("ensureActive").receiver(ref("coroutineContext")))))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void narrowCatchOrPlainFunction_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CANCEL_003", tree(
                suspendFun("load",
                        tryExpr(call("fetch")).catching(catchClause("e", "IOException", call("log")))),
                fun("parse",
                        tryExpr(call("decode")).catching(catchClause("e", "Exception", call("log"))))));

        assertTrue(findings.isEmpty());
    }
}
