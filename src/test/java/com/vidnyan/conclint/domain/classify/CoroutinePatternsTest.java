package com.vidnyan.conclint.domain.classify;

import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class CoroutinePatternsTest {

    private final CoroutinePatterns patterns = new CoroutinePatterns(AnalysisConfig.defaults());

    private static SyntaxNode firstCall(SyntaxTree tree, String name) {
        return tree.nodesOfKind(NodeKind.CALL_EXPRESSION).stream()
                .filter(c -> c.isCall(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void isInSuspendContext_ShouldFollowSuspendModifier() {
        SyntaxTree tree = tree(
                suspendFun("load", call("work")),
                fun("plain", call("other")));

        assertTrue(patterns.isInSuspendContext(firstCall(tree, "work")));
        assertFalse(patterns.isInSuspendContext(firstCall(tree, "other")));
    }

    @Test
    void isInSuspendContext_ShouldTreatBuilderLambdasAsSuspending() {
        SyntaxTree tree = tree(fun("plain",
                launchOn("viewModelScope", "launch", call("inside")),
                call("items").withLambda(call("perItem"))));

        assertTrue(patterns.isInSuspendContext(firstCall(tree, "inside")));
        assertFalse(patterns.isInSuspendContext(firstCall(tree, "perItem")));
    }

    @Test
    void isInSuspendContext_ShouldSeeThroughInlineLambdas() {
        SyntaxTree tree = tree(suspendFun("load",
                call("forEach").receiver(ref("items")).withLambda(call("handle"))));

        assertTrue(patterns.isInSuspendContext(firstCall(tree, "handle")));
    }

    @Test
    void isSuspendable_ShouldAcceptSuspendFunctionsAndBuilderLambdas() {
        SyntaxTree tree = tree(
                suspendFun("load"),
                fun("start", launchOn("scope", "launch", call("x"))));

        SyntaxNode load = tree.nodesOfKind(NodeKind.FUNCTION_DECLARATION).get(0);
        SyntaxNode start = tree.nodesOfKind(NodeKind.FUNCTION_DECLARATION).get(1);
        SyntaxNode lambda = tree.nodesOfKind(NodeKind.LAMBDA_EXPRESSION).get(0);

        assertTrue(patterns.isSuspendable(load));
        assertFalse(patterns.isSuspendable(start));
        assertTrue(patterns.isSuspendable(lambda));
    }

    @Test
    void isWithinFinally_ShouldOnlyMatchFinallyClause() {
        SyntaxTree tree = tree(suspendFun("cleanup",
                tryExpr(call("inTry"))
                        .catching(catchClause("e", "IOException", call("inCatch")))
                        .finallyBlock(call("inFinally"))));

        assertFalse(patterns.isWithinFinally(firstCall(tree, "inTry")));
        assertFalse(patterns.isWithinFinally(firstCall(tree, "inCatch")));
        assertTrue(patterns.isWithinFinally(firstCall(tree, "inFinally")));
    }

    @Test
    void isWithinFinally_ShouldStopAtLaunchedCoroutines() {
        SyntaxTree tree = tree(suspendFun("cleanup",
                tryExpr(call("work"))
                        .finallyBlock(launchOn("scope", "launch", call("later")))));

        assertFalse(patterns.isWithinFinally(firstCall(tree, "later")));
        assertTrue(patterns.isWithinFinally(firstCall(tree, "launch")));
    }

    @Test
    void isWrappedInNonCancellableContext_ShouldMatchWithContextBlock() {
        SyntaxTree tree = tree(suspendFun("cleanup",
                call("withContext").arguments(ref("NonCancellable")).withLambda(call("delay")),
                call("withContext").arguments(ref("Dispatchers.IO")).withLambda(call("save"))));

        assertTrue(patterns.isWrappedInNonCancellableContext(firstCall(tree, "delay")));
        assertFalse(patterns.isWrappedInNonCancellableContext(firstCall(tree, "save")));
    }

    @Test
    void isCooperationPoint_ShouldUseRegistry() {
        SyntaxTree tree = tree(suspendFun("loop", call("yield"), call("compute")));

        assertTrue(patterns.isCooperationPoint(firstCall(tree, "yield")));
        assertFalse(patterns.isCooperationPoint(firstCall(tree, "compute")));

        CoroutinePatterns extended = new CoroutinePatterns(AnalysisConfig.builder()
                .cooperationPoints(List.of("compute"))
                .build());
        assertTrue(extended.isCooperationPoint(firstCall(tree, "compute")));
    }

    @Test
    void blockingCategory_ShouldMatchQualifiedSuffixes() {
        SyntaxTree tree = tree(suspendFun("load",
                call("sleep").receiver(ref("Thread")),
                call("sleep").receiver(ref("java.lang.Thread")),
                call("executeQuery").receiver(ref("stmt").typeName("PreparedStatement")),
                call("execute").receiver(ref("call")),
                call("sleep").receiver(ref("MyThread"))));

        List<SyntaxNode> calls = tree.nodesOfKind(NodeKind.CALL_EXPRESSION);
        assertEquals(CoroutineNames.BlockingCategory.THREAD, patterns.blockingCategory(calls.get(0)).orElseThrow());
        assertEquals(CoroutineNames.BlockingCategory.THREAD, patterns.blockingCategory(calls.get(1)).orElseThrow());
        assertEquals(CoroutineNames.BlockingCategory.DATABASE, patterns.blockingCategory(calls.get(2)).orElseThrow());
        assertTrue(patterns.blockingCategory(calls.get(3)).isEmpty());
        assertTrue(patterns.blockingCategory(calls.get(4)).isEmpty());
    }

    @Test
    void blockingCategory_ShouldPreferBuiltInEntryOverOverlappingHostEntry() {
        CoroutinePatterns extended = new CoroutinePatterns(AnalysisConfig.builder()
                .blockingCalls(List.of("sleep"))
                .build());
        SyntaxTree tree = tree(suspendFun("load",
                call("sleep").receiver(ref("Thread")),
                call("sleep").receiver(ref("Throttle"))));

        List<SyntaxNode> calls = tree.nodesOfKind(NodeKind.CALL_EXPRESSION);
        for (int i = 0; i < 5; i++) {
            assertEquals(CoroutineNames.BlockingCategory.THREAD, extended.blockingCategory(calls.get(0)).orElseThrow());
        }
        assertEquals(CoroutineNames.BlockingCategory.CUSTOM, extended.blockingCategory(calls.get(1)).orElseThrow());
    }

    @Test
    void denotesDispatcher_ShouldLookThroughContextCombinations() {
        SyntaxTree tree = tree(suspendFun("load",
                call("launch").arguments(binary("+", ref("Dispatchers.Main"), call("CoroutineName")))
                        .withLambda()));

        SyntaxNode argument = firstCall(tree, "launch").arguments().get(0);
        assertTrue(patterns.denotesDispatcher(argument, "Main"));
        assertFalse(patterns.denotesDispatcher(argument, "IO"));
    }

    @Test
    void isTestFile_ShouldRecognizeTestNamingAndFolders() {
        assertTrue(patterns.isTestFile("src/test/kotlin/FooTest.kt"));
        assertTrue(patterns.isTestFile("FooSpec.kt"));
        assertTrue(patterns.isTestFile("app/src/androidTest/java/Foo.kt"));
        assertFalse(patterns.isTestFile("src/main/kotlin/Foo.kt"));
        assertFalse(patterns.isTestFile(null));
    }
}
