package com.vidnyan.conclint.adapter.out.evaluator.channel;

import com.vidnyan.conclint.domain.ast.NodeSpec;
import com.vidnyan.conclint.domain.rule.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class SharedConsumeEachEvaluatorTest {

    private final SharedConsumeEachEvaluator evaluator = new SharedConsumeEachEvaluator();

    private static NodeSpec consumer(String channel) {
        return launchOn("scope", "launch",
                call("consumeEach").receiver(ref(channel)).withLambda(call("handle").arguments(ref("it"))));
    }

    @Test
    void twoLaunchesConsumingSameChannel_ShouldReportEachConsumer() {
        List<Finding> findings = run(evaluator, "CHANNEL_002", tree(fun("fanOut",
                property("jobs").initializer(call("Channel")),
                consumer("jobs"),
                consumer("jobs"))));

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("'jobs'"));
        assertTrue(findings.get(0).message().contains("from 2 coroutines"));
    }

    @Test
    void distinctChannels_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CHANNEL_002", tree(fun("fanOut",
                consumer("jobs"),
                consumer("otherJobs"))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void consumersInOneLaunch_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CHANNEL_002", tree(fun("drain",
                launchOn("scope", "launch",
                        call("consumeEach").receiver(ref("jobs")).withLambda(),
                        call("consumeEach").receiver(ref("jobs")).withLambda()))));

        assertTrue(findings.isEmpty());
    }

    @Test
    void consumersInDifferentFunctions_ShouldNotReport() {
        List<Finding> findings = run(evaluator, "CHANNEL_002", tree(
                fun("first", consumer("jobs")),
                fun("second", consumer("jobs"))));

        assertTrue(findings.isEmpty());
    }
}
