package com.vidnyan.conclint;

import com.vidnyan.conclint.adapter.out.parser.NameBasedTypeResolver;
import com.vidnyan.conclint.adapter.out.rule.FileSystemRuleRepository;
import com.vidnyan.conclint.config.ConclintConfiguration;
import com.vidnyan.conclint.domain.ast.NodeSpec;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.Finding;
import com.vidnyan.conclint.domain.rule.RuleContext;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import com.vidnyan.conclint.domain.rule.RuleEvaluator;

import java.util.List;

/**
 * Shared fixtures for building trees and running single rules against them.
 */
public final class TestTrees {

    public static final String SOURCE_FILE = "src/main/kotlin/com/example/Sample.kt";
    public static final String TEST_FILE = "src/test/kotlin/com/example/SampleTest.kt";

    private static FileSystemRuleRepository catalog;

    private TestTrees() {
    }

    /**
     * The bundled rule catalog, loaded once.
     */
    public static synchronized FileSystemRuleRepository catalog() {
        if (catalog == null) {
            catalog = new FileSystemRuleRepository(new ConclintConfiguration().objectMapper(),
                    "classpath*:rules/*.json");
            catalog.loadRules();
        }
        return catalog;
    }

    public static RuleDefinition rule(String id) {
        return catalog().findById(id)
                .orElseThrow(() -> new IllegalStateException("No rule " + id + " in catalog"));
    }

    public static SyntaxTree tree(NodeSpec... declarations) {
        return NodeSpec.file(declarations).toTree(SOURCE_FILE);
    }

    public static SyntaxTree testTree(NodeSpec... declarations) {
        return NodeSpec.file(declarations).toTree(TEST_FILE);
    }

    public static NodeSpec suspendFun(String name, NodeSpec... statements) {
        return NodeSpec.function(name).suspend().body(statements);
    }

    public static NodeSpec fun(String name, NodeSpec... statements) {
        return NodeSpec.function(name).body(statements);
    }

    /**
     * {@code receiver.callee { statements }}
     */
    public static NodeSpec launchOn(String receiver, String callee, NodeSpec... statements) {
        return NodeSpec.call(callee).receiver(NodeSpec.ref(receiver)).withLambda(statements);
    }

    public static RuleContext context(SyntaxTree tree) {
        return context(tree, AnalysisConfig.defaults());
    }

    public static RuleContext context(SyntaxTree tree, AnalysisConfig config) {
        return RuleContext.build(tree, config, new NameBasedTypeResolver());
    }

    public static List<Finding> run(RuleEvaluator evaluator, String ruleId, SyntaxTree tree) {
        return run(evaluator, ruleId, tree, AnalysisConfig.defaults());
    }

    public static List<Finding> run(RuleEvaluator evaluator, String ruleId, SyntaxTree tree, AnalysisConfig config) {
        return evaluator.evaluate(rule(ruleId), context(tree, config)).findings();
    }
}
