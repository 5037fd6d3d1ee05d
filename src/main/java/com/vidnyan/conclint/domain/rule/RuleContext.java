package com.vidnyan.conclint.domain.rule;

import com.vidnyan.conclint.application.port.out.TypeResolver;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.classify.CoroutineNames;
import com.vidnyan.conclint.domain.classify.CoroutinePatterns;
import com.vidnyan.conclint.domain.classify.ScopeClassifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of one compilation unit shared by all rules.
 * <p>
 * Indices are computed in a single pass at construction and never change afterwards,
 * so one context may be read by several rules concurrently.
 */
public final class RuleContext {

    private final SyntaxTree tree;
    private final AnalysisConfig config;
    private final TypeResolver typeResolver;
    private final ScopeClassifier scopeClassifier;
    private final CoroutinePatterns patterns;
    private final List<SyntaxNode> calls;
    private final Map<String, List<SyntaxNode>> callsByName;
    private final Map<String, List<SyntaxNode>> exclusiveConsumers;
    private final Set<String> suspendFunctionNames;
    private final boolean testFile;

    private RuleContext(SyntaxTree tree, AnalysisConfig config, TypeResolver typeResolver) {
        this.tree = tree;
        this.config = config;
        this.typeResolver = typeResolver;
        this.scopeClassifier = new ScopeClassifier(config);
        this.patterns = new CoroutinePatterns(config);

        List<SyntaxNode> allCalls = new ArrayList<>();
        Map<String, List<SyntaxNode>> byName = new LinkedHashMap<>();
        Map<String, List<SyntaxNode>> consumers = new LinkedHashMap<>();
        Set<String> suspendNames = new HashSet<>();

        for (SyntaxNode node : tree.nodes()) {
            if (node.is(NodeKind.CALL_EXPRESSION)) {
                allCalls.add(node);
                byName.computeIfAbsent(node.calleeName(), k -> new ArrayList<>()).add(node);
                if (node.isCall(CoroutineNames.CONSUME_EACH) && node.receiver().isPresent()) {
                    consumers.computeIfAbsent(node.receiver().get().referenceText(), k -> new ArrayList<>())
                            .add(node);
                }
            } else if (node.is(NodeKind.FUNCTION_DECLARATION) && patterns.isSuspendable(node)) {
                suspendNames.add(node.name());
            }
        }

        this.calls = List.copyOf(allCalls);
        byName.replaceAll((k, v) -> List.copyOf(v));
        this.callsByName = Map.copyOf(byName);
        consumers.replaceAll((k, v) -> List.copyOf(v));
        this.exclusiveConsumers = Collections.unmodifiableMap(consumers);
        this.suspendFunctionNames = Set.copyOf(suspendNames);
        this.testFile = patterns.isTestFile(tree.filePath());
    }

    public static RuleContext build(SyntaxTree tree, AnalysisConfig config, TypeResolver typeResolver) {
        return new RuleContext(tree, config, typeResolver);
    }

    public SyntaxTree tree() {
        return tree;
    }

    public String filePath() {
        return tree.filePath();
    }

    public AnalysisConfig config() {
        return config;
    }

    public ScopeClassifier scopes() {
        return scopeClassifier;
    }

    public CoroutinePatterns patterns() {
        return patterns;
    }

    public List<SyntaxNode> nodesOfKind(NodeKind kind) {
        return tree.nodesOfKind(kind);
    }

    /**
     * All call expressions in document order.
     */
    public List<SyntaxNode> calls() {
        return calls;
    }

    public List<SyntaxNode> callsNamed(String callee) {
        return callsByName.getOrDefault(callee, List.of());
    }

    /**
     * Calls to any of the given callees, in document order.
     */
    public List<SyntaxNode> callsNamed(Collection<String> callees) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode call : calls) {
            if (callees.contains(call.calleeName())) {
                result.add(call);
            }
        }
        return result;
    }

    /**
     * Channel receiver text mapped to its exclusive-consume call sites.
     */
    public Map<String, List<SyntaxNode>> exclusiveConsumers() {
        return exclusiveConsumers;
    }

    /**
     * Whether a function of this name is declared suspend in the same file.
     */
    public boolean isLocalSuspendFunction(String name) {
        return suspendFunctionNames.contains(name);
    }

    public boolean isTestFile() {
        return testFile;
    }

    public Optional<SyntaxNode> enclosingFunction(SyntaxNode node) {
        return typeResolver.enclosingFunction(node);
    }

    public List<String> supertypes(SyntaxNode classDeclaration) {
        return typeResolver.supertypes(classDeclaration);
    }

    /**
     * Nearest enclosing class with a direct supertype among the given simple names,
     * matched on the last segment of qualified supertypes.
     */
    public Optional<SyntaxNode> enclosingClassExtending(SyntaxNode node, Set<String> typeNames) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.CLASS_DECLARATION) && extendsAny(ancestor, typeNames)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    private boolean extendsAny(SyntaxNode classDeclaration, Set<String> typeNames) {
        return supertypes(classDeclaration).stream()
                .map(type -> type.substring(type.lastIndexOf('.') + 1))
                .anyMatch(typeNames::contains);
    }
}
