package com.vidnyan.conclint.domain.classify;

import com.vidnyan.conclint.domain.ast.Modifier;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.classify.CoroutineNames.BlockingCategory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classification primitives shared by the rules.
 * <p>
 * All checks are total: they never throw, and anything they cannot decide
 * answers {@code false} or empty, so a rule misses a case rather than reporting a wrong one.
 */
public class CoroutinePatterns {

    private final AnalysisConfig config;

    public CoroutinePatterns(AnalysisConfig config) {
        this.config = config;
    }

    public boolean isTaskLaunch(SyntaxNode node) {
        return node.isCallTo(CoroutineNames.TASK_LAUNCHERS);
    }

    public boolean isCoroutineBuilder(SyntaxNode node) {
        return node.isCallTo(CoroutineNames.COROUTINE_BUILDERS);
    }

    /**
     * The call a lambda is passed to, as trailing lambda or as argument.
     */
    public Optional<SyntaxNode> ownerCall(SyntaxNode lambda) {
        if (!lambda.is(NodeKind.LAMBDA_EXPRESSION)) {
            return Optional.empty();
        }
        if (lambda.role() != Role.TRAILING_LAMBDA && lambda.role() != Role.ARGUMENT) {
            return Optional.empty();
        }
        return lambda.parent().filter(p -> p.is(NodeKind.CALL_EXPRESSION));
    }

    public boolean isLambdaOf(SyntaxNode lambda, Set<String> callees) {
        return ownerCall(lambda).map(call -> call.isCallTo(callees)).orElse(false);
    }

    public boolean isBuilderLambda(SyntaxNode lambda) {
        return isLambdaOf(lambda, CoroutineNames.COROUTINE_BUILDERS);
    }

    /**
     * Nearest enclosing named function declaration.
     */
    public Optional<SyntaxNode> enclosingNamedFunction(SyntaxNode node) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /**
     * Nearest enclosing function-like node: a named function or a lambda.
     */
    public Optional<SyntaxNode> enclosingFunctionLike(SyntaxNode node) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION) || ancestor.is(NodeKind.LAMBDA_EXPRESSION)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /**
     * A named function is suspendable when it carries the suspend modifier. A lambda is
     * suspendable when it is the block of a coroutine builder, or when it is nested inside
     * suspend context.
     */
    public boolean isSuspendable(SyntaxNode function) {
        if (function.is(NodeKind.FUNCTION_DECLARATION)) {
            return function.hasModifier(Modifier.SUSPEND);
        }
        if (function.is(NodeKind.LAMBDA_EXPRESSION)) {
            return isBuilderLambda(function) || isInSuspendContext(function);
        }
        return false;
    }

    /**
     * Walks outwards until a builder lambda (suspend context) or a named function
     * (suspend iff marked) decides. Other lambdas are transparent.
     */
    public boolean isInSuspendContext(SyntaxNode node) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION) && isBuilderLambda(ancestor)) {
                return true;
            }
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION)) {
                return ancestor.hasModifier(Modifier.SUSPEND);
            }
        }
        return false;
    }

    public boolean isInsideTaskLauncherLambda(SyntaxNode node) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION) && isBuilderLambda(ancestor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Nearest enclosing lambda that belongs to one of the given calls.
     */
    public Optional<SyntaxNode> enclosingLambdaOf(SyntaxNode node, Set<String> callees) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION) && isLambdaOf(ancestor, callees)) {
                return ownerCall(ancestor);
            }
        }
        return Optional.empty();
    }

    public boolean isCooperationPoint(SyntaxNode call) {
        return call.is(NodeKind.CALL_EXPRESSION) && config.cooperationPoints().contains(call.calleeName());
    }

    /**
     * Name heuristics for calls that very likely suspend.
     */
    public boolean looksSuspending(SyntaxNode call) {
        if (!call.is(NodeKind.CALL_EXPRESSION)) {
            return false;
        }
        String name = call.calleeName();
        return CoroutineNames.KNOWN_SUSPEND_CALLS.contains(name)
                || name.startsWith(CoroutineNames.AWAIT_PREFIX)
                || name.startsWith("suspend")
                || name.startsWith("fetch")
                || name.startsWith("load")
                || (name.startsWith("get") && name.endsWith("Async"))
                || name.endsWith("Suspending")
                || name.equals("collect");
    }

    /**
     * Only the finally clause of the nearest try counts; the walk stops at function
     * boundaries and at launched coroutines, which do not run as part of the cleanup.
     */
    public boolean isWithinFinally(SyntaxNode node) {
        SyntaxNode child = node;
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.TRY_EXPRESSION) && child.role() == Role.FINALLY) {
                return true;
            }
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION)) {
                return false;
            }
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION) && isLambdaOf(ancestor, CoroutineNames.TASK_LAUNCHERS)) {
                return false;
            }
            child = ancestor;
        }
        return false;
    }

    /**
     * True for the {@code withContext(NonCancellable)} call itself and for anything inside its block.
     */
    public boolean isWrappedInNonCancellableContext(SyntaxNode node) {
        if (isNonCancellableSwitch(node)) {
            return true;
        }
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.LAMBDA_EXPRESSION)) {
                Optional<SyntaxNode> owner = ownerCall(ancestor);
                if (owner.isPresent() && isNonCancellableSwitch(owner.get())) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isNonCancellableSwitch(SyntaxNode call) {
        if (!call.isCall(CoroutineNames.WITH_CONTEXT)) {
            return false;
        }
        List<SyntaxNode> args = call.arguments();
        return !args.isEmpty() && denotes(args.get(0), CoroutineNames.NON_CANCELLABLE);
    }

    /**
     * Whether an expression is, or combines with {@code +}, a reference to the given name.
     */
    public boolean denotes(SyntaxNode expression, String name) {
        return contextElements(expression).stream().anyMatch(element -> name.equals(element.name()));
    }

    /**
     * Whether an expression is {@code Dispatchers.<member>}, directly or inside a context combination.
     */
    public boolean denotesDispatcher(SyntaxNode expression, String member) {
        String target = CoroutineNames.DISPATCHERS + "." + member;
        for (SyntaxNode element : contextElements(expression)) {
            String text = element.referenceText();
            if (text.equals(target) || text.endsWith("." + target) || text.startsWith(target + ".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Name references combined by an expression such as {@code Dispatchers.IO + job}.
     */
    private static List<SyntaxNode> contextElements(SyntaxNode expression) {
        List<SyntaxNode> elements = new ArrayList<>();
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            SyntaxNode current = pending.pop();
            if (current.is(NodeKind.NAME_REFERENCE)) {
                elements.add(current);
            } else if (current.is(NodeKind.BINARY_EXPRESSION)) {
                List<SyntaxNode> operands = current.children(Role.OPERAND);
                for (int i = operands.size() - 1; i >= 0; i--) {
                    pending.push(operands.get(i));
                }
            }
        }
        return elements;
    }

    /**
     * Registry category of a blocking call, matched by qualified name suffix.
     */
    public Optional<BlockingCategory> blockingCategory(SyntaxNode call) {
        if (!call.is(NodeKind.CALL_EXPRESSION)) {
            return Optional.empty();
        }
        for (String candidate : qualifiedCandidates(call)) {
            for (Map.Entry<String, BlockingCategory> entry : config.blockingCalls().entrySet()) {
                String registered = entry.getKey();
                if (candidate.equals(registered) || candidate.endsWith("." + registered)) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isBlockingCall(SyntaxNode call) {
        return blockingCategory(call).isPresent();
    }

    /**
     * Renders the call as {@code receiver.callee}.
     */
    public String qualifiedName(SyntaxNode call) {
        return call.receiver()
                .map(r -> r.referenceText() + "." + call.calleeName())
                .orElse(call.calleeName());
    }

    // receiver text first, then the receiver's or the declaring type where the host supplied one
    private List<String> qualifiedCandidates(SyntaxNode call) {
        List<String> candidates = new ArrayList<>(3);
        candidates.add(qualifiedName(call));
        call.receiver()
                .map(SyntaxNode::typeName)
                .filter(t -> !t.isBlank())
                .ifPresent(t -> candidates.add(t + "." + call.calleeName()));
        if (call.typeName() != null && !call.typeName().isBlank()) {
            candidates.add(call.typeName() + "." + call.calleeName());
        }
        return candidates;
    }

    public boolean isTestFile(String filePath) {
        if (filePath == null) {
            return false;
        }
        String path = filePath.replace('\\', '/');
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.indexOf('.');
        String base = dot >= 0 ? fileName.substring(0, dot) : fileName;
        return base.endsWith("Test") || base.endsWith("Tests") || base.endsWith("Spec")
                || path.contains("/test/") || path.contains("/androidTest/")
                || path.startsWith("test/") || path.startsWith("androidTest/");
    }
}
