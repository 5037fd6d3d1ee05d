package com.vidnyan.conclint.domain.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Nested, fluent description of a syntax subtree.
 * Flattened into a {@link SyntaxTree} through the tree builder, so it is subject
 * to the same validation as trees coming from a host adapter.
 *
 * <pre>
 * NodeSpec.file(
 *     NodeSpec.call("launch")
 *         .receiver(NodeSpec.ref("GlobalScope"))
 *         .trailingLambda(NodeSpec.lambda(NodeSpec.call("work"))))
 *     .toTree("Main.kt");
 * </pre>
 */
public final class NodeSpec {

    private final NodeKind kind;
    private String name;
    private String typeName;
    private String text;
    private final Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private final List<String> annotations = new ArrayList<>();
    private final List<String> supertypes = new ArrayList<>();
    private final List<Child> children = new ArrayList<>();
    private Span span;

    private NodeSpec(NodeKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static NodeSpec node(NodeKind kind) {
        return new NodeSpec(kind, null);
    }

    public static NodeSpec file(NodeSpec... declarations) {
        NodeSpec spec = new NodeSpec(NodeKind.FILE, null);
        for (NodeSpec declaration : declarations) {
            spec.child(Role.DECLARATION, declaration);
        }
        return spec;
    }

    public static NodeSpec classDecl(String name) {
        return new NodeSpec(NodeKind.CLASS_DECLARATION, name);
    }

    public static NodeSpec function(String name) {
        return new NodeSpec(NodeKind.FUNCTION_DECLARATION, name);
    }

    public static NodeSpec parameter(String name, String typeName) {
        return new NodeSpec(NodeKind.PARAMETER, name).typeName(typeName);
    }

    public static NodeSpec property(String name) {
        return new NodeSpec(NodeKind.PROPERTY_DECLARATION, name);
    }

    public static NodeSpec block(NodeSpec... statements) {
        NodeSpec spec = new NodeSpec(NodeKind.BLOCK, null);
        for (NodeSpec statement : statements) {
            spec.child(Role.STATEMENT, statement);
        }
        return spec;
    }

    public static NodeSpec call(String callee) {
        return new NodeSpec(NodeKind.CALL_EXPRESSION, callee);
    }

    public static NodeSpec lambda(NodeSpec... statements) {
        return new NodeSpec(NodeKind.LAMBDA_EXPRESSION, null).child(Role.BODY, block(statements));
    }

    /**
     * A dotted reference such as {@code Dispatchers.IO}; every segment becomes the receiver of the next.
     */
    public static NodeSpec ref(String dotted) {
        String[] parts = dotted.split("\\.");
        NodeSpec current = new NodeSpec(NodeKind.NAME_REFERENCE, parts[0]);
        for (int i = 1; i < parts.length; i++) {
            current = new NodeSpec(NodeKind.NAME_REFERENCE, parts[i]).receiver(current);
        }
        return current;
    }

    public static NodeSpec tryExpr(NodeSpec... statements) {
        return new NodeSpec(NodeKind.TRY_EXPRESSION, null).child(Role.TRY_BLOCK, block(statements));
    }

    public static NodeSpec catchClause(String parameter, String caughtType, NodeSpec... statements) {
        return new NodeSpec(NodeKind.CATCH_CLAUSE, parameter).typeName(caughtType)
                .child(Role.BODY, block(statements));
    }

    public static NodeSpec loop(String keyword, NodeSpec... statements) {
        return new NodeSpec(NodeKind.LOOP_EXPRESSION, keyword).child(Role.BODY, block(statements));
    }

    public static NodeSpec ifExpr(NodeSpec condition, NodeSpec... then) {
        return new NodeSpec(NodeKind.IF_EXPRESSION, null)
                .child(Role.CONDITION, condition)
                .child(Role.THEN, block(then));
    }

    public static NodeSpec throwExpr(NodeSpec value) {
        return new NodeSpec(NodeKind.THROW_EXPRESSION, null).child(Role.VALUE, value);
    }

    public static NodeSpec assignment(String target, NodeSpec value) {
        return new NodeSpec(NodeKind.ASSIGNMENT, null)
                .child(Role.TARGET, ref(target))
                .child(Role.VALUE, value);
    }

    public static NodeSpec binary(String operator, NodeSpec left, NodeSpec right) {
        return new NodeSpec(NodeKind.BINARY_EXPRESSION, operator)
                .child(Role.OPERAND, left)
                .child(Role.OPERAND, right);
    }

    public static NodeSpec returnExpr(NodeSpec value) {
        return new NodeSpec(NodeKind.RETURN_EXPRESSION, null).child(Role.VALUE, value);
    }

    public static NodeSpec literal(String text) {
        return new NodeSpec(NodeKind.LITERAL, null).text(text);
    }

    // --- attributes ---

    public NodeSpec name(String name) {
        this.name = name;
        return this;
    }

    public NodeSpec typeName(String typeName) {
        this.typeName = typeName;
        return this;
    }

    public NodeSpec text(String text) {
        this.text = text;
        return this;
    }

    public NodeSpec modifier(Modifier modifier) {
        modifiers.add(modifier);
        return this;
    }

    public NodeSpec suspend() {
        return modifier(Modifier.SUSPEND);
    }

    public NodeSpec annotation(String annotation) {
        annotations.add(annotation);
        return this;
    }

    public NodeSpec supertypes(String... types) {
        supertypes.addAll(Arrays.asList(types));
        return this;
    }

    public NodeSpec at(int line, int column) {
        this.span = Span.at(line, column);
        return this;
    }

    public NodeSpec span(Span span) {
        this.span = span;
        return this;
    }

    // --- children ---

    public NodeSpec child(Role role, NodeSpec child) {
        children.add(new Child(role, child));
        return this;
    }

    public NodeSpec receiver(NodeSpec receiver) {
        return child(Role.RECEIVER, receiver);
    }

    public NodeSpec arguments(NodeSpec... arguments) {
        for (NodeSpec argument : arguments) {
            child(Role.ARGUMENT, argument);
        }
        return this;
    }

    public NodeSpec trailingLambda(NodeSpec lambda) {
        return child(Role.TRAILING_LAMBDA, lambda);
    }

    /**
     * Shorthand for a trailing lambda with the given statements.
     */
    public NodeSpec withLambda(NodeSpec... statements) {
        return trailingLambda(lambda(statements));
    }

    public NodeSpec parameters(NodeSpec... parameters) {
        for (NodeSpec parameter : parameters) {
            child(Role.PARAMETER, parameter);
        }
        return this;
    }

    public NodeSpec members(NodeSpec... members) {
        for (NodeSpec member : members) {
            child(Role.MEMBER, member);
        }
        return this;
    }

    /**
     * Body block made of the given statements.
     */
    public NodeSpec body(NodeSpec... statements) {
        return child(Role.BODY, block(statements));
    }

    public NodeSpec initializer(NodeSpec initializer) {
        return child(Role.INITIALIZER, initializer);
    }

    public NodeSpec catching(NodeSpec... catchClauses) {
        for (NodeSpec clause : catchClauses) {
            child(Role.CATCH, clause);
        }
        return this;
    }

    public NodeSpec finallyBlock(NodeSpec... statements) {
        return child(Role.FINALLY, block(statements));
    }

    public NodeSpec elseBranch(NodeSpec... statements) {
        return child(Role.ELSE, block(statements));
    }

    /**
     * Flatten into a validated tree; ids are assigned in pre-order.
     */
    public SyntaxTree toTree(String filePath) {
        SyntaxTree.Builder builder = SyntaxTree.builder(filePath);
        flatten(builder, null, Role.ROOT, new int[]{0});
        return builder.build();
    }

    private void flatten(SyntaxTree.Builder builder, String parentId, Role role, int[] counter) {
        String id = "n" + counter[0]++;
        builder.add(id, parentId, kind, role,
                new NodeData(name, typeName, text, modifiers, annotations, supertypes), span);
        for (Child child : children) {
            child.spec().flatten(builder, id, child.role(), counter);
        }
    }

    private record Child(Role role, NodeSpec spec) {}
}
