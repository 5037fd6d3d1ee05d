package com.vidnyan.conclint.domain.ast;

import com.vidnyan.conclint.domain.model.Location;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lightweight view of one node of a {@link SyntaxTree}.
 * Two views are equal when they point at the same node of the same tree.
 */
public final class SyntaxNode {

    private final SyntaxTree tree;
    private final int index;

    SyntaxNode(SyntaxTree tree, int index) {
        this.tree = tree;
        this.index = index;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public String id() {
        return tree.id(index);
    }

    public NodeKind kind() {
        return tree.kind(index);
    }

    public Role role() {
        return tree.role(index);
    }

    public boolean is(NodeKind kind) {
        return kind() == kind;
    }

    public String name() {
        return tree.data(index).name();
    }

    public String typeName() {
        return tree.data(index).typeName();
    }

    public String text() {
        return tree.data(index).text();
    }

    public Set<Modifier> modifiers() {
        return tree.data(index).modifiers();
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers().contains(modifier);
    }

    public List<String> annotations() {
        return tree.data(index).annotations();
    }

    /**
     * Match an annotation by simple or qualified name, ignoring a leading '@'
     * and any argument list.
     */
    public boolean hasAnnotation(String simpleName) {
        for (String annotation : annotations()) {
            String bare = annotation.startsWith("@") ? annotation.substring(1) : annotation;
            int paren = bare.indexOf('(');
            if (paren >= 0) {
                bare = bare.substring(0, paren);
            }
            if (bare.equals(simpleName) || bare.endsWith("." + simpleName)) {
                return true;
            }
        }
        return false;
    }

    public List<String> supertypes() {
        return tree.data(index).supertypes();
    }

    public Span span() {
        return tree.span(index);
    }

    public Location location() {
        Span span = span();
        return new Location(tree.filePath(), span.startLine(), span.startColumn(),
                span.endLine(), span.endColumn());
    }

    // --- navigation ---

    public Optional<SyntaxNode> parent() {
        int parent = tree.parent(index);
        return parent < 0 ? Optional.empty() : Optional.of(new SyntaxNode(tree, parent));
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<SyntaxNode> ancestors() {
        List<SyntaxNode> result = new ArrayList<>();
        for (int p = tree.parent(index); p >= 0; p = tree.parent(p)) {
            result.add(new SyntaxNode(tree, p));
        }
        return result;
    }

    public List<SyntaxNode> children() {
        int[] ids = tree.children(index);
        List<SyntaxNode> result = new ArrayList<>(ids.length);
        for (int child : ids) {
            result.add(new SyntaxNode(tree, child));
        }
        return result;
    }

    public List<SyntaxNode> children(Role role) {
        List<SyntaxNode> result = new ArrayList<>();
        for (int child : tree.children(index)) {
            if (tree.role(child) == role) {
                result.add(new SyntaxNode(tree, child));
            }
        }
        return result;
    }

    public Optional<SyntaxNode> child(Role role) {
        for (int child : tree.children(index)) {
            if (tree.role(child) == role) {
                return Optional.of(new SyntaxNode(tree, child));
            }
        }
        return Optional.empty();
    }

    /**
     * All nodes below this one in document order.
     */
    public List<SyntaxNode> descendants() {
        return tree.descendants(index);
    }

    public List<SyntaxNode> descendantsOfKind(NodeKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode node : descendants()) {
            if (node.kind() == kind) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * True when {@code other} lies strictly inside this node's subtree.
     */
    public boolean contains(SyntaxNode other) {
        return other.tree == tree && tree.contains(index, other.index);
    }

    /**
     * Source order: span start first, document order when spans tie.
     */
    public boolean precedes(SyntaxNode other) {
        Span mine = span();
        Span theirs = other.span();
        if (!mine.sameStart(theirs)) {
            return mine.startsBefore(theirs);
        }
        return tree.ordinal(index) < other.tree.ordinal(other.index);
    }

    // --- call and declaration shape ---

    public Optional<SyntaxNode> receiver() {
        return child(Role.RECEIVER);
    }

    public List<SyntaxNode> arguments() {
        return children(Role.ARGUMENT);
    }

    public Optional<SyntaxNode> trailingLambda() {
        return child(Role.TRAILING_LAMBDA);
    }

    /**
     * The block argument of a call: the trailing lambda, or a lambda passed as the last argument.
     */
    public Optional<SyntaxNode> lambdaArgument() {
        Optional<SyntaxNode> trailing = trailingLambda();
        if (trailing.isPresent()) {
            return trailing;
        }
        List<SyntaxNode> args = arguments();
        if (!args.isEmpty() && args.get(args.size() - 1).is(NodeKind.LAMBDA_EXPRESSION)) {
            return Optional.of(args.get(args.size() - 1));
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> body() {
        return child(Role.BODY);
    }

    /**
     * Statements executed directly by this node: the statements of a block, of a body
     * block, or the body expression itself when it is not a block.
     */
    public List<SyntaxNode> statements() {
        if (is(NodeKind.BLOCK)) {
            List<SyntaxNode> statements = children(Role.STATEMENT);
            return statements.isEmpty() ? children() : statements;
        }
        Optional<SyntaxNode> body = body();
        if (body.isEmpty()) {
            return List.of();
        }
        return body.get().is(NodeKind.BLOCK) ? body.get().statements() : List.of(body.get());
    }

    /**
     * Callee name without type arguments, e.g. {@code Channel} for {@code Channel<Int>}.
     */
    public String calleeName() {
        String name = name();
        if (name == null) {
            return "";
        }
        int generic = name.indexOf('<');
        return generic >= 0 ? name.substring(0, generic).trim() : name;
    }

    public boolean isCall(String callee) {
        return is(NodeKind.CALL_EXPRESSION) && calleeName().equals(callee);
    }

    public boolean isCallTo(Set<String> callees) {
        return is(NodeKind.CALL_EXPRESSION) && callees.contains(calleeName());
    }

    public boolean isReference(String identifier) {
        return is(NodeKind.NAME_REFERENCE) && identifier.equals(name());
    }

    /**
     * Source-like rendering of a reference chain: {@code a.b}, {@code Factory().scope},
     * used for syntactic identity of receivers.
     */
    public String referenceText() {
        Deque<String> segments = new ArrayDeque<>();
        SyntaxNode current = this;
        while (true) {
            segments.addFirst(current.ownReferenceText());
            if (current.kind() != NodeKind.NAME_REFERENCE && current.kind() != NodeKind.CALL_EXPRESSION) {
                break;
            }
            Optional<SyntaxNode> receiver = current.receiver();
            if (receiver.isEmpty()) {
                break;
            }
            current = receiver.get();
        }
        return String.join(".", segments);
    }

    private String ownReferenceText() {
        return switch (kind()) {
            case NAME_REFERENCE -> name();
            case CALL_EXPRESSION -> calleeName() + "()";
            case LITERAL -> text() != null ? text() : "";
            default -> text() != null ? text() : (name() != null ? name() : "");
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode other)) return false;
        return tree == other.tree && index == other.index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(tree) * 31 + index;
    }

    @Override
    public String toString() {
        return kind() + (name() != null ? "(" + name() + ")" : "") + "@" + location().format();
    }
}
