package com.vidnyan.conclint.domain.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable syntax tree of one compilation unit.
 * <p>
 * Nodes live in an arena addressed by dense integer indices. Parent and child links
 * are index arrays, so ancestry walks cost O(depth) with O(1) parent lookup.
 * A pre-order numbering is computed once at build time; it gives document order
 * and O(1) subtree containment checks.
 */
public final class SyntaxTree {

    private static final int NO_PARENT = -1;

    private final String filePath;
    private final String[] ids;
    private final NodeKind[] kinds;
    private final Role[] roles;
    private final NodeData[] data;
    private final Span[] spans;
    private final int[] parents;
    private final int[][] children;
    private final int[] preorder;
    private final int[] ordinals;
    private final int[] subtreeEnds;
    private final Map<NodeKind, List<SyntaxNode>> byKind;
    private final int root;

    private SyntaxTree(String filePath, String[] ids, NodeKind[] kinds, Role[] roles, NodeData[] data,
                       Span[] spans, int[] parents, int[][] children, int[] preorder, int[] ordinals,
                       int[] subtreeEnds, int root) {
        this.filePath = filePath;
        this.ids = ids;
        this.kinds = kinds;
        this.roles = roles;
        this.data = data;
        this.spans = spans;
        this.parents = parents;
        this.children = children;
        this.preorder = preorder;
        this.ordinals = ordinals;
        this.subtreeEnds = subtreeEnds;
        this.root = root;

        Map<NodeKind, List<SyntaxNode>> index = new EnumMap<>(NodeKind.class);
        for (int position : preorder) {
            index.computeIfAbsent(kinds[position], k -> new ArrayList<>()).add(new SyntaxNode(this, position));
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.byKind = Collections.unmodifiableMap(index);
    }

    public String filePath() {
        return filePath;
    }

    public int size() {
        return kinds.length;
    }

    public SyntaxNode root() {
        return new SyntaxNode(this, root);
    }

    /**
     * All nodes in document (pre-order) order.
     */
    public List<SyntaxNode> nodes() {
        return preorderRange(0, preorder.length);
    }

    /**
     * All nodes of a kind in document order.
     */
    public List<SyntaxNode> nodesOfKind(NodeKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    // --- arena accessors used by SyntaxNode ---

    String id(int index) {
        return ids[index];
    }

    NodeKind kind(int index) {
        return kinds[index];
    }

    Role role(int index) {
        return roles[index];
    }

    NodeData data(int index) {
        return data[index];
    }

    Span span(int index) {
        return spans[index];
    }

    int parent(int index) {
        return parents[index];
    }

    int[] children(int index) {
        return children[index];
    }

    int ordinal(int index) {
        return ordinals[index];
    }

    boolean contains(int ancestor, int descendant) {
        int ord = ordinals[descendant];
        return ord > ordinals[ancestor] && ord <= subtreeEnds[ancestor];
    }

    List<SyntaxNode> descendants(int index) {
        return preorderRange(ordinals[index] + 1, subtreeEnds[index] + 1);
    }

    private List<SyntaxNode> preorderRange(int from, int to) {
        List<SyntaxNode> result = new ArrayList<>(Math.max(0, to - from));
        for (int i = from; i < to; i++) {
            result.add(new SyntaxNode(this, preorder[i]));
        }
        return result;
    }

    public static Builder builder(String filePath) {
        return new Builder(filePath);
    }

    /**
     * Collects flat node records and validates them into a tree.
     * Children keep the order in which they were added.
     */
    public static final class Builder {

        private final String filePath;
        private final List<Entry> entries = new ArrayList<>();

        private Builder(String filePath) {
            this.filePath = filePath == null ? "<unknown>" : filePath;
        }

        public Builder add(String id, String parentId, NodeKind kind, Role role, NodeData data, Span span) {
            entries.add(new Entry(id, parentId, kind, role, data, span));
            return this;
        }

        public SyntaxTree build() {
            int size = entries.size();
            if (size == 0) {
                throw new MalformedTreeException(filePath, "tree has no nodes");
            }

            Map<String, Integer> indexById = new HashMap<>();
            for (int i = 0; i < size; i++) {
                Entry entry = entries.get(i);
                if (entry.id() == null || entry.id().isBlank()) {
                    throw new MalformedTreeException(filePath, "node #" + i + " has no id");
                }
                if (indexById.putIfAbsent(entry.id(), i) != null) {
                    throw new MalformedTreeException(filePath, "duplicate node id '" + entry.id() + "'");
                }
            }

            String[] ids = new String[size];
            NodeKind[] kinds = new NodeKind[size];
            Role[] roles = new Role[size];
            NodeData[] data = new NodeData[size];
            int[] parents = new int[size];
            List<List<Integer>> childLists = new ArrayList<>(size);
            int root = NO_PARENT;

            for (int i = 0; i < size; i++) {
                Entry entry = entries.get(i);
                ids[i] = entry.id();
                if (entry.kind() == null) {
                    throw new MalformedTreeException(filePath, "node '" + entry.id() + "' has no kind");
                }
                kinds[i] = entry.kind();
                data[i] = entry.data() == null ? NodeData.EMPTY : entry.data();
                if (kinds[i].isNameRequired() && (data[i].name() == null || data[i].name().isBlank())) {
                    throw new MalformedTreeException(filePath,
                            "node '" + entry.id() + "' of kind " + kinds[i] + " requires a name");
                }
                childLists.add(new ArrayList<>());

                if (entry.parentId() == null) {
                    if (root != NO_PARENT) {
                        throw new MalformedTreeException(filePath,
                                "multiple roots: '" + ids[root] + "' and '" + entry.id() + "'");
                    }
                    root = i;
                    parents[i] = NO_PARENT;
                    roles[i] = Role.ROOT;
                } else {
                    roles[i] = entry.role() == null ? Role.OTHER : entry.role();
                }
            }
            if (root == NO_PARENT) {
                throw new MalformedTreeException(filePath, "tree has no root node");
            }

            for (int i = 0; i < size; i++) {
                String parentId = entries.get(i).parentId();
                if (parentId == null) {
                    continue;
                }
                Integer parent = indexById.get(parentId);
                if (parent == null) {
                    throw new MalformedTreeException(filePath,
                            "node '" + ids[i] + "' references unknown parent '" + parentId + "'");
                }
                parents[i] = parent;
                childLists.get(parent).add(i);
            }

            int[][] children = new int[size][];
            for (int i = 0; i < size; i++) {
                children[i] = childLists.get(i).stream().mapToInt(Integer::intValue).toArray();
            }

            // Pre-order numbering; nodes the root cannot reach sit on a parent cycle.
            int[] preorder = new int[size];
            int[] ordinals = new int[size];
            int[] subtreeEnds = new int[size];
            int visited = 0;
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{root, 0});
            ordinals[root] = visited;
            preorder[visited++] = root;
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                if (frame[1] < children[node].length) {
                    int child = children[node][frame[1]++];
                    ordinals[child] = visited;
                    preorder[visited++] = child;
                    stack.push(new int[]{child, 0});
                } else {
                    subtreeEnds[node] = visited - 1;
                    stack.pop();
                }
            }
            if (visited != size) {
                throw new MalformedTreeException(filePath,
                        (size - visited) + " node(s) unreachable from the root (cyclic parent links)");
            }

            Span[] spans = new Span[size];
            for (int i = 0; i < size; i++) {
                Span span = entries.get(i).span();
                spans[i] = span != null ? span : Span.at(ordinals[i] + 1, 1);
            }

            return new SyntaxTree(filePath, ids, kinds, roles, data, spans, parents, children,
                    preorder, ordinals, subtreeEnds, root);
        }

        private record Entry(String id, String parentId, NodeKind kind, Role role, NodeData data, Span span) {}
    }
}
