/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node in the LogQL concrete syntax tree.
 *
 * <p>A node covers the half-open range {@code [from, to)} of the parsed text and owns its children in
 * source order. Nodes are linked to their parent, so sibling navigation is available. The tree is not
 * modified after {@link LogQLParser#parse(String)} returns.</p>
 */
public final class SyntaxNode {
    /**
     * The kind of this node.
     */
    private final NodeKind kind;

    /**
     * Start offset, inclusive.
     */
    private final int from;

    /**
     * End offset, exclusive.
     */
    private final int to;

    /**
     * The list of child nodes.
     */
    private final List<SyntaxNode> children;

    private SyntaxNode parent;

    /**
     * Constructor for SyntaxNode. Children are re-parented to the new node.
     * @param kind the node kind
     * @param from start offset, inclusive
     * @param to end offset, exclusive
     * @param children the child nodes in source order
     */
    public SyntaxNode(NodeKind kind, int from, int to, List<SyntaxNode> children) {
        if (from > to) {
            throw new IllegalArgumentException("Invalid node range [" + from + ", " + to + ") for " + kind);
        }
        this.kind = kind;
        this.from = from;
        this.to = to;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (SyntaxNode child : this.children) {
            child.parent = this;
        }
    }

    /**
     * Creates a node without children.
     * @param kind the node kind
     * @param from start offset, inclusive
     * @param to end offset, exclusive
     * @return the leaf node
     */
    public static SyntaxNode leaf(NodeKind kind, int from, int to) {
        return new SyntaxNode(kind, from, to, List.of());
    }

    /**
     * Gets the node kind.
     * @return the kind
     */
    public NodeKind getKind() {
        return kind;
    }

    /**
     * Gets the grammar name of the node kind.
     * @return the grammar name
     */
    public String getName() {
        return kind.getGrammarName();
    }

    /**
     * Gets the start offset.
     * @return the start offset, inclusive
     */
    public int getFrom() {
        return from;
    }

    /**
     * Gets the end offset.
     * @return the end offset, exclusive
     */
    public int getTo() {
        return to;
    }

    /**
     * Gets the parent node.
     * @return the parent, or null for the root
     */
    public SyntaxNode getParent() {
        return parent;
    }

    /**
     * Gets the list of child nodes.
     * @return the children in source order
     */
    public List<SyntaxNode> getChildren() {
        return children;
    }

    public SyntaxNode getFirstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public SyntaxNode getLastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * Gets the first direct child of the given kind.
     * @param childKind the kind to look for
     * @return the child, or null if there is none
     */
    public SyntaxNode getChild(NodeKind childKind) {
        for (SyntaxNode child : children) {
            if (child.kind == childKind) {
                return child;
            }
        }
        return null;
    }

    /**
     * Gets all direct children of the given kind.
     * @param childKind the kind to look for
     * @return the matching children in source order
     */
    public List<SyntaxNode> getChildren(NodeKind childKind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.kind == childKind) {
                result.add(child);
            }
        }
        return result;
    }

    public SyntaxNode getNextSibling() {
        if (parent == null) {
            return null;
        }
        List<SyntaxNode> siblings = parent.children;
        int index = indexIn(siblings);
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    public SyntaxNode getPrevSibling() {
        if (parent == null) {
            return null;
        }
        List<SyntaxNode> siblings = parent.children;
        int index = indexIn(siblings);
        return index > 0 ? siblings.get(index - 1) : null;
    }

    private int indexIn(List<SyntaxNode> siblings) {
        // identity, not equals: two empty error nodes at the same offset are distinct
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        throw new IllegalStateException("Node " + kind + " is not a child of its parent");
    }

    @Override
    public String toString() {
        return kind.getGrammarName() + "[" + from + ".." + to + "]";
    }
}
