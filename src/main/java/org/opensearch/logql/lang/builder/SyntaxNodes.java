/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.parser.NodeKind;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.ParsingError;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree navigation and diagnostic helpers shared by the handlers.
 */
public final class SyntaxNodes {

    private SyntaxNodes() {}

    /**
     * Collects the text of every node of the given kind, in source order. Matching nodes are not searched further.
     */
    public static List<String> getAllByType(SourceText text, SyntaxNode node, NodeKind kind) {
        List<String> values = new ArrayList<>();
        collect(text, node, kind, values);
        return values;
    }

    private static void collect(SourceText text, SyntaxNode node, NodeKind kind, List<String> values) {
        if (node.getKind() == kind) {
            values.add(text.slice(node));
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            collect(text, child, kind, values);
        }
    }

    /**
     * Finds the first node of the given kind in preorder, including the node itself.
     * @return the node, or null if there is none
     */
    public static SyntaxNode findFirst(SyntaxNode node, NodeKind kind) {
        if (node.getKind() == kind) {
            return node;
        }
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = findFirst(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public static boolean containsKind(SyntaxNode node, NodeKind kind) {
        return findFirst(node, kind) != null;
    }

    /**
     * Follows first children down to a leaf.
     */
    public static SyntaxNode leftMostChild(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.getFirstChild() != null) {
            current = current.getFirstChild();
        }
        return current;
    }

    /**
     * Follows a path of child kinds, e.g. {@code MetricExpr > LiteralExpr > Number}.
     * @return the node at the end of the path, or null if some step is missing
     */
    public static SyntaxNode childAtPath(SyntaxNode node, NodeKind... path) {
        SyntaxNode current = node;
        for (NodeKind kind : path) {
            current = current.getChild(kind);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Builds a diagnostic anchored to a node.
     */
    public static ParsingError makeError(SourceText text, SyntaxNode node) {
        SyntaxNode parent = node.getParent();
        return new ParsingError(text.slice(node), node.getFrom(), node.getTo(), parent != null ? parent.getName() : null);
    }

    /**
     * Builds a diagnostic for a construct the visual query cannot represent, {@code "<message>: <node text>"}.
     */
    public static ParsingError notSupportedError(SourceText text, SyntaxNode node, String message) {
        ParsingError error = makeError(text, node);
        return new ParsingError(message + ": " + error.text(), error.from(), error.to(), error.parentType());
    }

    /**
     * Builds a diagnostic for the first syntax error among the direct children of a node.
     * @return the diagnostic, or null if no child is an error
     */
    public static ParsingError childError(SourceText text, SyntaxNode node) {
        SyntaxNode error = node.getChild(NodeKind.ERROR);
        return error != null ? makeError(text, error) : null;
    }
}
