/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.common.BinaryOperator;
import org.opensearch.logql.lang.common.Constants.NotSupported;
import org.opensearch.logql.lang.common.VectorMatchType;
import org.opensearch.logql.lang.parser.NodeKind;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.BinaryQuery;
import org.opensearch.logql.lang.visual.Operation;
import org.opensearch.logql.lang.visual.VisualQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a binary expression into the visual query.
 *
 * <p>A binary expression is represented in one of two ways:</p>
 * <ul>
 *   <li><b>vector op scalar</b>: the right operand is a number literal. The expression becomes one more operation,
 *   e.g. {@code __greater_than [10]}, appended after the operations of the left side.</li>
 *   <li><b>vector op vector</b>: the right operand is a query. It becomes a {@link BinaryQuery} holding its own
 *   visual query, filled in with a context that shares the error list.</li>
 * </ul>
 *
 * <p>Because binary operators are left associative, {@code x + 2 * 3} parses as {@code x + (2 * 3)}: the right
 * operand is a binary expression whose left-most leaf is the literal {@code 2}. That literal is the argument of
 * the current operator, so it is emitted here, and it is skipped when the right operand is walked because it is
 * the left operand of that nested expression.</p>
 */
final class BinaryExpressionResolver {

    private final SourceText text;
    private final VisualQueryWalker walker;

    BinaryExpressionResolver(SourceText text, VisualQueryWalker walker) {
        this.text = text;
        this.walker = walker;
    }

    void resolve(SyntaxNode node, ParsingContext context) {
        SyntaxNode left = node.getFirstChild();
        String sign = text.slice(left.getNextSibling());
        BinaryOperator operator = BinaryOperator.fromSign(sign);
        Modifier modifier = Modifier.of(text, node.getChild(NodeKind.BIN_MODIFIERS));
        SyntaxNode right = node.getLastChild();

        // a leading literal was already consumed as the argument of the enclosing operator
        if (SyntaxNodes.childAtPath(left, NodeKind.METRIC_EXPR, NodeKind.LITERAL_EXPR, NodeKind.NUMBER) == null) {
            walker.walk(left, context);
        }

        SyntaxNode rightLiteral = SyntaxNodes.childAtPath(right, NodeKind.METRIC_EXPR, NodeKind.LITERAL_EXPR);
        if (rightLiteral != null && rightLiteral.getChild(NodeKind.NUMBER) != null) {
            addScalarOperation(node, operator, rightLiteral, modifier, context);
        } else if (SyntaxNodes.childAtPath(right, NodeKind.METRIC_EXPR, NodeKind.BIN_OP_EXPR) != null) {
            SyntaxNode leadingLiteral = leadingLiteral(right);
            if (leadingLiteral != null) {
                addScalarOperation(node, operator, leadingLiteral, modifier, context);
            }
            walker.walk(right, context);
        } else {
            VisualQuery nested = new VisualQuery();
            BinaryQuery binaryQuery = modifier.matchType() != null
                ? new BinaryQuery(sign, nested, modifier.matchType(), modifier.matches())
                : new BinaryQuery(sign, nested);
            context.getQuery().addBinaryQuery(binaryQuery);
            if (modifier.groupModifier()) {
                context.addError(SyntaxNodes.notSupportedError(text, node, NotSupported.GROUP_MODIFIER));
            }
            walker.walk(right, context.forBinaryQuery(nested));
        }
    }

    private void addScalarOperation(
        SyntaxNode node,
        BinaryOperator operator,
        SyntaxNode literal,
        Modifier modifier,
        ParsingContext context
    ) {
        if (operator.isSetOperator()) {
            context.addError(SyntaxNodes.notSupportedError(text, node, NotSupported.SET_OPERATOR_WITH_SCALAR));
            return;
        }
        List<String> params = new ArrayList<>();
        params.add(text.slice(literal));
        if (operator.isComparison() && modifier.bool()) {
            params.add("bool");
        }
        context.getQuery().addOperation(new Operation(operator.getOperationId(), params));
    }

    /**
     * @return the literal a binary expression starts with, or null if it starts with a query
     */
    private static SyntaxNode leadingLiteral(SyntaxNode expression) {
        SyntaxNode leftMost = SyntaxNodes.leftMostChild(expression);
        SyntaxNode parent = leftMost.getParent();
        boolean inLiteral = parent != null && parent.getKind() == NodeKind.LITERAL_EXPR;
        return switch (leftMost.getKind()) {
            case NUMBER -> inLiteral ? parent : leftMost;
            case ADD, SUB -> inLiteral ? parent : null;
            default -> null;
        };
    }

    /**
     * Binary modifiers. {@code bool} and on/ignoring are exclusive; {@code bool} wins if both are present.
     */
    private record Modifier(boolean bool, VectorMatchType matchType, String matches, boolean groupModifier) {

        private static final Modifier NONE = new Modifier(false, null, null, false);

        static Modifier of(SourceText text, SyntaxNode modifiers) {
            if (modifiers == null) {
                return NONE;
            }
            if (modifiers.getChild(NodeKind.BOOL) != null) {
                return new Modifier(true, null, null, false);
            }
            SyntaxNode matcher = modifiers.getChild(NodeKind.ON_OR_IGNORING);
            if (matcher == null) {
                return NONE;
            }
            VectorMatchType type = matcher.getChild(NodeKind.ON) != null ? VectorMatchType.ON : VectorMatchType.IGNORING;
            SyntaxNode labels = SyntaxNodes.childAtPath(matcher, NodeKind.GROUPING_LABELS, NodeKind.GROUPING_LABEL_LIST);
            String matches = labels != null ? String.join(",", SyntaxNodes.getAllByType(text, labels, NodeKind.IDENTIFIER)) : "";
            boolean groupModifier = matcher.getChild(NodeKind.GROUP_LEFT) != null || matcher.getChild(NodeKind.GROUP_RIGHT) != null;
            return new Modifier(false, type, matches, groupModifier);
        }
    }
}
