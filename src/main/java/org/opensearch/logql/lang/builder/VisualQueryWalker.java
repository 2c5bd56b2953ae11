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

/**
 * Depth-first walk of a LogQL syntax tree that fills a {@link ParsingContext}.
 *
 * <p>Every {@link NodeKind} has an explicit disposition in {@link #walk(SyntaxNode, ParsingContext)}. Constructs
 * the visual query understands go to their handler, which does not descend any further except into the
 * expression an aggregation applies to. Structural nodes are transparent: the walk continues into their children
 * in order. Adding a node kind breaks compilation here until it is given a disposition.</p>
 */
public class VisualQueryWalker {

    @FunctionalInterface
    private interface Visit {
        void apply(SyntaxNode node, ParsingContext context);
    }

    private final SourceText text;
    private final BinaryExpressionResolver binaryResolver;

    public VisualQueryWalker(SourceText text) {
        this.text = text;
        this.binaryResolver = new BinaryExpressionResolver(text, this);
    }

    /**
     * Walks a node, appending what it finds to the context.
     * @param node the node to walk
     * @param context the context to fill
     */
    public void walk(SyntaxNode node, ParsingContext context) {
        Visit visit = switch (node.getKind()) {
            case MATCHER -> this::visitMatcher;
            case LINE_FILTER -> (n, c) -> PipelineHandlers.lineFilter(text, n).applyTo(c);
            case LABEL_PARSER -> (n, c) -> PipelineHandlers.labelParser(text, n).applyTo(c);
            case LABEL_FILTER -> (n, c) -> PipelineHandlers.labelFilter(text, n).applyTo(c);
            case JSON_EXPRESSION_PARSER -> (n, c) -> c.addError(PipelineHandlers.jsonExpressionParser(text, n));
            case LINE_FORMAT_EXPR -> (n, c) -> PipelineHandlers.lineFormat(text, n).applyTo(c);
            case LABEL_FORMAT_MATCHER -> (n, c) -> PipelineHandlers.labelFormat(text, n).applyTo(c);
            case UNWRAP_EXPR -> this::visitUnwrap;
            case RANGE_AGGREGATION_EXPR -> this::visitRangeAggregation;
            case VECTOR_AGGREGATION_EXPR -> this::visitVectorAggregation;
            case BIN_OP_EXPR -> binaryResolver::resolve;
            case ERROR -> this::visitError;

            // Structure
            case LOG_QL, EXPR, LOG_EXPR, METRIC_EXPR, SELECTOR, MATCHERS, PIPELINE_EXPR, PIPELINE_STAGE, LOG_RANGE_EXPR,
                RANGE, OFFSET_EXPR, LABEL_FORMAT_EXPR, LABELS_FORMAT, LITERAL_EXPR, LABEL_REPLACE_EXPR,
                VECTOR_EXPR -> this::visitChildren;

            // Read by the handler of an enclosing construct, or leaves
            case PIPE, FILTER, PIPE_EXACT, PIPE_MATCH, IP, JSON, LOGFMT, UNPACK, PATTERN, REGEXP, JSON_EXPRESSION_LIST,
                JSON_EXPRESSION, IP_LABEL_FILTER, UNIT_FILTER, DURATION_FILTER, BYTES_FILTER, NUMBER_FILTER, LINE_FORMAT,
                LABEL_FORMAT, UNWRAP, CONV_OP, OFFSET, LABEL_REPLACE, VECTOR, RANGE_OP, VECTOR_OP, GROUPING, BY, WITHOUT,
                LABELS, BIN_MODIFIERS, BOOL, ON_OR_IGNORING, ON, IGNORING, GROUP_LEFT, GROUP_RIGHT, GROUPING_LABELS,
                GROUPING_LABEL_LIST, EQ, NEQ, RE, NRE, EQL, GTR, GTE, LSS, LTE, ADD, SUB, MUL, DIV, MOD, POW, AND, OR,
                UNLESS, COMMA, IDENTIFIER, STRING, NUMBER, DURATION, BYTES -> this::visitChildren;
        };
        visit.apply(node, context);
    }

    private void visitChildren(SyntaxNode node, ParsingContext context) {
        for (SyntaxNode child : node.getChildren()) {
            walk(child, context);
        }
    }

    private void visitMatcher(SyntaxNode node, ParsingContext context) {
        context.getQuery().addLabel(PipelineHandlers.label(text, node));
        for (SyntaxNode error : node.getChildren(NodeKind.ERROR)) {
            context.addError(SyntaxNodes.makeError(text, error));
        }
    }

    /**
     * An unwrap followed by label filters nests as {@code UnwrapExpr(UnwrapExpr, Pipe, LabelFilter)}.
     */
    private void visitUnwrap(SyntaxNode node, ParsingContext context) {
        SyntaxNode inner = node.getChild(NodeKind.UNWRAP_EXPR);
        if (inner == null) {
            PipelineHandlers.unwrap(text, node).applyTo(context);
            return;
        }
        walk(inner, context);
        for (SyntaxNode filter : node.getChildren(NodeKind.LABEL_FILTER)) {
            walk(filter, context);
        }
    }

    private void visitRangeAggregation(SyntaxNode node, ParsingContext context) {
        HandlerResult result = AggregationHandlers.rangeAggregation(text, node);
        SyntaxNode logRange = node.getChild(NodeKind.LOG_RANGE_EXPR);
        if (logRange != null) {
            walk(logRange, context);
        }
        visitErrorChildren(node, context);
        result.applyTo(context);
    }

    private void visitVectorAggregation(SyntaxNode node, ParsingContext context) {
        SyntaxNode metric = node.getChild(NodeKind.METRIC_EXPR);
        if (metric != null) {
            walk(metric, context);
        }
        visitErrorChildren(node, context);
        context.getQuery().addOperation(AggregationHandlers.vectorAggregation(text, node));
    }

    private void visitErrorChildren(SyntaxNode node, ParsingContext context) {
        for (SyntaxNode error : node.getChildren(NodeKind.ERROR)) {
            visitError(error, context);
        }
    }

    /**
     * Reports a syntax error, except inside a range: {@code [$__interval]} does not parse as a duration once the
     * variable is replaced.
     */
    private void visitError(SyntaxNode node, ParsingContext context) {
        SyntaxNode parent = node.getParent();
        if (parent != null && parent.getKind() == NodeKind.RANGE) {
            return;
        }
        context.addError(SyntaxNodes.makeError(text, node));
    }
}
