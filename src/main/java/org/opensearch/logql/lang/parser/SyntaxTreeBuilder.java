/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.opensearch.logql.lang.parser.generated.LogQLBaseParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Converts a {@code LogQLBase} parse tree into a {@link SyntaxNode} tree.
 *
 * <p>Each parser rule becomes the node kind of the same name. Punctuation is dropped, operator and keyword tokens
 * become leaves, and single-token rules such as {@code identifier} or {@code rangeOp} collapse into one leaf.
 * Binary expressions are nested as {@code Expr(MetricExpr(BinOpExpr(Expr, operator, BinModifiers?, Expr)))}.</p>
 *
 * <p>ANTLR error nodes turn into {@link NodeKind#ERROR} nodes. A rule that failed without consuming anything
 * collapses into an empty error node at the end of the last real token.</p>
 */
final class SyntaxTreeBuilder {

    private static final Map<Integer, NodeKind> RULE_KINDS = Map.ofEntries(
        entry(LogQLBaseParser.RULE_expr, NodeKind.EXPR),
        entry(LogQLBaseParser.RULE_metricExpr, NodeKind.METRIC_EXPR),
        entry(LogQLBaseParser.RULE_logExpr, NodeKind.LOG_EXPR),
        entry(LogQLBaseParser.RULE_selector, NodeKind.SELECTOR),
        entry(LogQLBaseParser.RULE_matchers, NodeKind.MATCHERS),
        entry(LogQLBaseParser.RULE_matcher, NodeKind.MATCHER),
        entry(LogQLBaseParser.RULE_pipelineExpr, NodeKind.PIPELINE_EXPR),
        entry(LogQLBaseParser.RULE_pipelineStage, NodeKind.PIPELINE_STAGE),
        entry(LogQLBaseParser.RULE_lineFilter, NodeKind.LINE_FILTER),
        entry(LogQLBaseParser.RULE_filter, NodeKind.FILTER),
        entry(LogQLBaseParser.RULE_labelParser, NodeKind.LABEL_PARSER),
        entry(LogQLBaseParser.RULE_jsonExpressionParser, NodeKind.JSON_EXPRESSION_PARSER),
        entry(LogQLBaseParser.RULE_jsonExpressionList, NodeKind.JSON_EXPRESSION_LIST),
        entry(LogQLBaseParser.RULE_jsonExpression, NodeKind.JSON_EXPRESSION),
        entry(LogQLBaseParser.RULE_lineFormatExpr, NodeKind.LINE_FORMAT_EXPR),
        entry(LogQLBaseParser.RULE_labelFormatExpr, NodeKind.LABEL_FORMAT_EXPR),
        entry(LogQLBaseParser.RULE_labelsFormat, NodeKind.LABELS_FORMAT),
        entry(LogQLBaseParser.RULE_labelFormatMatcher, NodeKind.LABEL_FORMAT_MATCHER),
        entry(LogQLBaseParser.RULE_labelFilter, NodeKind.LABEL_FILTER),
        entry(LogQLBaseParser.RULE_ipLabelFilter, NodeKind.IP_LABEL_FILTER),
        entry(LogQLBaseParser.RULE_unitFilter, NodeKind.UNIT_FILTER),
        entry(LogQLBaseParser.RULE_durationFilter, NodeKind.DURATION_FILTER),
        entry(LogQLBaseParser.RULE_bytesFilter, NodeKind.BYTES_FILTER),
        entry(LogQLBaseParser.RULE_numberFilter, NodeKind.NUMBER_FILTER),
        entry(LogQLBaseParser.RULE_signedNumber, NodeKind.NUMBER),
        entry(LogQLBaseParser.RULE_unwrapExpr, NodeKind.UNWRAP_EXPR),
        entry(LogQLBaseParser.RULE_convOp, NodeKind.CONV_OP),
        entry(LogQLBaseParser.RULE_logRangeExpr, NodeKind.LOG_RANGE_EXPR),
        entry(LogQLBaseParser.RULE_range, NodeKind.RANGE),
        entry(LogQLBaseParser.RULE_offsetExpr, NodeKind.OFFSET_EXPR),
        entry(LogQLBaseParser.RULE_rangeAggregationExpr, NodeKind.RANGE_AGGREGATION_EXPR),
        entry(LogQLBaseParser.RULE_rangeOp, NodeKind.RANGE_OP),
        entry(LogQLBaseParser.RULE_vectorAggregationExpr, NodeKind.VECTOR_AGGREGATION_EXPR),
        entry(LogQLBaseParser.RULE_vectorOp, NodeKind.VECTOR_OP),
        entry(LogQLBaseParser.RULE_grouping, NodeKind.GROUPING),
        entry(LogQLBaseParser.RULE_labels, NodeKind.LABELS),
        entry(LogQLBaseParser.RULE_binModifiers, NodeKind.BIN_MODIFIERS),
        entry(LogQLBaseParser.RULE_onOrIgnoring, NodeKind.ON_OR_IGNORING),
        entry(LogQLBaseParser.RULE_groupingLabels, NodeKind.GROUPING_LABELS),
        entry(LogQLBaseParser.RULE_groupingLabelList, NodeKind.GROUPING_LABEL_LIST),
        entry(LogQLBaseParser.RULE_literalExpr, NodeKind.LITERAL_EXPR),
        entry(LogQLBaseParser.RULE_labelReplaceExpr, NodeKind.LABEL_REPLACE_EXPR),
        entry(LogQLBaseParser.RULE_vectorExpr, NodeKind.VECTOR_EXPR),
        entry(LogQLBaseParser.RULE_identifier, NodeKind.IDENTIFIER)
    );

    /**
     * Tokens that become leaves. Anything else, brackets and commas mostly, is dropped.
     */
    private static final Map<Integer, NodeKind> TOKEN_KINDS = Map.ofEntries(
        entry(LogQLBaseParser.PIPE, NodeKind.PIPE),
        entry(LogQLBaseParser.PIPE_EXACT, NodeKind.PIPE_EXACT),
        entry(LogQLBaseParser.PIPE_MATCH, NodeKind.PIPE_MATCH),
        entry(LogQLBaseParser.EQ, NodeKind.EQ),
        entry(LogQLBaseParser.NEQ, NodeKind.NEQ),
        entry(LogQLBaseParser.RE, NodeKind.RE),
        entry(LogQLBaseParser.NRE, NodeKind.NRE),
        entry(LogQLBaseParser.EQL, NodeKind.EQL),
        entry(LogQLBaseParser.GTR, NodeKind.GTR),
        entry(LogQLBaseParser.GTE, NodeKind.GTE),
        entry(LogQLBaseParser.LSS, NodeKind.LSS),
        entry(LogQLBaseParser.LTE, NodeKind.LTE),
        entry(LogQLBaseParser.ADD, NodeKind.ADD),
        entry(LogQLBaseParser.SUB, NodeKind.SUB),
        entry(LogQLBaseParser.MUL, NodeKind.MUL),
        entry(LogQLBaseParser.DIV, NodeKind.DIV),
        entry(LogQLBaseParser.MOD, NodeKind.MOD),
        entry(LogQLBaseParser.POW, NodeKind.POW),
        entry(LogQLBaseParser.AND, NodeKind.AND),
        entry(LogQLBaseParser.OR, NodeKind.OR),
        entry(LogQLBaseParser.UNLESS, NodeKind.UNLESS),
        entry(LogQLBaseParser.BY, NodeKind.BY),
        entry(LogQLBaseParser.WITHOUT, NodeKind.WITHOUT),
        entry(LogQLBaseParser.BOOL, NodeKind.BOOL),
        entry(LogQLBaseParser.ON, NodeKind.ON),
        entry(LogQLBaseParser.IGNORING, NodeKind.IGNORING),
        entry(LogQLBaseParser.GROUP_LEFT, NodeKind.GROUP_LEFT),
        entry(LogQLBaseParser.GROUP_RIGHT, NodeKind.GROUP_RIGHT),
        entry(LogQLBaseParser.OFFSET, NodeKind.OFFSET),
        entry(LogQLBaseParser.JSON, NodeKind.JSON),
        entry(LogQLBaseParser.LOGFMT, NodeKind.LOGFMT),
        entry(LogQLBaseParser.UNPACK, NodeKind.UNPACK),
        entry(LogQLBaseParser.PATTERN, NodeKind.PATTERN),
        entry(LogQLBaseParser.REGEXP, NodeKind.REGEXP),
        entry(LogQLBaseParser.LINE_FORMAT, NodeKind.LINE_FORMAT),
        entry(LogQLBaseParser.LABEL_FORMAT, NodeKind.LABEL_FORMAT),
        entry(LogQLBaseParser.UNWRAP, NodeKind.UNWRAP),
        entry(LogQLBaseParser.IP, NodeKind.IP),
        entry(LogQLBaseParser.LABEL_REPLACE, NodeKind.LABEL_REPLACE),
        entry(LogQLBaseParser.VECTOR, NodeKind.VECTOR),
        entry(LogQLBaseParser.STRING, NodeKind.STRING),
        entry(LogQLBaseParser.NUMBER, NodeKind.NUMBER),
        entry(LogQLBaseParser.DURATION, NodeKind.DURATION),
        entry(LogQLBaseParser.BYTES, NodeKind.BYTES),
        entry(LogQLBaseParser.IDENTIFIER, NodeKind.IDENTIFIER)
    );

    /**
     * Rules whose tokens form a single leaf.
     */
    private static final List<Integer> LEAF_RULES = List.of(
        LogQLBaseParser.RULE_identifier,
        LogQLBaseParser.RULE_rangeOp,
        LogQLBaseParser.RULE_vectorOp,
        LogQLBaseParser.RULE_convOp,
        LogQLBaseParser.RULE_signedNumber
    );

    private final int textLength;

    /**
     * Maps a code point index of the char stream to a UTF-16 index. Null when the text has no supplementary
     * characters and both indices coincide.
     */
    private final int[] utf16Offsets;

    /**
     * End offset of the last real token converted so far. Empty error nodes are placed here.
     */
    private int lastEnd;

    SyntaxTreeBuilder(String text) {
        this.textLength = text.length();
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            this.utf16Offsets = null;
        } else {
            this.utf16Offsets = new int[codePoints + 1];
            int offset = 0;
            for (int i = 0; i < codePoints; i++) {
                utf16Offsets[i] = offset;
                offset += Character.charCount(text.codePointAt(offset));
            }
            utf16Offsets[codePoints] = offset;
        }
    }

    /**
     * Converts the tree returned by the {@code logQL} rule.
     * @param tree the parse tree
     * @return the root node spanning the whole text
     */
    SyntaxNode build(LogQLBaseParser.LogQLContext tree) {
        lastEnd = 0;
        return new SyntaxNode(NodeKind.LOG_QL, 0, textLength, convertChildren(tree, new Extent()));
    }

    private SyntaxNode convert(ParserRuleContext ctx) {
        int rule = ctx.getRuleIndex();
        NodeKind kind = RULE_KINDS.get(rule);
        if (kind == null) {
            throw new IllegalStateException("No node kind for rule " + LogQLBaseParser.ruleNames[rule]);
        }

        Extent extent = new Extent();
        List<SyntaxNode> children = convertChildren(ctx, extent);
        if (!extent.hasTokens()) {
            // Nothing consumed: an error, unless the rule matched empty input
            boolean failed = ctx.exception != null || children.stream().anyMatch(c -> c.getKind() == NodeKind.ERROR);
            return SyntaxNode.leaf(failed ? NodeKind.ERROR : kind, lastEnd, lastEnd);
        }

        if (LEAF_RULES.contains(rule)) {
            List<SyntaxNode> errors = children.stream().filter(c -> c.getKind() == NodeKind.ERROR).toList();
            return new SyntaxNode(kind, extent.from, extent.to, errors);
        }
        if (rule == LogQLBaseParser.RULE_expr && ctx.getChild(0) instanceof LogQLBaseParser.ExprContext) {
            SyntaxNode binary = new SyntaxNode(NodeKind.BIN_OP_EXPR, extent.from, extent.to, children);
            SyntaxNode metric = new SyntaxNode(NodeKind.METRIC_EXPR, extent.from, extent.to, List.of(binary));
            return new SyntaxNode(NodeKind.EXPR, extent.from, extent.to, List.of(metric));
        }
        if (rule == LogQLBaseParser.RULE_metricExpr
            || rule == LogQLBaseParser.RULE_vectorAggregationExpr
            || rule == LogQLBaseParser.RULE_labelReplaceExpr) {
            children = unwrapOperands(children, rule != LogQLBaseParser.RULE_metricExpr);
        }
        return new SyntaxNode(kind, extent.from, extent.to, children);
    }

    /**
     * Replaces {@code Expr} operands by their only child. Functions over metrics do not accept a log expression,
     * so one found there is wrapped in an error node.
     */
    private static List<SyntaxNode> unwrapOperands(List<SyntaxNode> children, boolean metricOnly) {
        List<SyntaxNode> result = new ArrayList<>(children.size());
        for (SyntaxNode child : children) {
            SyntaxNode operand = child;
            if (child.getKind() == NodeKind.EXPR && child.getChildren().size() == 1) {
                operand = child.getFirstChild();
            }
            if (metricOnly && operand.getKind() == NodeKind.LOG_EXPR) {
                operand = new SyntaxNode(NodeKind.ERROR, operand.getFrom(), operand.getTo(), List.of(operand));
            }
            result.add(operand);
        }
        return result;
    }

    private List<SyntaxNode> convertChildren(ParserRuleContext ctx, Extent extent) {
        List<SyntaxNode> nodes = new ArrayList<>();
        boolean afterSkippedToken = false;
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof ErrorNode errorNode) {
                Token token = errorNode.getSymbol();
                if (token.getType() == Token.EOF) {
                    continue;
                }
                if (token.getTokenIndex() < 0) {
                    // Conjured by single token insertion
                    nodes.add(SyntaxNode.leaf(NodeKind.ERROR, lastEnd, lastEnd));
                    extent.include(lastEnd, lastEnd);
                    afterSkippedToken = false;
                    continue;
                }
                int from = start(token);
                int to = end(token);
                if (afterSkippedToken) {
                    from = nodes.remove(nodes.size() - 1).getFrom();
                }
                nodes.add(SyntaxNode.leaf(NodeKind.ERROR, from, to));
                extent.includeToken(from, to);
                lastEnd = to;
                afterSkippedToken = true;
                continue;
            }

            afterSkippedToken = false;
            if (child instanceof TerminalNode terminal) {
                SyntaxNode leaf = convertTerminal(terminal.getSymbol(), ctx, extent);
                if (leaf != null) {
                    nodes.add(leaf);
                }
            } else if (child instanceof ParserRuleContext rule) {
                SyntaxNode node = convert(rule);
                if (node.getTo() > node.getFrom()) {
                    extent.includeToken(node.getFrom(), node.getTo());
                } else {
                    extent.include(node.getFrom(), node.getTo());
                }
                nodes.add(node);
            }
        }

        if (ctx.exception != null && nodes.stream().noneMatch(n -> n.getKind() == NodeKind.ERROR)) {
            nodes.add(SyntaxNode.leaf(NodeKind.ERROR, lastEnd, lastEnd));
            extent.include(lastEnd, lastEnd);
        }
        return nodes;
    }

    private SyntaxNode convertTerminal(Token token, ParserRuleContext parent, Extent extent) {
        if (token.getType() == Token.EOF) {
            return null;
        }
        int from = start(token);
        int to = end(token);
        extent.includeToken(from, to);
        lastEnd = to;

        NodeKind kind;
        if (token.getType() == LogQLBaseParser.COMMA) {
            // Only a comma between label filters means something
            kind = parent.getRuleIndex() == LogQLBaseParser.RULE_labelFilter ? NodeKind.COMMA : null;
        } else {
            kind = TOKEN_KINDS.get(token.getType());
        }
        return kind == null ? null : SyntaxNode.leaf(kind, from, to);
    }

    private int start(Token token) {
        return utf16(token.getStartIndex());
    }

    private int end(Token token) {
        return utf16(token.getStopIndex() + 1);
    }

    private int utf16(int codePointIndex) {
        return utf16Offsets == null ? codePointIndex : utf16Offsets[codePointIndex];
    }

    /**
     * Source range covered by a rule, and whether it consumed any token.
     */
    private static final class Extent {
        private int from = Integer.MAX_VALUE;
        private int to = Integer.MIN_VALUE;
        private boolean tokens;

        void include(int start, int end) {
            from = Math.min(from, start);
            to = Math.max(to, end);
        }

        void includeToken(int start, int end) {
            include(start, end);
            tokens = true;
        }

        boolean hasTokens() {
            return tokens;
        }
    }
}
