/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.common.Constants;
import org.opensearch.logql.lang.common.Constants.NotSupported;
import org.opensearch.logql.lang.common.Constants.OperationIds;
import org.opensearch.logql.lang.common.LineFilterType;
import org.opensearch.logql.lang.parser.NodeKind;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.LabelFilter;
import org.opensearch.logql.lang.visual.Operation;
import org.opensearch.logql.lang.visual.ParsingError;

import java.util.List;

/**
 * Handlers for stream selectors and log pipeline stages. Each maps one node to at most one operation and at most
 * one diagnostic, and never recurses.
 */
public final class PipelineHandlers {

    private PipelineHandlers() {}

    /**
     * Reads {@code label op "value"} from a stream selector matcher.
     */
    public static LabelFilter label(SourceText text, SyntaxNode matcher) {
        SyntaxNode labelNode = matcher.getChild(NodeKind.IDENTIFIER);
        String label = text.slice(labelNode);
        String operator = labelNode != null ? text.slice(labelNode.getNextSibling()) : "";
        String value = QuotedValues.stripQuotes(text.slice(matcher.getChild(NodeKind.STRING)));
        return new LabelFilter(label, operator, value);
    }

    public static HandlerResult lineFilter(SourceText text, SyntaxNode node) {
        if (SyntaxNodes.containsKind(node, NodeKind.IP)) {
            return HandlerResult.error(SyntaxNodes.notSupportedError(text, node, NotSupported.IP_LINE_FILTER));
        }
        LineFilterType type = LineFilterType.fromOperator(text.slice(node.getChild(NodeKind.FILTER)));
        String value = QuotedValues.unquote(text.slice(node.getChild(NodeKind.STRING)));
        return new HandlerResult(new Operation(type.getOperationId(), value), SyntaxNodes.childError(text, node));
    }

    /**
     * The operation id is the parser keyword; pattern and regexp take their expression as the only parameter.
     */
    public static HandlerResult labelParser(SourceText text, SyntaxNode node) {
        String parser = text.slice(node.getFirstChild());
        String expression = QuotedValues.unquote(text.slice(node.getChild(NodeKind.STRING)));
        Operation operation = expression.isEmpty() ? new Operation(parser) : new Operation(parser, expression);
        return new HandlerResult(operation, SyntaxNodes.childError(text, node));
    }

    public static ParsingError jsonExpressionParser(SourceText text, SyntaxNode node) {
        return SyntaxNodes.notSupportedError(text, node, NotSupported.JSON_EXPRESSION_PARSER);
    }

    /**
     * Maps a single label filter to {@code __label_filter} with {@code [label, operator, value]}, or to
     * {@code __label_filter_no_errors} for {@code __error__=""}. Combined filters have no visual form.
     */
    public static HandlerResult labelFilter(SourceText text, SyntaxNode node) {
        if (node.getChild(NodeKind.OR) != null
            || node.getChild(NodeKind.AND) != null
            || node.getChild(NodeKind.COMMA) != null
            || node.getChildren(NodeKind.LABEL_FILTER).size() > 1) {
            return HandlerResult.error(SyntaxNodes.notSupportedError(text, node, NotSupported.COMPOUND_LABEL_FILTER));
        }

        SyntaxNode first = node.getFirstChild();
        return switch (first.getKind()) {
            case LABEL_FILTER -> {
                // parenthesized
                HandlerResult inner = labelFilter(text, first);
                ParsingError error = SyntaxNodes.childError(text, node);
                yield error != null && inner.error() == null ? new HandlerResult(inner.operation(), error) : inner;
            }
            case ERROR -> HandlerResult.error(SyntaxNodes.makeError(text, first));
            case IP_LABEL_FILTER -> HandlerResult.error(SyntaxNodes.notSupportedError(text, node, NotSupported.IP_LABEL_FILTER));
            default -> {
                // Matcher, NumberFilter, or a duration/bytes filter inside UnitFilter
                SyntaxNode filter = first.getKind() == NodeKind.UNIT_FILTER ? first.getFirstChild() : first;
                SyntaxNode label = filter.getFirstChild();
                SyntaxNode operator = label.getNextSibling();
                SyntaxNode value = operator.getNextSibling();
                List<String> params = List.of(text.slice(label), text.slice(operator), QuotedValues.unquote(text.slice(value)));

                if (String.join("", params).equals(Constants.ERROR_LABEL + "=")) {
                    yield HandlerResult.of(new Operation(OperationIds.LABEL_FILTER_NO_ERRORS));
                }
                yield HandlerResult.of(new Operation(OperationIds.LABEL_FILTER, params));
            }
        };
    }

    public static HandlerResult lineFormat(SourceText text, SyntaxNode node) {
        String template = QuotedValues.unquote(text.slice(node.getChild(NodeKind.STRING)));
        return new HandlerResult(new Operation(OperationIds.LINE_FORMAT, template), SyntaxNodes.childError(text, node));
    }

    /**
     * One {@code label_format} operation per {@code target=source} pair.
     */
    public static HandlerResult labelFormat(SourceText text, SyntaxNode matcher) {
        SyntaxNode identifier = matcher.getChild(NodeKind.IDENTIFIER);
        SyntaxNode operator = identifier.getNextSibling();
        SyntaxNode value = operator != null ? operator.getNextSibling() : null;
        Operation operation = new Operation(OperationIds.LABEL_FORMAT, text.slice(identifier), QuotedValues.unquote(text.slice(value)));
        return new HandlerResult(operation, SyntaxNodes.childError(text, matcher));
    }

    public static HandlerResult unwrap(SourceText text, SyntaxNode node) {
        if (node.getChild(NodeKind.CONV_OP) != null) {
            return HandlerResult.error(SyntaxNodes.notSupportedError(text, node, NotSupported.UNWRAP_CONVERSION));
        }
        String label = text.slice(node.getChild(NodeKind.IDENTIFIER));
        return new HandlerResult(new Operation(OperationIds.UNWRAP, label), SyntaxNodes.childError(text, node));
    }
}
