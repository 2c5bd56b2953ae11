/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.common.Constants.NotSupported;
import org.opensearch.logql.lang.common.GroupingModifier;
import org.opensearch.logql.lang.parser.NodeKind;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.Operation;
import org.opensearch.logql.lang.visual.ParsingError;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handlers for range and vector aggregations. They only build the aggregation's own operation; the walker is
 * responsible for the aggregated expression.
 */
public final class AggregationHandlers {

    private static final Pattern INTERVAL_PATTERN = Pattern.compile("\\[(.+)\\]");

    private AggregationHandlers() {}

    /**
     * Builds e.g. {@code count_over_time [5m]} or {@code quantile_over_time [0.99, 5m]}.
     *
     * <p>The interval is read from the text of the range. It is not taken from a child token because a template
     * variable such as {@code $__interval} does not parse as a duration.</p>
     */
    public static HandlerResult rangeAggregation(SourceText text, SyntaxNode node) {
        String function = text.slice(node.getChild(NodeKind.RANGE_OP));
        List<String> params = new ArrayList<>();
        SyntaxNode number = node.getChild(NodeKind.NUMBER);
        if (number != null) {
            params.add(text.slice(number));
        }

        SyntaxNode range = SyntaxNodes.findFirst(node, NodeKind.RANGE);
        Matcher matcher = INTERVAL_PATTERN.matcher(text.slice(range != null ? range : node));
        if (matcher.find() && !matcher.group(1).isEmpty()) {
            params.add(matcher.group(1));
        }

        ParsingError error = null;
        if (node.getChild(NodeKind.GROUPING) != null) {
            error = SyntaxNodes.notSupportedError(text, node, NotSupported.RANGE_AGGREGATION_GROUPING);
        }
        return new HandlerResult(new Operation(function, params), error);
    }

    /**
     * Builds e.g. {@code sum []}, {@code __sum_by [job]} or {@code topk [5]}. A numeric parameter comes before the
     * grouping labels.
     */
    public static Operation vectorAggregation(SourceText text, SyntaxNode node) {
        String function = text.slice(node.getChild(NodeKind.VECTOR_OP));
        List<String> params = new ArrayList<>();
        SyntaxNode number = node.getChild(NodeKind.NUMBER);
        if (number != null) {
            params.add(text.slice(number));
        }

        String id = function;
        SyntaxNode grouping = node.getChild(NodeKind.GROUPING);
        if (grouping != null) {
            if (grouping.getChild(NodeKind.BY) != null) {
                id = GroupingModifier.BY.operationId(function);
            } else if (grouping.getChild(NodeKind.WITHOUT) != null) {
                id = GroupingModifier.WITHOUT.operationId(function);
            }
            params.addAll(SyntaxNodes.getAllByType(text, grouping, NodeKind.IDENTIFIER));
        }
        return new Operation(id, params);
    }
}
