/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.common;

/**
 * Constants for the LogQL visual query model.
 */
public class Constants {

    /**
     * Label that carries parser errors in a LogQL pipeline.
     */
    public static final String ERROR_LABEL = "__error__";

    /**
     * Operation ids understood by the visual query builder.
     */
    public static class OperationIds {
        // Line filters
        public static final String LINE_CONTAINS = "__line_contains";
        public static final String LINE_CONTAINS_NOT = "__line_contains_not";
        public static final String LINE_MATCHES_REGEX = "__line_matches_regex";
        public static final String LINE_MATCHES_REGEX_NOT = "__line_matches_regex_not";

        // Label filters
        public static final String LABEL_FILTER = "__label_filter";
        public static final String LABEL_FILTER_NO_ERRORS = "__label_filter_no_errors";

        // Formatters
        public static final String LINE_FORMAT = "line_format";
        public static final String LABEL_FORMAT = "label_format";

        public static final String UNWRAP = "unwrap";

        private OperationIds() {}
    }

    /**
     * Messages for constructs that parse but have no visual representation.
     */
    public static class NotSupported {
        public static final String IP_LINE_FILTER = "Matching ip addresses not supported in query builder";
        public static final String COMPOUND_LABEL_FILTER = "Label filter with comma, \"and\", \"or\" not supported in query builder";
        public static final String IP_LABEL_FILTER = "IpLabelFilter not supported in query builder";
        public static final String JSON_EXPRESSION_PARSER = "JsonExpressionParser not supported in visual query builder";
        public static final String UNWRAP_CONVERSION = "Unwrap with conversion operator not supported in query builder";
        public static final String RANGE_AGGREGATION_GROUPING = "Grouping in range aggregation not supported in query builder";
        public static final String SET_OPERATOR_WITH_SCALAR = "Set operator with scalar not supported in query builder";
        public static final String GROUP_MODIFIER = "Binary operation with group_left/group_right not supported in query builder";

        private NotSupported() {}
    }

    private Constants() {}
}
