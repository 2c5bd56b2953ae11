/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.parser;

/**
 * Closed set of syntax node kinds produced by {@link LogQLParser}. Most kinds mirror a rule or a token of the
 * {@code LogQLBase} grammar.
 *
 * <p>Each kind carries its grammar name, which is what appears in printed trees and in the
 * {@code parentType} of diagnostics.</p>
 */
public enum NodeKind {
    // Structure
    LOG_QL("LogQL"),
    EXPR("Expr"),
    LOG_EXPR("LogExpr"),
    METRIC_EXPR("MetricExpr"),

    // Stream selector
    SELECTOR("Selector"),
    MATCHERS("Matchers"),
    MATCHER("Matcher"),

    // Pipeline
    PIPELINE_EXPR("PipelineExpr"),
    PIPELINE_STAGE("PipelineStage"),
    PIPE("Pipe"),
    LINE_FILTER("LineFilter"),
    FILTER("Filter"),
    PIPE_EXACT("PipeExact"),
    PIPE_MATCH("PipeMatch"),
    IP("Ip"),
    LABEL_PARSER("LabelParser"),
    JSON("Json"),
    LOGFMT("Logfmt"),
    UNPACK("Unpack"),
    PATTERN("Pattern"),
    REGEXP("Regexp"),
    JSON_EXPRESSION_PARSER("JsonExpressionParser"),
    JSON_EXPRESSION_LIST("JsonExpressionList"),
    JSON_EXPRESSION("JsonExpression"),
    LABEL_FILTER("LabelFilter"),
    IP_LABEL_FILTER("IpLabelFilter"),
    UNIT_FILTER("UnitFilter"),
    DURATION_FILTER("DurationFilter"),
    BYTES_FILTER("BytesFilter"),
    NUMBER_FILTER("NumberFilter"),
    LINE_FORMAT_EXPR("LineFormatExpr"),
    LINE_FORMAT("LineFormat"),
    LABEL_FORMAT_EXPR("LabelFormatExpr"),
    LABEL_FORMAT("LabelFormat"),
    LABELS_FORMAT("LabelsFormat"),
    LABEL_FORMAT_MATCHER("LabelFormatMatcher"),
    UNWRAP_EXPR("UnwrapExpr"),
    UNWRAP("Unwrap"),
    CONV_OP("ConvOp"),

    // Range and vector aggregations
    LOG_RANGE_EXPR("LogRangeExpr"),
    RANGE("Range"),
    OFFSET_EXPR("OffsetExpr"),
    OFFSET("Offset"),
    RANGE_AGGREGATION_EXPR("RangeAggregationExpr"),
    RANGE_OP("RangeOp"),
    VECTOR_AGGREGATION_EXPR("VectorAggregationExpr"),
    VECTOR_OP("VectorOp"),
    GROUPING("Grouping"),
    BY("By"),
    WITHOUT("Without"),
    LABELS("Labels"),

    // Binary expressions
    BIN_OP_EXPR("BinOpExpr"),
    BIN_MODIFIERS("BinModifiers"),
    BOOL("Bool"),
    ON_OR_IGNORING("OnOrIgnoring"),
    ON("On"),
    IGNORING("Ignoring"),
    GROUP_LEFT("GroupLeft"),
    GROUP_RIGHT("GroupRight"),
    GROUPING_LABELS("GroupingLabels"),
    GROUPING_LABEL_LIST("GroupingLabelList"),
    LITERAL_EXPR("LiteralExpr"),

    // Functions
    LABEL_REPLACE_EXPR("LabelReplaceExpr"),
    LABEL_REPLACE("LabelReplace"),
    VECTOR_EXPR("VectorExpr"),
    VECTOR("Vector"),

    // Operators
    EQ("Eq"),
    NEQ("Neq"),
    RE("Re"),
    NRE("Nre"),
    EQL("Eql"),
    GTR("Gtr"),
    GTE("Gte"),
    LSS("Lss"),
    LTE("Lte"),
    ADD("Add"),
    SUB("Sub"),
    MUL("Mul"),
    DIV("Div"),
    MOD("Mod"),
    POW("Pow"),
    AND("And"),
    OR("Or"),
    UNLESS("Unless"),
    COMMA("Comma"),

    // Literals
    IDENTIFIER("Identifier"),
    STRING("String"),
    NUMBER("Number"),
    DURATION("Duration"),
    BYTES("Bytes"),

    /**
     * A syntax error. May be empty when the parser inserted it for a missing token.
     */
    ERROR("⚠");

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    /**
     * Gets the grammar name of this kind.
     * @return the grammar name
     */
    public String getGrammarName() {
        return grammarName;
    }

    @Override
    public String toString() {
        return grammarName;
    }
}
