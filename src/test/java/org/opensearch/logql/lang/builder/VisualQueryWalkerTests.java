/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.common.Constants.NotSupported;
import org.opensearch.logql.lang.common.VectorMatchType;
import org.opensearch.logql.lang.parser.NodeKind;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.BinaryQuery;
import org.opensearch.logql.lang.visual.LabelFilter;
import org.opensearch.logql.lang.visual.Operation;
import org.opensearch.logql.lang.visual.ParsingError;
import org.opensearch.logql.lang.visual.VisualQuery;
import org.opensearch.logql.lang.visual.VisualQueryResult;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

/**
 * Tests for how each LogQL construct lands in the visual query.
 */
public class VisualQueryWalkerTests extends OpenSearchTestCase {

    private static final LabelFilter APP_FOO = new LabelFilter("app", "=", "foo");

    private static VisualQueryResult translate(String query) {
        return LogQLVisualTranslator.translate(query);
    }

    // ========== Selectors and line filters ==========

    public void testSelectorWithLineFilter() {
        VisualQueryResult result = translate("{app=\"foo\"} |= \"bar\"");

        assertEquals(List.of(APP_FOO), result.query().getLabels());
        assertEquals(List.of(new Operation("__line_contains", "bar")), result.query().getOperations());
        assertThat(result.errors(), empty());
    }

    public void testBacktickSelectorValueKeepsBackslashes() {
        VisualQueryResult result = translate("{path=`C:\\\\logs`}");
        assertEquals(List.of(new LabelFilter("path", "=", "C:\\\\logs")), result.query().getLabels());
    }

    public void testRegexLineFilterUnescaping() {
        VisualQueryResult doubleQuoted = translate("{app=\"foo\"} |~ \"\\\\d+\"");
        assertEquals(List.of(new Operation("__line_matches_regex", "\\d+")), doubleQuoted.query().getOperations());

        VisualQueryResult backtick = translate("{app=\"foo\"} |~ `\\d+`");
        assertEquals(List.of(new Operation("__line_matches_regex", "\\d+")), backtick.query().getOperations());
    }

    public void testIpLineFilterIsReported() {
        VisualQueryResult result = translate("{app=\"foo\"} |= \"a\" |= ip(\"1.2.3.4\")");

        assertEquals(List.of(new Operation("__line_contains", "a")), result.query().getOperations());
        assertThat(result.errors(), hasSize(1));
        assertThat(result.errors().get(0).text(), startsWith("Matching ip addresses not supported"));
    }

    public void testMatcherWithoutValueIsPartiallyExtracted() {
        VisualQueryResult result = translate("{app=}");

        assertEquals(List.of(new LabelFilter("app", "=", "")), result.query().getLabels());
        assertEquals(List.of(new ParsingError("", 5, 5, "Matcher")), result.errors());
    }

    // ========== Parsers and label filters ==========

    public void testJsonParserFollowedByLabelFilter() {
        VisualQueryResult result = translate("{app=\"foo\"} | json | status_code >= 400");

        assertEquals(
            List.of(new Operation("json"), new Operation("__label_filter", "status_code", ">=", "400")),
            result.query().getOperations()
        );
    }

    public void testPatternParserTakesItsExpression() {
        VisualQueryResult result = translate("{app=\"foo\"} | pattern `<ip> - <method>`");
        assertEquals(List.of(new Operation("pattern", "<ip> - <method>")), result.query().getOperations());
    }

    public void testDurationAndBytesLabelFilters() {
        VisualQueryResult result = translate("{app=\"foo\"} | latency > 250ms | size <= 20MiB");

        assertEquals(
            List.of(new Operation("__label_filter", "latency", ">", "250ms"), new Operation("__label_filter", "size", "<=", "20MiB")),
            result.query().getOperations()
        );
        assertThat(result.errors(), empty());
    }

    public void testParenthesizedLabelFilterIsUnwrapped() {
        VisualQueryResult result = translate("{app=\"foo\"} | (level=\"error\")");
        assertEquals(List.of(new Operation("__label_filter", "level", "=", "error")), result.query().getOperations());
    }

    public void testCompoundLabelFiltersAreReported() {
        for (String filter : List.of("a=\"1\", b=\"2\"", "a=\"1\" and b=\"2\"", "a=\"1\" b=\"2\"")) {
            VisualQueryResult result = translate("{app=\"foo\"} | " + filter);

            assertThat(filter, result.query().getOperations(), empty());
            assertThat(filter, result.errors(), hasSize(1));
            assertEquals(NotSupported.COMPOUND_LABEL_FILTER + ": " + filter, result.errors().get(0).text());
        }
    }

    public void testIpLabelFilterIsReported() {
        VisualQueryResult result = translate("{app=\"foo\"} | addr = ip(\"10.0.0.0/8\")");

        assertThat(result.query().getOperations(), empty());
        assertEquals(
            List.of(new ParsingError(NotSupported.IP_LABEL_FILTER + ": addr = ip(\"10.0.0.0/8\")", 14, 37, "PipelineStage")),
            result.errors()
        );
    }

    public void testNoErrorsFilter() {
        VisualQueryResult result = translate("{app=\"foo\"} | __error__=\"\"");
        assertEquals(List.of(new Operation("__label_filter_no_errors")), result.query().getOperations());
    }

    public void testErrorLabelWithValueIsARegularFilter() {
        VisualQueryResult result = translate("{app=\"foo\"} | __error__!=\"JSONParserErr\"");
        assertEquals(List.of(new Operation("__label_filter", "__error__", "!=", "JSONParserErr")), result.query().getOperations());
    }

    // ========== Formatters and unwrap ==========

    public void testLabelFormatYieldsOneOperationPerPair() {
        VisualQueryResult result = translate("{app=\"foo\"} | label_format a=\"x\", b=c");

        assertEquals(
            List.of(new Operation("label_format", "a", "x"), new Operation("label_format", "b", "c")),
            result.query().getOperations()
        );
    }

    public void testUnwrapFollowedByLabelFilters() {
        VisualQueryResult result = translate("sum_over_time({app=\"foo\"} | json | unwrap bytes_processed | __error__=\"\" [1m])");

        assertEquals(
            List.of(
                new Operation("json"),
                new Operation("unwrap", "bytes_processed"),
                new Operation("__label_filter_no_errors"),
                new Operation("sum_over_time", "1m")
            ),
            result.query().getOperations()
        );
        assertThat(result.errors(), empty());
    }

    public void testUnwrapWithConversionIsReported() {
        VisualQueryResult result = translate("sum_over_time({app=\"foo\"} | unwrap duration(latency) [5m])");

        assertEquals(List.of(new Operation("sum_over_time", "5m")), result.query().getOperations());
        assertThat(result.errors(), hasSize(1));
        assertEquals(NotSupported.UNWRAP_CONVERSION + ": | unwrap duration(latency)", result.errors().get(0).text());
    }

    // ========== Aggregations ==========

    public void testVectorOverRangeAggregation() {
        VisualQueryResult result = translate("sum by (job) (count_over_time({app=\"foo\"}[5m]))");

        assertEquals(List.of(new Operation("count_over_time", "5m"), new Operation("__sum_by", "job")), result.query().getOperations());
    }

    public void testGroupingAfterVectorAggregation() {
        VisualQueryResult result = translate("sum(rate({app=\"foo\"}[1m])) without (pod, node)");

        assertEquals(
            List.of(new Operation("rate", "1m"), new Operation("__sum_without", "pod", "node")),
            result.query().getOperations()
        );
    }

    public void testQuantileTakesItsParameterFirst() {
        VisualQueryResult result = translate("quantile_over_time(0.99, {app=\"foo\"} | unwrap latency [5m])");

        assertEquals(
            List.of(new Operation("unwrap", "latency"), new Operation("quantile_over_time", "0.99", "5m")),
            result.query().getOperations()
        );
    }

    public void testIntervalVariableInRange() {
        VisualQueryResult result = translate("count_over_time({app=\"foo\"}[$__interval])");

        assertEquals(List.of(new Operation("count_over_time", "$__interval")), result.query().getOperations());
        assertThat(result.errors(), empty());
    }

    public void testVariablesAreRestoredInValues() {
        VisualQueryResult result = translate("{app=\"$app\", env=\"${env:raw}\"} |= \"[[search]]\"");

        assertEquals(List.of(new LabelFilter("app", "=", "$app"), new LabelFilter("env", "=", "${env:raw}")), result.query().getLabels());
        assertEquals(List.of(new Operation("__line_contains", "[[search]]")), result.query().getOperations());
    }

    public void testLogQueryInVectorAggregationIsReported() {
        VisualQueryResult result = translate("sum({app=\"foo\"})");

        assertEquals(List.of(new Operation("sum")), result.query().getOperations());
        assertEquals(List.of(new ParsingError("{app=\"foo\"}", 4, 15, "VectorAggregationExpr")), result.errors());
    }

    public void testOffsetIsAccepted() {
        VisualQueryResult result = translate("rate({app=\"foo\"}[5m] offset 1h)");

        assertEquals(List.of(APP_FOO), result.query().getLabels());
        assertEquals(List.of(new Operation("rate", "5m")), result.query().getOperations());
        assertThat(result.errors(), empty());
    }

    public void testLabelReplaceKeepsItsOperand() {
        VisualQueryResult result = translate("label_replace(rate({a=\"b\"}[5m]), \"x\", \"y\", \"z\", \"w\")");

        assertEquals(List.of(new LabelFilter("a", "=", "b")), result.query().getLabels());
        assertEquals(List.of(new Operation("rate", "5m")), result.query().getOperations());
        assertThat(result.errors(), empty());
    }

    public void testVectorLiteralIsAnEmptyQuery() {
        VisualQueryResult result = LogQLVisualTranslator.translate("vector(1)", new LogQLVisualTranslator.Params(true, false));

        assertTrue(result.query().isEmpty());
        assertThat(result.errors(), empty());
    }

    // ========== Binary expressions ==========

    public void testComparisonWithScalar() {
        VisualQueryResult result = translate("count_over_time({app=\"foo\"}[5m]) > 10");

        assertEquals(
            List.of(new Operation("count_over_time", "5m"), new Operation("__greater_than", "10")),
            result.query().getOperations()
        );
        assertThat(result.query().getBinaryQueries(), empty());
    }

    public void testChainedScalarOperations() {
        VisualQueryResult result = translate("rate({app=\"foo\"}[1m]) + 2 * 3");

        assertEquals(
            List.of(new Operation("rate", "1m"), new Operation("__addition", "2"), new Operation("__multiply_by", "3")),
            result.query().getOperations()
        );
    }

    public void testSignedScalar() {
        VisualQueryResult result = translate("rate({app=\"foo\"}[1m]) * -1");
        assertEquals(List.of(new Operation("rate", "1m"), new Operation("__multiply_by", "-1")), result.query().getOperations());
    }

    public void testVectorToVectorBinaryQuery() {
        VisualQueryResult result = translate("count_over_time({app=\"foo\"}[5m]) / count_over_time({app=\"bar\"}[5m])");

        VisualQuery nested = new VisualQuery();
        nested.addLabel(new LabelFilter("app", "=", "bar"));
        nested.addOperation(new Operation("count_over_time", "5m"));

        assertEquals(List.of(APP_FOO), result.query().getLabels());
        assertEquals(List.of(new Operation("count_over_time", "5m")), result.query().getOperations());
        assertEquals(List.of(new BinaryQuery("/", nested)), result.query().getBinaryQueries());
    }

    public void testIgnoringLabelsAreJoined() {
        VisualQueryResult result = translate("sum(rate({a=\"1\"}[1m])) + ignoring (x, y) sum(rate({a=\"2\"}[1m]))");

        List<BinaryQuery> binaryQueries = result.query().getBinaryQueries();
        assertThat(binaryQueries, hasSize(1));
        assertEquals("+", binaryQueries.get(0).getOperator());
        assertEquals(VectorMatchType.IGNORING, binaryQueries.get(0).getVectorMatchesType());
        assertEquals("x,y", binaryQueries.get(0).getVectorMatches());
    }

    public void testGroupModifierIsReported() {
        VisualQueryResult result = translate("sum(rate({a=\"1\"}[1m])) / on (job) group_left sum(rate({a=\"2\"}[1m]))");

        assertThat(result.query().getBinaryQueries(), hasSize(1));
        assertThat(result.errors(), hasSize(1));
        assertThat(result.errors().get(0).text(), startsWith(NotSupported.GROUP_MODIFIER));
    }

    public void testSetOperatorWithScalarIsReported() {
        VisualQueryResult result = translate("rate({app=\"foo\"}[1m]) and 1");

        assertEquals(List.of(new Operation("rate", "1m")), result.query().getOperations());
        assertThat(result.errors(), hasSize(1));
        assertEquals(NotSupported.SET_OPERATOR_WITH_SCALAR + ": rate({app=\"foo\"}[1m]) and 1", result.errors().get(0).text());
    }

    public void testNestedBinaryQueriesShareErrors() {
        VisualQueryResult result = translate("rate({a=\"1\"}[1m]) / rate({a=\"2\"} |= ip(\"1.2.3.4\") [1m])");

        assertThat(result.query().getBinaryQueries(), hasSize(1));
        assertThat(result.errors(), hasSize(1));
        assertThat(result.errors().get(0).text(), startsWith(NotSupported.IP_LINE_FILTER));
    }

    public void testSetOperatorBetweenComparisonsFlattensIntoOneQuery() {
        VisualQueryResult result = translate(
            "sum(count_over_time({app=\"foo\"}[5m])) by (level) > 0 and sum(rate({x=\"y\"}[1m])) < 10"
        );

        // The right side of 'and' is itself a binary expression, so it is walked into the same query
        assertEquals(List.of(APP_FOO, new LabelFilter("x", "=", "y")), result.query().getLabels());
        assertEquals(
            List.of(
                new Operation("count_over_time", "5m"),
                new Operation("__sum_by", "level"),
                new Operation("__greater_than", "0"),
                new Operation("rate", "1m"),
                new Operation("sum"),
                new Operation("__less_than", "10")
            ),
            result.query().getOperations()
        );
        assertThat(result.query().getBinaryQueries(), empty());
        assertThat(result.errors(), empty());
    }

    // ========== Empty queries and failures ==========

    public void testEmptyInput() {
        VisualQueryResult result = translate("");

        assertTrue(result.query().isEmpty());
        assertThat(result.errors(), empty());
    }

    public void testErrorsOfEmptyQueryAreReset() {
        VisualQueryResult reset = translate("unknown_fn(5)");
        assertTrue(reset.query().isEmpty());
        assertThat(reset.errors(), empty());

        VisualQueryResult kept = LogQLVisualTranslator.translate("unknown_fn(5)", new LogQLVisualTranslator.Params(true, false));
        assertTrue(kept.query().isEmpty());
        assertThat(kept.errors(), not(empty()));
        assertEquals(Integer.valueOf(0), kept.errors().get(0).from());
    }

    public void testFailureDuringWalkKeepsWhatWasExtracted() {
        VisualQueryResult result = LogQLVisualTranslator.translate(
            "{app=\"foo\"} |= \"bar\"",
            LogQLVisualTranslator.Params.DEFAULT,
            text -> new FailingWalker(text, NodeKind.PIPELINE_EXPR, new IllegalStateException("walk failed"))
        );

        assertEquals(List.of(APP_FOO), result.query().getLabels());
        assertThat(result.query().getOperations(), empty());
        assertEquals(List.of(new ParsingError("walk failed")), result.errors());
    }

    public void testFailureWithoutMessageIsNamedByItsType() {
        VisualQueryResult result = LogQLVisualTranslator.translate(
            "{app=\"foo\"} |= \"bar\"",
            LogQLVisualTranslator.Params.DEFAULT,
            text -> new FailingWalker(text, NodeKind.LINE_FILTER, new NullPointerException())
        );

        assertEquals(List.of(APP_FOO), result.query().getLabels());
        assertEquals(List.of(new ParsingError("NullPointerException")), result.errors());
    }

    public void testNullQueryIsRejected() {
        expectThrows(NullPointerException.class, () -> LogQLVisualTranslator.translate(null));
    }

    public void testArbitraryInputNeverThrows() {
        List<String> fragments = List.of(
            "{",
            "}",
            "(",
            ")",
            "[",
            "]",
            "app=\"foo\"",
            "|=",
            "|",
            "json",
            "unwrap",
            "sum",
            "rate",
            "by",
            "5m",
            "10",
            "+",
            "and",
            ",",
            "\"",
            "`",
            "$__interval",
            "ip(",
            "label_format",
            "x="
        );
        for (int i = 0; i < 50; i++) {
            StringBuilder query = new StringBuilder();
            int length = randomIntBetween(1, 20);
            for (int j = 0; j < length; j++) {
                query.append(randomFrom(fragments)).append(randomBoolean() ? " " : "");
            }
            VisualQueryResult result = LogQLVisualTranslator.translate(query.toString());
            assertNotNull(query.toString(), result);
            assertNotNull(query.toString(), result.query());
        }
    }

    /**
     * Throws when the walk reaches a node of the given kind.
     */
    private static final class FailingWalker extends VisualQueryWalker {
        private final NodeKind failAt;
        private final RuntimeException failure;

        FailingWalker(SourceText text, NodeKind failAt, RuntimeException failure) {
            super(text);
            this.failAt = failAt;
            this.failure = failure;
        }

        @Override
        public void walk(SyntaxNode node, ParsingContext context) {
            if (node.getKind() == failAt) {
                throw failure;
            }
            super.walk(node, context);
        }
    }
}
