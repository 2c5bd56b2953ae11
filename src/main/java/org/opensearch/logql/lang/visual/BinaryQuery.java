/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.visual;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.logql.lang.common.VectorMatchType;

import java.io.IOException;
import java.util.Objects;

/**
 * A query combined with the enclosing one by a binary operator, e.g. the right side of
 * {@code rate({a="1"}[5m]) / rate({a="2"}[5m])}.
 */
public class BinaryQuery implements ToXContentObject {

    private final String operator;
    private final VisualQuery query;
    private final VectorMatchType vectorMatchesType;
    private final String vectorMatches;

    /**
     * @param operator the operator as written in the query
     * @param query the right hand side query
     * @param vectorMatchesType on/ignoring, or null without a matching modifier
     * @param vectorMatches comma separated labels of the matching modifier, or null
     */
    public BinaryQuery(String operator, VisualQuery query, VectorMatchType vectorMatchesType, String vectorMatches) {
        this.operator = Objects.requireNonNull(operator);
        this.query = Objects.requireNonNull(query);
        this.vectorMatchesType = vectorMatchesType;
        this.vectorMatches = vectorMatches;
    }

    public BinaryQuery(String operator, VisualQuery query) {
        this(operator, query, null, null);
    }

    public String getOperator() {
        return operator;
    }

    public VisualQuery getQuery() {
        return query;
    }

    public VectorMatchType getVectorMatchesType() {
        return vectorMatchesType;
    }

    public String getVectorMatches() {
        return vectorMatches;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("operator", operator);
        builder.field("query", query);
        if (vectorMatchesType != null) {
            builder.field("vectorMatchesType", vectorMatchesType.toString());
            builder.field("vectorMatches", vectorMatches);
        }
        builder.endObject();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryQuery that = (BinaryQuery) o;
        return operator.equals(that.operator)
            && query.equals(that.query)
            && vectorMatchesType == that.vectorMatchesType
            && Objects.equals(vectorMatches, that.vectorMatches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, query, vectorMatchesType, vectorMatches);
    }

    @Override
    public String toString() {
        return "BinaryQuery{operator=" + operator + ", query=" + query + ", vectorMatchesType=" + vectorMatchesType
            + ", vectorMatches=" + vectorMatches + "}";
    }
}
