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

import java.io.IOException;
import java.util.List;

/**
 * Outcome of translating a query: the best-effort visual query and everything it could not represent.
 *
 * @param query the visual query
 * @param errors diagnostics in the order they were found
 */
public record VisualQueryResult(VisualQuery query, List<ParsingError> errors) implements ToXContentObject {

    public VisualQueryResult {
        errors = List.copyOf(errors);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("query", query);
        builder.startArray("errors");
        for (ParsingError error : errors) {
            error.toXContent(builder, params);
        }
        builder.endArray();
        builder.endObject();
        return builder;
    }
}
