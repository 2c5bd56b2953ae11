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
 * One stage of the visual pipeline.
 *
 * @param id the operation id, see {@link org.opensearch.logql.lang.common.Constants.OperationIds}
 * @param params positional parameters
 */
public record Operation(String id, List<String> params) implements ToXContentObject {

    public Operation {
        params = List.copyOf(params);
    }

    public Operation(String id, String... params) {
        this(id, List.of(params));
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("id", id);
        builder.array("params", this.params.toArray(new String[0]));
        builder.endObject();
        return builder;
    }
}
