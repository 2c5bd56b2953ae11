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

/**
 * A stream selector matcher such as {@code app="foo"}.
 *
 * @param label the label name
 * @param operator the matcher operator, one of {@code = != =~ !~}
 * @param value the unquoted value
 */
public record LabelFilter(String label, String operator, String value) implements ToXContentObject {

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("label", label);
        builder.field("op", operator);
        builder.field("value", value);
        builder.endObject();
        return builder;
    }
}
