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
 * A diagnostic for a part of the query the visual model cannot represent.
 *
 * @param text the message, usually ending with the offending query text
 * @param from start offset in the parsed text, or null when not anchored to a node
 * @param to end offset in the parsed text, or null when not anchored to a node
 * @param parentType grammar name of the parent of the offending node, or null
 */
public record ParsingError(String text, Integer from, Integer to, String parentType) implements ToXContentObject {

    /**
     * An error that is not anchored to a node.
     */
    public ParsingError(String text) {
        this(text, null, null, null);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("text", text);
        if (from != null) {
            builder.field("from", from);
        }
        if (to != null) {
            builder.field("to", to);
        }
        if (parentType != null) {
            builder.field("parentType", parentType);
        }
        builder.endObject();
        return builder;
    }
}
