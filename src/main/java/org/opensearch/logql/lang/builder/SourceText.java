/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.parser.SyntaxNode;

/**
 * The text a syntax tree was parsed from. Slices have template variables restored when the text went through
 * {@link VariableInterpolation#replaceVariables(String)}.
 */
public final class SourceText {

    private final String text;
    private final boolean restoreVariables;

    /**
     * @param text the parsed text
     * @param restoreVariables whether the text contains variable placeholders to restore
     */
    public SourceText(String text, boolean restoreVariables) {
        this.text = text;
        this.restoreVariables = restoreVariables;
    }

    public String getText() {
        return text;
    }

    /**
     * Gets the text covered by a node.
     * @param node the node, may be null
     * @return the covered text, or an empty string for a null node
     */
    public String slice(SyntaxNode node) {
        if (node == null) {
            return "";
        }
        String slice = text.substring(node.getFrom(), node.getTo());
        return restoreVariables ? VariableInterpolation.restoreVariables(slice) : slice;
    }
}
