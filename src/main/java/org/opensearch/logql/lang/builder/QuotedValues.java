/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

/**
 * Turns LogQL string literals into plain values.
 */
public final class QuotedValues {

    private QuotedValues() {}

    /**
     * Unquotes a string literal. A double-quoted literal loses every double quote and has each escaped backslash
     * collapsed to one. Anything else, normally a backtick literal, loses every backtick and is otherwise kept as is.
     *
     * <p>Applying this twice is a no-op for backtick literals but not for double-quoted values that contain
     * backslashes.</p>
     *
     * @param literal the literal as written in the query
     * @return the unquoted value
     */
    public static String unquote(String literal) {
        if (!literal.isEmpty() && literal.charAt(0) == '"' && literal.charAt(literal.length() - 1) == '"') {
            return literal.replace("\"", "").replace("\\\\", "\\");
        }
        return literal.replace("`", "");
    }

    /**
     * Strips the quote characters of a stream selector value without touching escapes.
     * @param literal the literal as written in the query
     * @return the value without quote characters
     */
    public static String stripQuotes(String literal) {
        if (literal.startsWith("`")) {
            return literal.replace("`", "");
        }
        return literal.replace("\"", "");
    }
}
