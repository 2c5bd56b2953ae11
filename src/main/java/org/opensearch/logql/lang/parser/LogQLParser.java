/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.opensearch.logql.lang.parser.generated.LogQLBaseLexer;
import org.opensearch.logql.lang.parser.generated.LogQLBaseParser;

/**
 * Parses LogQL text into a {@link SyntaxNode} tree.
 *
 * <p>The parser never throws on bad input. The generated {@code LogQLBase} parser recovers with its default
 * error strategy, and every recovery shows up as an {@link NodeKind#ERROR} node: a token the parser had to
 * assume is an empty error at the end of the last real token, and skipped tokens are covered by one error node.
 * Tokens left over after the top-level expression end up in a trailing error node under the root.</p>
 *
 * <p>Binary operators bind, from loosest to tightest: {@code or}; {@code and}, {@code unless}; comparisons;
 * {@code + -}; {@code * / %}; {@code ^}. Only {@code ^} is right associative.</p>
 */
public final class LogQLParser {

    private LogQLParser() {}

    /**
     * Parses a LogQL query.
     * @param text the query text
     * @return the root node, of kind {@link NodeKind#LOG_QL}, spanning the whole text
     */
    public static SyntaxNode parse(String text) {
        LogQLBaseLexer lexer = new LogQLBaseLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        LogQLBaseParser parser = new LogQLBaseParser(new CommonTokenStream(lexer));
        // Errors are kept in the tree instead of being printed
        parser.removeErrorListeners();
        return new SyntaxTreeBuilder(text).build(parser.logQL());
    }
}
