/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.logql.lang.parser.LogQLParser;
import org.opensearch.logql.lang.parser.SyntaxNode;
import org.opensearch.logql.lang.visual.ParsingError;
import org.opensearch.logql.lang.visual.VisualQuery;
import org.opensearch.logql.lang.visual.VisualQueryResult;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * LogQLVisualTranslator is responsible for translating LogQL text into a visual query.
 *
 * <p>Translation flow:
 * <ol>
 *   <li>Replace template variables with placeholders the grammar accepts</li>
 *   <li>Parse the text into a syntax tree</li>
 *   <li>Walk the tree, collecting labels, operations, binary queries and diagnostics</li>
 *   <li>Drop the diagnostics if nothing could be extracted</li>
 * </ol>
 *
 * <p>Translation never fails. Constructs without a visual representation are reported as {@link ParsingError}s
 * next to the best-effort query.</p>
 */
public class LogQLVisualTranslator {

    private static final Logger logger = LogManager.getLogger(LogQLVisualTranslator.class);

    private LogQLVisualTranslator() {}

    /**
     * Translates a LogQL query with default parameters.
     *
     * @param query The LogQL query string
     * @return the visual query and its diagnostics
     */
    public static VisualQueryResult translate(String query) {
        return translate(query, Params.DEFAULT);
    }

    /**
     * Translates a LogQL query.
     *
     * @param query The LogQL query string
     * @param params translation parameters
     * @return the visual query and its diagnostics
     */
    public static VisualQueryResult translate(String query, Params params) {
        return translate(query, params, VisualQueryWalker::new);
    }

    static VisualQueryResult translate(String query, Params params, Function<SourceText, VisualQueryWalker> walkers) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(params, "params must not be null");

        String parsedText = params.interpolateVariables() ? VariableInterpolation.replaceVariables(query) : query;
        SourceText source = new SourceText(parsedText, params.interpolateVariables());
        ParsingContext context = new ParsingContext(new VisualQuery());

        try {
            SyntaxNode root = LogQLParser.parse(parsedText);
            walkers.apply(source).walk(root, context);
        } catch (RuntimeException e) {
            // Keep what was extracted so far and report the failure as a diagnostic
            logger.warn("Failed to build visual query from [{}]", query, e);
            context.addError(new ParsingError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }

        VisualQuery visualQuery = context.getQuery();
        List<ParsingError> errors = context.getErrors();
        if (params.resetErrorsOnEmptyQuery() && visualQuery.isEmpty()) {
            errors = List.of();
        }
        logger.debug(
            "Translated [{}] into {} labels, {} operations, {} binary queries with {} errors",
            query,
            visualQuery.getLabels().size(),
            visualQuery.getOperations().size(),
            visualQuery.getBinaryQueries().size(),
            errors.size()
        );
        return new VisualQueryResult(visualQuery, errors);
    }

    /**
     * Parameters used during translation.
     *
     * @param interpolateVariables Replace template variables such as {@code $__interval} before parsing and restore
     *                             them in extracted values
     * @param resetErrorsOnEmptyQuery Return no errors when neither labels nor operations could be extracted
     */
    public record Params(boolean interpolateVariables, boolean resetErrorsOnEmptyQuery) {

        /**
         * Interpolate variables and reset errors of empty queries.
         */
        public static final Params DEFAULT = new Params(true, true);
    }
}
