/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.visual.ParsingError;
import org.opensearch.logql.lang.visual.VisualQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulator for one translation: the visual query being filled in and the diagnostics found so far.
 *
 * <p>The right side of a vector to vector binary expression gets its own context via
 * {@link #forBinaryQuery(VisualQuery)}, which fills the nested query but reports into the same error list.</p>
 */
public final class ParsingContext {

    private final VisualQuery query;
    private final List<ParsingError> errors;

    public ParsingContext(VisualQuery query) {
        this(query, new ArrayList<>());
    }

    private ParsingContext(VisualQuery query, List<ParsingError> errors) {
        this.query = query;
        this.errors = errors;
    }

    /**
     * Creates a context that fills a nested query and shares this context's errors.
     * @param nested the query of a binary query
     * @return the nested context
     */
    public ParsingContext forBinaryQuery(VisualQuery nested) {
        return new ParsingContext(nested, errors);
    }

    public VisualQuery getQuery() {
        return query;
    }

    public void addError(ParsingError error) {
        errors.add(error);
    }

    public List<ParsingError> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
