/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.logql.lang.visual.Operation;
import org.opensearch.logql.lang.visual.ParsingError;

/**
 * What a handler extracted from one node. Either part may be absent, and both may be present when a construct is
 * partially understood.
 *
 * @param operation the operation to append, or null
 * @param error the diagnostic to report, or null
 */
public record HandlerResult(Operation operation, ParsingError error) {

    public static HandlerResult of(Operation operation) {
        return new HandlerResult(operation, null);
    }

    public static HandlerResult error(ParsingError error) {
        return new HandlerResult(null, error);
    }

    /**
     * Appends the operation and reports the error, whichever are present.
     */
    void applyTo(ParsingContext context) {
        if (operation != null) {
            context.getQuery().addOperation(operation);
        }
        if (error != null) {
            context.addError(error);
        }
    }
}
