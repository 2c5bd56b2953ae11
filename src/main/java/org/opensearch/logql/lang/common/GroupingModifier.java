/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.common;

import java.util.Locale;

/**
 * Grouping modifiers of vector aggregations.
 */
public enum GroupingModifier {
    /**
     * Keep only the specified labels in the result.
     */
    BY,

    /**
     * Remove the specified labels, keep all others.
     */
    WITHOUT;

    /**
     * Builds the id of the grouped variant of an aggregation, e.g. {@code __sum_by}.
     * @param function the aggregation keyword
     * @return the grouped operation id
     */
    public String operationId(String function) {
        return "__" + function + "_" + this;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
