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
 * Vector aggregation operators.
 */
public enum VectorAggregationType {
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    STDDEV,
    STDVAR,
    BOTTOMK,
    TOPK,
    SORT,
    SORT_DESC;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
