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
 * Range aggregation functions, applied to a log range such as {@code {app="foo"}[5m]}.
 */
public enum RangeAggregationType {
    COUNT_OVER_TIME,
    RATE,
    RATE_COUNTER,
    BYTES_OVER_TIME,
    BYTES_RATE,
    AVG_OVER_TIME,
    SUM_OVER_TIME,
    MIN_OVER_TIME,
    MAX_OVER_TIME,
    STDDEV_OVER_TIME,
    STDVAR_OVER_TIME,
    QUANTILE_OVER_TIME,
    FIRST_OVER_TIME,
    LAST_OVER_TIME,
    ABSENT_OVER_TIME;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
