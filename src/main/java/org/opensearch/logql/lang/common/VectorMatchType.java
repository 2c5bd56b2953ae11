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
 * Label matching modifiers of vector to vector binary operations.
 */
public enum VectorMatchType {
    ON,
    IGNORING;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
