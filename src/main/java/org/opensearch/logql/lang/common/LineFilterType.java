/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.common;

import org.opensearch.logql.lang.common.Constants.OperationIds;

/**
 * Line filter operators and the operation ids they map to.
 */
public enum LineFilterType {
    CONTAINS("|=", OperationIds.LINE_CONTAINS),
    CONTAINS_NOT("!=", OperationIds.LINE_CONTAINS_NOT),
    MATCHES_REGEX("|~", OperationIds.LINE_MATCHES_REGEX),
    MATCHES_REGEX_NOT("!~", OperationIds.LINE_MATCHES_REGEX_NOT);

    private final String operator;
    private final String operationId;

    LineFilterType(String operator, String operationId) {
        this.operator = operator;
        this.operationId = operationId;
    }

    /**
     * Gets the operator string.
     * @return the operator string
     */
    public String getOperator() {
        return operator;
    }

    public String getOperationId() {
        return operationId;
    }

    /**
     * Parse line filter type from operator string.
     * @param operator the operator string
     * @return the corresponding line filter type
     */
    public static LineFilterType fromOperator(String operator) {
        for (LineFilterType type : values()) {
            if (type.operator.equals(operator)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown line filter operator: " + operator);
    }
}
