/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.common;

import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of LogQL metric expressions.
 *
 * <p>Arithmetic and comparison operators carry the id of the scalar operation used when the right operand is a
 * number literal. Set operators ({@code and}, {@code or}, {@code unless}) only combine two vectors and have no
 * operation id.</p>
 */
public enum BinaryOperator {
    ADDITION("+", "__addition", false),
    SUBTRACTION("-", "__subtraction", false),
    MULTIPLY_BY("*", "__multiply_by", false),
    DIVIDE_BY("/", "__divide_by", false),
    MODULO("%", "__modulo", false),
    EXPONENT("^", "__exponent", false),
    EQUAL_TO("==", "__equal_to", true),
    NOT_EQUAL_TO("!=", "__not_equal_to", true),
    GREATER_THAN(">", "__greater_than", true),
    LESS_THAN("<", "__less_than", true),
    GREATER_OR_EQUAL(">=", "__greater_or_equal", true),
    LESS_OR_EQUAL("<=", "__less_or_equal", true),
    AND("and", null, false),
    OR("or", null, false),
    UNLESS("unless", null, false);

    private static final Map<String, BinaryOperator> BY_SIGN;

    static {
        Map<String, BinaryOperator> bySign = new HashMap<>();
        for (BinaryOperator operator : values()) {
            bySign.put(operator.sign, operator);
        }
        BY_SIGN = Map.copyOf(bySign);
    }

    private final String sign;
    private final String operationId;
    private final boolean comparison;

    BinaryOperator(String sign, String operationId, boolean comparison) {
        this.sign = sign;
        this.operationId = operationId;
        this.comparison = comparison;
    }

    /**
     * Gets the operator as written in a query.
     * @return the operator sign
     */
    public String getSign() {
        return sign;
    }

    /**
     * Gets the id of the scalar operation for this operator.
     * @return the operation id, or null for set operators
     */
    public String getOperationId() {
        return operationId;
    }

    /**
     * Whether this is a comparison operator, which accepts the {@code bool} modifier.
     * @return true for comparison operators
     */
    public boolean isComparison() {
        return comparison;
    }

    public boolean isSetOperator() {
        return operationId == null;
    }

    /**
     * Look up an operator by its sign.
     * @param sign the operator sign
     * @return the operator
     * @throws IllegalArgumentException if the sign is not a binary operator
     */
    public static BinaryOperator fromSign(String sign) {
        BinaryOperator operator = BY_SIGN.get(sign);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + sign);
        }
        return operator;
    }
}
