/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.common;

import org.opensearch.test.OpenSearchTestCase;

public class BinaryOperatorTests extends OpenSearchTestCase {

    public void testFromSign() {
        assertEquals(BinaryOperator.DIVIDE_BY, BinaryOperator.fromSign("/"));
        assertEquals(BinaryOperator.GREATER_OR_EQUAL, BinaryOperator.fromSign(">="));
        assertEquals(BinaryOperator.UNLESS, BinaryOperator.fromSign("unless"));
    }

    public void testEverySignRoundTrips() {
        for (BinaryOperator operator : BinaryOperator.values()) {
            assertSame(operator, BinaryOperator.fromSign(operator.getSign()));
        }
    }

    public void testUnknownSign() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> BinaryOperator.fromSign("=~"));
        assertTrue(e.getMessage().contains("=~"));
    }

    public void testSetOperatorsHaveNoOperationId() {
        for (BinaryOperator operator : BinaryOperator.values()) {
            assertEquals(operator.name(), operator.isSetOperator(), operator.getOperationId() == null);
        }
        assertTrue(BinaryOperator.AND.isSetOperator());
        assertFalse(BinaryOperator.MODULO.isSetOperator());
    }

    public void testComparisons() {
        assertTrue(BinaryOperator.EQUAL_TO.isComparison());
        assertTrue(BinaryOperator.LESS_OR_EQUAL.isComparison());
        assertFalse(BinaryOperator.EXPONENT.isComparison());
        assertFalse(BinaryOperator.OR.isComparison());
        assertEquals("__not_equal_to", BinaryOperator.NOT_EQUAL_TO.getOperationId());
    }
}
