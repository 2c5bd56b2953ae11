/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import org.opensearch.test.OpenSearchTestCase;

public class VariableInterpolationTests extends OpenSearchTestCase {

    public void testDollarVariable() {
        assertEquals("rate([__V_0____interval__V__])", VariableInterpolation.replaceVariables("rate([$__interval])"));
    }

    public void testBracketVariableWithFormat() {
        assertEquals("__V_1__var__V____F__csv__F__", VariableInterpolation.replaceVariables("[[var:csv]]"));
        assertEquals("__V_1__var__V__", VariableInterpolation.replaceVariables("[[var]]"));
    }

    public void testBraceVariableDropsFieldPath() {
        assertEquals("__V_2__var__V__", VariableInterpolation.replaceVariables("${var.some.path}"));
        assertEquals("__V_2__var__V____F__regex__F__", VariableInterpolation.replaceVariables("${var:regex}"));
    }

    public void testTextWithoutVariablesIsUnchanged() {
        String query = "{app=\"foo\"} |= \"price: 5$\"";
        assertEquals(query, VariableInterpolation.replaceVariables(query));
        assertEquals(query, VariableInterpolation.restoreVariables(query));
    }

    public void testRestoreReversesReplace() {
        for (String query : new String[] { "$__interval", "[[var]]", "[[var:csv]]", "${var}", "${var:regex}", "a $x b $y" }) {
            assertEquals(query, VariableInterpolation.restoreVariables(VariableInterpolation.replaceVariables(query)));
        }
    }

    public void testReplacementIsQuoted() {
        // text outside a variable is copied as is
        assertEquals("\\$ __V_0__a__V__", VariableInterpolation.replaceVariables("\\$ $a"));
    }
}
