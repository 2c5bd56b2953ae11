/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.builder;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites dashboard template variables into placeholders the LogQL grammar accepts as identifiers, and back.
 *
 * <p>Three syntaxes are recognized, each tagged with its own type so it is restored as written:</p>
 * <ul>
 *   <li>{@code $var} becomes {@code __V_0__var__V__}</li>
 *   <li>{@code [[var]]} or {@code [[var:fmt]]} becomes {@code __V_1__var__V__} with an optional {@code __F__fmt__F__}</li>
 *   <li>{@code ${var}}, {@code ${var.path}} or {@code ${var:fmt}} becomes {@code __V_2__var__V__} with an optional
 *   {@code __F__fmt__F__}. The field path is dropped.</li>
 * </ul>
 */
public final class VariableInterpolation {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile(
        "\\$(\\w+)|\\[\\[([\\s\\S]+?)(?::(\\w+))?\\]\\]|\\$\\{(\\w+)(?:\\.([^:^\\}]+))?(?::([^\\}]+))?\\}"
    );
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("__V_(\\d)__(.+?)__V__(?:__F__(\\w+)__F__)?");

    private VariableInterpolation() {}

    /**
     * Replaces template variables with placeholders.
     * @param query the query as typed
     * @return the query with placeholders
     */
    public static String replaceVariables(String query) {
        Matcher matcher = VARIABLE_PATTERN.matcher(query);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String variable = matcher.group(1);
            String format = null;
            int type = 0;
            if (matcher.group(2) != null) {
                variable = matcher.group(2);
                format = matcher.group(3);
                type = 1;
            } else if (matcher.group(4) != null) {
                variable = matcher.group(4);
                format = matcher.group(6);
                type = 2;
            }
            String placeholder = "__V_" + type + "__" + variable + "__V__" + (format != null ? "__F__" + format + "__F__" : "");
            matcher.appendReplacement(sb, Matcher.quoteReplacement(placeholder));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Restores template variables from placeholders.
     * @param text text that may contain placeholders
     * @return the text with variables in their original syntax
     */
    public static String restoreVariables(String text) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String variable = matcher.group(2);
            String format = matcher.group(3);
            String restored = switch (matcher.group(1)) {
                case "1" -> "[[" + variable + (format != null ? ":" + format : "") + "]]";
                case "2" -> "${" + variable + (format != null ? ":" + format : "") + "}";
                default -> "$" + variable;
            };
            matcher.appendReplacement(sb, Matcher.quoteReplacement(restored));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
