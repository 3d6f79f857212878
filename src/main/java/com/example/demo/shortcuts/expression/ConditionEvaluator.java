package com.example.demo.shortcuts.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates property conditions against a flat property map.
 *
 * Operators (symbol and keyword forms):
 * - Equality: prop=value or prop EQUALS value
 * - Contains: prop~value or prop CONTAINS value
 * - Empty check: prop EMPTY
 * - List membership: prop IN value1,value2,value3
 * - AND: a + b or a AND b
 * - OR: a | b or a OR b
 * - NOT: !a or NOT a
 * - Grouping: [a | b]
 * - Compact OR: prop=value1 | value2 | value3
 *
 * Negation binds to the adjacent condition only: {@code !prop=a | b} is
 * {@code (!prop=a) | prop=b}. Use brackets to negate a group: {@code ![prop=a | b]}.
 */
public final class ConditionEvaluator {

    private static final Pattern CONDITION_MATCH =
            Pattern.compile("^(!?)([a-zA-Z_][a-zA-Z0-9_.]*)([=~])(.*)$");

    private static final Pattern[] KEYWORDS = {
            Pattern.compile("\\bAND\\b"),
            Pattern.compile("\\bOR\\b"),
            Pattern.compile("\\bNOT\\b"),
            Pattern.compile("\\bEQUALS\\b"),
            Pattern.compile("\\bCONTAINS\\b")
    };
    private static final String[] SYMBOLS = {"+", "|", "!", "=", "~"};

    private ConditionEvaluator() {
    }

    /**
     * Evaluate a condition against property values.
     *
     * @param condition condition text; null or blank is vacuously true
     * @param properties property name to value; missing names read as ""
     * @return whether the condition holds
     */
    public static boolean evaluate(String condition, Map<String, String> properties) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        String normalized = normalizeKeywords(condition.trim());
        if (normalized.contains("|")) {
            normalized = expandCompactOr(normalized);
        }
        return evaluateExpanded(normalized, properties);
    }

    /**
     * Convert keyword operators to their symbols (AND to +, OR to |, NOT to !,
     * EQUALS to =, CONTAINS to ~). Whole words only, so values are left alone.
     */
    public static String normalizeKeywords(String condition) {
        String result = condition;
        for (int i = 0; i < KEYWORDS.length; i++) {
            result = KEYWORDS[i].matcher(result).replaceAll(Matcher.quoteReplacement(SYMBOLS[i]));
        }
        return result;
    }

    /**
     * Expand compact OR syntax to its full form.
     * {@code widgetType=movies | episodes} becomes
     * {@code widgetType=movies | widgetType=episodes}. The property name and
     * operator cascade from the most recent full {@code name OP value} segment.
     */
    public static String expandCompactOr(String condition) {
        if (condition == null || condition.isEmpty()) {
            return condition;
        }

        List<String> result = new ArrayList<>();
        for (String rawPart : splitPreservingBrackets(condition, '+')) {
            String andPart = rawPart.trim();
            if (andPart.isEmpty()) {
                continue;
            }

            boolean negated = andPart.startsWith("!");
            if (negated) {
                andPart = andPart.substring(1).trim();
            }

            String expanded;
            if (isWrappedInBrackets(andPart)) {
                expanded = "[" + expandCompactOr(andPart.substring(1, andPart.length() - 1).trim()) + "]";
            } else {
                expanded = expandOrSegment(andPart);
            }
            result.add(negated ? "!" + expanded : expanded);
        }
        return String.join(" + ", result);
    }

    private static String expandOrSegment(String segment) {
        if (!segment.contains("|")) {
            return segment;
        }
        List<String> parts = splitPreservingBrackets(segment, '|');
        if (parts.size() <= 1) {
            return segment;
        }

        List<String> result = new ArrayList<>();
        String currentProperty = "";
        String currentOperator = "";

        for (String rawPart : parts) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }

            // bracketed groups are expanded on their own and never take part in the cascade
            String bare = part.startsWith("!") ? part.substring(1).trim() : part;
            if (isWrappedInBrackets(bare)) {
                String inner = expandCompactOr(bare.substring(1, bare.length() - 1).trim());
                result.add((part.startsWith("!") ? "!" : "") + "[" + inner + "]");
                continue;
            }

            Matcher match = CONDITION_MATCH.matcher(part);
            if (match.matches()) {
                currentProperty = match.group(2);
                currentOperator = match.group(3);
                result.add(match.group(1) + currentProperty + currentOperator + match.group(4));
            } else if (!currentProperty.isEmpty()) {
                result.add(currentProperty + currentOperator + part);
            } else {
                result.add(part);
            }
        }
        return String.join(" | ", result);
    }

    /**
     * Split on a delimiter that is not nested inside [...] groups.
     * A trailing empty segment is dropped.
     */
    static List<String> splitPreservingBrackets(String text, char delimiter) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
                current.append(c);
            } else if (c == ']') {
                depth--;
                current.append(c);
            } else if (c == delimiter && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    /**
     * True when the whole text is one bracketed group, not merely starting and
     * ending with brackets ("[a] + [b]" is not wrapped).
     */
    static boolean isWrappedInBrackets(String text) {
        if (!text.startsWith("[") || !text.endsWith("]")) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static boolean evaluateExpanded(String condition, Map<String, String> properties) {
        String cond = condition.trim();
        if (cond.isEmpty()) {
            return true;
        }

        if (isWrappedInBrackets(cond)) {
            return evaluateExpanded(cond.substring(1, cond.length() - 1), properties);
        }

        // AND/OR split before negation: !a + b is (!a) + b
        List<String> andParts = splitPreservingBrackets(cond, '+');
        if (andParts.size() > 1) {
            for (String part : andParts) {
                if (!evaluateExpanded(part.trim(), properties)) {
                    return false;
                }
            }
            return true;
        }

        List<String> orParts = splitPreservingBrackets(cond, '|');
        if (orParts.size() > 1) {
            for (String part : orParts) {
                if (evaluateExpanded(part.trim(), properties)) {
                    return true;
                }
            }
            return false;
        }

        if (cond.startsWith("!")) {
            String inner = cond.substring(1).trim();
            if (isWrappedInBrackets(inner)) {
                return !evaluateExpanded(inner.substring(1, inner.length() - 1), properties);
            }
            return !evaluateSingle(inner, properties);
        }

        return evaluateSingle(cond, properties);
    }

    private static boolean evaluateSingle(String condition, Map<String, String> properties) {
        String cond = condition.trim();

        boolean negated = false;
        if (cond.startsWith("!")) {
            negated = true;
            cond = cond.substring(1).trim();
        }

        boolean result;
        if (isWrappedInBrackets(cond)) {
            result = evaluateExpanded(cond.substring(1, cond.length() - 1), properties);
        } else if (cond.endsWith(" EMPTY")) {
            String name = cond.substring(0, cond.length() - 6).trim();
            result = lookup(properties, name).isBlank();
        } else if (cond.contains(" IN ")) {
            int at = cond.indexOf(" IN ");
            String actual = lookup(properties, cond.substring(0, at).trim());
            result = false;
            for (String candidate : cond.substring(at + 4).trim().split(",", -1)) {
                if (candidate.trim().equals(actual)) {
                    result = true;
                    break;
                }
            }
        } else if (cond.contains("=")) {
            int at = cond.indexOf('=');
            String name = cond.substring(0, at).trim();
            String value = cond.substring(at + 1).trim();
            String actual;
            if (properties.containsKey(name)) {
                actual = lookup(properties, name);
            } else if (isBooleanLiteral(name)) {
                // literal left side, e.g. "true=true" after $PROPERTY substitution
                actual = name;
            } else {
                actual = "";
            }
            result = actual.equals(value);
        } else if (cond.contains("~")) {
            int at = cond.indexOf('~');
            String actual = lookup(properties, cond.substring(0, at).trim());
            result = actual.contains(cond.substring(at + 1).trim());
        } else if (isBooleanLiteral(cond)) {
            result = cond.equalsIgnoreCase("true");
        } else {
            result = isTruthy(lookup(properties, cond));
        }
        return negated != result;
    }

    private static boolean isTruthy(String value) {
        if (isBooleanLiteral(value)) {
            return value.equalsIgnoreCase("true");
        }
        return !value.isBlank();
    }

    private static boolean isBooleanLiteral(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.equals("true") || lower.equals("false");
    }

    private static String lookup(Map<String, String> properties, String name) {
        String value = properties.get(name);
        return value != null ? value : "";
    }
}
