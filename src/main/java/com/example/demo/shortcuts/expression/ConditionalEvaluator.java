package com.example.demo.shortcuts.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conditional values for $IF[...] placeholders.
 *
 * <pre>
 * $IF[condition THEN trueValue]
 * $IF[condition THEN trueValue ELSE falseValue]
 * $IF[cond1 THEN val1 ELIF cond2 THEN val2 ELSE val3]
 * </pre>
 *
 * Keywords are whole words, case-insensitive. Conditions are evaluated in
 * order with {@link ConditionEvaluator}; the first true one selects its
 * value. With no match the ELSE value is returned, or "" without an ELSE.
 */
public final class ConditionalEvaluator {

    static final Pattern IF_PATTERN = Pattern.compile("\\$IF\\[([^\\]]+)\\]");

    private static final Pattern THEN = Pattern.compile("\\bTHEN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELIF = Pattern.compile("\\bELIF\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSE = Pattern.compile("\\bELSE\\b", Pattern.CASE_INSENSITIVE);

    private ConditionalEvaluator() {
    }

    public static String evaluate(String expression, Map<String, String> properties) {
        List<String[]> clauses = new ArrayList<>();
        String elseValue = null;

        String remaining = expression.trim();
        while (!remaining.isEmpty()) {
            remaining = remaining.trim();

            Matcher then = THEN.matcher(remaining);
            if (!then.find()) {
                // keyword-free remainder after an ELIF acts as the else value
                if (!clauses.isEmpty() && !remaining.isEmpty()) {
                    elseValue = remaining;
                }
                break;
            }

            String condition = remaining.substring(0, then.start()).trim();
            String afterThen = remaining.substring(then.end()).trim();

            Matcher elif = ELIF.matcher(afterThen);
            Matcher otherwise = ELSE.matcher(afterThen);
            boolean hasElif = elif.find();
            boolean hasElse = otherwise.find();

            if (hasElif && (!hasElse || elif.start() < otherwise.start())) {
                clauses.add(new String[]{condition, afterThen.substring(0, elif.start()).trim()});
                remaining = afterThen.substring(elif.end());
            } else if (hasElse) {
                clauses.add(new String[]{condition, afterThen.substring(0, otherwise.start()).trim()});
                elseValue = afterThen.substring(otherwise.end()).trim();
                break;
            } else {
                clauses.add(new String[]{condition, afterThen});
                break;
            }
        }

        for (String[] clause : clauses) {
            if (ConditionEvaluator.evaluate(clause[0], properties)) {
                return clause[1];
            }
        }
        return elseValue != null ? elseValue : "";
    }

    /**
     * Replace every $IF[...] occurrence in the text with its selected value.
     */
    public static String processIf(String text, Map<String, String> properties) {
        if (text == null || !text.contains("$IF[")) {
            return text;
        }
        Matcher m = IF_PATTERN.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(evaluate(m.group(1), properties)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
