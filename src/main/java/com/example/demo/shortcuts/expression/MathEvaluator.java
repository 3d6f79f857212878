package com.example.demo.shortcuts.expression;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Arithmetic for $MATH[...] placeholders.
 *
 * Supports + - * / // % and parentheses, unary + and -, integer and decimal
 * literals, and property names as variables (missing or non-numeric values
 * count as 0). Precedence: unary, then * / // %, then + -; left associative.
 *
 * Evaluation never throws: on a syntax error or a zero divisor the original
 * expression text is returned unchanged.
 *
 * <pre>
 * $MATH[id * 100 + 5000]
 * $MATH[(mainmenuid * 1000) + 600 + id]
 * </pre>
 */
@Slf4j
public final class MathEvaluator {

    static final Pattern MATH_PATTERN = Pattern.compile("\\$MATH\\[([^\\]]+)\\]");

    private final Map<String, String> variables;
    private String expr = "";
    private int pos;

    private MathEvaluator(Map<String, String> variables) {
        this.variables = variables;
    }

    /**
     * Evaluate the expression inside $MATH[...] (without the wrapper).
     *
     * @return the result, whole numbers without a fractional part, or the
     *         original expression when it cannot be evaluated
     */
    public static String evaluate(String expression, Map<String, String> properties) {
        return new MathEvaluator(properties).run(expression);
    }

    /**
     * Replace every $MATH[...] occurrence in the text with its result.
     */
    public static String processMath(String text, Map<String, String> properties) {
        if (text == null || !text.contains("$MATH[")) {
            return text;
        }
        Matcher m = MATH_PATTERN.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(evaluate(m.group(1), properties)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private String run(String expression) {
        this.expr = expression.trim();
        this.pos = 0;
        try {
            double result = parseExpression();
            skipWhitespace();
            if (pos < expr.length()) {
                throw new IllegalArgumentException("Unexpected character: " + expr.charAt(pos));
            }
            return format(result);
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.debug("Cannot evaluate math expression '{}': {}", expression, e.getMessage());
            return expression;
        }
    }

    static String format(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new ArithmeticException("Result is not a finite number");
        }
        if (value == Math.rint(value)) {
            return BigDecimal.valueOf(value).toBigInteger().toString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private void skipWhitespace() {
        while (pos < expr.length() && Character.isWhitespace(expr.charAt(pos))) {
            pos++;
        }
    }

    // addition and subtraction, lowest precedence
    private double parseExpression() {
        double left = parseTerm();
        while (pos < expr.length()) {
            skipWhitespace();
            if (pos >= expr.length()) {
                break;
            }
            char op = expr.charAt(pos);
            if (op == '+') {
                pos++;
                left = left + parseTerm();
            } else if (op == '-') {
                pos++;
                left = left - parseTerm();
            } else {
                break;
            }
        }
        return left;
    }

    private double parseTerm() {
        double left = parseUnary();
        while (pos < expr.length()) {
            skipWhitespace();
            if (pos >= expr.length()) {
                break;
            }
            if (expr.startsWith("//", pos)) {
                pos += 2;
                long divisor = (long) parseUnary();
                if (divisor == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                left = Math.floorDiv((long) left, divisor);
            } else if (expr.charAt(pos) == '*') {
                pos++;
                left = left * parseUnary();
            } else if (expr.charAt(pos) == '/') {
                pos++;
                double right = parseUnary();
                if (right == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                left = left / right;
            } else if (expr.charAt(pos) == '%') {
                pos++;
                double right = parseUnary();
                if (right == 0) {
                    throw new ArithmeticException("Modulo by zero");
                }
                left = floorMod(left, right);
            } else {
                break;
            }
        }
        return left;
    }

    // remainder takes the sign of the divisor
    private static double floorMod(double left, double right) {
        double mod = left % right;
        if (mod != 0 && (mod < 0) != (right < 0)) {
            mod += right;
        }
        return mod;
    }

    private double parseUnary() {
        skipWhitespace();
        if (pos < expr.length() && expr.charAt(pos) == '-') {
            pos++;
            return -parseUnary();
        }
        if (pos < expr.length() && expr.charAt(pos) == '+') {
            pos++;
            return parseUnary();
        }
        return parsePrimary();
    }

    private double parsePrimary() {
        skipWhitespace();
        if (pos >= expr.length()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }

        char c = expr.charAt(pos);
        if (c == '(') {
            pos++;
            double result = parseExpression();
            skipWhitespace();
            if (pos >= expr.length() || expr.charAt(pos) != ')') {
                throw new IllegalArgumentException("Missing closing parenthesis");
            }
            pos++;
            return result;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return parseVariable();
        }
        throw new IllegalArgumentException("Unexpected character: " + c);
    }

    private double parseNumber() {
        int start = pos;
        boolean hasDot = false;
        while (pos < expr.length()) {
            char c = expr.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !hasDot) {
                hasDot = true;
                pos++;
            } else {
                break;
            }
        }
        // a lone "." fails here with NumberFormatException
        return Double.parseDouble(expr.substring(start, pos));
    }

    private double parseVariable() {
        int start = pos;
        while (pos < expr.length()) {
            char c = expr.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }

        String value = variables.get(expr.substring(start, pos));
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
