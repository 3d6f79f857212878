package com.example.demo.shortcuts.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level suffix rewriting that lets one definition serve several
 * parameterized slots: with suffix ".2" the condition {@code widgetArt=Poster}
 * becomes {@code widgetArt.2=Poster}.
 *
 * Only the property name directly left of {@code =} or {@code ~} is rewritten.
 * Built-in names are never suffixed, and anything inside a
 * {@code {NOSUFFIX:...}} marker is left untouched (the marker itself is kept
 * so later passes stay protected).
 */
public final class SuffixTransformer {

    /**
     * Context entries every item gets regardless of suffix
     */
    public static final Set<String> BUILT_IN_NAMES = Set.of("index", "name", "menu", "id", "idprefix", "suffix");

    static final Pattern NOSUFFIX = Pattern.compile("\\{NOSUFFIX:([^}]+)\\}");

    private static final String PLACEHOLDER_PREFIX = "__NOSUFFIX_";
    private static final String OPERATORS = "=~|+[]!";

    private SuffixTransformer() {
    }

    public static String applySuffixToCondition(String condition, String suffix) {
        if (condition == null || condition.isEmpty() || suffix == null || suffix.isEmpty()) {
            return condition;
        }

        List<String> preserved = new ArrayList<>();
        Matcher matcher = NOSUFFIX.matcher(condition);
        StringBuffer protectedText = new StringBuffer();
        while (matcher.find()) {
            preserved.add(matcher.group(0));
            matcher.appendReplacement(protectedText, PLACEHOLDER_PREFIX + (preserved.size() - 1) + "__");
        }
        matcher.appendTail(protectedText);

        List<String> tokens = tokenize(protectedText.toString());
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i).trim();
            if (token.isEmpty()) {
                continue;
            }
            boolean beforeOperator = i + 1 < tokens.size()
                    && (tokens.get(i + 1).equals("=") || tokens.get(i + 1).equals("~"));
            if (beforeOperator && !BUILT_IN_NAMES.contains(token) && !token.startsWith(PLACEHOLDER_PREFIX)) {
                token = token + suffix;
            }
            result.append(token);
        }

        String transformed = result.toString();
        for (int i = 0; i < preserved.size(); i++) {
            transformed = transformed.replace(PLACEHOLDER_PREFIX + i + "__", preserved.get(i));
        }
        return transformed;
    }

    /**
     * Suffix a "from" source reference unless it names a built-in.
     */
    public static String applySuffixToFromSource(String source, String suffix) {
        if (source == null || source.isEmpty() || suffix == null || suffix.isEmpty()) {
            return source;
        }
        if (BUILT_IN_NAMES.contains(source)) {
            return source;
        }
        return source + suffix;
    }

    /**
     * Unwrap {NOSUFFIX:...} markers, keeping their content.
     */
    public static String stripNoSuffixMarkers(String text) {
        if (text == null || !text.contains("{NOSUFFIX:")) {
            return text;
        }
        return NOSUFFIX.matcher(text).replaceAll("$1");
    }

    /**
     * Alternating text/operator tokens; text tokens may be empty so that the
     * token after a name is always the operator that follows it.
     */
    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (OPERATORS.indexOf(c) >= 0) {
                tokens.add(current.toString());
                tokens.add(String.valueOf(c));
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        tokens.add(current.toString());
        return tokens;
    }
}
