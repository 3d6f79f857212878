package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.expression.ConditionalEvaluator;
import com.example.demo.shortcuts.expression.ExpressionExpander;
import com.example.demo.shortcuts.expression.MathEvaluator;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.TemplateSchema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder substitution for text and attribute values.
 *
 * Order of operations:
 * 1. $EXP[...] expression references
 * 2. $PARENT[...] parent item values (items iteration only)
 * 3. $PROPERTY[...] context values, so references inside $MATH resolve
 * 4. $MATH[...] arithmetic
 * 5. $IF[...] conditional values
 */
class TextSubstitutor {

    private static final Pattern PROPERTY_PATTERN = Pattern.compile("\\$PROPERTY\\[([^\\]]+)\\]");
    private static final Pattern PARENT_PATTERN = Pattern.compile("\\$PARENT\\[([^\\]]+)\\]");

    private final TemplateSchema schema;

    TextSubstitutor(TemplateSchema schema) {
        this.schema = schema;
    }

    String substitute(String text, Map<String, String> context, MenuItem item) {
        return substitute(text, context, item, null, null);
    }

    /**
     * @param parentContext context of the outer item, or null outside items iteration
     * @param parentItem outer item, or null outside items iteration
     */
    String substitute(String text, Map<String, String> context, MenuItem item,
                      Map<String, String> parentContext, MenuItem parentItem) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = text;
        if (result.contains("$EXP[")) {
            result = ExpressionExpander.expand(result, schema);
        }

        if (parentItem != null && result.contains("$PARENT[")) {
            Matcher m = PARENT_PATTERN.matcher(result);
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                m.appendReplacement(sb, Matcher.quoteReplacement(parentValue(m.group(1), parentContext, parentItem)));
            }
            m.appendTail(sb);
            result = sb.toString();
        }

        result = substitutePropertyRefs(result, item, context);

        if (result.contains("$MATH[") || result.contains("$IF[")) {
            Map<String, String> properties = new LinkedHashMap<>();
            if (parentItem != null) {
                properties.putAll(parentItem.getProperties());
            }
            if (parentContext != null) {
                properties.putAll(parentContext);
            }
            properties.putAll(item.getProperties());
            properties.putAll(context);

            result = MathEvaluator.processMath(result, properties);
            result = ConditionalEvaluator.processIf(result, properties);
        }
        return result;
    }

    /**
     * Replace $PROPERTY[name] with the context value, then the item's own
     * property, else "".
     */
    String substitutePropertyRefs(String text, MenuItem item, Map<String, String> context) {
        if (text == null || !text.contains("$PROPERTY[")) {
            return text;
        }
        Matcher m = PROPERTY_PATTERN.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String name = m.group(1);
            String value = context.containsKey(name) ? context.get(name) : item.getProperty(name);
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : ""));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String parentValue(String name, Map<String, String> parentContext, MenuItem parentItem) {
        if (parentContext != null && parentContext.containsKey(name)) {
            return parentContext.get(name);
        }
        if (name.equals("label")) {
            return parentItem.getLabel();
        }
        if (name.equals("name")) {
            return parentItem.getName();
        }
        return parentItem.getProperty(name);
    }
}
