package com.example.demo.shortcuts.expression;

import com.example.demo.shortcuts.exception.TemplateBuildException;
import com.example.demo.shortcuts.model.Expression;
import com.example.demo.shortcuts.model.TemplateSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands $EXP[name] references to the named schema expression.
 *
 * Expressions may reference other expressions; they are expanded recursively.
 * A nosuffix expression is wrapped as {NOSUFFIX:...} so that a later suffix
 * pass leaves it alone. Unknown names are left in place.
 */
@Slf4j
public final class ExpressionExpander {

    static final Pattern EXP_PATTERN = Pattern.compile("\\$EXP\\[([^\\]]+)\\]");

    private ExpressionExpander() {
    }

    /**
     * @throws TemplateBuildException with code CIRCULAR_EXPRESSION when an
     *         expression references itself, directly or through others
     */
    public static String expand(String text, TemplateSchema schema) {
        return expand(text, schema, new LinkedHashSet<>());
    }

    private static String expand(String text, TemplateSchema schema, Set<String> expanding) {
        if (text == null || !text.contains("$EXP[")) {
            return text;
        }

        Matcher m = EXP_PATTERN.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String name = m.group(1);
            Expression expression = schema.getExpression(name);
            if (expression == null) {
                log.debug("Expression '{}' not found, leaving reference in place", name);
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group(0)));
                continue;
            }
            if (!expanding.add(name)) {
                throw new TemplateBuildException(
                    TemplateBuildException.CIRCULAR_EXPRESSION,
                    "Circular expression reference: " + String.join(" -> ", expanding) + " -> " + name
                );
            }
            String expanded = expand(expression.getValue(), schema, expanding);
            expanding.remove(name);

            if (expression.isNosuffix() && expanded != null && !expanded.isEmpty()) {
                expanded = "{NOSUFFIX:" + expanded + "}";
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(expanded != null ? expanded : ""));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
