package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.expression.ConditionEvaluator;
import com.example.demo.shortcuts.expression.ExpressionExpander;
import com.example.demo.shortcuts.expression.SuffixTransformer;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.TemplateSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Condition handling shared by the builder collaborators: $EXP expansion,
 * suffix rewriting and evaluation against an item plus its context.
 */
class TemplateConditions {

    private final TemplateSchema schema;

    TemplateConditions(TemplateSchema schema) {
        this.schema = schema;
    }

    String expand(String text) {
        return ExpressionExpander.expand(text, schema);
    }

    /**
     * Expand expressions, then rewrite property names with the suffix (if any).
     * The order matters: nosuffix expressions must already be wrapped when the
     * suffix pass runs.
     */
    String prepare(String condition, String suffix) {
        String expanded = expand(condition);
        if (suffix != null && !suffix.isEmpty()) {
            expanded = SuffixTransformer.applySuffixToCondition(expanded, suffix);
        }
        return expanded;
    }

    /**
     * Evaluate against the item's own properties overlaid with the context.
     * A blank condition matches.
     */
    boolean matches(String condition, MenuItem item, Map<String, String> context) {
        if (condition == null || condition.isEmpty()) {
            return true;
        }
        String resolved = SuffixTransformer.stripNoSuffixMarkers(expand(condition));

        Map<String, String> properties = new LinkedHashMap<>(item.getProperties());
        properties.putAll(context);
        return ConditionEvaluator.evaluate(resolved, properties);
    }

    /**
     * Template gating conditions are ANDed and see only the item's own properties.
     */
    boolean matchesAll(Iterable<String> conditions, MenuItem item, String suffix) {
        for (String condition : conditions) {
            if (!matches(prepare(condition, suffix), item, Collections.emptyMap())) {
                return false;
            }
        }
        return true;
    }
}
