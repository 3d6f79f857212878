package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.expression.SuffixTransformer;
import com.example.demo.shortcuts.model.FallbackRule;
import com.example.demo.shortcuts.model.ItemsDefinition;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.Preset;
import com.example.demo.shortcuts.model.PresetGroup;
import com.example.demo.shortcuts.model.PresetGroupChild;
import com.example.demo.shortcuts.model.PresetGroupReference;
import com.example.demo.shortcuts.model.PresetReference;
import com.example.demo.shortcuts.model.PresetRow;
import com.example.demo.shortcuts.model.PropertyFallback;
import com.example.demo.shortcuts.model.PropertyGroup;
import com.example.demo.shortcuts.model.PropertyGroupReference;
import com.example.demo.shortcuts.model.PropertySchema;
import com.example.demo.shortcuts.model.SchemaReference;
import com.example.demo.shortcuts.model.Template;
import com.example.demo.shortcuts.model.TemplateOutput;
import com.example.demo.shortcuts.model.TemplateProperty;
import com.example.demo.shortcuts.model.TemplateSchema;
import com.example.demo.shortcuts.model.TemplateVar;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the per-item property context a template's controls and variables
 * are substituted against.
 *
 * Resolution order for a template item:
 * 1. menu defaults, then the item's own properties
 * 2. built-ins (index, name, menu, idprefix, id, suffix)
 * 3. property fallbacks, for every numeric suffix the item uses
 * 4. template properties (first match per name wins)
 * 5. template vars (later vars overwrite)
 * 6. preset references, preset group references, property group references
 */
@Slf4j
class ContextResolver {

    private final TemplateSchema schema;
    private final PropertySchema propertySchema;
    private final TemplateConditions conditions;
    private final TextSubstitutor substitutor;

    ContextResolver(TemplateSchema schema, PropertySchema propertySchema,
                    TemplateConditions conditions, TextSubstitutor substitutor) {
        this.schema = schema;
        this.propertySchema = propertySchema;
        this.conditions = conditions;
        this.substitutor = substitutor;
    }

    Map<String, String> buildItemContext(Template template, TemplateOutput output, MenuItem item,
                                         int index, Menu menu) {
        Map<String, String> context = new LinkedHashMap<>(menu.getDefaults());
        context.putAll(item.getProperties());

        String idPrefix = output.getIdPrefix() != null ? output.getIdPrefix() : "";
        String suffix = output.getSuffix() != null ? output.getSuffix() : "";

        context.put("index", String.valueOf(index));
        context.put("name", item.getName());
        context.put("menu", menu.getName());
        context.put("idprefix", idPrefix);
        context.put("id", idPrefix.isEmpty() ? String.valueOf(index) : idPrefix + index);
        context.put("suffix", suffix);

        applyFallbacks(item, context);

        Set<String> resolved = new HashSet<>();
        for (TemplateProperty property : template.getProperties()) {
            if (resolved.contains(property.getName())) {
                continue;
            }
            String value = resolveProperty(property, item, context, suffix);
            if (value != null) {
                context.put(property.getName(), value);
                resolved.add(property.getName());
            }
        }

        for (TemplateVar var : template.getVars()) {
            String value = resolveVar(var, item, context, suffix);
            if (value != null) {
                context.put(var.getName(), value);
            }
        }

        for (PresetReference ref : template.getPresetRefs()) {
            String refSuffix = ref.effectiveSuffix(suffix);
            if (referenceApplies(ref, refSuffix, item, context)) {
                applyPreset(ref.getName(), item, context, refSuffix);
            }
        }

        for (PresetGroupReference ref : template.getPresetGroupRefs()) {
            String refSuffix = ref.effectiveSuffix(suffix);
            if (referenceApplies(ref, refSuffix, item, context)) {
                applyPresetGroup(ref.getName(), item, context, refSuffix);
            }
        }

        for (PropertyGroupReference ref : template.getPropertyGroups()) {
            String refSuffix = ref.effectiveSuffix(suffix);
            if (referenceApplies(ref, refSuffix, item, context)) {
                applyPropertyGroup(ref.getName(), item, context, refSuffix);
            }
        }

        return context;
    }

    /**
     * Context for a submenu item during items iteration. Parent values are
     * reached through $PARENT[...] and are not copied in.
     */
    Map<String, String> buildItemsContext(MenuItem subItem, int index, Menu submenu) {
        Map<String, String> context = new LinkedHashMap<>(submenu.getDefaults());
        context.putAll(subItem.getProperties());
        context.put("index", String.valueOf(index));
        context.put("name", subItem.getName());
        context.put("menu", submenu.getName());
        context.put("label", subItem.getLabel());

        applyFallbacks(subItem, context);
        return context;
    }

    /**
     * Items-level properties, vars, presets and property groups. No suffix is
     * involved here except where a preset reference names its own.
     */
    void applyItemsTransformations(ItemsDefinition definition, MenuItem subItem, Map<String, String> context) {
        Set<String> resolved = new HashSet<>();
        for (TemplateProperty property : definition.getProperties()) {
            if (resolved.contains(property.getName())) {
                continue;
            }
            String value = resolveProperty(property, subItem, context, "");
            if (value != null) {
                context.put(property.getName(), value);
                resolved.add(property.getName());
            }
        }

        for (TemplateVar var : definition.getVars()) {
            String value = resolveVar(var, subItem, context, "");
            if (value != null) {
                context.put(var.getName(), value);
            }
        }

        // reference conditions are evaluated as written; only a preset
        // reference's own suffix reaches its rows
        for (PresetReference ref : definition.getPresetRefs()) {
            if (conditions.matches(ref.getCondition(), subItem, context)) {
                applyPreset(ref.getName(), subItem, context, ref.effectiveSuffix(""));
            }
        }

        for (PropertyGroupReference ref : definition.getPropertyGroups()) {
            if (conditions.matches(ref.getCondition(), subItem, context)) {
                applyPropertyGroup(ref.getName(), subItem, context, "");
            }
        }
    }

    /**
     * @return the resolved value, or null when the property's condition fails
     */
    String resolveProperty(TemplateProperty property, MenuItem item, Map<String, String> context, String suffix) {
        if (notBlank(property.getCondition())
                && !conditions.matches(conditions.prepare(property.getCondition(), suffix), item, context)) {
            return null;
        }

        if (notBlank(property.getFromSource())) {
            String source = property.getFromSource();
            if (!suffix.isEmpty()) {
                source = SuffixTransformer.applySuffixToFromSource(source, suffix);
            }
            return getFromSource(source, item, context);
        }

        String value = property.getValue() != null ? property.getValue() : "";
        return substitutor.substitutePropertyRefs(value, item, context);
    }

    /**
     * First value whose condition holds; a value without a condition always
     * matches. Null when nothing matches.
     */
    String resolveVar(TemplateVar var, MenuItem item, Map<String, String> context, String suffix) {
        for (TemplateProperty candidate : var.getValues()) {
            if (!notBlank(candidate.getCondition())
                    || conditions.matches(conditions.prepare(candidate.getCondition(), suffix), item, context)) {
                return candidate.getValue();
            }
        }
        return null;
    }

    String getFromSource(String source, MenuItem item, Map<String, String> context) {
        if (SuffixTransformer.BUILT_IN_NAMES.contains(source)) {
            String value = context.get(source);
            return value != null ? value : "";
        }
        if (context.containsKey(source)) {
            return context.get(source);
        }
        return item.getProperty(source);
    }

    /**
     * Group properties only fill names not yet in the context; group vars
     * overwrite.
     */
    void applyPropertyGroup(String groupName, MenuItem item, Map<String, String> context, String suffix) {
        PropertyGroup group = schema.getPropertyGroup(groupName);
        if (group == null) {
            log.debug("Property group '{}' not found", groupName);
            return;
        }

        for (TemplateProperty property : group.getProperties()) {
            String value = resolveProperty(property, item, context, suffix);
            if (value != null && !context.containsKey(property.getName())) {
                context.put(property.getName(), value);
            }
        }

        for (TemplateVar var : group.getVars()) {
            String value = resolveVar(var, item, context, suffix);
            if (value != null) {
                context.put(var.getName(), value);
            }
        }
    }

    /**
     * Copy the first matching row's values into the context without
     * overwriting anything already present. The suffix rewrites row
     * conditions, never the preset name or its output names.
     */
    void applyPreset(String presetName, MenuItem item, Map<String, String> context, String suffix) {
        Preset preset = schema.getPreset(presetName);
        if (preset == null) {
            log.debug("Preset '{}' not found", presetName);
            return;
        }
        Map<String, String> values = getPresetValues(preset, item, context, suffix);
        if (values != null) {
            putAbsent(context, values);
        }
    }

    /**
     * Children are tried in order; the first one that yields values wins. A
     * preset child whose rows all fail lets the next child try.
     */
    void applyPresetGroup(String groupName, MenuItem item, Map<String, String> context, String suffix) {
        PresetGroup group = schema.getPresetGroup(groupName);
        if (group == null) {
            log.debug("Preset group '{}' not found", groupName);
            return;
        }

        for (PresetGroupChild child : group.getChildren()) {
            if (notBlank(child.getCondition())
                    && !conditions.matches(conditions.prepare(child.getCondition(), suffix), item, context)) {
                continue;
            }

            if (notBlank(child.getPresetName())) {
                Preset preset = schema.getPreset(child.getPresetName());
                if (preset == null) {
                    log.debug("Preset '{}' referenced from group '{}' not found", child.getPresetName(), groupName);
                    continue;
                }
                Map<String, String> values = getPresetValues(preset, item, context, suffix);
                if (values != null && !values.isEmpty()) {
                    putAbsent(context, values);
                    return;
                }
            } else if (child.getValues() != null && !child.getValues().isEmpty()) {
                putAbsent(context, child.getValues());
                return;
            }
        }
    }

    Map<String, String> getPresetValues(Preset preset, MenuItem item, Map<String, String> context, String suffix) {
        for (PresetRow row : preset.getRows()) {
            if (!notBlank(row.getCondition())
                    || conditions.matches(conditions.prepare(row.getCondition(), suffix), item, context)) {
                return row.getValues();
            }
        }
        return null;
    }

    /**
     * Fill missing properties from the fallback rules, once unsuffixed and
     * once for every numeric suffix (".2", ".3") found on the item's own
     * property names.
     */
    void applyFallbacks(MenuItem item, Map<String, String> context) {
        if (propertySchema == null || propertySchema.getFallbacks().isEmpty()) {
            return;
        }

        Set<String> suffixes = new LinkedHashSet<>();
        suffixes.add("");
        for (String propertyName : item.getProperties().keySet()) {
            int dot = propertyName.lastIndexOf('.');
            if (dot >= 0 && dot < propertyName.length() - 1 && isDigits(propertyName.substring(dot + 1))) {
                suffixes.add(propertyName.substring(dot));
            }
        }

        for (Map.Entry<String, PropertyFallback> entry : propertySchema.getFallbacks().entrySet()) {
            for (String suffix : suffixes) {
                String target = entry.getKey() + suffix;
                if (context.containsKey(target) || item.hasProperty(target)) {
                    continue;
                }
                for (FallbackRule rule : entry.getValue().getRules()) {
                    if (!notBlank(rule.getCondition())
                            || conditions.matches(conditions.prepare(rule.getCondition(), suffix), item, context)) {
                        context.put(target, rule.getValue());
                        break;
                    }
                }
            }
        }
    }

    private boolean referenceApplies(SchemaReference ref, String suffix, MenuItem item, Map<String, String> context) {
        if (!notBlank(ref.getCondition())) {
            return true;
        }
        return conditions.matches(conditions.prepare(ref.getCondition(), suffix), item, context);
    }

    private static void putAbsent(Map<String, String> context, Map<String, String> values) {
        for (Map.Entry<String, String> value : values.entrySet()) {
            context.putIfAbsent(value.getKey(), value.getValue());
        }
    }

    private static boolean isDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean notBlank(String text) {
        return text != null && !text.isEmpty();
    }
}
