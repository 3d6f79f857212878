package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete template schema. Every reusable kind is indexed by name; lookups
 * return null on a miss so callers can skip unresolved references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateSchema {
    @Builder.Default
    private Map<String, Expression> expressions = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, PropertyGroup> propertyGroups = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, IncludeDefinition> includes = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Preset> presets = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, PresetGroup> presetGroups = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, VariableDefinition> variableDefinitions = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, VariableGroup> variableGroups = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, ItemsDefinition> itemsDefinitions = new LinkedHashMap<>();

    @Builder.Default
    private List<Template> templates = new ArrayList<>();

    public Expression getExpression(String name) {
        return expressions.get(name);
    }

    public PropertyGroup getPropertyGroup(String name) {
        return propertyGroups.get(name);
    }

    public IncludeDefinition getInclude(String name) {
        return includes.get(name);
    }

    public Preset getPreset(String name) {
        return presets.get(name);
    }

    public PresetGroup getPresetGroup(String name) {
        return presetGroups.get(name);
    }

    public VariableDefinition getVariableDefinition(String name) {
        return variableDefinitions.get(name);
    }

    public VariableGroup getVariableGroup(String name) {
        return variableGroups.get(name);
    }

    public ItemsDefinition getItemsDefinition(String name) {
        return itemsDefinitions.get(name);
    }
}
