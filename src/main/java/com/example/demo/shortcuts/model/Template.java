package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level template: iterates menu items and produces controls for one or
 * more includes plus any variables it declares.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Template {
    /**
     * Single output include name, used only when no outputs are declared
     */
    @Builder.Default
    private String include = "";

    /**
     * Id prefix paired with the single include attribute
     */
    @Builder.Default
    private String idPrefix = "";

    @Builder.Default
    private TemplateOnly templateOnly = TemplateOnly.NONE;

    /**
     * Restricts the template to one menu (e.g., "mainmenu"); empty means all menus
     */
    @Builder.Default
    private String menu = "";

    @Builder.Default
    private List<TemplateOutput> outputs = new ArrayList<>();

    /**
     * Gating conditions, ANDed together
     */
    @Builder.Default
    private List<String> conditions = new ArrayList<>();

    @Builder.Default
    private List<TemplateProperty> properties = new ArrayList<>();

    @Builder.Default
    private List<TemplateVar> vars = new ArrayList<>();

    @Builder.Default
    private List<PropertyGroupReference> propertyGroups = new ArrayList<>();

    @Builder.Default
    private List<PresetReference> presetRefs = new ArrayList<>();

    @Builder.Default
    private List<PresetGroupReference> presetGroupRefs = new ArrayList<>();

    /**
     * Wrapper whose children are appended to the include for each item
     */
    private Element controls;

    @Builder.Default
    private List<VariableDefinition> variables = new ArrayList<>();

    @Builder.Default
    private List<VariableGroupReference> variableGroups = new ArrayList<>();

    /**
     * Declared outputs, or a single output derived from include/idPrefix.
     */
    public List<TemplateOutput> getEffectiveOutputs() {
        if (outputs != null && !outputs.isEmpty()) {
            return outputs;
        }
        if (include != null && !include.isEmpty()) {
            return List.of(TemplateOutput.builder().include(include).idPrefix(idPrefix).build());
        }
        return Collections.emptyList();
    }
}
