package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Content generated for each submenu item at an
 * &lt;skinshortcuts insert="name"/&gt; point.
 *
 * The submenu is looked up as {parentItemName}.{source}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemsDefinition {
    /**
     * Insert point name to match (e.g., "widgets")
     */
    private String name;

    /**
     * Submenu name suffix; defaults to the name when empty
     */
    @Builder.Default
    private String source = "";

    /**
     * Evaluated against the parent item; when false the insert is skipped
     */
    @Builder.Default
    private String condition = "";

    /**
     * Evaluated against each submenu item's own properties
     */
    @Builder.Default
    private String filter = "";

    @Builder.Default
    private List<TemplateProperty> properties = new ArrayList<>();

    @Builder.Default
    private List<TemplateVar> vars = new ArrayList<>();

    @Builder.Default
    private List<PresetReference> presetRefs = new ArrayList<>();

    @Builder.Default
    private List<PropertyGroupReference> propertyGroups = new ArrayList<>();

    /**
     * Wrapper whose child elements are replicated once per submenu item
     */
    private Element controls;

    public String getEffectiveSource() {
        return source != null && !source.isEmpty() ? source : name;
    }
}
