package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single entry of a menu record, as produced by the menu loader.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MenuItem {
    /**
     * Unique name of the item within its menu (e.g., "movies")
     */
    private String name;

    /**
     * Display label (may be a localize string such as "$LOCALIZE[342]")
     */
    @Builder.Default
    private String label = "";

    /**
     * Item properties (widgetPath, widgetArt.2, ...). Insertion ordered.
     */
    @Builder.Default
    private Map<String, String> properties = new LinkedHashMap<>();

    /**
     * Disabled items are never built
     */
    private boolean disabled;

    public String getProperty(String propertyName) {
        String value = properties == null ? null : properties.get(propertyName);
        return value != null ? value : "";
    }

    public boolean hasProperty(String propertyName) {
        return properties != null && properties.containsKey(propertyName);
    }
}
