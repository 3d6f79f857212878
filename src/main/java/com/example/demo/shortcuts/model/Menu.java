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
 * A menu record: a named, ordered list of items plus default properties
 * shared by every item. Submenus are menus named "{parentItem}.{suffix}".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Menu {
    private String name;

    /**
     * Default properties applied underneath each item's own properties
     */
    @Builder.Default
    private Map<String, String> defaults = new LinkedHashMap<>();

    @Builder.Default
    private List<MenuItem> items = new ArrayList<>();

    public MenuItem getItem(String itemName) {
        for (MenuItem item : items) {
            if (item.getName() != null && item.getName().equals(itemName)) {
                return item;
            }
        }
        return null;
    }
}
