package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Property assignment used while building an item context.
 *
 * Three shapes are supported:
 * - literal value: name="left", value="245"
 * - copied from another property or built-in: name="content", fromSource="widgetPath"
 * - conditional: name="aspect", condition="widgetArt=Poster", value="stretch"
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TemplateProperty {
    private String name;

    @Builder.Default
    private String value = "";

    /**
     * Built-in or item property name to copy the value from
     */
    @Builder.Default
    private String fromSource = "";

    @Builder.Default
    private String condition = "";
}
