package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable set of properties and vars applied to a context.
 * Properties never overwrite keys already present; vars do.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyGroup {
    private String name;

    @Builder.Default
    private List<TemplateProperty> properties = new ArrayList<>();

    @Builder.Default
    private List<TemplateVar> vars = new ArrayList<>();
}
