package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a preset group by name
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetGroupReference implements SchemaReference {
    private String name;

    @Builder.Default
    private String suffix = "";

    @Builder.Default
    private String condition = "";
}
