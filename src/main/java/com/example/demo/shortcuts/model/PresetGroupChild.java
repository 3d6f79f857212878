package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Child of a preset group: either a reference to a named preset or an inline
 * set of values. presetName and values are mutually exclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetGroupChild {
    @Builder.Default
    private String presetName = "";

    @Builder.Default
    private Map<String, String> values = new LinkedHashMap<>();

    @Builder.Default
    private String condition = "";
}
