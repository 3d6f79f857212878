package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single row in a preset lookup table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetRow {
    @Builder.Default
    private String condition = "";

    @Builder.Default
    private Map<String, String> values = new LinkedHashMap<>();
}
